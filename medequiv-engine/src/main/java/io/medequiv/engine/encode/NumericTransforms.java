package io.medequiv.engine.encode;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Arrays;

/// Deterministic transforms of the quantity fields.
///
/// | Transform | Definition | Fails when |
/// |-----------|------------|------------|
/// | log | `ln(q)` | `q <= 0` or not finite |
/// | ratio | `q / q_ref` | `q_ref == 0` or not finite |
/// | bin | number of breakpoints `b <= q` | never |
///
/// Bins are half-open: with breakpoints `[10, 100, 500]`, `q = 9.9` is in bin
/// 0, `q = 10` in bin 1 and `q = 500` in bin 3.
public final class NumericTransforms {

    /// Breakpoints used when the configuration supplies none
    public static final double[] DEFAULT_BREAKPOINTS = {10.0d, 100.0d, 500.0d};

    private final double[] breakpoints;

    /// @param breakpoints strictly increasing, finite bucket boundaries
    public NumericTransforms(double[] breakpoints) {
        validateBreakpoints(breakpoints);
        this.breakpoints = Arrays.copyOf(breakpoints, breakpoints.length);
    }

    /// Check that breakpoints are finite and strictly increasing.
    /// @param breakpoints the candidate breakpoints
    /// @throws IllegalArgumentException if they are not
    public static void validateBreakpoints(double[] breakpoints) {
        if (breakpoints == null) {
            throw new IllegalArgumentException("breakpoints cannot be null");
        }
        for (int i = 0; i < breakpoints.length; i++) {
            if (!Double.isFinite(breakpoints[i])) {
                throw new IllegalArgumentException("breakpoint " + i + " is not finite: " + breakpoints[i]);
            }
            if (i > 0 && breakpoints[i] <= breakpoints[i - 1]) {
                throw new IllegalArgumentException(
                    "breakpoints must be strictly increasing: " + Arrays.toString(breakpoints));
            }
        }
    }

    /// @return a copy of the breakpoints
    public double[] breakpoints() {
        return Arrays.copyOf(breakpoints, breakpoints.length);
    }

    /// @param field name of the field, for error reporting
    /// @param q the quantity
    /// @return `ln(q)`
    /// @throws InvalidQuantityException if `q` is not a positive finite number
    public double logFeature(String field, double q) {
        if (!Double.isFinite(q) || q <= 0.0d) {
            throw new InvalidQuantityException(field, q, "logarithm needs a positive quantity");
        }
        return Math.log(q);
    }

    /// @param q the quantity
    /// @param qRef the reference quantity
    /// @return `q / qRef`
    /// @throws InvalidQuantityException if `qRef` is zero or either value is not finite
    public double ratioFeature(double q, double qRef) {
        if (!Double.isFinite(qRef) || qRef == 0.0d) {
            throw new InvalidQuantityException("reference_quantity", qRef, "ratio needs a non-zero reference quantity");
        }
        if (!Double.isFinite(q)) {
            throw new InvalidQuantityException("quantity", q, "ratio needs a finite quantity");
        }
        return q / qRef;
    }

    /// @param q the quantity
    /// @return index of the half-open bucket containing `q`
    public int binFeature(double q) {
        int bin = 0;
        while (bin < breakpoints.length && q >= breakpoints[bin]) {
            bin++;
        }
        return bin;
    }
}
