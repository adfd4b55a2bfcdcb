package io.medequiv.command.common;

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

import picocli.CommandLine;

/// Shared `--auto-k` option selecting the cluster count with the elbow heuristic.
public class KRangeOption {

    /// Inclusive range of candidate cluster counts.
    ///
    /// @param min smallest candidate, at least 1
    /// @param max largest candidate, not below `min`
    public record KRange(int min, int max) {

        public KRange {
            if (min < 1) {
                throw new IllegalArgumentException("k range start must be positive: " + min);
            }
            if (max < min) {
                throw new IllegalArgumentException("k range end must not be below start: " + min + ".." + max);
            }
        }

        @Override
        public String toString() {
            return min + ".." + max;
        }
    }

    /// Picocli type converter for [KRange] specifications.
    /// Supports formats: `m..n` (inclusive) and `[m,n)` (half-open).
    public static class KRangeConverter implements CommandLine.ITypeConverter<KRange> {

        @Override
        public KRange convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new CommandLine.TypeConversionException("k range cannot be empty");
            }
            String trimmed = value.trim();
            try {
                if (trimmed.startsWith("[") && trimmed.endsWith(")")) {
                    String[] parts = trimmed.substring(1, trimmed.length() - 1).split(",");
                    if (parts.length != 2) {
                        throw new CommandLine.TypeConversionException(
                            "Invalid k range: " + value + ". Expected: [min,max)");
                    }
                    return new KRange(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()) - 1);
                }
                if (trimmed.contains("..")) {
                    String[] parts = trimmed.split("\\.\\.");
                    if (parts.length != 2) {
                        throw new CommandLine.TypeConversionException(
                            "Invalid k range: " + value + ". Expected: min..max");
                    }
                    return new KRange(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
                }
                throw new CommandLine.TypeConversionException(
                    "Invalid k range: " + value + ". Expected: min..max or [min,max)");
            } catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(
                    "Invalid k range: " + value + ". Could not parse numbers: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    @CommandLine.Option(
        names = {"--auto-k"},
        description = "Choose k with the elbow heuristic over a range. Formats: 'm..n' (inclusive), '[m,n)'",
        converter = KRangeConverter.class
    )
    private KRange range;

    /// @return the range, or null when not given
    public KRange getRange() {
        return range;
    }

    /// @return whether `--auto-k` was given
    public boolean isSpecified() {
        return range != null;
    }
}
