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
import io.medequiv.engine.config.InvalidConfigurationException;

/// A category occurs too often for the configured `frequency_divisor`.
///
/// The fractional term `count / divisor` of the adjusted frequency score must
/// stay below 1, so the batch cannot be encoded until the divisor is raised
/// above [#count()].
public class FrequencyDivisorException extends InvalidConfigurationException {

    private final String value;
    private final int count;
    private final int divisor;

    /// @param value the category value
    /// @param count its number of occurrences
    /// @param divisor the configured divisor
    public FrequencyDivisorException(String value, int count, int divisor) {
        super("Value '" + value + "' occurs " + count + " times, which is not below frequency_divisor " + divisor
            + "; raise frequency_divisor to at least " + minimumDivisor(count));
        this.value = value;
        this.count = count;
        this.divisor = divisor;
    }

    /// @param count the largest count of a batch
    /// @return the smallest divisor that accepts it, rounded up to a power of ten
    public static int minimumDivisor(int count) {
        long divisor = 10L;
        while (divisor <= count) {
            divisor *= 10L;
        }
        return divisor > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) divisor;
    }

    /// @return the category value
    public String value() {
        return value;
    }

    /// @return its number of occurrences
    public int count() {
        return count;
    }

    /// @return the divisor that was configured
    public int divisor() {
        return divisor;
    }
}
