package io.medequiv.engine.config;

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

import com.google.gson.annotations.SerializedName;
import io.medequiv.engine.cluster.ClusterQualityMetrics;
import io.medequiv.engine.cluster.ClusteringParameters;
import io.medequiv.engine.encode.CategoricalEncoder;
import io.medequiv.engine.encode.EligibilityRules;
import io.medequiv.engine.encode.NumericTransforms;

import java.util.Arrays;
import java.util.Objects;

/// Validated configuration of a training run and of the query defaults.
///
/// ## Keys
///
/// | Key | Default | Constraint |
/// |-----|---------|------------|
/// | `k` | 15 | `>= 1` |
/// | `seed` | 42 | any |
/// | `max_iterations` | 300 | `>= 1` |
/// | `tolerance` | 1e-4 | `>= 0` |
/// | `n_restarts` | 10 | `>= 1` |
/// | `max_reseed_attempts` | 10 | `>= 0` |
/// | `critical_weight` | 0.85 | in `[0, 1]` |
/// | `important_weight` | 0.15 | in `[0, 1]`, sums to 1 with `critical_weight` |
/// | `bin_breakpoints` | `[10, 100, 500]` | finite, strictly increasing |
/// | `frequency_divisor` | 10000 | `>= 2` |
/// | `default_top_k` | 10 | `>= 1` |
/// | `silhouette_sample_limit` | 2000 | `>= 1` |
/// | `eligibility_rules` | see [EligibilityRules#DEFAULTS] | non-empty status sets |
///
/// Instances are immutable and are stored inside every trained model.
public final class EngineConfig {

    /// Allowed deviation of `critical_weight + important_weight` from 1
    public static final double WEIGHT_SUM_TOLERANCE = 1e-9;

    /// Configuration with every default
    public static final EngineConfig DEFAULTS = builder().build();

    @SerializedName("k")
    private final int k;

    @SerializedName("seed")
    private final long seed;

    @SerializedName("max_iterations")
    private final int maxIterations;

    @SerializedName("tolerance")
    private final double tolerance;

    @SerializedName("n_restarts")
    private final int nRestarts;

    @SerializedName("max_reseed_attempts")
    private final int maxReseedAttempts;

    @SerializedName("critical_weight")
    private final double criticalWeight;

    @SerializedName("important_weight")
    private final double importantWeight;

    @SerializedName("bin_breakpoints")
    private final double[] binBreakpoints;

    @SerializedName("frequency_divisor")
    private final int frequencyDivisor;

    @SerializedName("default_top_k")
    private final int defaultTopK;

    @SerializedName("silhouette_sample_limit")
    private final int silhouetteSampleLimit;

    @SerializedName("eligibility_rules")
    private final EligibilityRules eligibilityRules;

    private EngineConfig(Builder builder) {
        this.k = builder.k;
        this.seed = builder.seed;
        this.maxIterations = builder.maxIterations;
        this.tolerance = builder.tolerance;
        this.nRestarts = builder.nRestarts;
        this.maxReseedAttempts = builder.maxReseedAttempts;
        this.criticalWeight = builder.criticalWeight;
        this.importantWeight = builder.importantWeight;
        this.binBreakpoints = builder.binBreakpoints.clone();
        this.frequencyDivisor = builder.frequencyDivisor;
        this.defaultTopK = builder.defaultTopK;
        this.silhouetteSampleLimit = builder.silhouetteSampleLimit;
        this.eligibilityRules = builder.eligibilityRules;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder carrying every value of this configuration
    public Builder toBuilder() {
        return new Builder()
            .k(k)
            .seed(seed)
            .maxIterations(maxIterations)
            .tolerance(tolerance)
            .nRestarts(nRestarts)
            .maxReseedAttempts(maxReseedAttempts)
            .criticalWeight(criticalWeight)
            .importantWeight(importantWeight)
            .binBreakpoints(binBreakpoints)
            .frequencyDivisor(frequencyDivisor)
            .defaultTopK(defaultTopK)
            .silhouetteSampleLimit(silhouetteSampleLimit)
            .eligibilityRules(eligibilityRules);
    }

    /// Re-run validation; used after deserialization, which bypasses the builder.
    /// @return this configuration
    /// @throws InvalidConfigurationException if any value is out of range
    public EngineConfig validate() {
        toBuilder().build();
        return this;
    }

    /// @return the clustering parameters of this configuration
    public ClusteringParameters clusteringParameters() {
        return new ClusteringParameters(k, seed, maxIterations, tolerance, nRestarts, maxReseedAttempts);
    }

    public int k() {
        return k;
    }

    public long seed() {
        return seed;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public double tolerance() {
        return tolerance;
    }

    public int nRestarts() {
        return nRestarts;
    }

    public int maxReseedAttempts() {
        return maxReseedAttempts;
    }

    public double criticalWeight() {
        return criticalWeight;
    }

    public double importantWeight() {
        return importantWeight;
    }

    /// @return a copy of the bin breakpoints
    public double[] binBreakpoints() {
        return binBreakpoints.clone();
    }

    public int frequencyDivisor() {
        return frequencyDivisor;
    }

    public int defaultTopK() {
        return defaultTopK;
    }

    public int silhouetteSampleLimit() {
        return silhouetteSampleLimit;
    }

    public EligibilityRules eligibilityRules() {
        return eligibilityRules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EngineConfig)) {
            return false;
        }
        EngineConfig that = (EngineConfig) o;
        return k == that.k && seed == that.seed && maxIterations == that.maxIterations
            && Double.compare(tolerance, that.tolerance) == 0 && nRestarts == that.nRestarts
            && maxReseedAttempts == that.maxReseedAttempts
            && Double.compare(criticalWeight, that.criticalWeight) == 0
            && Double.compare(importantWeight, that.importantWeight) == 0
            && Arrays.equals(binBreakpoints, that.binBreakpoints) && frequencyDivisor == that.frequencyDivisor
            && defaultTopK == that.defaultTopK && silhouetteSampleLimit == that.silhouetteSampleLimit
            && eligibilityRules.equals(that.eligibilityRules);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(k, seed, maxIterations, tolerance, nRestarts, maxReseedAttempts, criticalWeight,
            importantWeight, frequencyDivisor, defaultTopK, silhouetteSampleLimit, eligibilityRules);
        return 31 * result + Arrays.hashCode(binBreakpoints);
    }

    @Override
    public String toString() {
        return "EngineConfig{k=" + k + ", seed=" + seed + ", max_iterations=" + maxIterations
            + ", tolerance=" + tolerance + ", n_restarts=" + nRestarts + ", critical_weight=" + criticalWeight
            + ", important_weight=" + importantWeight + ", bin_breakpoints=" + Arrays.toString(binBreakpoints)
            + ", frequency_divisor=" + frequencyDivisor + ", default_top_k=" + defaultTopK
            + ", eligibility_rules=" + eligibilityRules + "}";
    }

    /// Builder for [EngineConfig]; [#build()] validates.
    public static final class Builder {
        private int k = ClusteringParameters.DEFAULT_K;
        private long seed = ClusteringParameters.DEFAULT_SEED;
        private int maxIterations = ClusteringParameters.DEFAULT_MAX_ITERATIONS;
        private double tolerance = ClusteringParameters.DEFAULT_TOLERANCE;
        private int nRestarts = ClusteringParameters.DEFAULT_RESTARTS;
        private int maxReseedAttempts = ClusteringParameters.DEFAULT_MAX_RESEED_ATTEMPTS;
        private double criticalWeight = 0.85d;
        private double importantWeight = 0.15d;
        private double[] binBreakpoints = NumericTransforms.DEFAULT_BREAKPOINTS;
        private int frequencyDivisor = CategoricalEncoder.DEFAULT_FREQUENCY_DIVISOR;
        private int defaultTopK = 10;
        private int silhouetteSampleLimit = ClusterQualityMetrics.DEFAULT_SAMPLE_LIMIT;
        private EligibilityRules eligibilityRules = EligibilityRules.DEFAULTS;

        private Builder() {
        }

        public Builder k(int k) {
            this.k = k;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Builder nRestarts(int nRestarts) {
            this.nRestarts = nRestarts;
            return this;
        }

        public Builder maxReseedAttempts(int maxReseedAttempts) {
            this.maxReseedAttempts = maxReseedAttempts;
            return this;
        }

        public Builder criticalWeight(double criticalWeight) {
            this.criticalWeight = criticalWeight;
            return this;
        }

        public Builder importantWeight(double importantWeight) {
            this.importantWeight = importantWeight;
            return this;
        }

        public Builder binBreakpoints(double[] binBreakpoints) {
            this.binBreakpoints = binBreakpoints;
            return this;
        }

        public Builder frequencyDivisor(int frequencyDivisor) {
            this.frequencyDivisor = frequencyDivisor;
            return this;
        }

        public Builder defaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
            return this;
        }

        public Builder silhouetteSampleLimit(int silhouetteSampleLimit) {
            this.silhouetteSampleLimit = silhouetteSampleLimit;
            return this;
        }

        public Builder eligibilityRules(EligibilityRules eligibilityRules) {
            this.eligibilityRules = eligibilityRules;
            return this;
        }

        /// @return the validated configuration
        /// @throws InvalidConfigurationException if any value is out of range
        public EngineConfig build() {
            new ClusteringParameters(k, seed, maxIterations, tolerance, nRestarts, maxReseedAttempts);
            checkWeight("critical_weight", criticalWeight);
            checkWeight("important_weight", importantWeight);
            if (Math.abs(criticalWeight + importantWeight - 1.0d) > WEIGHT_SUM_TOLERANCE) {
                throw new InvalidConfigurationException("critical_weight + important_weight must equal 1, got "
                    + criticalWeight + " + " + importantWeight);
            }
            try {
                NumericTransforms.validateBreakpoints(binBreakpoints);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("invalid bin_breakpoints: " + e.getMessage(), e);
            }
            if (frequencyDivisor < 2) {
                throw new InvalidConfigurationException("frequency_divisor must be at least 2, got " + frequencyDivisor);
            }
            if (defaultTopK < 1) {
                throw new InvalidConfigurationException("default_top_k must be positive, got " + defaultTopK);
            }
            if (silhouetteSampleLimit < 1) {
                throw new InvalidConfigurationException(
                    "silhouette_sample_limit must be positive, got " + silhouetteSampleLimit);
            }
            if (eligibilityRules == null) {
                throw new InvalidConfigurationException("eligibility_rules cannot be null");
            }
            return new EngineConfig(this);
        }

        private static void checkWeight(String name, double weight) {
            if (!Double.isFinite(weight) || weight < 0.0d || weight > 1.0d) {
                throw new InvalidConfigurationException(name + " must be in [0, 1], got " + weight);
            }
        }
    }
}
