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

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Ordered weighted components of the feature space, with the scaling fitted
/// on one training batch.
///
/// ## Weighting
///
/// Each component is standardized with the batch mean and standard deviation
/// and then multiplied by `sqrt(w)`, where `w = blockWeight / blockSize`:
///
/// ```
/// v[i] = (raw[i] - mean[i]) / std[i] * sqrt(blockWeight(tier[i]) / blockSize(tier[i]))
/// ```
///
/// A standardized component has unit variance, so each block's expected share
/// of the squared Euclidean distance equals its configured weight and the
/// component weights sum to `criticalWeight + importantWeight`. Components
/// that are constant over the batch (`std == 0`) contribute nothing.
///
/// Informative features never appear here.
public final class FeatureLayout {

    private static final double MIN_STD_DEV = 1e-12;

    @SerializedName("critical_weight")
    private final double criticalWeight;

    @SerializedName("important_weight")
    private final double importantWeight;

    @SerializedName("components")
    private final List<Component> components;

    @SerializedName("means")
    private final double[] means;

    @SerializedName("std_devs")
    private final double[] stdDevs;

    private FeatureLayout(double criticalWeight, double importantWeight, List<Component> components,
                          double[] means, double[] stdDevs) {
        this.criticalWeight = criticalWeight;
        this.importantWeight = importantWeight;
        this.components = List.copyOf(components);
        this.means = means;
        this.stdDevs = stdDevs;
    }

    /// Fit the standardization of each component over a batch of raw rows.
    ///
    /// @param components the weighted components, in row order
    /// @param rawRows unweighted component values, one row per record
    /// @param criticalWeight aggregate weight of the critical block
    /// @param importantWeight aggregate weight of the important block
    /// @return the fitted layout
    public static FeatureLayout fit(List<Component> components, List<double[]> rawRows,
                                    double criticalWeight, double importantWeight) {
        Objects.requireNonNull(components, "components cannot be null");
        for (Component component : components) {
            if (component.tier() == FeatureTier.INFORMATIVE) {
                throw new IllegalArgumentException("informative component cannot be weighted: " + component.name());
            }
        }
        int dims = components.size();
        double[] means = new double[dims];
        double[] stdDevs = new double[dims];
        int n = rawRows.size();
        if (n > 0) {
            for (double[] row : rawRows) {
                if (row.length != dims) {
                    throw new IllegalArgumentException("row has " + row.length + " components, expected " + dims);
                }
                for (int d = 0; d < dims; d++) {
                    means[d] += row[d];
                }
            }
            for (int d = 0; d < dims; d++) {
                means[d] /= n;
            }
            for (double[] row : rawRows) {
                for (int d = 0; d < dims; d++) {
                    double diff = row[d] - means[d];
                    stdDevs[d] += diff * diff;
                }
            }
            for (int d = 0; d < dims; d++) {
                stdDevs[d] = Math.sqrt(stdDevs[d] / n);
            }
        }
        return new FeatureLayout(criticalWeight, importantWeight, components, means, stdDevs);
    }

    /// @return the weighted components in vector order
    public List<Component> components() {
        return components;
    }

    /// @return vector dimensionality
    public int dimensions() {
        return components.size();
    }

    /// @param tier a weighted tier
    /// @return aggregate weight of the tier, 0 for informative
    public double blockWeight(FeatureTier tier) {
        switch (tier) {
            case CRITICAL:
                return criticalWeight;
            case IMPORTANT:
                return importantWeight;
            default:
                return 0.0d;
        }
    }

    /// @param tier a tier
    /// @return number of components in the tier
    public int blockSize(FeatureTier tier) {
        int size = 0;
        for (Component component : components) {
            if (component.tier() == tier) {
                size++;
            }
        }
        return size;
    }

    /// @return the weight of each component; they sum to the total configured weight
    public double[] componentWeights() {
        double[] weights = new double[components.size()];
        int criticalSize = blockSize(FeatureTier.CRITICAL);
        int importantSize = blockSize(FeatureTier.IMPORTANT);
        for (int i = 0; i < weights.length; i++) {
            FeatureTier tier = components.get(i).tier();
            int size = tier == FeatureTier.CRITICAL ? criticalSize : importantSize;
            weights[i] = size == 0 ? 0.0d : blockWeight(tier) / size;
        }
        return weights;
    }

    /// Map raw component values into the weighted space.
    ///
    /// @param raw unweighted component values in layout order
    /// @return the weighted vector
    public double[] weigh(double[] raw) {
        if (raw.length != components.size()) {
            throw new IllegalArgumentException("raw vector has " + raw.length + " components, expected " + components.size());
        }
        double[] weights = componentWeights();
        double[] weighted = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            if (stdDevs[i] > MIN_STD_DEV) {
                weighted[i] = (raw[i] - means[i]) / stdDevs[i] * Math.sqrt(weights[i]);
            }
        }
        return weighted;
    }

    /// @return a copy of the fitted means
    public double[] means() {
        return Arrays.copyOf(means, means.length);
    }

    /// @return a copy of the fitted standard deviations
    public double[] stdDevs() {
        return Arrays.copyOf(stdDevs, stdDevs.length);
    }

    /// One weighted component.
    /// @param name stable component name, used in exports
    /// @param tier critical or important
    public record Component(
        @SerializedName("name") String name,
        @SerializedName("tier") FeatureTier tier
    ) {
    }
}
