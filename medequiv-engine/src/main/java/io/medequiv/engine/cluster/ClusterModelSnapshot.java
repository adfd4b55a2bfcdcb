package io.medequiv.engine.cluster;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/// Immutable result of one clustering fit.
///
/// ## Purpose
///
/// Holds the centroids and the label of every record that received one.
/// Retraining never modifies a snapshot; it produces a new one with a higher
/// [#generation()].
///
/// ## Generations
///
/// A generation is the epoch millisecond at which the snapshot was built,
/// bumped so that numbers handed out by one process strictly increase.
/// Snapshots read back from disk are passed to [#observeGeneration], so a
/// model trained after loading another always carries a higher number.
///
/// ## Thread Safety
///
/// Instances are immutable; [#predict] and the accessors are safe for any
/// number of concurrent readers.
public final class ClusterModelSnapshot {

    private static final AtomicLong GENERATIONS = new AtomicLong();

    @SerializedName("generation")
    private final long generation;

    @SerializedName("k")
    private final int k;

    @SerializedName("centroids")
    private final double[][] centroids;

    @SerializedName("assignments")
    private final List<ClusterAssignment> assignments;

    @SerializedName("inertia")
    private final double inertia;

    @SerializedName("iterations")
    private final int iterations;

    @SerializedName("converged")
    private final boolean converged;

    @SerializedName("restart")
    private final int restart;

    @SerializedName("failed_restarts")
    private final int failedRestarts;

    @SerializedName("reseeds")
    private final int reseeds;

    @SerializedName("quality")
    private final ClusterQuality quality;

    private ClusterModelSnapshot(Builder builder) {
        this.generation = builder.generation;
        this.centroids = VectorMath.copy(builder.centroids);
        this.k = centroids.length;
        this.assignments = List.copyOf(builder.assignments);
        this.inertia = builder.inertia;
        this.iterations = builder.iterations;
        this.converged = builder.converged;
        this.restart = builder.restart;
        this.failedRestarts = builder.failedRestarts;
        this.reseeds = builder.reseeds;
        this.quality = builder.quality;
    }

    /// @return a builder stamped with the next generation number
    public static Builder builder() {
        return new Builder(GENERATIONS.updateAndGet(last -> Math.max(last + 1, System.currentTimeMillis())));
    }

    /// Make every generation handed out from now on exceed `generation`.
    /// @param generation a generation seen outside this process, e.g. in a model file
    public static void observeGeneration(long generation) {
        GENERATIONS.accumulateAndGet(generation, Math::max);
    }

    /// Label a vector with its nearest centroid; ties go to the lowest label.
    ///
    /// @param vector a weighted feature vector
    /// @return the cluster label
    public int predict(double[] vector) {
        if (vector.length != dimensions()) {
            throw new IllegalArgumentException(
                "vector has " + vector.length + " dimensions, model has " + dimensions());
        }
        return VectorMath.nearest(centroids, vector);
    }

    /// Extend the snapshot with records labeled by prediction.
    ///
    /// The result keeps the generation and fit statistics of this snapshot.
    ///
    /// @param predicted assignments with `fitted == false`
    /// @return a new snapshot with the extra assignments appended
    public ClusterModelSnapshot withPredicted(List<ClusterAssignment> predicted) {
        List<ClusterAssignment> all = new ArrayList<>(assignments);
        for (ClusterAssignment assignment : predicted) {
            if (assignment.fitted()) {
                throw new IllegalArgumentException("assignment of " + assignment.cum() + " is marked as fitted");
            }
            all.add(assignment);
        }
        return toBuilder().assignments(all).build();
    }

    /// @return a builder carrying every field of this snapshot, generation included
    public Builder toBuilder() {
        return new Builder(generation)
            .centroids(centroids)
            .assignments(assignments)
            .inertia(inertia)
            .iterations(iterations)
            .converged(converged)
            .restart(restart)
            .failedRestarts(failedRestarts)
            .reseeds(reseeds)
            .quality(quality);
    }

    /// @return a map from CUM to assignment, in assignment order
    public Map<String, ClusterAssignment> assignmentsByCum() {
        Map<String, ClusterAssignment> byCum = new LinkedHashMap<>();
        for (ClusterAssignment assignment : assignments) {
            byCum.put(assignment.cum(), assignment);
        }
        return byCum;
    }

    /// @return number of fitted records per label
    public int[] clusterSizes() {
        int[] sizes = new int[k];
        for (ClusterAssignment assignment : assignments) {
            if (assignment.fitted()) {
                sizes[assignment.label()]++;
            }
        }
        return sizes;
    }

    public long generation() {
        return generation;
    }

    public int k() {
        return k;
    }

    /// @return vector dimensionality, 0 for an empty model
    public int dimensions() {
        return centroids.length == 0 ? 0 : centroids[0].length;
    }

    /// @return a deep copy of the centroids
    public double[][] centroids() {
        return VectorMath.copy(centroids);
    }

    public List<ClusterAssignment> assignments() {
        return Collections.unmodifiableList(assignments);
    }

    /// @return sum of squared distances of fitted vectors to their centroid
    public double inertia() {
        return inertia;
    }

    public int iterations() {
        return iterations;
    }

    public boolean converged() {
        return converged;
    }

    /// @return index of the restart that produced this snapshot
    public int restart() {
        return restart;
    }

    public int failedRestarts() {
        return failedRestarts;
    }

    /// @return empty clusters reseeded in the winning restart
    public int reseeds() {
        return reseeds;
    }

    /// @return quality scores, or null if they were not computed
    public ClusterQuality quality() {
        return quality;
    }

    @Override
    public String toString() {
        return "ClusterModelSnapshot{generation=" + generation + ", k=" + k + ", inertia=" + inertia
            + ", iterations=" + iterations + ", converged=" + converged + ", assignments=" + assignments.size() + "}";
    }

    /// Builder for [ClusterModelSnapshot].
    public static final class Builder {
        private final long generation;
        private double[][] centroids = new double[0][];
        private List<ClusterAssignment> assignments = List.of();
        private double inertia;
        private int iterations;
        private boolean converged;
        private int restart;
        private int failedRestarts;
        private int reseeds;
        private ClusterQuality quality;

        private Builder(long generation) {
            this.generation = generation;
        }

        public Builder centroids(double[][] centroids) {
            this.centroids = centroids;
            return this;
        }

        public Builder assignments(List<ClusterAssignment> assignments) {
            this.assignments = assignments;
            return this;
        }

        public Builder inertia(double inertia) {
            this.inertia = inertia;
            return this;
        }

        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder converged(boolean converged) {
            this.converged = converged;
            return this;
        }

        public Builder restart(int restart) {
            this.restart = restart;
            return this;
        }

        public Builder failedRestarts(int failedRestarts) {
            this.failedRestarts = failedRestarts;
            return this;
        }

        public Builder reseeds(int reseeds) {
            this.reseeds = reseeds;
            return this;
        }

        public Builder quality(ClusterQuality quality) {
            this.quality = quality;
            return this;
        }

        public ClusterModelSnapshot build() {
            return new ClusterModelSnapshot(this);
        }
    }
}
