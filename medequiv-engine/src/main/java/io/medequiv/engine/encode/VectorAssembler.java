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

import io.medequiv.engine.model.CategoricalAttribute;
import io.medequiv.engine.model.MedicationRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Combines encoded categories and numeric transforms into feature vectors.
///
/// ## Components
///
/// ```text
/// CRITICAL   atc.score  atc.valid  atc.prob_valid
///            route.score  route.valid  route.prob_valid
///            active_ingredient.score  active_ingredient.valid  active_ingredient.prob_valid
/// IMPORTANT  pharmaceutical_form.score  pharmaceutical_form.prob_valid
///            measurement_unit.score  measurement_unit.prob_valid
///            quantity.log  reference_quantity.log  quantity.ratio  quantity.bin
/// ```
///
/// Everything else (identity, names, raw strings, statuses) travels as
/// informative metadata and never reaches the vector.
///
/// Assembly is two-phase: [#rawComponents] produces unweighted rows for the
/// whole batch, [FeatureLayout#fit] learns the scaling, then [#assemble] maps
/// each record into the weighted space.
public final class VectorAssembler {

    /// Attributes in the critical block
    public static final List<CategoricalAttribute> CRITICAL_ATTRIBUTES = List.of(
        CategoricalAttribute.ATC, CategoricalAttribute.ROUTE, CategoricalAttribute.ACTIVE_INGREDIENT);

    /// Categorical attributes in the important block
    public static final List<CategoricalAttribute> IMPORTANT_ATTRIBUTES = List.of(
        CategoricalAttribute.PHARMACEUTICAL_FORM, CategoricalAttribute.MEASUREMENT_UNIT);

    /// The weighted components, in vector order
    public static final List<FeatureLayout.Component> COMPONENTS = buildComponents();

    private final NumericTransforms transforms;

    /// @param transforms numeric transforms with the configured breakpoints
    public VectorAssembler(NumericTransforms transforms) {
        this.transforms = Objects.requireNonNull(transforms, "transforms cannot be null");
    }

    private static List<FeatureLayout.Component> buildComponents() {
        List<FeatureLayout.Component> components = new ArrayList<>();
        for (CategoricalAttribute attribute : CRITICAL_ATTRIBUTES) {
            String prefix = attribute.name().toLowerCase(Locale.ROOT);
            components.add(new FeatureLayout.Component(prefix + ".score", FeatureTier.CRITICAL));
            components.add(new FeatureLayout.Component(prefix + ".valid", FeatureTier.CRITICAL));
            components.add(new FeatureLayout.Component(prefix + ".prob_valid", FeatureTier.CRITICAL));
        }
        for (CategoricalAttribute attribute : IMPORTANT_ATTRIBUTES) {
            String prefix = attribute.name().toLowerCase(Locale.ROOT);
            components.add(new FeatureLayout.Component(prefix + ".score", FeatureTier.IMPORTANT));
            components.add(new FeatureLayout.Component(prefix + ".prob_valid", FeatureTier.IMPORTANT));
        }
        components.add(new FeatureLayout.Component("quantity.log", FeatureTier.IMPORTANT));
        components.add(new FeatureLayout.Component("reference_quantity.log", FeatureTier.IMPORTANT));
        components.add(new FeatureLayout.Component("quantity.ratio", FeatureTier.IMPORTANT));
        components.add(new FeatureLayout.Component("quantity.bin", FeatureTier.IMPORTANT));
        return Collections.unmodifiableList(components);
    }

    /// @return the numeric transforms in use
    public NumericTransforms transforms() {
        return transforms;
    }

    /// Compute the unweighted component values of one record.
    ///
    /// @param record the record
    /// @param encoded the encoding of every categorical attribute of the record
    /// @return raw values in [#COMPONENTS] order
    /// @throws InvalidQuantityException if a quantity cannot be transformed
    public double[] rawComponents(MedicationRecord record, Map<CategoricalAttribute, EncodedFeature> encoded) {
        double[] raw = new double[COMPONENTS.size()];
        int i = 0;
        for (CategoricalAttribute attribute : CRITICAL_ATTRIBUTES) {
            EncodedFeature feature = requireFeature(encoded, attribute);
            raw[i++] = feature.score();
            raw[i++] = feature.validIndicator();
            raw[i++] = feature.probAmongValid();
        }
        for (CategoricalAttribute attribute : IMPORTANT_ATTRIBUTES) {
            EncodedFeature feature = requireFeature(encoded, attribute);
            raw[i++] = feature.score();
            raw[i++] = feature.probAmongValid();
        }
        raw[i++] = transforms.logFeature("quantity", record.quantity());
        raw[i++] = transforms.logFeature("reference_quantity", record.referenceQuantity());
        raw[i++] = transforms.ratioFeature(record.quantity(), record.referenceQuantity());
        raw[i] = transforms.binFeature(record.quantity());
        return raw;
    }

    /// Assemble the weighted feature vector of one record.
    ///
    /// @param record the record
    /// @param encoded the encoding of every categorical attribute of the record
    /// @param layout the layout fitted on the batch
    /// @return the feature vector
    /// @throws InvalidQuantityException if a quantity cannot be transformed
    public FeatureVector assemble(MedicationRecord record, Map<CategoricalAttribute, EncodedFeature> encoded,
                                  FeatureLayout layout) {
        return new FeatureVector(record.cum(), layout.weigh(rawComponents(record, encoded)), informative(record));
    }

    /// @param record the record
    /// @return the informative fields of the record
    public static Map<String, String> informative(MedicationRecord record) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("cum", record.cum());
        metadata.put("product_name", String.valueOf(record.productName()));
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            metadata.put(attribute.name().toLowerCase(Locale.ROOT), attribute.valueOf(record));
        }
        metadata.put("quantity", String.valueOf(record.quantity()));
        metadata.put("reference_quantity", String.valueOf(record.referenceQuantity()));
        metadata.put("registration_status", record.registrationStatus().name());
        metadata.put("cum_status", record.cumStatus().name());
        metadata.put("medical_sample", String.valueOf(record.medicalSample()));
        return metadata;
    }

    private static EncodedFeature requireFeature(Map<CategoricalAttribute, EncodedFeature> encoded,
                                                 CategoricalAttribute attribute) {
        EncodedFeature feature = encoded.get(attribute);
        if (feature == null) {
            throw new IllegalArgumentException("missing encoding for attribute " + attribute);
        }
        return feature;
    }
}
