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

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/// Encodes whole records against the tables of one training batch.
///
/// Binds a [CategoricalEncoder], the per-attribute frequency and validity
/// tables, and a [VectorAssembler]. Used by training for every batch record
/// and by the resolver for ad-hoc query records.
public final class RecordEncoder {

    private final CategoricalEncoder encoder;
    private final Map<CategoricalAttribute, CategoricalFrequencyTable> tables;
    private final Map<CategoricalAttribute, CategoryValidityStats> validity;
    private final VectorAssembler assembler;

    /// @param encoder the categorical encoder
    /// @param tables one frequency table per attribute
    /// @param validity one validity table per attribute
    /// @param assembler the vector assembler
    public RecordEncoder(CategoricalEncoder encoder, Map<CategoricalAttribute, CategoricalFrequencyTable> tables,
                         Map<CategoricalAttribute, CategoryValidityStats> validity, VectorAssembler assembler) {
        this.encoder = Objects.requireNonNull(encoder, "encoder cannot be null");
        this.tables = new EnumMap<>(tables);
        this.validity = new EnumMap<>(validity);
        this.assembler = Objects.requireNonNull(assembler, "assembler cannot be null");
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            if (!this.tables.containsKey(attribute) || !this.validity.containsKey(attribute)) {
                throw new IllegalArgumentException("missing tables for attribute " + attribute);
            }
        }
    }

    /// @param record a record
    /// @return the encoding of each categorical attribute
    public Map<CategoricalAttribute, EncodedFeature> encodeAttributes(MedicationRecord record) {
        Map<CategoricalAttribute, EncodedFeature> encoded = new EnumMap<>(CategoricalAttribute.class);
        for (CategoricalAttribute attribute : CategoricalAttribute.values()) {
            encoded.put(attribute,
                encoder.encodeFeature(attribute.valueOf(record), tables.get(attribute), validity.get(attribute)));
        }
        return encoded;
    }

    /// @param encoded result of [#encodeAttributes]
    /// @return number of attributes that fell back to the sentinel
    public static int unknownCount(Map<CategoricalAttribute, EncodedFeature> encoded) {
        int unknown = 0;
        for (EncodedFeature feature : encoded.values()) {
            if (!feature.knownCategory()) {
                unknown++;
            }
        }
        return unknown;
    }

    /// @param record a record
    /// @return unweighted component values
    /// @throws InvalidQuantityException if a quantity cannot be transformed
    public double[] rawComponents(MedicationRecord record) {
        return assembler.rawComponents(record, encodeAttributes(record));
    }

    /// @param record a record
    /// @param layout the fitted layout
    /// @return the weighted feature vector
    /// @throws InvalidQuantityException if a quantity cannot be transformed
    public FeatureVector vector(MedicationRecord record, FeatureLayout layout) {
        return assembler.assemble(record, encodeAttributes(record), layout);
    }
}
