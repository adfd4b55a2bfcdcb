package io.medequiv.engine;

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

import io.medequiv.engine.config.EngineConfig;
import io.medequiv.engine.model.CumStatus;
import io.medequiv.engine.model.MedicationRecord;
import io.medequiv.engine.model.RegistrationStatus;

import java.util.ArrayList;
import java.util.List;

/// A small synthetic registry with five well separated therapeutic groups.
///
/// | Group | Records | Notes |
/// |-------|---------|-------|
/// | G1 acetaminophen | G1-01..G1-07, G1-EXP | G1-06 in renewal, G1-07 has 1000 mg, G1-EXP expired |
/// | G2 amoxicillin | G2-01..G2-06, G2-MS | G2-02 and G2-04 covered, G2-MS medical sample |
/// | G3 salbutamol | G3-01..G3-05, G3-BAD | G3-BAD has quantity 0 |
/// | G4 betamethasone | G4-01..G4-05 | |
/// | G5 insulin | G5-01 | alone in its group |
public final class RegistryFixtures {

    public static final int GROUPS = 5;

    private RegistryFixtures() {
    }

    /// Defaults with one cluster per group.
    public static EngineConfig config() {
        return EngineConfig.DEFAULTS.toBuilder().k(GROUPS).build();
    }

    public static List<MedicationRecord> registry() {
        List<MedicationRecord> records = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            MedicationRecord.Builder builder = acetaminophen(String.format("G1-%02d", i));
            if (i == 6) {
                builder.registrationStatus(RegistrationStatus.IN_RENEWAL);
            }
            if (i == 7) {
                builder.quantity(1000.0d);
            }
            records.add(builder.build());
        }
        records.add(acetaminophen("G1-EXP").registrationStatus(RegistrationStatus.EXPIRED).build());

        for (int i = 1; i <= 6; i++) {
            records.add(amoxicillin(String.format("G2-%02d", i)).pbsCoverage(i == 2 || i == 4).build());
        }
        records.add(amoxicillin("G2-MS").medicalSample(true).build());

        for (int i = 1; i <= 5; i++) {
            records.add(salbutamol(String.format("G3-%02d", i)).build());
        }
        records.add(salbutamol("G3-BAD").quantity(0.0d).build());

        for (int i = 1; i <= 5; i++) {
            records.add(MedicationRecord.builder()
                .cum(String.format("G4-%02d", i))
                .productName("BETAMETASONA CREMA " + i)
                .activeIngredient("BETAMETASONA")
                .atcCode("D07AC01")
                .pharmaceuticalForm("CREMA")
                .route("TOPICA")
                .measurementUnit("G")
                .quantity(15.0d)
                .referenceQuantity(100.0d)
                .build());
        }

        records.add(MedicationRecord.builder()
            .cum("G5-01")
            .productName("INSULINA GLARGINA")
            .activeIngredient("INSULINA GLARGINA")
            .atcCode("A10AE04")
            .pharmaceuticalForm("SOLUCION INYECTABLE")
            .route("SUBCUTANEA")
            .measurementUnit("UI")
            .quantity(300.0d)
            .referenceQuantity(3.0d)
            .cumStatus(CumStatus.ACTIVE)
            .build());
        return records;
    }

    public static MedicationRecord.Builder acetaminophen(String cum) {
        return MedicationRecord.builder()
            .cum(cum)
            .productName("ACETAMINOFEN 500 MG " + cum)
            .activeIngredient("ACETAMINOFEN")
            .atcCode("N02BE01")
            .atcDescription("PARACETAMOL")
            .pharmaceuticalForm("TABLETA")
            .route("ORAL")
            .measurementUnit("MG")
            .quantity(500.0d)
            .referenceQuantity(1.0d);
    }

    public static MedicationRecord.Builder amoxicillin(String cum) {
        return MedicationRecord.builder()
            .cum(cum)
            .productName("AMOXICILINA 250 MG " + cum)
            .activeIngredient("AMOXICILINA")
            .atcCode("J01CA04")
            .pharmaceuticalForm("CAPSULA")
            .route("ORAL")
            .measurementUnit("MG")
            .quantity(250.0d)
            .referenceQuantity(1.0d);
    }

    public static MedicationRecord.Builder salbutamol(String cum) {
        return MedicationRecord.builder()
            .cum(cum)
            .productName("SALBUTAMOL INHALADOR " + cum)
            .activeIngredient("SALBUTAMOL")
            .atcCode("R03AC02")
            .pharmaceuticalForm("AEROSOL")
            .route("INHALADA")
            .measurementUnit("MCG")
            .quantity(100.0d)
            .referenceQuantity(1.0d);
    }
}
