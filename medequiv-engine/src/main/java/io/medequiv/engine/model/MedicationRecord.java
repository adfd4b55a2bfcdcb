package io.medequiv.engine.model;

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

import java.time.LocalDate;
import java.util.Objects;

/// One cleaned entry of the drug registry.
///
/// Identity is the [#cum()] code. Records are produced by the ingestion stage
/// and never modified by the engine.
///
/// ## JSON form
///
/// ```json
/// {
///   "cum": "19901234-1",
///   "product_name": "ACETAMINOFEN 500 MG TABLETAS",
///   "active_ingredient": "ACETAMINOFEN",
///   "atc_code": "N02BE01",
///   "atc_description": "PARACETAMOL",
///   "pharmaceutical_form": "TABLETA",
///   "route": "ORAL",
///   "measurement_unit": "MG",
///   "quantity": 500.0,
///   "reference_quantity": 1.0,
///   "registration_status": "Vigente",
///   "cum_status": "Activo",
///   "medical_sample": "No",
///   "expiration_date": "2027-03-01",
///   "pbs_coverage": true
/// }
/// ```
///
/// @param cum unique regulatory code
/// @param productName commercial name
/// @param activeIngredient raw active ingredient string
/// @param atcCode anatomical therapeutic chemical code
/// @param atcDescription human readable ATC description
/// @param pharmaceuticalForm pharmaceutical form
/// @param route route of administration
/// @param measurementUnit measurement unit of [#quantity()]
/// @param quantity amount of active ingredient
/// @param referenceQuantity reference amount the quantity is expressed against
/// @param registrationStatus sanitary registration status
/// @param cumStatus status of the CUM code itself
/// @param medicalSample whether the product is a free medical sample
/// @param expirationDate registration expiration date, may be null
/// @param pbsCoverage whether the product is covered by the health benefits plan
public record MedicationRecord(
    @SerializedName("cum") String cum,
    @SerializedName("product_name") String productName,
    @SerializedName("active_ingredient") String activeIngredient,
    @SerializedName("atc_code") String atcCode,
    @SerializedName("atc_description") String atcDescription,
    @SerializedName("pharmaceutical_form") String pharmaceuticalForm,
    @SerializedName("route") String route,
    @SerializedName("measurement_unit") String measurementUnit,
    @SerializedName("quantity") double quantity,
    @SerializedName("reference_quantity") double referenceQuantity,
    @SerializedName("registration_status") RegistrationStatus registrationStatus,
    @SerializedName("cum_status") CumStatus cumStatus,
    @SerializedName("medical_sample") boolean medicalSample,
    @SerializedName("expiration_date") LocalDate expirationDate,
    @SerializedName("pbs_coverage") boolean pbsCoverage
) {

    public MedicationRecord {
        Objects.requireNonNull(cum, "cum cannot be null");
        if (cum.isBlank()) {
            throw new IllegalArgumentException("cum cannot be blank");
        }
        registrationStatus = registrationStatus == null ? RegistrationStatus.OTHER : registrationStatus;
        cumStatus = cumStatus == null ? CumStatus.OTHER : cumStatus;
    }

    /// @return a builder with no fields set
    public static Builder builder() {
        return new Builder();
    }

    /// @return a builder pre-populated with this record's fields
    public Builder toBuilder() {
        return new Builder()
            .cum(cum)
            .productName(productName)
            .activeIngredient(activeIngredient)
            .atcCode(atcCode)
            .atcDescription(atcDescription)
            .pharmaceuticalForm(pharmaceuticalForm)
            .route(route)
            .measurementUnit(measurementUnit)
            .quantity(quantity)
            .referenceQuantity(referenceQuantity)
            .registrationStatus(registrationStatus)
            .cumStatus(cumStatus)
            .medicalSample(medicalSample)
            .expirationDate(expirationDate)
            .pbsCoverage(pbsCoverage);
    }

    /// Builder for [MedicationRecord].
    public static final class Builder {
        private String cum;
        private String productName;
        private String activeIngredient;
        private String atcCode;
        private String atcDescription;
        private String pharmaceuticalForm;
        private String route;
        private String measurementUnit;
        private double quantity;
        private double referenceQuantity;
        private RegistrationStatus registrationStatus = RegistrationStatus.ACTIVE;
        private CumStatus cumStatus = CumStatus.ACTIVE;
        private boolean medicalSample;
        private LocalDate expirationDate;
        private boolean pbsCoverage;

        private Builder() {
        }

        public Builder cum(String cum) {
            this.cum = cum;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder activeIngredient(String activeIngredient) {
            this.activeIngredient = activeIngredient;
            return this;
        }

        public Builder atcCode(String atcCode) {
            this.atcCode = atcCode;
            return this;
        }

        public Builder atcDescription(String atcDescription) {
            this.atcDescription = atcDescription;
            return this;
        }

        public Builder pharmaceuticalForm(String pharmaceuticalForm) {
            this.pharmaceuticalForm = pharmaceuticalForm;
            return this;
        }

        public Builder route(String route) {
            this.route = route;
            return this;
        }

        public Builder measurementUnit(String measurementUnit) {
            this.measurementUnit = measurementUnit;
            return this;
        }

        public Builder quantity(double quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder referenceQuantity(double referenceQuantity) {
            this.referenceQuantity = referenceQuantity;
            return this;
        }

        public Builder registrationStatus(RegistrationStatus registrationStatus) {
            this.registrationStatus = registrationStatus;
            return this;
        }

        public Builder cumStatus(CumStatus cumStatus) {
            this.cumStatus = cumStatus;
            return this;
        }

        public Builder medicalSample(boolean medicalSample) {
            this.medicalSample = medicalSample;
            return this;
        }

        public Builder expirationDate(LocalDate expirationDate) {
            this.expirationDate = expirationDate;
            return this;
        }

        public Builder pbsCoverage(boolean pbsCoverage) {
            this.pbsCoverage = pbsCoverage;
            return this;
        }

        public MedicationRecord build() {
            return new MedicationRecord(cum, productName, activeIngredient, atcCode, atcDescription,
                pharmaceuticalForm, route, measurementUnit, quantity, referenceQuantity,
                registrationStatus, cumStatus, medicalSample, expirationDate, pbsCoverage);
        }
    }
}
