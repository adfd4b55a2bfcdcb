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

import io.medequiv.engine.resolve.CandidateFilter;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/// Shared repeatable `--filter` option.
public class FilterOption {

    /// Picocli converter accepting `atc_exact_match`, `ATC-EXACT-MATCH` and similar spellings.
    public static class FilterConverter implements CommandLine.ITypeConverter<CandidateFilter> {
        @Override
        public CandidateFilter convert(String value) {
            try {
                return CandidateFilter.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage()
                    + "; expected one of registration_active, not_medical_sample, atc_exact_match, coverage_in_pbs");
            }
        }
    }

    @CommandLine.Option(
        names = {"--filter"},
        description = "Hard candidate filter, repeatable: registration_active, not_medical_sample, "
            + "atc_exact_match, coverage_in_pbs",
        converter = FilterConverter.class
    )
    private List<CandidateFilter> filters = new ArrayList<>();

    /// @return the requested filters, possibly empty
    public Set<CandidateFilter> getFilters() {
        if (filters == null || filters.isEmpty()) {
            return Collections.emptySet();
        }
        return EnumSet.copyOf(filters);
    }

    @Override
    public String toString() {
        return String.valueOf(getFilters());
    }
}
