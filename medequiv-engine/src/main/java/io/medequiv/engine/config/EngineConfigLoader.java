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

import io.medequiv.engine.encode.EligibilityRules;
import io.medequiv.engine.model.CumStatus;
import io.medequiv.engine.model.RegistrationStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Reads an [EngineConfig] from YAML.
///
/// ```yaml
/// k: 20
/// seed: 7
/// critical_weight: 0.8
/// important_weight: 0.2
/// bin_breakpoints: [10, 100, 500]
/// eligibility_rules:
///   registration_statuses: [ACTIVE, IN_RENEWAL]
///   cum_statuses: [ACTIVE]
///   exclude_medical_samples: true
/// ```
///
/// Missing keys keep their defaults. Unknown keys, wrongly typed values and
/// out-of-range values raise [InvalidConfigurationException]. Status lists
/// accept enum names or registry labels such as `Vigente`.
public final class EngineConfigLoader {

    private static final Logger logger = LogManager.getLogger(EngineConfigLoader.class);

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
        "k", "seed", "max_iterations", "tolerance", "n_restarts", "max_reseed_attempts",
        "critical_weight", "important_weight", "bin_breakpoints", "frequency_divisor",
        "default_top_k", "silhouette_sample_limit", "eligibility_rules");

    private static final Set<String> RULE_KEYS = Set.of(
        "registration_statuses", "cum_statuses", "exclude_medical_samples");

    private EngineConfigLoader() {
    }

    /// @param path a YAML file
    /// @return the validated configuration
    /// @throws IOException if the file cannot be read
    /// @throws InvalidConfigurationException if the content is not a valid configuration
    public static EngineConfig load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            EngineConfig config = load(reader);
            logger.info("loaded configuration from {}", path);
            return config;
        }
    }

    /// @param yaml YAML text
    /// @return the validated configuration
    public static EngineConfig parse(String yaml) {
        return load(new StringReader(yaml));
    }

    /// @param reader YAML source
    /// @return the validated configuration
    public static EngineConfig load(Reader reader) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        Object document;
        try {
            document = yaml.loadFromReader(reader);
        } catch (YamlEngineException e) {
            throw new InvalidConfigurationException("malformed YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return EngineConfig.DEFAULTS;
        }
        if (!(document instanceof Map)) {
            throw new InvalidConfigurationException("configuration must be a mapping, got " + typeName(document));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> cfgmap = (Map<String, Object>) document;
        return fromMap(cfgmap);
    }

    /// @param cfgmap parsed configuration entries
    /// @return the validated configuration
    public static EngineConfig fromMap(Map<String, Object> cfgmap) {
        checkKeys("configuration", cfgmap, TOP_LEVEL_KEYS);
        EngineConfig.Builder builder = EngineConfig.builder();
        if (cfgmap.containsKey("k")) {
            builder.k(intValue(cfgmap, "k"));
        }
        if (cfgmap.containsKey("seed")) {
            builder.seed(number(cfgmap, "seed").longValue());
        }
        if (cfgmap.containsKey("max_iterations")) {
            builder.maxIterations(intValue(cfgmap, "max_iterations"));
        }
        if (cfgmap.containsKey("tolerance")) {
            builder.tolerance(number(cfgmap, "tolerance").doubleValue());
        }
        if (cfgmap.containsKey("n_restarts")) {
            builder.nRestarts(intValue(cfgmap, "n_restarts"));
        }
        if (cfgmap.containsKey("max_reseed_attempts")) {
            builder.maxReseedAttempts(intValue(cfgmap, "max_reseed_attempts"));
        }
        if (cfgmap.containsKey("critical_weight")) {
            builder.criticalWeight(number(cfgmap, "critical_weight").doubleValue());
        }
        if (cfgmap.containsKey("important_weight")) {
            builder.importantWeight(number(cfgmap, "important_weight").doubleValue());
        }
        if (cfgmap.containsKey("bin_breakpoints")) {
            List<?> values = list(cfgmap, "bin_breakpoints");
            double[] breakpoints = new double[values.size()];
            for (int i = 0; i < breakpoints.length; i++) {
                Object value = values.get(i);
                if (!(value instanceof Number)) {
                    throw new InvalidConfigurationException("bin_breakpoints[" + i + "] must be a number, got "
                        + typeName(value));
                }
                breakpoints[i] = ((Number) value).doubleValue();
            }
            builder.binBreakpoints(breakpoints);
        }
        if (cfgmap.containsKey("frequency_divisor")) {
            builder.frequencyDivisor(intValue(cfgmap, "frequency_divisor"));
        }
        if (cfgmap.containsKey("default_top_k")) {
            builder.defaultTopK(intValue(cfgmap, "default_top_k"));
        }
        if (cfgmap.containsKey("silhouette_sample_limit")) {
            builder.silhouetteSampleLimit(intValue(cfgmap, "silhouette_sample_limit"));
        }
        if (cfgmap.containsKey("eligibility_rules")) {
            builder.eligibilityRules(rules(cfgmap.get("eligibility_rules")));
        }
        return builder.build();
    }

    private static EligibilityRules rules(Object node) {
        if (!(node instanceof Map)) {
            throw new InvalidConfigurationException("eligibility_rules must be a mapping, got " + typeName(node));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> rulemap = (Map<String, Object>) node;
        checkKeys("eligibility_rules", rulemap, RULE_KEYS);
        EligibilityRules defaults = EligibilityRules.DEFAULTS;

        Set<RegistrationStatus> registration = defaults.registrationStatuses();
        if (rulemap.containsKey("registration_statuses")) {
            registration = EnumSet.noneOf(RegistrationStatus.class);
            for (Object label : list(rulemap, "registration_statuses")) {
                registration.add(registrationStatus(String.valueOf(label)));
            }
        }
        Set<CumStatus> cum = defaults.cumStatuses();
        if (rulemap.containsKey("cum_statuses")) {
            cum = EnumSet.noneOf(CumStatus.class);
            for (Object label : list(rulemap, "cum_statuses")) {
                cum.add(cumStatus(String.valueOf(label)));
            }
        }
        boolean excludeSamples = defaults.excludeMedicalSamples();
        if (rulemap.containsKey("exclude_medical_samples")) {
            Object value = rulemap.get("exclude_medical_samples");
            if (!(value instanceof Boolean)) {
                throw new InvalidConfigurationException("exclude_medical_samples must be a boolean, got "
                    + typeName(value));
            }
            excludeSamples = (Boolean) value;
        }
        try {
            return new EligibilityRules(registration, cum, excludeSamples);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("invalid eligibility_rules: " + e.getMessage(), e);
        }
    }

    private static RegistrationStatus registrationStatus(String label) {
        RegistrationStatus status = RegistrationStatus.parse(label);
        if (status == RegistrationStatus.OTHER && !isOtherLabel(label)) {
            throw new InvalidConfigurationException("unknown registration status '" + label + "'");
        }
        return status;
    }

    private static CumStatus cumStatus(String label) {
        CumStatus status = CumStatus.parse(label);
        if (status == CumStatus.OTHER && !isOtherLabel(label)) {
            throw new InvalidConfigurationException("unknown CUM status '" + label + "'");
        }
        return status;
    }

    private static boolean isOtherLabel(String label) {
        return "OTHER".equals(label.trim().toUpperCase(Locale.ROOT));
    }

    private static void checkKeys(String section, Map<String, Object> map, Set<String> allowed) {
        for (String key : map.keySet()) {
            if (!allowed.contains(key)) {
                throw new InvalidConfigurationException("unknown key '" + key + "' in " + section);
            }
        }
    }

    private static Number number(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Number)) {
            throw new InvalidConfigurationException(key + " must be a number, got " + typeName(value));
        }
        return (Number) value;
    }

    private static int intValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new InvalidConfigurationException(key + " must be an integer, got " + typeName(value));
        }
        long longValue = ((Number) value).longValue();
        if (longValue > Integer.MAX_VALUE || longValue < Integer.MIN_VALUE) {
            throw new InvalidConfigurationException(key + " is out of range: " + longValue);
        }
        return (int) longValue;
    }

    private static List<?> list(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof List)) {
            throw new InvalidConfigurationException(key + " must be a list, got " + typeName(value));
        }
        return (List<?>) value;
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
