package com.raditha.typebench.config;

import com.raditha.typebench.model.ConstructorKind;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the evaluation configuration from the YAML document with CLI overrides.
 *
 * Configuration priority: CLI arguments > typebench.yml > defaults
 */
public class EvaluationSettings {

    private static final String CONFIG_KEY = "typebench";

    private EvaluationSettings() {
    }

    /**
     * Build the configuration.
     *
     * @param document          parsed YAML document (may be empty)
     * @param numWorkersCLI     CLI worker count (0 = use YAML/default)
     * @param timeoutSecondsCLI CLI checker timeout in seconds (0 = use YAML/default)
     * @param cacheDirCLI       CLI cache directory (null = use YAML/default)
     * @return complete evaluation configuration
     * @throws IllegalArgumentException for invalid values
     */
    public static EvaluationConfig loadConfig(Map<String, Object> document, int numWorkersCLI,
                                              int timeoutSecondsCLI, @Nullable Path cacheDirCLI) {
        EvaluationConfig defaults = EvaluationConfig.defaults();
        Map<String, Object> config = getMap(document, CONFIG_KEY);

        int numWorkers = numWorkersCLI != 0 ? numWorkersCLI : getInt(config, "num_workers", defaults.numWorkers());
        CheckerConfig checker = buildChecker(getMap(config, "checker"), timeoutSecondsCLI);
        SimilarityPolicy similarity = buildSimilarity(getMap(config, "similarity"));

        List<Integer> thresholds = getListInt(config, "frequency_thresholds");
        int maxDepth = getInt(config, "max_depth", EvaluationConfig.DEFAULT_MAX_DEPTH);

        Path cacheDir = cacheDirCLI;
        if (cacheDir == null) {
            String fromYaml = getString(config, "cache_dir", null);
            cacheDir = fromYaml != null ? Path.of(fromYaml) : EvaluationConfig.DEFAULT_CACHE_DIR;
        }

        return new EvaluationConfig(numWorkers, checker, similarity, thresholds, maxDepth, cacheDir);
    }

    private static CheckerConfig buildChecker(Map<String, Object> config, int timeoutSecondsCLI) {
        List<String> command = getCommand(config);
        long timeoutSeconds = timeoutSecondsCLI != 0
                ? timeoutSecondsCLI
                : getInt(config, "timeout_seconds", (int) CheckerConfig.DEFAULT_TIMEOUT.toSeconds());
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("checker timeout must be positive, got " + timeoutSeconds);
        }
        String environmentRoot = getString(config, "environment_root", null);

        List<Integer> okCodes = getListInt(config, "ok_exit_codes");
        List<String> keepCodes = getListString(config, "keep_codes");

        return new CheckerConfig(
                command,
                Duration.ofSeconds(timeoutSeconds),
                environmentRoot != null ? Path.of(environmentRoot) : null,
                okCodes.isEmpty() ? CheckerConfig.DEFAULT_OK_EXIT_CODES : new LinkedHashSet<>(okCodes),
                keepCodes.isEmpty() ? CheckerConfig.DEFAULT_KEEP_CODES : Set.copyOf(keepCodes),
                getString(config, "keyword", CheckerConfig.DEFAULT_KEYWORD));
    }

    private static SimilarityPolicy buildSimilarity(Map<String, Object> config) {
        SimilarityPolicy defaults = SimilarityPolicy.defaults();
        if (config.isEmpty()) {
            return defaults;
        }
        double localWeight = getDouble(config, "local_weight", defaults.localWeight());
        double sameKindCredit = getDouble(config, "same_kind_credit", defaults.sameKindCredit());

        List<SimilarityPolicy.AffinityRule> overrides = new ArrayList<>();
        Object affinity = config.get("affinity");
        if (affinity instanceof List<?> entries) {
            for (Object entry : entries) {
                if (!(entry instanceof Map)) {
                    throw new IllegalArgumentException("similarity.affinity entries must be mappings");
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> rule = (Map<String, Object>) entry;
                overrides.add(new SimilarityPolicy.AffinityRule(
                        parseKind(getString(rule, "a", null)),
                        parseKind(getString(rule, "b", null)),
                        getDouble(rule, "score", -1.0)));
            }
        }
        return defaults.withOverrides(localWeight, sameKindCredit, overrides);
    }

    private static ConstructorKind parseKind(@Nullable String value) {
        if (value == null) {
            throw new IllegalArgumentException("similarity.affinity entries need both 'a' and 'b'");
        }
        try {
            return ConstructorKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown constructor kind in similarity.affinity: " + value, e);
        }
    }

    private static List<String> getCommand(Map<String, Object> config) {
        Object value = config.get("command");
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object part : list) {
                parts.add(String.valueOf(part));
            }
            return parts;
        }
        if (value != null) {
            return List.of(value.toString().trim().split("\\s+"));
        }
        return CheckerConfig.DEFAULT_COMMAND;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static List<Integer> getListInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            List<Integer> ints = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Number)) {
                    throw new IllegalArgumentException(key + " must contain integers, got " + item);
                }
                ints.add(((Number) item).intValue());
            }
            return ints;
        }
        return List.of();
    }
}
