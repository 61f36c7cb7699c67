package io.meld.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link MeldConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * YAML layout:
 *
 * <pre>
 * transformation:
 *   enabled: true
 * resolution:
 *   max-depth: 10
 *   max-iterations: 100
 * sections:
 *   fuzzy-threshold: 0.7
 * paths:
 *   home: /home/me
 *   project: /work/project
 * validation:
 *   enabled: true
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code MELD_TRANSFORMATION},
 * {@code MELD_MAX_RESOLUTION_DEPTH}, {@code MELD_MAX_RESOLUTION_ITERATIONS},
 * {@code MELD_SECTION_FUZZY_THRESHOLD}, {@code MELD_HOME_PATH}, {@code MELD_PROJECT_PATH},
 * {@code MELD_VALIDATION}). Env vars take precedence over YAML values. An env var is "set" if and
 * only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /** Defaults with the environment overlay from {@link System#getenv}. */
    public static MeldConfig defaults() {
        return defaults(System::getenv);
    }

    /** Defaults with the environment overlay from {@code envLookup}. */
    public static MeldConfig defaults(Function<String, String> envLookup) {
        MeldConfig.Builder builder = MeldConfig.builder();
        applyEnvOverrides(builder, envLookup);
        return validate(builder.build());
    }

    /**
     * Loads the config at {@code configPath}, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static MeldConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the config at {@code configPath}, applying overrides from {@code envLookup}. The
     * lookup returns {@code null} for an undefined variable.
     *
     * @throws ConfigLoadException if the file is missing, is not valid YAML or holds an invalid value
     */
    public static MeldConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a mapping: " + configPath);
        }

        MeldConfig.Builder builder = MeldConfig.builder();

        // --- YAML mapping ---

        JsonNode transformation = root.path("transformation");
        if (transformation.has("enabled"))
            builder.transformationEnabled(transformation.get("enabled").asBoolean());

        JsonNode resolution = root.path("resolution");
        if (resolution.has("max-depth"))
            builder.maxResolutionDepth(resolution.get("max-depth").asInt());
        if (resolution.has("max-iterations"))
            builder.maxResolutionIterations(resolution.get("max-iterations").asInt());

        JsonNode sections = root.path("sections");
        if (sections.has("fuzzy-threshold"))
            builder.sectionFuzzyThreshold(sections.get("fuzzy-threshold").asDouble());

        JsonNode paths = root.path("paths");
        if (paths.has("home")) builder.homePath(paths.get("home").asText());
        if (paths.has("project")) builder.projectPath(paths.get("project").asText());

        JsonNode validation = root.path("validation");
        if (validation.has("enabled"))
            builder.validationEnabled(validation.get("enabled").asBoolean());

        // --- Environment variable overlay ---
        applyEnvOverrides(builder, envLookup);

        return validate(builder.build());
    }

    private static void applyEnvOverrides(MeldConfig.Builder builder, Function<String, String> envLookup) {
        envBool(envLookup, "MELD_TRANSFORMATION", builder::transformationEnabled);
        envInt(envLookup, "MELD_MAX_RESOLUTION_DEPTH", builder::maxResolutionDepth);
        envInt(envLookup, "MELD_MAX_RESOLUTION_ITERATIONS", builder::maxResolutionIterations);
        envDouble(envLookup, "MELD_SECTION_FUZZY_THRESHOLD", builder::sectionFuzzyThreshold);
        envString(envLookup, "MELD_HOME_PATH", builder::homePath);
        envString(envLookup, "MELD_PROJECT_PATH", builder::projectPath);
        envBool(envLookup, "MELD_VALIDATION", builder::validationEnabled);
    }

    private static MeldConfig validate(MeldConfig config) {
        if (config.maxResolutionDepth() <= 0) {
            throw new ConfigLoadException(
                    "resolution.max-depth must be positive, got " + config.maxResolutionDepth());
        }
        if (config.maxResolutionIterations() <= 0) {
            throw new ConfigLoadException(
                    "resolution.max-iterations must be positive, got " + config.maxResolutionIterations());
        }
        double threshold = config.sectionFuzzyThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ConfigLoadException("sections.fuzzy-threshold must be within [0, 1], got " + threshold);
        }
        return config;
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envDouble(Function<String, String> envLookup, String envVar, DoubleConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Double.parseDouble(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be a number, got '" + value + "'", e);
            }
        }
    }
}
