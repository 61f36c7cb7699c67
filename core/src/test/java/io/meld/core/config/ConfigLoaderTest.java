package io.meld.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConfigLoader}: YAML fixtures from the classpath, defaults for missing keys,
 * the environment overlay and the error paths.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("full config populates every field")
        void fullConfig() throws Exception {
            MeldConfig config = ConfigLoader.load(fixture("meld-full.yaml"), NO_ENV);

            assertThat(config.transformationEnabled()).isTrue();
            assertThat(config.maxResolutionDepth()).isEqualTo(5);
            assertThat(config.maxResolutionIterations()).isEqualTo(40);
            assertThat(config.sectionFuzzyThreshold()).isEqualTo(0.55);
            assertThat(config.homePath()).isEqualTo("/home/writer");
            assertThat(config.projectPath()).isEqualTo("/work/handbook");
            assertThat(config.validationEnabled()).isFalse();
        }

        @Test
        @DisplayName("missing keys keep their defaults")
        void partialConfig() throws Exception {
            MeldConfig config = ConfigLoader.load(fixture("meld-partial.yaml"), NO_ENV);

            assertThat(config.maxResolutionDepth()).isEqualTo(3);
            assertThat(config.maxResolutionIterations()).isEqualTo(100);
            assertThat(config.sectionFuzzyThreshold()).isEqualTo(0.7);
            assertThat(config.transformationEnabled()).isFalse();
            assertThat(config.validationEnabled()).isTrue();
            assertThat(config.projectPath()).isEqualTo(System.getProperty("user.dir"));
        }

        @Test
        @DisplayName("an empty document yields the defaults")
        void emptyConfig() throws Exception {
            assertThat(ConfigLoader.load(fixture("meld-empty.yaml"), NO_ENV)).isEqualTo(MeldConfig.defaults());
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        @DisplayName("env vars win over YAML values")
        void envWins() throws Exception {
            Map<String, String> env = Map.of(
                    "MELD_MAX_RESOLUTION_DEPTH", " 8 ",
                    "MELD_TRANSFORMATION", "false",
                    "MELD_PROJECT_PATH", "/srv/docs",
                    "MELD_SECTION_FUZZY_THRESHOLD", "0.9");

            MeldConfig config = ConfigLoader.load(fixture("meld-full.yaml"), env::get);

            assertThat(config.maxResolutionDepth()).isEqualTo(8);
            assertThat(config.transformationEnabled()).isFalse();
            assertThat(config.projectPath()).isEqualTo("/srv/docs");
            assertThat(config.sectionFuzzyThreshold()).isEqualTo(0.9);
            assertThat(config.homePath()).isEqualTo("/home/writer");
        }

        @Test
        @DisplayName("blank env vars count as unset")
        void blankIgnored() throws Exception {
            Map<String, String> env = Map.of("MELD_MAX_RESOLUTION_DEPTH", "   ", "MELD_HOME_PATH", "");

            MeldConfig config = ConfigLoader.load(fixture("meld-full.yaml"), env::get);

            assertThat(config.maxResolutionDepth()).isEqualTo(5);
            assertThat(config.homePath()).isEqualTo("/home/writer");
        }

        @Test
        @DisplayName("defaults take the overlay too")
        void defaultsWithEnv() {
            MeldConfig config = ConfigLoader.defaults(Map.of("MELD_VALIDATION", "false")::get);

            assertThat(config.validationEnabled()).isFalse();
            assertThat(config.maxResolutionDepth()).isEqualTo(10);
        }

        @Test
        @DisplayName("non-numeric env values are rejected")
        void badNumber() {
            assertThatThrownBy(() -> ConfigLoader.defaults(Map.of("MELD_MAX_RESOLUTION_ITERATIONS", "lots")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("MELD_MAX_RESOLUTION_ITERATIONS must be an integer, got 'lots'")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("missing file")
        void missingFile() {
            Path missing = Path.of("does-not-exist", "meld.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found");
        }

        @Test
        @DisplayName("malformed YAML")
        void malformedYaml() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("meld-malformed.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML configuration");
        }

        @Test
        @DisplayName("root must be a mapping")
        void listRoot() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("meld-list-root.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("must be a mapping");
        }

        @Test
        @DisplayName("out-of-range values fail validation")
        void outOfRange() {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("meld-invalid-threshold.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("sections.fuzzy-threshold must be within [0, 1], got 1.5");
            assertThatThrownBy(() -> ConfigLoader.defaults(Map.of("MELD_MAX_RESOLUTION_DEPTH", "0")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("max-depth must be positive");
        }
    }
}
