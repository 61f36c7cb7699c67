package io.meld.core.config;

/**
 * Engine configuration. Every field has a default; use {@link #builder()} to construct instances.
 *
 * @param transformationEnabled  start the root state in transformation mode
 * @param maxResolutionDepth     deepest allowed {@code ${${...}}} nesting
 * @param maxResolutionIterations most expansion rounds for one value
 * @param sectionFuzzyThreshold  section similarity threshold when a directive gives none, in [0, 1]
 * @param homePath               value of {@code ~} / {@code HOMEPATH}
 * @param projectPath            value of {@code .} / {@code PROJECTPATH}; also the working
 *                               directory for relative paths and commands
 * @param validationEnabled      validate directive payloads against their schemas
 */
public record MeldConfig(
        boolean transformationEnabled,
        int maxResolutionDepth,
        int maxResolutionIterations,
        double sectionFuzzyThreshold,
        String homePath,
        String projectPath,
        boolean validationEnabled) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** The default configuration, without any environment overlay. */
    public static MeldConfig defaults() {
        return builder().build();
    }

    /** Builder for {@link MeldConfig}. */
    public static final class Builder {
        private boolean transformationEnabled = false;
        private int maxResolutionDepth = 10;
        private int maxResolutionIterations = 100;
        private double sectionFuzzyThreshold = 0.7;
        private String homePath = System.getProperty("user.home");
        private String projectPath = System.getProperty("user.dir");
        private boolean validationEnabled = true;

        Builder() {}

        public Builder transformationEnabled(boolean transformationEnabled) {
            this.transformationEnabled = transformationEnabled;
            return this;
        }

        public Builder maxResolutionDepth(int maxResolutionDepth) {
            this.maxResolutionDepth = maxResolutionDepth;
            return this;
        }

        public Builder maxResolutionIterations(int maxResolutionIterations) {
            this.maxResolutionIterations = maxResolutionIterations;
            return this;
        }

        public Builder sectionFuzzyThreshold(double sectionFuzzyThreshold) {
            this.sectionFuzzyThreshold = sectionFuzzyThreshold;
            return this;
        }

        public Builder homePath(String homePath) {
            this.homePath = homePath;
            return this;
        }

        public Builder projectPath(String projectPath) {
            this.projectPath = projectPath;
            return this;
        }

        public Builder validationEnabled(boolean validationEnabled) {
            this.validationEnabled = validationEnabled;
            return this;
        }

        public MeldConfig build() {
            return new MeldConfig(
                    transformationEnabled,
                    maxResolutionDepth,
                    maxResolutionIterations,
                    sectionFuzzyThreshold,
                    homePath,
                    projectPath,
                    validationEnabled);
        }
    }
}
