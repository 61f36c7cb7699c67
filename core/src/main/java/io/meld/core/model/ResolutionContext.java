package io.meld.core.model;

import io.meld.core.state.StateService;
import java.util.List;
import java.util.Objects;

/**
 * Per-call resolution context. Built fresh for every resolution and never mutated; the state is
 * borrowed and only read.
 *
 * @param currentFilePath file whose content is being resolved, or {@code null}
 * @param allowed         reference kinds permitted here
 * @param pathValidation  optional path constraints, {@code null} for none
 * @param state           state that references are looked up in
 */
public record ResolutionContext(
        String currentFilePath, AllowedVariableTypes allowed, PathValidation pathValidation, StateService state) {

    public ResolutionContext {
        Objects.requireNonNull(allowed, "allowed must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    /** Which reference kinds may appear. */
    public record AllowedVariableTypes(boolean text, boolean data, boolean path, boolean command) {

        public static final AllowedVariableTypes ALL = new AllowedVariableTypes(true, true, true, true);
        public static final AllowedVariableTypes NONE = new AllowedVariableTypes(false, false, false, false);
    }

    /**
     * Constraints on resolved paths.
     *
     * @param requireAbsolute resolved path must be absolute
     * @param allowedRoots    names of path variables the resolved path must start with; empty means any
     */
    public record PathValidation(boolean requireAbsolute, List<String> allowedRoots) {

        public PathValidation {
            allowedRoots = allowedRoots == null ? List.of() : List.copyOf(allowedRoots);
        }
    }

    public ResolutionContext withAllowed(AllowedVariableTypes types) {
        return new ResolutionContext(currentFilePath, types, pathValidation, state);
    }

    public ResolutionContext withPathValidation(PathValidation validation) {
        return new ResolutionContext(currentFilePath, allowed, validation, state);
    }
}
