package io.meld.core.model;

import io.meld.core.state.StateService;
import java.util.Objects;

/**
 * Everything a handler gets besides the node itself.
 *
 * @param currentFilePath  file containing the directive, or {@code null}
 * @param parentState      state the working state was forked from (provenance)
 * @param state            working state, always a fresh child of {@code parentState}
 * @param workingDirectory directory for relative paths and commands, or {@code null} for the cwd
 */
public record DirectiveContext(
        String currentFilePath, StateService parentState, StateService state, String workingDirectory) {

    public DirectiveContext {
        Objects.requireNonNull(state, "state must not be null");
    }
}
