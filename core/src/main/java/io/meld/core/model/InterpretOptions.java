package io.meld.core.model;

import io.meld.core.state.StateService;

/**
 * Options for {@code InterpreterService.interpret}.
 *
 * @param initialState state to start from (and merge into when {@code mergeState}), or {@code null}
 * @param filePath     file being interpreted, or {@code null}
 * @param mergeState   fold the result back into {@code initialState} (default {@code true})
 */
public record InterpretOptions(StateService initialState, String filePath, boolean mergeState) {

    public static InterpretOptions defaults() {
        return new InterpretOptions(null, null, true);
    }

    public static InterpretOptions into(StateService initialState) {
        String filePath = initialState != null ? initialState.getCurrentFilePath() : null;
        return new InterpretOptions(initialState, filePath, true);
    }

    public InterpretOptions withFilePath(String path) {
        return new InterpretOptions(initialState, path, mergeState);
    }

    public InterpretOptions withMergeState(boolean merge) {
        return new InterpretOptions(initialState, filePath, merge);
    }
}
