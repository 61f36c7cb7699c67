package io.meld.core.error;

/** Normalized reason codes attached to every {@link DirectiveException}. */
public enum DirectiveErrorCode {
    VALIDATION_FAILED,
    RESOLUTION_FAILED,
    EXECUTION_FAILED,
    HANDLER_NOT_FOUND,
    FILE_NOT_FOUND,
    CIRCULAR_IMPORT,
    PARAMETER_MISMATCH,
    INVALID_PATH,
    VARIABLE_NOT_FOUND,
    INVALID_NODE_TYPE,
    INITIALIZATION_FAILED
}
