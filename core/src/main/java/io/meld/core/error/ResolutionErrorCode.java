package io.meld.core.error;

/** Machine-checkable reason codes for {@link ResolutionException}. */
public enum ResolutionErrorCode {
    UNDEFINED_VARIABLE,
    CIRCULAR_REFERENCE,
    INVALID_CONTEXT,
    INVALID_VARIABLE_TYPE,
    INVALID_PATH,
    MAX_ITERATIONS_EXCEEDED,
    MAX_DEPTH_EXCEEDED,
    SYNTAX_ERROR,
    FIELD_ACCESS_ERROR,
    INVALID_NODE_TYPE,
    INVALID_COMMAND,
    VARIABLE_NOT_FOUND,
    SECTION_NOT_FOUND
}
