package io.meld.core.error;

import io.meld.core.model.SourceLocation;

/** Thrown by a {@code DocumentParser} when the input cannot be parsed. */
public final class DocumentParseException extends MeldException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, SourceLocation location) {
        super(message, Phase.PARSE, location);
    }

    public DocumentParseException(String message, Throwable cause, SourceLocation location) {
        super(message, cause, Phase.PARSE, location);
    }
}
