package io.meld.core.error;

import io.meld.core.model.SourceLocation;

/**
 * Abstract base for all interpreter exceptions. Never thrown directly; each failure surfaces as one
 * of the concrete subclasses, tagged with the {@link Phase} it came from and, when known, the source
 * location of the offending node.
 */
public abstract class MeldException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        PARSE,
        RESOLUTION,
        DIRECTIVE,
        INTERPRETATION,
        STATE
    }

    private final Phase phase;
    private final transient SourceLocation location;

    protected MeldException(String message, Phase phase, SourceLocation location) {
        super(message);
        this.phase = phase;
        this.location = location;
    }

    protected MeldException(String message, Throwable cause, Phase phase, SourceLocation location) {
        super(message, cause);
        this.phase = phase;
        this.location = location;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    /** Source location of the node that failed, or {@code null} if unknown. */
    public SourceLocation location() {
        return location;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }
}
