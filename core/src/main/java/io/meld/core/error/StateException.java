package io.meld.core.error;

/** Thrown for illegal state operations: writes after {@code setImmutable()}, unknown transform targets. */
public final class StateException extends MeldException {

    private static final long serialVersionUID = 1L;

    public StateException(String message) {
        super(message, Phase.STATE, null);
    }
}
