package io.meld.core.error;

import io.meld.core.model.SourceLocation;

/**
 * Thrown by the interpreter when a node fails. Carries the node type, its location and the file
 * path of the state that was running when the failure happened.
 */
public final class InterpreterException extends MeldException {

    private static final long serialVersionUID = 1L;

    private final String nodeType;
    private final String filePath;

    public InterpreterException(String message, String nodeType, SourceLocation location, String filePath) {
        super(message, Phase.INTERPRETATION, location);
        this.nodeType = nodeType;
        this.filePath = filePath;
    }

    public InterpreterException(
            String message, Throwable cause, String nodeType, SourceLocation location, String filePath) {
        super(message, cause, Phase.INTERPRETATION, location);
        this.nodeType = nodeType;
        this.filePath = filePath;
    }

    /** Type of the node that failed ({@code Text}, {@code Directive}, ...), or {@code null}. */
    public String nodeType() {
        return nodeType;
    }

    /** File path of the running state, or {@code null} if it had none. */
    public String filePath() {
        return filePath;
    }
}
