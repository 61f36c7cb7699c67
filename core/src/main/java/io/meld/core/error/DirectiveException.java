package io.meld.core.error;

import io.meld.core.model.DirectiveNode;

/**
 * Normalized directive failure: {@code {message, kind, code, node, cause}}. Handlers throw it for
 * failures they recognize; the dispatcher wraps anything else into one.
 */
public final class DirectiveException extends MeldException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final DirectiveErrorCode code;
    private final transient DirectiveNode node;

    public DirectiveException(String message, String kind, DirectiveErrorCode code, DirectiveNode node) {
        super(message, Phase.DIRECTIVE, node != null ? node.location() : null);
        this.kind = kind;
        this.code = code;
        this.node = node;
    }

    public DirectiveException(
            String message, String kind, DirectiveErrorCode code, DirectiveNode node, Throwable cause) {
        super(message, cause, Phase.DIRECTIVE, node != null ? node.location() : null);
        this.kind = kind;
        this.code = code;
        this.node = node;
    }

    /** The directive kind ({@code text}, {@code import}, ...). */
    public String kind() {
        return kind;
    }

    public DirectiveErrorCode code() {
        return code;
    }

    /** The directive node being processed, or {@code null} if not available. */
    public DirectiveNode node() {
        return node;
    }
}
