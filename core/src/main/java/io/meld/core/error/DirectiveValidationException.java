package io.meld.core.error;

import io.meld.core.model.DirectiveNode;
import java.util.List;

/** Thrown by a {@code DirectiveValidator} when a directive payload does not have the expected shape. */
public final class DirectiveValidationException extends MeldException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public DirectiveValidationException(String message, DirectiveNode node, List<String> violations) {
        super(message, Phase.DIRECTIVE, node != null ? node.location() : null);
        this.violations = List.copyOf(violations);
    }

    /** Individual schema violation messages, possibly empty. */
    public List<String> violations() {
        return violations;
    }
}
