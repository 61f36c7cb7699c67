package io.meld.core.spi;

import io.meld.core.error.DirectiveValidationException;
import io.meld.core.model.DirectiveNode;

/** Checks the shape of a directive payload before its handler runs. */
@FunctionalInterface
public interface DirectiveValidator {

    /** Accepts everything. */
    DirectiveValidator NONE = node -> {};

    /** @throws DirectiveValidationException if the payload is malformed for its kind */
    void validate(DirectiveNode node);
}
