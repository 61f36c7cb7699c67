package io.meld.core.directive;

import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;

/**
 * Executes one directive kind.
 *
 * <p>
 * Implementations never write to {@code context.state()} itself: they clone it, write to the
 * clone and return the clone, bundled with a replacement node only in transformation mode and
 * only for directives with visible output.
 */
public interface DirectiveHandler {

    /** Directive kind this handler executes ({@code text}, {@code run}, ...). */
    String kind();

    DirectiveResult execute(DirectiveNode node, DirectiveContext context);
}
