package io.meld.core.directive.handler;

import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.resolution.ResolutionContexts;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.state.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code @text name = value}: resolves a literal, concatenation or template and stores it. */
public final class TextDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(TextDirectiveHandler.class);

    private final ResolutionService resolution;

    public TextDirectiveHandler(ResolutionService resolution) {
        this.resolution = resolution;
    }

    @Override
    public String kind() {
        return "text";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        String identifier = requireText(node, "identifier");
        String raw = requireText(node, "value");
        String value = resolution.resolveText(
                raw, ResolutionContexts.forText(context.state(), context.currentFilePath()));

        StateService state = context.state().clone();
        state.setTextVar(identifier, value);
        LOG.debug("Set text variable {}", identifier);
        return new DirectiveResult.StateOnly(state);
    }
}
