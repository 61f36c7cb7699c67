package io.meld.core.directive.handler;

import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.resolution.ResolutionContexts;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.state.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code @path name = value}: resolves the path in a path context and stores it verbatim. */
public final class PathDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(PathDirectiveHandler.class);

    private final ResolutionService resolution;

    public PathDirectiveHandler(ResolutionService resolution) {
        this.resolution = resolution;
    }

    @Override
    public String kind() {
        return "path";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        String identifier = requireText(node, "identifier");
        String raw = requireText(node, "value");
        String value =
                resolution.resolvePath(raw, ResolutionContexts.forPath(context.state(), context.currentFilePath()));

        StateService state = context.state().clone();
        state.setPathVar(identifier, value);
        LOG.debug("Set path variable {} = {}", identifier, value);
        return new DirectiveResult.StateOnly(state);
    }
}
