package io.meld.core.directive.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.ResolutionContext;
import io.meld.core.resolution.ResolutionContexts;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.state.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code @data name = value}. A string value is JSON text: its references are resolved in the raw
 * text, the result is parsed, and every string leaf of the parsed value is resolved again (object
 * keys are left alone). A structured value is resolved in place.
 */
public final class DataDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(DataDirectiveHandler.class);

    private final ResolutionService resolution;
    private final ObjectMapper mapper;

    public DataDirectiveHandler(ResolutionService resolution, ObjectMapper mapper) {
        this.resolution = resolution;
        this.mapper = mapper;
    }

    @Override
    public String kind() {
        return "data";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        String identifier = requireText(node, "identifier");
        JsonNode raw = node.field("value");
        if (raw == null || raw.isNull()) {
            throw failure("data directive requires 'value'", DirectiveErrorCode.VALIDATION_FAILED, node, null);
        }
        ResolutionContext resolutionContext =
                ResolutionContexts.forData(context.state(), context.currentFilePath());

        JsonNode value;
        if (raw.isTextual()) {
            String text = resolution.resolveInContext(raw.asText(), resolutionContext);
            JsonNode parsed;
            try {
                parsed = mapper.readTree(text);
            } catch (JsonProcessingException e) {
                throw failure(
                        "Invalid JSON in data directive '" + identifier + "': " + e.getOriginalMessage(),
                        DirectiveErrorCode.EXECUTION_FAILED,
                        node,
                        e);
            }
            if (parsed == null || parsed.isMissingNode()) {
                throw failure(
                        "Invalid JSON in data directive '" + identifier + "': empty value",
                        DirectiveErrorCode.EXECUTION_FAILED,
                        node,
                        null);
            }
            value = resolution.resolveData(parsed, resolutionContext);
        } else {
            value = resolution.resolveData(raw, resolutionContext);
        }

        StateService state = context.state().clone();
        state.setDataVar(identifier, value);
        LOG.debug("Set data variable {}", identifier);
        return new DirectiveResult.StateOnly(state);
    }
}
