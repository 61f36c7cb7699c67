package io.meld.core.directive.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.model.CommandDefinition;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.RiskLevel;
import io.meld.core.resolution.ReferenceScanner;
import io.meld.core.state.StateService;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code @define name(params) = template}. The identifier may carry one metadata suffix:
 * {@code .risk.<low|medium|high>} or {@code .about.<description>}. Declared parameters must be
 * identifier-shaped and unique; when any are declared, every {@code ${x}} placeholder in the
 * template must be a declared parameter or an already defined variable.
 */
public final class DefineDirectiveHandler extends AbstractDirectiveHandler {

    private static final Logger LOG = LoggerFactory.getLogger(DefineDirectiveHandler.class);

    static final String DEFAULT_DESCRIPTION = "Defined command";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    /** Parsed identifier: the command name plus optional metadata. */
    record Name(String name, RiskLevel risk, String description) {}

    @Override
    public String kind() {
        return "define";
    }

    @Override
    public DirectiveResult execute(DirectiveNode node, DirectiveContext context) {
        Name name = parseIdentifier(requireText(node, "identifier"), node);
        String template = requireText(node, "value").trim();
        List<String> parameters = parameters(node);

        if (!parameters.isEmpty()) {
            for (String placeholder : ReferenceScanner.placeholders(template)) {
                String base = ReferenceScanner.baseName(placeholder);
                if (!parameters.contains(base)
                        && context.state().getTextVar(base) == null
                        && context.state().getDataVar(base) == null) {
                    throw failure(
                            "Command " + name.name() + " references undeclared parameter '" + base + "'",
                            DirectiveErrorCode.VALIDATION_FAILED,
                            node,
                            null);
                }
            }
        }

        StateService state = context.state().clone();
        state.setCommand(name.name(), new CommandDefinition(template, parameters, name.risk(), name.description()));
        LOG.debug("Defined command {} with parameters {}", name.name(), parameters);
        return new DirectiveResult.StateOnly(state);
    }

    Name parseIdentifier(String identifier, DirectiveNode node) {
        int dot = identifier.indexOf('.');
        String name = dot < 0 ? identifier : identifier.substring(0, dot);
        if (!IDENTIFIER.matcher(name).matches()) {
            throw failure("Invalid command name: " + name, DirectiveErrorCode.VALIDATION_FAILED, node, null);
        }
        if (dot < 0) {
            return new Name(name, null, null);
        }
        String suffix = identifier.substring(dot + 1);
        if (suffix.startsWith("risk.")) {
            try {
                return new Name(name, RiskLevel.parse(suffix.substring("risk.".length())), null);
            } catch (IllegalArgumentException e) {
                throw failure(
                        "Invalid risk level in '" + identifier + "'. Must be high, medium, or low",
                        DirectiveErrorCode.VALIDATION_FAILED,
                        node,
                        e);
            }
        }
        if (suffix.equals("about") || suffix.startsWith("about.")) {
            String about = suffix.length() > "about.".length() ? suffix.substring("about.".length()).trim() : "";
            return new Name(name, null, about.isEmpty() ? DEFAULT_DESCRIPTION : about);
        }
        throw failure(
                "Invalid metadata '" + suffix + "' in '" + identifier + "'. Only risk and about are supported",
                DirectiveErrorCode.VALIDATION_FAILED,
                node,
                null);
    }

    private List<String> parameters(DirectiveNode node) {
        JsonNode raw = node.field("parameters");
        List<String> parameters = new ArrayList<>();
        if (raw == null || raw.isNull()) {
            return parameters;
        }
        if (!raw.isArray()) {
            throw failure("'parameters' must be an array", DirectiveErrorCode.VALIDATION_FAILED, node, null);
        }
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode element : raw) {
            String param = element.asText().trim();
            if (!IDENTIFIER.matcher(param).matches()) {
                throw failure(
                        "Invalid parameter name: '" + param + "'", DirectiveErrorCode.VALIDATION_FAILED, node, null);
            }
            if (!seen.add(param)) {
                throw failure(
                        "Duplicate parameter name: '" + param + "'", DirectiveErrorCode.VALIDATION_FAILED, node, null);
            }
            parameters.add(param);
        }
        return parameters;
    }
}
