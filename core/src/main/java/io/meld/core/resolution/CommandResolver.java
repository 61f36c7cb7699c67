package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.CommandDefinition;
import io.meld.core.model.ResolutionContext;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands a defined command into the shell command it stands for. The definition must be wrapped
 * in {@code @run [...]}; arguments replace the {@code ${param}} placeholders positionally.
 */
public final class CommandResolver {

    static final Pattern RUN_TEMPLATE = Pattern.compile("^@run\\s*\\[(.*)\\]$", Pattern.DOTALL);

    /**
     * Expands {@code $identifier(args)} to the command's {@code @run} body with each parameter
     * reference replaced by its argument.
     *
     * @throws ResolutionException {@link ResolutionErrorCode#UNDEFINED_VARIABLE} if the command is not
     *     defined; {@link ResolutionErrorCode#INVALID_COMMAND} if its template is not a {@code @run}
     *     or the argument count differs from the parameter count
     */
    public String resolve(String identifier, List<String> args, ResolutionContext context) {
        if (!context.allowed().command()) {
            throw new ResolutionException(
                    "Command references are not allowed in this context",
                    ResolutionErrorCode.INVALID_CONTEXT,
                    identifier);
        }
        CommandDefinition definition = context.state().getCommand(identifier);
        if (definition == null) {
            throw new ResolutionException(
                    "Undefined command: " + identifier, ResolutionErrorCode.UNDEFINED_VARIABLE, identifier);
        }
        Matcher m = RUN_TEMPLATE.matcher(definition.command().trim());
        if (!m.matches()) {
            throw new ResolutionException(
                    "Invalid command definition for " + identifier + ": must be wrapped in @run [...]",
                    ResolutionErrorCode.INVALID_COMMAND,
                    definition.command());
        }
        String template = m.group(1);
        List<String> parameters = definition.parameters().isEmpty()
                ? ReferenceScanner.placeholders(template)
                : definition.parameters();
        if (args.size() != parameters.size()) {
            throw new ResolutionException(
                    "Command " + identifier + " expects " + parameters.size() + " parameters but got " + args.size(),
                    ResolutionErrorCode.INVALID_COMMAND,
                    identifier);
        }
        String result = template;
        for (int i = 0; i < parameters.size(); i++) {
            result = result.replace("${" + parameters.get(i) + "}", args.get(i));
        }
        return result.trim();
    }
}
