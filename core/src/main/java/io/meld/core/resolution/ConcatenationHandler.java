package io.meld.core.resolution;

import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.ResolutionContext;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code ++} concatenation. The operator needs whitespace on both sides and is ignored inside
 * quotes; each part is either a string literal or a variable expression.
 */
public final class ConcatenationHandler {

    private final StringLiteralHandler literals;
    private final VariableReferenceResolver variables;

    public ConcatenationHandler(StringLiteralHandler literals, VariableReferenceResolver variables) {
        this.literals = literals;
        this.variables = variables;
    }

    public boolean hasConcatenation(String value) {
        return value != null && split(value).size() > 1;
    }

    /**
     * Resolves every part and joins them. Literal parts are unquoted and then have their
     * {@code ${}} and {@code #{}} references expanded; other parts are expanded directly.
     *
     * @throws ResolutionException with {@link ResolutionErrorCode#SYNTAX_ERROR} for an empty part
     */
    public String resolve(String value, ResolutionContext context) {
        List<String> parts = split(value);
        StringBuilder result = new StringBuilder();
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new ResolutionException(
                        "Empty part in concatenation", ResolutionErrorCode.SYNTAX_ERROR, value);
            }
            String text = literals.isStringLiteral(part) ? literals.parseLiteral(part) : part;
            result.append(variables.resolve(text, context));
        }
        return result.toString();
    }

    /** Splits on {@code ++} operators outside quotes; parts are trimmed. */
    List<String> split(String value) {
        List<String> parts = new ArrayList<>();
        char quote = 0;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (isOperatorAt(value, i)) {
                parts.add(value.substring(start, i).trim());
                start = i + 2;
                i++;
            }
        }
        parts.add(value.substring(start).trim());
        return parts;
    }

    private static boolean isOperatorAt(String value, int i) {
        return value.startsWith("++", i)
                && i > 0
                && Character.isWhitespace(value.charAt(i - 1))
                && i + 2 < value.length()
                && Character.isWhitespace(value.charAt(i + 2));
    }
}
