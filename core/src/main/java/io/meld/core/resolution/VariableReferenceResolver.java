package io.meld.core.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.ResolutionContext;
import io.meld.core.state.StateService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code ${expr}} and {@code #{expr}} references innermost first, so a reference can
 * compute another reference's name ({@code ${${kind}_label}}). Substituted values are expanded
 * again until no reference is left.
 *
 * <p>
 * An expression is a variable name followed by field accessors: {@code .field},
 * {@code [0]}, {@code ["key"]} or {@code [var]}, where {@code var} is looked up as a variable.
 * {@code ${name:-fallback}} yields the fallback when {@code name} is undefined. An undefined
 * {@code ENV_X} falls back to the environment variable {@code X}, then to an empty string with a
 * warning.
 *
 * <p>
 * Nesting deeper than {@code maxDepth} fails with {@link ResolutionErrorCode#MAX_DEPTH_EXCEEDED};
 * more than {@code maxIterations} expansion rounds fail with
 * {@link ResolutionErrorCode#MAX_ITERATIONS_EXCEEDED}; a round that reproduces an earlier result
 * fails with {@link ResolutionErrorCode#CIRCULAR_REFERENCE}.
 */
public final class VariableReferenceResolver {

    private static final Logger LOG = LoggerFactory.getLogger(VariableReferenceResolver.class);

    static final String ENV_PREFIX = "ENV_";

    private static final Pattern INNERMOST_TEXT = Pattern.compile("\\$\\{([^${}#]*)\\}");
    private static final Pattern INNERMOST_DATA = Pattern.compile("#\\{([^${}#]*)\\}");

    private final int maxDepth;
    private final int maxIterations;
    private final Function<String, String> envLookup;

    public VariableReferenceResolver(int maxDepth, int maxIterations, Function<String, String> envLookup) {
        this.maxDepth = maxDepth;
        this.maxIterations = maxIterations;
        this.envLookup = envLookup;
    }

    /** Expands every reference in {@code text}; returns it unchanged if it has none. */
    public String resolve(String text, ResolutionContext context) {
        if (text == null || (!text.contains("${") && !text.contains("#{"))) {
            return text;
        }
        int depth = nestingDepth(text);
        if (depth > maxDepth) {
            throw new ResolutionException(
                    "Maximum resolution depth (" + maxDepth + ") exceeded: nesting depth " + depth,
                    ResolutionErrorCode.MAX_DEPTH_EXCEEDED,
                    text);
        }

        String result = text;
        Set<String> seen = new HashSet<>();
        int iterations = 0;
        while (hasReference(result)) {
            if (!seen.add(result)) {
                throw new ResolutionException(
                        "Circular reference detected while expanding: " + text,
                        ResolutionErrorCode.CIRCULAR_REFERENCE,
                        text);
            }
            if (++iterations > maxIterations) {
                throw new ResolutionException(
                        "Maximum resolution iterations (" + maxIterations + ") exceeded",
                        ResolutionErrorCode.MAX_ITERATIONS_EXCEEDED,
                        text);
            }
            result = expandOnce(result, context);
        }
        return result;
    }

    private static boolean hasReference(String text) {
        return INNERMOST_TEXT.matcher(text).find() || INNERMOST_DATA.matcher(text).find();
    }

    private String expandOnce(String text, ResolutionContext context) {
        String result = replaceAll(INNERMOST_TEXT, text, expr -> {
            requireAllowed(context.allowed().text(), "Text variables are not allowed in this context", text);
            return evaluate(expr, context);
        });
        return replaceAll(INNERMOST_DATA, result, expr -> {
            requireAllowed(context.allowed().data(), "Data variables are not allowed in this context", text);
            return evaluateData(expr, context);
        });
    }

    private static String replaceAll(Pattern pattern, String text, Function<String, String> evaluator) {
        Matcher m = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(evaluator.apply(m.group(1))));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static void requireAllowed(boolean allowed, String message, String value) {
        if (!allowed) {
            throw new ResolutionException(message, ResolutionErrorCode.INVALID_CONTEXT, value);
        }
    }

    /** Evaluates the inside of a {@code ${...}} reference. */
    String evaluate(String rawExpression, ResolutionContext context) {
        String expression = rawExpression.trim();
        String fallback = null;
        int defaultAt = expression.indexOf(":-");
        if (defaultAt >= 0) {
            fallback = expression.substring(defaultAt + 2);
            expression = expression.substring(0, defaultAt).trim();
        }
        if (expression.isEmpty()) {
            throw new ResolutionException(
                    "Empty variable reference", ResolutionErrorCode.SYNTAX_ERROR, rawExpression);
        }

        StateService state = context.state();
        VariablePath path = parsePath(expression, state);
        String text = state.getTextVar(path.name());
        if (text != null) {
            if (!path.fields().isEmpty()) {
                throw new ResolutionException(
                        "Cannot access field of text variable: " + expression,
                        ResolutionErrorCode.FIELD_ACCESS_ERROR,
                        expression);
            }
            return text;
        }
        JsonNode data = state.getDataVar(path.name());
        if (data != null) {
            return JsonValues.stringify(access(data, path, expression));
        }
        if (fallback != null) {
            return fallback;
        }
        if (path.name().startsWith(ENV_PREFIX)) {
            String env = envLookup.apply(path.name().substring(ENV_PREFIX.length()));
            if (env != null && !env.isBlank()) {
                return env;
            }
            LOG.warn("Environment variable {} is not set, resolving to empty string", path.name());
            return "";
        }
        throw new ResolutionException(
                "Undefined variable: " + path.name(), ResolutionErrorCode.UNDEFINED_VARIABLE, path.name());
    }

    /** Evaluates the inside of a {@code #{...}} reference; only data variables qualify. */
    String evaluateData(String rawExpression, ResolutionContext context) {
        String expression = rawExpression.trim();
        StateService state = context.state();
        VariablePath path = parsePath(expression, state);
        JsonNode data = state.getDataVar(path.name());
        if (data == null) {
            throw new ResolutionException(
                    "Undefined data variable: " + path.name(),
                    ResolutionErrorCode.UNDEFINED_VARIABLE,
                    path.name());
        }
        return JsonValues.stringify(access(data, path, expression));
    }

    private static JsonNode access(JsonNode root, VariablePath path, String expression) {
        JsonNode current = root;
        for (String field : path.fields()) {
            JsonNode next = JsonValues.field(current, field);
            if (next == null) {
                throw new ResolutionException(
                        "Field '" + field + "' not found in " + expression,
                        ResolutionErrorCode.FIELD_ACCESS_ERROR,
                        expression);
            }
            current = next;
        }
        return current;
    }

    /** A variable name and its field accessors, index variables already looked up. */
    record VariablePath(String name, List<String> fields) {}

    static VariablePath parsePath(String expression, StateService state) {
        String name = ReferenceScanner.baseName(expression);
        List<String> fields = new ArrayList<>();
        int i = name.length();
        while (i < expression.length()) {
            char c = expression.charAt(i);
            if (c == '.') {
                int end = i + 1;
                while (end < expression.length() && expression.charAt(end) != '.' && expression.charAt(end) != '[') {
                    end++;
                }
                fields.add(expression.substring(i + 1, end).trim());
                i = end;
            } else if (c == '[') {
                int close = expression.indexOf(']', i);
                if (close < 0) {
                    throw new ResolutionException(
                            "Unclosed bracket in " + expression, ResolutionErrorCode.SYNTAX_ERROR, expression);
                }
                fields.add(bracketKey(expression.substring(i + 1, close).trim(), expression, state));
                i = close + 1;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else {
                throw new ResolutionException(
                        "Unexpected character '" + c + "' in " + expression,
                        ResolutionErrorCode.SYNTAX_ERROR,
                        expression);
            }
        }
        return new VariablePath(name, fields);
    }

    private static String bracketKey(String token, String expression, StateService state) {
        if (token.length() >= 2
                && (token.startsWith("\"") && token.endsWith("\"") || token.startsWith("'") && token.endsWith("'"))) {
            return token.substring(1, token.length() - 1);
        }
        if (token.matches("\\d+")) {
            return token;
        }
        String text = state.getTextVar(token);
        if (text != null) {
            return text;
        }
        JsonNode data = state.getDataVar(token);
        if (data != null && data.isValueNode()) {
            return data.asText();
        }
        throw new ResolutionException(
                "Undefined index variable '" + token + "' in " + expression,
                ResolutionErrorCode.FIELD_ACCESS_ERROR,
                expression);
    }

    /** Deepest nesting of {@code ${} / #{} } openings in {@code text}. */
    static int nestingDepth(String text) {
        int depth = 0;
        int max = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '$' || c == '#') && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                depth++;
                max = Math.max(max, depth);
                i++;
            } else if (c == '}' && depth > 0) {
                depth--;
            }
        }
        return max;
    }
}
