package io.meld.core.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.Node;
import io.meld.core.model.ResolutionContext;
import io.meld.core.resolution.ReferenceScanner.Reference;
import io.meld.core.resolution.ReferenceScanner.References;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolution engine: every substitution of {@code ${text}}, {@code #{data}},
 * {@code $command(args)} and {@code $path} references goes through here.
 *
 * <p>
 * {@link #resolveInContext} is the general entry point. It validates the value against the
 * context's allowed reference kinds before touching state, then runs four passes in a fixed
 * order: text, data, command, path. Text and data references are scanned in the original value;
 * command references are scanned after the text and data passes (so arguments may contain
 * references); path references are scanned in the original value again. Every occurrence of a
 * reference is replaced by its value. Text values that themselves contain text or data references
 * are resolved recursively; one resolution path is shared across the whole call and a name that
 * reappears on it fails with {@link ResolutionErrorCode#CIRCULAR_REFERENCE}.
 *
 * <p>
 * {@link #resolveText} is the value path of the {@code text} directive. Precedence, first
 * match wins: a quoted literal (unquoted, then its {@code ${}} and {@code #{}} references
 * expanded), a {@code ++} concatenation, then nested expansion through
 * {@link VariableReferenceResolver} followed by the command and path passes. Only this path
 * supports {@code ${${x}}} nesting, {@code :-} fallbacks and bracketed field access.
 */
public final class ResolutionService {

    private static final Logger LOG = LoggerFactory.getLogger(ResolutionService.class);

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_FUZZY_THRESHOLD = 0.7;

    private final StringLiteralHandler literals = new StringLiteralHandler();
    private final VariableReferenceResolver variables;
    private final ConcatenationHandler concatenation;
    private final TextResolver textResolver = new TextResolver();
    private final DataResolver dataResolver = new DataResolver();
    private final PathResolver pathResolver = new PathResolver();
    private final CommandResolver commandResolver = new CommandResolver();
    private final ContentResolver contentResolver = new ContentResolver();
    private final SectionExtractor sections = new SectionExtractor();
    private final double fuzzyThreshold;

    public ResolutionService() {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_ITERATIONS, DEFAULT_FUZZY_THRESHOLD, System::getenv);
    }

    /**
     * Creates a service with explicit limits.
     *
     * @param maxDepth       deepest allowed {@code ${${...}}} nesting
     * @param maxIterations  most expansion rounds for one value
     * @param fuzzyThreshold section similarity threshold used when a caller gives none
     * @param envLookup      environment lookup for {@code ENV_} references
     */
    public ResolutionService(
            int maxDepth, int maxIterations, double fuzzyThreshold, Function<String, String> envLookup) {
        this.variables = new VariableReferenceResolver(maxDepth, maxIterations, envLookup);
        this.concatenation = new ConcatenationHandler(literals, variables);
        this.fuzzyThreshold = fuzzyThreshold;
    }

    // --- Four-pass resolution ---

    /**
     * Resolves every reference in {@code value}.
     *
     * @throws ResolutionException {@code INVALID_CONTEXT} for a disallowed reference kind,
     *     {@code UNDEFINED_VARIABLE} for an undefined reference, {@code CIRCULAR_REFERENCE} for a
     *     cycle, or any code raised by the per-kind resolvers
     */
    public String resolveInContext(String value, ResolutionContext context) {
        if (value == null) {
            return null;
        }
        validateResolution(value, context);
        return resolvePasses(value, context, new ArrayDeque<>(), true);
    }

    /**
     * Rejects any reference kind the context does not allow. Does not consult the state.
     *
     * @throws ResolutionException with {@link ResolutionErrorCode#INVALID_CONTEXT}
     */
    public void validateResolution(String value, ResolutionContext context) {
        References refs = ReferenceScanner.scan(value);
        ResolutionContext.AllowedVariableTypes allowed = context.allowed();
        if (!refs.text().isEmpty() && !allowed.text()) {
            throw invalidContext("Text variables are not allowed in this context", value);
        }
        if (!refs.data().isEmpty() && !allowed.data()) {
            throw invalidContext("Data variables are not allowed in this context", value);
        }
        if (!refs.path().isEmpty() && !allowed.path()) {
            throw invalidContext("Path variables are not allowed in this context", value);
        }
        if (!refs.command().isEmpty() && !allowed.command()) {
            throw invalidContext("Command references are not allowed in this context", value);
        }
    }

    private static ResolutionException invalidContext(String message, String value) {
        return new ResolutionException(message, ResolutionErrorCode.INVALID_CONTEXT, value);
    }

    private String resolvePasses(
            String value, ResolutionContext context, Deque<String> path, boolean withCommandsAndPaths) {
        References refs = ReferenceScanner.scan(value);
        String result = value;
        for (Reference ref : refs.text()) {
            result = result.replace(ref.match(), resolveTextReference(ref.name(), context, path));
        }
        for (Reference ref : refs.data()) {
            result = result.replace(ref.match(), resolveDataReference(ref.name(), context));
        }
        if (withCommandsAndPaths) {
            result = resolveCommandsAndPaths(value, result, context, path);
        }
        return result;
    }

    private String resolveCommandsAndPaths(
            String original, String current, ResolutionContext context, Deque<String> path) {
        String result = current;
        for (Reference ref : ReferenceScanner.scan(current).command()) {
            result = result.replace(ref.match(), resolveCommandReference(ref, context, path));
        }
        for (Reference ref : ReferenceScanner.scan(original).path()) {
            result = result.replace(ref.match(), pathResolver.resolve(ref.name(), context));
        }
        return result;
    }

    private String resolveTextReference(String expression, ResolutionContext context, Deque<String> path) {
        String name = ReferenceScanner.baseName(expression);
        String field = fieldOf(expression, name);
        enter(name, path);
        try {
            String text = context.state().getTextVar(name);
            if (text != null) {
                if (field != null) {
                    throw new ResolutionException(
                            "Cannot access field of text variable: " + expression,
                            ResolutionErrorCode.FIELD_ACCESS_ERROR,
                            expression);
                }
                References nested = ReferenceScanner.scan(text);
                if (nested.text().isEmpty() && nested.data().isEmpty()) {
                    return text;
                }
                return resolvePasses(text, context, path, false);
            }
            if (context.state().getDataVar(name) != null) {
                return dataResolver.resolve(name, field, context);
            }
            return textResolver.resolve(name, context);
        } finally {
            path.pop();
        }
    }

    private String resolveDataReference(String expression, ResolutionContext context) {
        String name = ReferenceScanner.baseName(expression);
        if (context.state().getDataVar(name) == null) {
            throw new ResolutionException(
                    "Undefined data variable: " + name, ResolutionErrorCode.UNDEFINED_VARIABLE, name);
        }
        return dataResolver.resolve(name, fieldOf(expression, name), context);
    }

    private String resolveCommandReference(Reference ref, ResolutionContext context, Deque<String> path) {
        List<String> args = new ArrayList<>();
        ResolutionContext paramContext =
                ResolutionContexts.forCommandParameters(context.state(), context.currentFilePath());
        for (String arg : splitArguments(ref.arguments())) {
            args.add(resolvePasses(arg, paramContext, path, false));
        }
        enter(ref.name(), path);
        try {
            String command = commandResolver.resolve(ref.name(), args, context);
            return resolvePasses(command, context, path, false);
        } finally {
            path.pop();
        }
    }

    /** Naive comma split; each argument is trimmed and one pair of surrounding quotes removed. */
    static List<String> splitArguments(String arguments) {
        List<String> args = new ArrayList<>();
        if (arguments == null || arguments.isBlank()) {
            return args;
        }
        for (String raw : arguments.split(",", -1)) {
            String arg = raw.trim();
            if (arg.length() >= 2) {
                char first = arg.charAt(0);
                if ((first == '"' || first == '\'' || first == '`') && arg.charAt(arg.length() - 1) == first) {
                    arg = arg.substring(1, arg.length() - 1);
                }
            }
            args.add(arg);
        }
        return args;
    }

    private static String fieldOf(String expression, String name) {
        String rest = expression.substring(name.length()).trim();
        if (rest.startsWith(".")) {
            return rest.substring(1);
        }
        return rest.isEmpty() ? null : rest;
    }

    private static void enter(String name, Deque<String> path) {
        if (path.contains(name)) {
            List<String> chain = new ArrayList<>();
            Iterator<String> it = path.descendingIterator();
            while (it.hasNext()) {
                chain.add(it.next());
            }
            chain.add(name);
            throw new ResolutionException(
                    "Circular reference detected: " + String.join(" -> ", chain),
                    ResolutionErrorCode.CIRCULAR_REFERENCE,
                    name);
        }
        path.push(name);
    }

    // --- Cycle detection ---

    /**
     * Walks the text and data references reachable from {@code value} depth-first and fails on the
     * first cycle. Undefined names are not this method's concern and are skipped.
     *
     * @throws ResolutionException with {@link ResolutionErrorCode#CIRCULAR_REFERENCE}
     */
    public void detectCircularReferences(String value, ResolutionContext context) {
        Set<String> visited = new HashSet<>();
        Set<String> stack = new LinkedHashSet<>();
        for (String name : ReferenceScanner.scan(value).variableNames()) {
            visit(name, context, visited, stack);
        }
    }

    private void visit(String name, ResolutionContext context, Set<String> visited, Set<String> stack) {
        if (stack.contains(name)) {
            List<String> chain = new ArrayList<>(stack);
            chain.add(name);
            throw new ResolutionException(
                    "Circular reference detected: " + String.join(" -> ", chain),
                    ResolutionErrorCode.CIRCULAR_REFERENCE,
                    name);
        }
        if (!visited.add(name)) {
            return;
        }
        stack.add(name);
        String text = context.state().getTextVar(name);
        if (text != null) {
            for (String next : ReferenceScanner.scan(text).variableNames()) {
                visit(next, context, visited, stack);
            }
        }
        stack.remove(name);
    }

    // --- Directive value paths ---

    /** Value of a {@code text} directive; see the class documentation for the precedence. */
    public String resolveText(String raw, ResolutionContext context) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim();
        if (literals.isStringLiteral(value)) {
            return variables.resolve(literals.parseLiteral(value), context);
        }
        if (concatenation.hasConcatenation(value)) {
            return concatenation.resolve(value, context);
        }
        validateResolution(value, context);
        String expanded = variables.resolve(value, context);
        return resolveCommandsAndPaths(value, expanded, context, new ArrayDeque<>());
    }

    /**
     * Resolves every string leaf of a structured value in place; object keys are left untouched.
     * Returns a new tree.
     */
    public JsonNode resolveData(JsonNode value, ResolutionContext context) {
        if (value.isTextual()) {
            return TextNode.valueOf(resolveInContext(value.asText(), context));
        }
        if (value.isObject()) {
            ObjectNode result = JsonValues.MAPPER.createObjectNode();
            for (Iterator<Map.Entry<String, JsonNode>> it = value.fields(); it.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = it.next();
                result.set(entry.getKey(), resolveData(entry.getValue(), context));
            }
            return result;
        }
        if (value.isArray()) {
            ArrayNode result = JsonValues.MAPPER.createArrayNode();
            for (JsonNode element : value) {
                result.add(resolveData(element, context));
            }
            return result;
        }
        return value.deepCopy();
    }

    /**
     * Value of a {@code path} directive or an import/embed path. Surrounding quotes are removed,
     * {@code $~} and {@code $.} prefixes become {@code $HOMEPATH} and {@code $PROJECTPATH}, the
     * result is resolved and then checked against the context's path validation.
     */
    public String resolvePath(String raw, ResolutionContext context) {
        String value = normalizePathAliases(unquote(raw.trim()));
        String resolved = resolveInContext(value, context);
        pathResolver.validate(resolved, context);
        return resolved;
    }

    static String normalizePathAliases(String path) {
        if (path.equals("$~") || path.startsWith("$~/")) {
            return "$" + PathResolver.HOME_PATH + path.substring(2);
        }
        if (path.equals("$.") || path.startsWith("$./")) {
            return "$" + PathResolver.PROJECT_PATH + path.substring(2);
        }
        return path;
    }

    private String unquote(String value) {
        return literals.isStringLiteral(value) ? literals.parseLiteral(value) : value;
    }

    // --- Single-purpose resolvers ---

    public String resolveTextVariable(String identifier, ResolutionContext context) {
        return textResolver.resolve(identifier, context);
    }

    public String resolveDataVariable(String identifier, String field, ResolutionContext context) {
        return dataResolver.resolve(identifier, field, context);
    }

    public String resolvePathVariable(String identifier, ResolutionContext context) {
        return pathResolver.resolve(identifier, context);
    }

    public String resolveCommand(String identifier, List<String> args, ResolutionContext context) {
        return commandResolver.resolve(identifier, args, context);
    }

    public String resolveContent(List<Node> nodes) {
        return contentResolver.resolve(nodes);
    }

    // --- Sections ---

    /** Extracts a section using the configured similarity threshold. */
    public String extractSection(String content, String heading) {
        return sections.extract(content, heading, fuzzyThreshold);
    }

    /**
     * Extracts a section using {@code fuzzy} as the similarity threshold; a threshold outside
     * {@code [0, 1]} falls back to the configured one with a warning.
     */
    public String extractSection(String content, String heading, Double fuzzy) {
        double threshold = fuzzyThreshold;
        if (fuzzy != null) {
            if (fuzzy < 0.0 || fuzzy > 1.0) {
                LOG.warn("Invalid fuzzy threshold {}, using {}", fuzzy, fuzzyThreshold);
            } else {
                threshold = fuzzy;
            }
        }
        return sections.extract(content, heading, threshold);
    }
}
