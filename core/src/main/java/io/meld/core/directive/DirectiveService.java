package io.meld.core.directive;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meld.core.directive.handler.DataDirectiveHandler;
import io.meld.core.directive.handler.DefineDirectiveHandler;
import io.meld.core.directive.handler.EmbedDirectiveHandler;
import io.meld.core.directive.handler.ImportDirectiveHandler;
import io.meld.core.directive.handler.PathDirectiveHandler;
import io.meld.core.directive.handler.RunDirectiveHandler;
import io.meld.core.directive.handler.TextDirectiveHandler;
import io.meld.core.engine.CircularityGuard;
import io.meld.core.engine.InterpreterService;
import io.meld.core.error.CircularImportException;
import io.meld.core.error.DirectiveErrorCode;
import io.meld.core.error.DirectiveException;
import io.meld.core.error.DirectiveValidationException;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.resolution.ResolutionService;
import io.meld.core.spi.DirectiveValidator;
import io.meld.core.spi.DocumentParser;
import io.meld.core.spi.FileSystemService;
import io.meld.core.state.StateService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Directive dispatcher: a registry of handlers keyed by directive kind, plus error normalization.
 *
 * <p>
 * Lifecycle: construct, {@link #initialize} (registers the built-in handlers), then
 * {@link #bindInterpreter}. Registering before initialization fails. The interpreter is bound
 * late because import and embed recurse into it while the interpreter dispatches here.
 *
 * <p>
 * Every failure leaves this class as a {@link DirectiveException}. Failures that are not one
 * already are classified by type and message: file not found, circular import, parameter count,
 * invalid path, then any resolution failure, then execution failure.
 */
public final class DirectiveService {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveService.class);

    private final Map<String, DirectiveHandler> handlers = new LinkedHashMap<>();
    private final DirectiveValidator validator;
    private InterpreterService interpreter;
    private boolean initialized;

    /**
     * Creates a dispatcher with no handlers; call {@link #initialize} before use.
     *
     * @param validator checks directive payloads before their handler runs
     */
    public DirectiveService(DirectiveValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /** Registers the built-in handlers for all seven directive kinds. */
    public void initialize(
            ResolutionService resolution,
            FileSystemService fileSystem,
            DocumentParser parser,
            CircularityGuard guard,
            ObjectMapper mapper) {
        initialized = true;
        registerHandler(new TextDirectiveHandler(resolution));
        registerHandler(new DataDirectiveHandler(resolution, mapper));
        registerHandler(new PathDirectiveHandler(resolution));
        registerHandler(new DefineDirectiveHandler());
        registerHandler(new RunDirectiveHandler(resolution, fileSystem));
        registerHandler(new ImportDirectiveHandler(resolution, fileSystem, parser, guard, this::interpreter));
        registerHandler(new EmbedDirectiveHandler(resolution, fileSystem, parser, guard, this::interpreter));
        LOG.debug("Directive handlers registered: {}", handlers.keySet());
    }

    /**
     * Supplies the interpreter that import and embed handlers use for nested documents.
     *
     * @param interpreter interpreter that owns this dispatcher
     */
    public void bindInterpreter(InterpreterService interpreter) {
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter must not be null");
    }

    /**
     * Registers (or replaces) the handler for {@code handler.kind()}.
     *
     * @throws DirectiveException {@code INITIALIZATION_FAILED} before {@link #initialize}, or
     *     {@code VALIDATION_FAILED} for a blank kind
     */
    public void registerHandler(DirectiveHandler handler) {
        String kind = handler.kind();
        if (!initialized) {
            throw new DirectiveException(
                    "DirectiveService must be initialized before registering handlers",
                    kind,
                    DirectiveErrorCode.INITIALIZATION_FAILED,
                    null);
        }
        if (kind == null || kind.isBlank()) {
            throw new DirectiveException(
                    "Handler must declare a non-empty directive kind",
                    kind,
                    DirectiveErrorCode.VALIDATION_FAILED,
                    null);
        }
        handlers.put(kind, handler);
    }

    /**
     * Looks up the handler for a directive kind.
     *
     * @param kind directive kind, e.g. {@code text}
     * @return the handler, or empty if none is registered
     */
    public Optional<DirectiveHandler> getHandler(String kind) {
        return Optional.ofNullable(handlers.get(kind));
    }

    public boolean hasHandler(String kind) {
        return handlers.containsKey(kind);
    }

    /** Kinds that currently have a handler. */
    public Set<String> supportedKinds() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * Validates and executes one directive.
     *
     * @throws DirectiveException on any failure
     */
    public DirectiveResult handleDirective(DirectiveNode node, DirectiveContext context) {
        String kind = node.kind();
        try {
            validator.validate(node);
        } catch (DirectiveValidationException e) {
            throw new DirectiveException(
                    "Invalid " + kind + " directive: " + e.getMessage(),
                    kind,
                    DirectiveErrorCode.VALIDATION_FAILED,
                    node,
                    e);
        }
        DirectiveHandler handler = handlers.get(kind);
        if (handler == null) {
            throw new DirectiveException(
                    "No handler registered for directive kind: " + kind,
                    kind,
                    DirectiveErrorCode.HANDLER_NOT_FOUND,
                    node);
        }
        LOG.debug("Executing {} directive at {}", kind, node.location());
        try {
            return handler.execute(node, context);
        } catch (DirectiveException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DirectiveException(e.getMessage(), kind, classify(e), node, e);
        }
    }

    static DirectiveErrorCode classify(RuntimeException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof CircularImportException) {
                return DirectiveErrorCode.CIRCULAR_IMPORT;
            }
        }
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (message.contains("file not found") || message.contains("no such file")) {
            return DirectiveErrorCode.FILE_NOT_FOUND;
        }
        if (message.contains("circular import")) {
            return DirectiveErrorCode.CIRCULAR_IMPORT;
        }
        if (message.contains("parameter")) {
            return DirectiveErrorCode.PARAMETER_MISMATCH;
        }
        if (message.contains("invalid path")) {
            return DirectiveErrorCode.INVALID_PATH;
        }
        if (e instanceof ResolutionException) {
            return DirectiveErrorCode.RESOLUTION_FAILED;
        }
        return DirectiveErrorCode.EXECUTION_FAILED;
    }

    /**
     * Executes one directive in a fresh child of {@code state} and returns the resulting state.
     * {@code state} itself is not modified.
     */
    public StateService processDirective(DirectiveNode node, StateService state, String currentFilePath) {
        DirectiveContext context = new DirectiveContext(
                currentFilePath != null ? currentFilePath : state.getCurrentFilePath(),
                state,
                state.createChildState(),
                null);
        return handleDirective(node, context).state();
    }

    /**
     * Executes directives left to right, each in a child of the previous result. In transformation
     * mode every directive runs against {@code state} instead and the per-directive states are not
     * folded; the caller tracks the replacement nodes.
     */
    public List<DirectiveResult> processDirectives(
            List<DirectiveNode> nodes, StateService state, String currentFilePath) {
        List<DirectiveResult> results = new ArrayList<>();
        StateService current = state;
        for (DirectiveNode node : nodes) {
            DirectiveContext context = new DirectiveContext(
                    currentFilePath != null ? currentFilePath : current.getCurrentFilePath(),
                    current,
                    current.createChildState(),
                    null);
            DirectiveResult result = handleDirective(node, context);
            results.add(result);
            if (!state.isTransformationEnabled()) {
                current = result.state();
            }
        }
        return results;
    }

    /**
     * The bound interpreter.
     *
     * @throws DirectiveException {@code INITIALIZATION_FAILED} if none is bound
     */
    public InterpreterService interpreter() {
        if (interpreter == null) {
            throw new DirectiveException(
                    "No interpreter bound to DirectiveService",
                    null,
                    DirectiveErrorCode.INITIALIZATION_FAILED,
                    null);
        }
        return interpreter;
    }
}
