package io.meld.core.engine;

import io.meld.core.directive.DirectiveService;
import io.meld.core.error.InterpreterException;
import io.meld.core.model.CodeFenceNode;
import io.meld.core.model.CommentNode;
import io.meld.core.model.DirectiveContext;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.DirectiveResult;
import io.meld.core.model.InterpretOptions;
import io.meld.core.model.Node;
import io.meld.core.model.TextNode;
import io.meld.core.state.StateNodes;
import io.meld.core.state.StateService;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Node-by-node interpreter.
 *
 * <p>
 * Nodes run strictly in order against a running state. After each successful node the running
 * state is snapshotted; when a node fails the running state rolls back to the last snapshot and
 * the failure is rethrown as an {@link InterpreterException}. Nothing reaches the caller's state
 * until every node has succeeded.
 */
public final class InterpreterService {

    private static final Logger LOG = LoggerFactory.getLogger(InterpreterService.class);

    /** MDC key for the file being interpreted. */
    static final String MDC_FILE = "meldFile";
    /** MDC key for the id of the state being interpreted into. */
    static final String MDC_STATE_ID = "meldStateId";

    private final DirectiveService directives;
    private final String workingDirectory;

    /**
     * Creates an interpreter that dispatches every directive node to {@code directives}.
     *
     * @param directives       dispatcher for directive nodes
     * @param workingDirectory directory handed to handlers, or {@code null} for the process cwd
     */
    public InterpreterService(DirectiveService directives, String workingDirectory) {
        this.directives = Objects.requireNonNull(directives, "directives must not be null");
        this.workingDirectory = workingDirectory;
    }

    /**
     * Interprets {@code nodes}.
     *
     * <ul>
     * <li>{@code mergeState} with an initial state: runs in a child of it, merges the result back
     * and returns the initial state</li>
     * <li>no initial state: runs in a fresh state and returns it</li>
     * <li>{@code mergeState == false}: runs in a fresh state that ignores the initial state's data,
     * then returns a separate immutable state holding the result</li>
     * </ul>
     * The transformation flag of the initial state carries over in every case.
     *
     * @throws InterpreterException if any node fails
     */
    public StateService interpret(List<Node> nodes, InterpretOptions options) {
        StateService initial = options.initialState();
        String filePath = options.filePath() != null
                ? options.filePath()
                : initial != null ? initial.getCurrentFilePath() : null;
        boolean merge = options.mergeState() && initial != null;

        StateService running = merge ? initial.createChildState() : freshState(filePath, initial);
        if (filePath != null && !filePath.equals(running.getCurrentFilePath())) {
            running.setCurrentFilePath(filePath);
        }

        String previousFile = MDC.get(MDC_FILE);
        String previousStateId = MDC.get(MDC_STATE_ID);
        putMdc(MDC_FILE, filePath);
        putMdc(MDC_STATE_ID, running.getStateId());
        try {
            LOG.debug("Interpreting {} nodes from {}", nodes.size(), filePath);
            StateService lastGood = running.clone();
            for (Node node : nodes) {
                try {
                    running = interpretNode(node, running);
                    lastGood = running.clone();
                } catch (RuntimeException e) {
                    running = lastGood;
                    LOG.debug("Rolled back to state {} after {} node failed", running.getStateId(), node.type());
                    throw wrap(e, node, running);
                }
            }

            if (merge) {
                initial.mergeChildState(running);
                return initial;
            }
            if (!options.mergeState()) {
                StateService isolated = freshState(filePath, running);
                isolated.mergeChildState(running);
                isolated.setImmutable();
                return isolated;
            }
            return running;
        } finally {
            putMdc(MDC_FILE, previousFile);
            putMdc(MDC_STATE_ID, previousStateId);
        }
    }

    /**
     * Interprets a single node against {@code state} and returns the next state. {@code state}
     * itself is never modified.
     */
    public StateService interpretNode(Node node, StateService state) {
        if (node instanceof TextNode || node instanceof CodeFenceNode) {
            StateService next = state.clone();
            next.addNode(node);
            return next;
        }
        if (node instanceof CommentNode) {
            return state;
        }
        if (node instanceof DirectiveNode directive) {
            StateService next = state.clone();
            next.addNode(directive);
            DirectiveContext context = new DirectiveContext(
                    next.getCurrentFilePath(), next, next.createChildState(), workingDirectory);
            DirectiveResult result = directives.handleDirective(directive, context);
            next.mergeChildState(result.state());
            if (result instanceof DirectiveResult.WithReplacement replaced && next.isTransformationEnabled()) {
                next.transformNode(directive, replaced.replacement());
            }
            return next;
        }
        throw new InterpreterException(
                "Unknown node type: " + (node == null ? "null" : node.type()),
                node == null ? null : node.type(),
                node == null ? null : node.location(),
                state.getCurrentFilePath());
    }

    private static StateService freshState(String filePath, StateService flagsFrom) {
        StateService state = new StateService(StateNodes.create(null, filePath, "interpret"));
        if (flagsFrom != null && flagsFrom.isTransformationEnabled()) {
            state.enableTransformation();
        }
        return state;
    }

    private static InterpreterException wrap(RuntimeException e, Node node, StateService state) {
        if (e instanceof InterpreterException interpreterException) {
            return interpreterException;
        }
        String where = node.location() != null ? " at " + node.location() : "";
        return new InterpreterException(
                "Failed to interpret " + node.type() + " node" + where + ": " + e.getMessage(),
                e,
                node.type(),
                node.location(),
                state.getCurrentFilePath());
    }

    private static void putMdc(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
