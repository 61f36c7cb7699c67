package io.meld.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.meld.core.model.CommandDefinition;
import io.meld.core.model.Node;
import io.meld.core.model.StateNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Pure value-to-value transforms over {@link StateNode}. Nothing here throws or has side effects;
 * callers own the consistency of option combinations.
 *
 * <p>
 * A fork copies the parent's variables, commands, imports and file path into a fresh id. Node
 * lists start empty (the transformed list empty but present if the parent had one): a child only
 * ever records the nodes it interprets itself, so {@link #merge} can append the child's nodes
 * after the parent's without duplicating the parent's.
 */
public final class StateNodes {

    private StateNodes() {}

    public static StateNode create() {
        return create(null, null, null);
    }

    /**
     * Creates a state, forked from {@code parent} when one is given.
     *
     * @param parent   state to fork from, or {@code null} for an empty state
     * @param filePath file path, or {@code null} to inherit the parent's
     * @param source   origin tag, or {@code null}
     */
    public static StateNode create(StateNode parent, String filePath, String source) {
        String id = newId();
        if (parent == null) {
            return new StateNode(id, null, null, null, null, null, null, null, filePath, source, null);
        }
        return new StateNode(
                id,
                parent.textVars(),
                parent.dataVars(),
                parent.pathVars(),
                parent.commands(),
                List.of(),
                parent.transformedNodes() != null ? List.of() : null,
                parent.imports(),
                filePath != null ? filePath : parent.filePath(),
                source,
                parent);
    }

    /** Sugar for {@link #create(StateNode, String, String)} with a required parent. */
    public static StateNode createChild(StateNode parent) {
        return create(parent, null, "child");
    }

    /**
     * Folds {@code child} into {@code parent}. Maps are seeded from the parent and overwritten by
     * every child entry; imports are the union; nodes are parent then child. Transformed nodes are
     * appended the same way when the child has them, falling back to the parent's plain nodes for
     * the prefix. The result keeps the parent's id.
     */
    public static StateNode merge(StateNode parent, StateNode child) {
        Map<String, String> text = new LinkedHashMap<>(parent.textVars());
        text.putAll(child.textVars());
        Map<String, JsonNode> data = new LinkedHashMap<>(parent.dataVars());
        data.putAll(child.dataVars());
        Map<String, String> path = new LinkedHashMap<>(parent.pathVars());
        path.putAll(child.pathVars());
        Map<String, CommandDefinition> commands = new LinkedHashMap<>(parent.commands());
        commands.putAll(child.commands());
        Set<String> imports = new LinkedHashSet<>(parent.imports());
        imports.addAll(child.imports());

        List<Node> nodes = new ArrayList<>(parent.nodes());
        nodes.addAll(child.nodes());

        List<Node> transformed = null;
        if (child.transformedNodes() != null) {
            transformed = new ArrayList<>(
                    parent.transformedNodes() != null ? parent.transformedNodes() : parent.nodes());
            transformed.addAll(child.transformedNodes());
        } else if (parent.transformedNodes() != null) {
            transformed = new ArrayList<>(parent.transformedNodes());
            transformed.addAll(child.nodes());
        }

        return new StateNode(
                parent.stateId(),
                text,
                data,
                path,
                commands,
                nodes,
                transformed,
                imports,
                child.filePath() != null ? child.filePath() : parent.filePath(),
                parent.source(),
                parent.parentState());
    }

    /** Starts a shallow update over a full copy of {@code state}; the id is preserved. */
    public static Update update(StateNode state) {
        return new Update(state);
    }

    /** A copy of {@code state} under a new id. */
    public static StateNode withNewId(StateNode state, String source) {
        return new StateNode(
                newId(),
                state.textVars(),
                state.dataVars(),
                state.pathVars(),
                state.commands(),
                state.nodes(),
                state.transformedNodes(),
                state.imports(),
                state.filePath(),
                source,
                state.parentState());
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }

    /** Field-by-field update; unspecified fields keep the original values. */
    public static final class Update {

        private final StateNode base;
        private Map<String, String> textVars;
        private Map<String, JsonNode> dataVars;
        private Map<String, String> pathVars;
        private Map<String, CommandDefinition> commands;
        private List<Node> nodes;
        private List<Node> transformedNodes;
        private boolean transformedNodesSet;
        private Set<String> imports;
        private String filePath;
        private boolean filePathSet;

        private Update(StateNode base) {
            this.base = base;
        }

        public Update textVars(Map<String, String> value) {
            this.textVars = value;
            return this;
        }

        public Update dataVars(Map<String, JsonNode> value) {
            this.dataVars = value;
            return this;
        }

        public Update pathVars(Map<String, String> value) {
            this.pathVars = value;
            return this;
        }

        public Update commands(Map<String, CommandDefinition> value) {
            this.commands = value;
            return this;
        }

        public Update nodes(List<Node> value) {
            this.nodes = value;
            return this;
        }

        /** Sets the transformed list; {@code null} is a legal value and clears it. */
        public Update transformedNodes(List<Node> value) {
            this.transformedNodes = value;
            this.transformedNodesSet = true;
            return this;
        }

        public Update imports(Set<String> value) {
            this.imports = value;
            return this;
        }

        public Update filePath(String value) {
            this.filePath = value;
            this.filePathSet = true;
            return this;
        }

        public StateNode build() {
            return new StateNode(
                    base.stateId(),
                    textVars != null ? textVars : base.textVars(),
                    dataVars != null ? dataVars : base.dataVars(),
                    pathVars != null ? pathVars : base.pathVars(),
                    commands != null ? commands : base.commands(),
                    nodes != null ? nodes : base.nodes(),
                    transformedNodesSet ? transformedNodes : base.transformedNodes(),
                    imports != null ? imports : base.imports(),
                    filePathSet ? filePath : base.filePath(),
                    base.source(),
                    base.parentState());
        }
    }
}
