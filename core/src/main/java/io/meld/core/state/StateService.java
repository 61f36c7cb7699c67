package io.meld.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import io.meld.core.error.StateException;
import io.meld.core.model.CommandDefinition;
import io.meld.core.model.Node;
import io.meld.core.model.StateNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity-bearing façade over an immutable {@link StateNode}.
 *
 * <p>
 * The façade holds a single mutable slot with the current snapshot. Every write computes a new
 * snapshot through {@link StateNodes} and swaps the slot, so a snapshot handed out earlier never
 * changes. Variable lookups are flat: after a fork there is no layered inheritance, so the
 * {@code getAll*} and {@code getLocal*} accessors return the same maps.
 *
 * <p>
 * Two flags live on the façade rather than in the snapshot: transformation mode and the
 * one-way immutability latch. Instances are not thread-safe.
 */
public final class StateService {

    private static final Logger LOG = LoggerFactory.getLogger(StateService.class);

    private StateNode current;
    private boolean transformationEnabled;
    private boolean immutable;

    /** Creates an empty root state with no current file. */
    public StateService() {
        this(StateNodes.create());
    }

    /**
     * Wraps an existing snapshot. The façade starts mutable with transformation disabled.
     *
     * @param snapshot initial snapshot
     */
    public StateService(StateNode snapshot) {
        this.current = Objects.requireNonNull(snapshot, "snapshot must not be null");
    }

    /** Fresh empty state for the given file. */
    public static StateService forFile(String filePath) {
        return new StateService(StateNodes.create(null, filePath, "root"));
    }

    // --- Snapshot ---

    /** The current immutable snapshot. */
    public StateNode snapshot() {
        return current;
    }

    /** Identifier of this state, kept across writes and merges. */
    public String getStateId() {
        return current.stateId();
    }

    // --- Text variables ---

    /** Text variable value, or {@code null} if undefined. */
    public String getTextVar(String name) {
        return current.textVars().get(name);
    }

    /**
     * All text variables, in definition order.
     *
     * @return a read-only map
     */
    public Map<String, String> getAllTextVars() {
        return current.textVars();
    }

    public Map<String, String> getLocalTextVars() {
        return current.textVars();
    }

    /**
     * Defines or replaces a text variable.
     *
     * @param name  variable name
     * @param value value, never {@code null}
     * @throws StateException if this state is immutable
     */
    public void setTextVar(String name, String value) {
        checkMutable();
        Map<String, String> vars = new LinkedHashMap<>(current.textVars());
        vars.put(name, Objects.requireNonNull(value, "text value must not be null"));
        current = StateNodes.update(current).textVars(vars).build();
    }

    // --- Data variables ---

    /** Deep copy of the data variable, or {@code null} if undefined. */
    public JsonNode getDataVar(String name) {
        return current.dataVar(name);
    }

    /**
     * All data variables.
     *
     * @return a read-only map of deep copies; changing a value never reaches this state
     */
    public Map<String, JsonNode> getAllDataVars() {
        return current.dataVars();
    }

    /**
     * Data variables of this state, the same map as {@link #getAllDataVars()}.
     *
     * @return a read-only map of deep copies
     */
    public Map<String, JsonNode> getLocalDataVars() {
        return current.dataVars();
    }

    /**
     * Defines or replaces a data variable. The value is deep-copied into the new snapshot.
     *
     * @param name  variable name
     * @param value JSON value, never {@code null}
     * @throws StateException if this state is immutable
     */
    public void setDataVar(String name, JsonNode value) {
        checkMutable();
        Map<String, JsonNode> vars = new LinkedHashMap<>(current.dataVars());
        vars.put(name, Objects.requireNonNull(value, "data value must not be null"));
        current = StateNodes.update(current).dataVars(vars).build();
    }

    // --- Path variables ---

    /** Path variable value, or {@code null} if undefined. */
    public String getPathVar(String name) {
        return current.pathVars().get(name);
    }

    public Map<String, String> getAllPathVars() {
        return current.pathVars();
    }

    /** Defines or replaces a path variable; fails if this state is immutable. */
    public void setPathVar(String name, String value) {
        checkMutable();
        Map<String, String> vars = new LinkedHashMap<>(current.pathVars());
        vars.put(name, Objects.requireNonNull(value, "path value must not be null"));
        current = StateNodes.update(current).pathVars(vars).build();
    }

    // --- Commands ---

    /** Command definition, or {@code null} if undefined. */
    public CommandDefinition getCommand(String name) {
        return current.commands().get(name);
    }

    public Map<String, CommandDefinition> getAllCommands() {
        return current.commands();
    }

    /**
     * Defines or replaces a command.
     *
     * @param name    command name, as referenced by {@code $name(...)}
     * @param command definition, never {@code null}
     * @throws StateException if this state is immutable
     */
    public void setCommand(String name, CommandDefinition command) {
        checkMutable();
        Map<String, CommandDefinition> commands = new LinkedHashMap<>(current.commands());
        commands.put(name, Objects.requireNonNull(command, "command must not be null"));
        current = StateNodes.update(current).commands(commands).build();
    }

    // --- Nodes ---

    /** Nodes in document order, as parsed; never affected by transformation. */
    public List<Node> getNodes() {
        return current.nodes();
    }

    /**
     * The output node list: the transformed list while transformation is enabled and the list
     * exists, otherwise the plain node list.
     */
    public List<Node> getTransformedNodes() {
        if (transformationEnabled && current.transformedNodes() != null) {
            return current.transformedNodes();
        }
        return current.nodes();
    }

    /** Appends a node; while transformation is enabled it is appended to the transformed list too. */
    public void addNode(Node node) {
        checkMutable();
        Objects.requireNonNull(node, "node must not be null");
        List<Node> nodes = new ArrayList<>(current.nodes());
        nodes.add(node);
        StateNodes.Update update = StateNodes.update(current).nodes(nodes);
        if (transformationEnabled) {
            List<Node> transformed =
                    new ArrayList<>(current.transformedNodes() != null ? current.transformedNodes() : current.nodes());
            transformed.add(node);
            update.transformedNodes(transformed);
        }
        current = update.build();
    }

    /**
     * Replaces {@code original} with {@code replacement} in the transformed list. No-op while
     * transformation is disabled. The original is matched by identity first, then structurally
     * (type, content and location); the transformed list is searched before the plain list, whose
     * index is then used.
     *
     * @throws StateException if the original is not present in either list
     */
    public void transformNode(Node original, Node replacement) {
        checkMutable();
        if (!transformationEnabled) {
            return;
        }
        List<Node> transformed =
                new ArrayList<>(current.transformedNodes() != null ? current.transformedNodes() : current.nodes());
        int index = indexOf(transformed, original);
        if (index < 0) {
            int plainIndex = indexOf(current.nodes(), original);
            if (plainIndex < 0 || plainIndex >= transformed.size()) {
                throw new StateException("Cannot transform node: original node not found in state");
            }
            index = plainIndex;
        }
        transformed.set(index, replacement);
        current = StateNodes.update(current).transformedNodes(transformed).build();
    }

    private static int indexOf(List<Node> nodes, Node target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        for (int i = 0; i < nodes.size(); i++) {
            if (Objects.equals(nodes.get(i), target)) {
                return i;
            }
        }
        return -1;
    }

    // --- Transformation mode ---

    public boolean isTransformationEnabled() {
        return transformationEnabled;
    }

    /** Enables transformation, seeding the transformed list from the plain list if it has none. */
    public void enableTransformation() {
        if (transformationEnabled) {
            return;
        }
        transformationEnabled = true;
        if (current.transformedNodes() == null) {
            current = StateNodes.update(current)
                    .transformedNodes(current.nodes())
                    .build();
        }
    }

    /** Disables transformation. The transformed list is kept but ignored. */
    public void disableTransformation() {
        transformationEnabled = false;
    }

    // --- Imports ---

    /**
     * Records an imported file.
     *
     * @param key normalized path of the imported file
     * @throws StateException if this state is immutable
     */
    public void addImport(String key) {
        checkMutable();
        Set<String> imports = new LinkedHashSet<>(current.imports());
        imports.add(key);
        current = StateNodes.update(current).imports(imports).build();
    }

    public void removeImport(String key) {
        checkMutable();
        Set<String> imports = new LinkedHashSet<>(current.imports());
        imports.remove(key);
        current = StateNodes.update(current).imports(imports).build();
    }

    public boolean hasImport(String key) {
        return current.imports().contains(key);
    }

    /** Imported file keys in import order. */
    public Set<String> getImports() {
        return current.imports();
    }

    // --- File path ---

    /** File path, or {@code null} if this state has none. */
    public String getCurrentFilePath() {
        return current.filePath();
    }

    public void setCurrentFilePath(String path) {
        checkMutable();
        current = StateNodes.update(current).filePath(path).build();
    }

    // --- Immutability ---

    /** One-way latch: every later write throws {@link StateException}. */
    public void setImmutable() {
        immutable = true;
    }

    public boolean isImmutable() {
        return immutable;
    }

    private void checkMutable() {
        if (immutable) {
            throw new StateException("Cannot modify immutable state");
        }
    }

    // --- Structure ---

    /**
     * Forks a child. The child starts with copies of this state's variables, commands and imports.
     * Its node lists start empty: {@link #getNodes()} on a fresh child returns nothing, and after
     * {@link #mergeChildState} the parent holds its own nodes followed by the child's. The child
     * inherits transformation mode and is always mutable.
     *
     * @return the new child state
     */
    public StateService createChildState() {
        StateService child = new StateService(StateNodes.createChild(current));
        child.transformationEnabled = transformationEnabled;
        LOG.debug("Forked child state {} from {}", child.getStateId(), getStateId());
        return child;
    }

    /** Independent copy under a new id, including nodes and both flags. */
    @Override
    public StateService clone() {
        StateService copy = new StateService(StateNodes.withNewId(current, "clone"));
        copy.transformationEnabled = transformationEnabled;
        copy.immutable = immutable;
        return copy;
    }

    /** Folds {@code child} into this state; this state keeps its id. */
    public void mergeChildState(StateService child) {
        checkMutable();
        Objects.requireNonNull(child, "child must not be null");
        current = StateNodes.merge(current, child.current);
        LOG.debug("Merged state {} into {}", child.getStateId(), getStateId());
    }

    @Override
    public String toString() {
        return "StateService[" + current + ", transformation=" + transformationEnabled + ", immutable=" + immutable
                + "]";
    }
}
