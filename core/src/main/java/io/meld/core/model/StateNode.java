package io.meld.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable program state snapshot.
 *
 * <p>
 * Every container is copied on construction and exposed read-only; data values are deep-copied,
 * so no two snapshots share mutable structure. {@code parentState} records provenance only and is
 * never consulted for lookups.
 *
 * @param stateId          unique id of this snapshot lineage
 * @param textVars         text variables
 * @param dataVars         data variables (JSON values)
 * @param pathVars         path variables
 * @param commands         commands created by {@code define}
 * @param nodes            program nodes in document order
 * @param transformedNodes parallel output list, {@code null} until transformation is first enabled
 * @param imports          keys of completed imports
 * @param filePath         file this state belongs to, or {@code null}
 * @param source           free-form origin tag ({@code "child"}, {@code "clone"}, ...), or {@code null}
 * @param parentState      snapshot this one was forked from, or {@code null}
 */
public record StateNode(
        String stateId,
        Map<String, String> textVars,
        Map<String, JsonNode> dataVars,
        Map<String, String> pathVars,
        Map<String, CommandDefinition> commands,
        List<Node> nodes,
        List<Node> transformedNodes,
        Set<String> imports,
        String filePath,
        String source,
        StateNode parentState) {

    public StateNode {
        Objects.requireNonNull(stateId, "stateId must not be null");
        textVars = copy(textVars);
        dataVars = deepCopy(dataVars);
        pathVars = copy(pathVars);
        commands = copy(commands);
        nodes = nodes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(nodes));
        transformedNodes =
                transformedNodes == null ? null : Collections.unmodifiableList(new ArrayList<>(transformedNodes));
        imports = imports == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(imports));
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, JsonNode> deepCopy(Map<String, JsonNode> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v.deepCopy()));
        return Collections.unmodifiableMap(copy);
    }

    /** Data variables, deep-copied so callers can never alter this snapshot. */
    @Override
    public Map<String, JsonNode> dataVars() {
        return deepCopy(dataVars);
    }

    /** Data variable, deep-copied so callers can never alter this snapshot. */
    public JsonNode dataVar(String name) {
        JsonNode value = dataVars.get(name);
        return value != null ? value.deepCopy() : null;
    }

    @Override
    public String toString() {
        return "StateNode[" + stateId + ", file=" + filePath + ", text=" + textVars.keySet() + ", data="
                + dataVars.keySet() + ", path=" + pathVars.keySet() + ", commands=" + commands.keySet()
                + ", nodes=" + nodes.size() + "]";
    }
}
