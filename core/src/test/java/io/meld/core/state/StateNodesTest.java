package io.meld.core.state;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meld.core.model.CommandDefinition;
import io.meld.core.model.StateNode;
import io.meld.core.model.TextNode;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StateNodes")
class StateNodesTest {

    private static StateNode withText(StateNode state, String name, String value) {
        return StateNodes.update(state).textVars(Map.of(name, value)).build();
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("empty state has empty containers and no transformed list")
        void emptyState() {
            StateNode state = StateNodes.create();

            assertThat(state.stateId()).isNotBlank();
            assertThat(state.textVars()).isEmpty();
            assertThat(state.nodes()).isEmpty();
            assertThat(state.transformedNodes()).isNull();
            assertThat(state.imports()).isEmpty();
        }

        @Test
        @DisplayName("fork copies variables and commands, starts with empty nodes and a new id")
        void forkCopiesDefinitions() {
            StateNode parent = StateNodes.update(StateNodes.create(null, "/a.meld", null))
                    .textVars(Map.of("greeting", "hi"))
                    .commands(Map.of("hello", CommandDefinition.of("@run [echo hi]", List.of())))
                    .nodes(List.of(TextNode.of("x")))
                    .imports(Set.of("/b.meld"))
                    .build();

            StateNode child = StateNodes.createChild(parent);

            assertThat(child.stateId()).isNotEqualTo(parent.stateId());
            assertThat(child.textVars()).containsEntry("greeting", "hi");
            assertThat(child.commands()).containsKey("hello");
            assertThat(child.imports()).containsExactly("/b.meld");
            assertThat(child.filePath()).isEqualTo("/a.meld");
            assertThat(child.nodes()).isEmpty();
            assertThat(child.transformedNodes()).isNull();
            assertThat(child.parentState()).isSameAs(parent);
        }

        @Test
        @DisplayName("fork of a transforming parent gets an empty transformed list")
        void forkKeepsTransformedListPresence() {
            StateNode parent = StateNodes.update(StateNodes.create())
                    .transformedNodes(List.of(TextNode.of("x")))
                    .build();

            assertThat(StateNodes.createChild(parent).transformedNodes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("child entries win, parent entries survive, parent id kept")
        void childWins() {
            StateNode parent = StateNodes.update(StateNodes.create())
                    .textVars(Map.of("a", "1", "b", "2"))
                    .build();
            StateNode child = withText(StateNodes.createChild(parent), "b", "3");

            StateNode merged = StateNodes.merge(parent, child);

            assertThat(merged.stateId()).isEqualTo(parent.stateId());
            assertThat(merged.textVars()).containsEntry("a", "1").containsEntry("b", "3");
        }

        @Test
        @DisplayName("nodes are parent followed by child; imports are the union")
        void nodesAndImports() {
            TextNode p = TextNode.of("p");
            TextNode c = TextNode.of("c");
            StateNode parent = StateNodes.update(StateNodes.create())
                    .nodes(List.of(p))
                    .imports(Set.of("x"))
                    .build();
            StateNode child = StateNodes.update(StateNodes.createChild(parent))
                    .nodes(List.of(c))
                    .imports(Set.of("x", "y"))
                    .build();

            StateNode merged = StateNodes.merge(parent, child);

            assertThat(merged.nodes()).containsExactly(p, c);
            assertThat(merged.imports()).containsExactly("x", "y");
        }

        @Test
        @DisplayName("child transformed list is appended to the parent's plain nodes when the parent has none")
        void transformedFallsBackToParentNodes() {
            TextNode p = TextNode.of("p");
            TextNode replaced = TextNode.of("out");
            StateNode parent = StateNodes.update(StateNodes.create()).nodes(List.of(p)).build();
            StateNode child = StateNodes.update(StateNodes.createChild(parent))
                    .transformedNodes(List.of(replaced))
                    .build();

            assertThat(StateNodes.merge(parent, child).transformedNodes()).containsExactly(p, replaced);
        }

        @Test
        @DisplayName("parent transformed list is extended with the child's plain nodes")
        void parentTransformedExtended() {
            TextNode t = TextNode.of("t");
            TextNode c = TextNode.of("c");
            StateNode parent = StateNodes.update(StateNodes.create()).transformedNodes(List.of(t)).build();
            StateNode child = StateNodes.update(StateNodes.create()).nodes(List.of(c)).build();

            assertThat(StateNodes.merge(parent, child).transformedNodes()).containsExactly(t, c);
        }

        @Test
        @DisplayName("no transformed list on either side stays absent")
        void noTransformedList() {
            StateNode merged = StateNodes.merge(StateNodes.create(), StateNodes.create());

            assertThat(merged.transformedNodes()).isNull();
        }

        @Test
        @DisplayName("child file path wins when present")
        void filePath() {
            StateNode parent = StateNodes.create(null, "/parent.meld", null);
            StateNode child = StateNodes.create(null, "/child.meld", null);

            assertThat(StateNodes.merge(parent, child).filePath()).isEqualTo("/child.meld");
            assertThat(StateNodes.merge(parent, StateNodes.create()).filePath()).isEqualTo("/parent.meld");
        }
    }

    @Test
    @DisplayName("snapshots never share mutable data values")
    void dataIsDeepCopied() {
        ObjectNode value = JsonNodeFactory.instance.objectNode().put("name", "meld");
        StateNode state = StateNodes.update(StateNodes.create())
                .dataVars(Map.<String, JsonNode>of("config", value))
                .build();

        value.put("name", "changed");

        assertThat(state.dataVar("config").get("name").asText()).isEqualTo("meld");
    }

    @Test
    @DisplayName("update preserves the id; withNewId does not")
    void ids() {
        StateNode state = StateNodes.create();

        assertThat(withText(state, "a", "1").stateId()).isEqualTo(state.stateId());
        assertThat(StateNodes.withNewId(state, "clone").stateId()).isNotEqualTo(state.stateId());
    }
}
