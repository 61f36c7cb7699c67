package io.meld.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Model types")
class ModelTest {

    @Test
    @DisplayName("source locations print file:line:col")
    void sourceLocation() {
        SourceLocation at = SourceLocation.of(3, 5, 3, 20);

        assertThat(at).hasToString("3:5");
        assertThat(at.withFilePath("/work/a.meld")).hasToString("/work/a.meld:3:5");
        assertThat(at.withFilePath("/work/a.meld").end()).isEqualTo(new SourceLocation.Position(3, 20));
    }

    @Test
    @DisplayName("code fences rebuild their source form")
    void fenced() {
        assertThat(new CodeFenceNode(null, "", 3, null).fenced()).isEqualTo("```\n```");
        assertThat(new CodeFenceNode("js", "x()", 5, null).fenced()).isEqualTo("`````js\nx()\n`````");
        assertThatThrownBy(() -> new CodeFenceNode(null, "x", 2, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("combined command output joins non-empty streams")
    void combinedOutput() {
        assertThat(new CommandOutput("out", "err").combined()).isEqualTo("out\nerr");
        assertThat(new CommandOutput("out", null).combined()).isEqualTo("out");
        assertThat(new CommandOutput(null, "err").combined()).isEqualTo("err");
        assertThat(new CommandOutput("", "").combined()).isEmpty();
    }

    @Test
    @DisplayName("directive payloads are copied in and out")
    void directivePayloadCopies() {
        ObjectNode payload = JsonNodeFactory.instance.objectNode().put("identifier", "x");
        DirectiveNode node = new DirectiveNode("text", payload, null);

        payload.put("identifier", "changed");
        node.directive().put("identifier", "also changed");

        assertThat(node.text("identifier")).isEqualTo("x");
        assertThat(node.has("value")).isFalse();
        assertThat(node.text("value")).isNull();
    }

    @Test
    @DisplayName("command definitions copy their parameters")
    void commandDefinition() {
        List<String> params = new ArrayList<>(List.of("who"));
        CommandDefinition definition = CommandDefinition.of("@run [echo ${who}]", params);
        params.add("extra");

        assertThat(definition.parameters()).containsExactly("who");
        assertThat(CommandDefinition.of("echo", null).parameters()).isEmpty();
    }

    @Test
    @DisplayName("risk levels parse case-insensitively")
    void riskLevel() {
        assertThat(RiskLevel.parse("High")).isEqualTo(RiskLevel.HIGH);
        assertThatThrownBy(() -> RiskLevel.parse("extreme")).hasMessage("Invalid risk level: extreme");
    }
}
