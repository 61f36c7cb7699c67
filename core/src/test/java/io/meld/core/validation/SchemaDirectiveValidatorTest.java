package io.meld.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.meld.core.error.DirectiveValidationException;
import io.meld.core.error.MeldException;
import io.meld.core.model.DirectiveNode;
import io.meld.core.model.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaDirectiveValidator")
class SchemaDirectiveValidatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SourceLocation AT = SourceLocation.of(4, 1, 4, 30);

    private final SchemaDirectiveValidator validator = new SchemaDirectiveValidator();

    private static DirectiveNode node(String kind, String json) throws Exception {
        return new DirectiveNode(kind, (ObjectNode) MAPPER.readTree(json), AT);
    }

    @Test
    @DisplayName("well-formed payloads of every kind pass")
    void validPayloads() throws Exception {
        assertThatCode(() -> {
            validator.validate(node("text", "{\"identifier\":\"greeting\",\"value\":\"\\\"hi\\\"\"}"));
            validator.validate(node("data", "{\"identifier\":\"cfg\",\"value\":{\"a\":1}}"));
            validator.validate(node("path", "{\"identifier\":\"docs\",\"value\":\"$./docs\"}"));
            validator.validate(node("define", "{\"identifier\":\"greet.risk\",\"parameters\":[\"who\"],"
                    + "\"value\":\"@run [echo ${who}]\"}"));
            validator.validate(node("run", "{\"command\":\"echo hi\",\"output\":\"out\"}"));
            validator.validate(node("import", "{\"path\":\"lib.meld\",\"imports\":\"a, b as c\"}"));
            validator.validate(node("embed", "{\"path\":\"guide.md\",\"section\":\"Setup\",\"fuzzy\":0.8,"
                    + "\"headingLevel\":2,\"underHeader\":\"Guide\"}"));
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("missing required fields are reported")
    void missingField() throws Exception {
        DirectiveNode bad = node("run", "{\"output\":\"out\"}");

        assertThatThrownBy(() -> validator.validate(bad))
                .isInstanceOf(DirectiveValidationException.class)
                .hasMessageStartingWith("Invalid @run directive: ")
                .hasMessageContaining("command")
                .satisfies(e -> {
                    DirectiveValidationException dve = (DirectiveValidationException) e;
                    assertThat(dve.violations()).isNotEmpty();
                    assertThat(dve.phase()).isEqualTo(MeldException.Phase.DIRECTIVE);
                    assertThat(dve.location()).isEqualTo(AT);
                });
    }

    @Test
    @DisplayName("identifiers must be valid names")
    void badIdentifier() throws Exception {
        assertThatThrownBy(() -> validator.validate(node("text", "{\"identifier\":\"2fast\",\"value\":\"x\"}")))
                .isInstanceOf(DirectiveValidationException.class);
        assertThatThrownBy(() -> validator.validate(node("run", "{\"command\":\"ls\",\"output\":\"a-b\"}")))
                .isInstanceOf(DirectiveValidationException.class);
    }

    @Test
    @DisplayName("unexpected fields and wrong types are rejected")
    void shape() throws Exception {
        assertThatThrownBy(() -> validator.validate(node("import", "{\"path\":\"a.meld\",\"extra\":true}")))
                .isInstanceOf(DirectiveValidationException.class);
        assertThatThrownBy(() -> validator.validate(node("embed", "{\"path\":\"a.md\",\"headingLevel\":\"two\"}")))
                .isInstanceOf(DirectiveValidationException.class);
    }

    @Test
    @DisplayName("kinds without a schema are rejected")
    void unknownKind() throws Exception {
        assertThatThrownBy(() -> validator.validate(node("shout", "{}")))
                .isInstanceOf(DirectiveValidationException.class)
                .hasMessage("Unknown directive kind 'shout'");
    }
}
