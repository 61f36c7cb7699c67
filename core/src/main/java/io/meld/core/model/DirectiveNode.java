package io.meld.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A directive: its {@code kind} and the kind-specific payload ({@code identifier}, {@code value},
 * {@code command}, {@code path}, ...). The payload is deep-copied on construction and on read, so a
 * node can be shared freely between states.
 */
public record DirectiveNode(String kind, ObjectNode directive, SourceLocation location) implements Node {

    public DirectiveNode {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(directive, "directive must not be null");
        directive = directive.deepCopy();
    }

    @Override
    public String type() {
        return "Directive";
    }

    @Override
    public ObjectNode directive() {
        return directive.deepCopy();
    }

    /** Text value of a payload field, or {@code null} if absent or JSON null. */
    public String text(String field) {
        JsonNode value = directive.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /** Raw payload field (a copy), or {@code null} if absent. */
    public JsonNode field(String field) {
        JsonNode value = directive.get(field);
        return value != null ? value.deepCopy() : null;
    }

    public boolean has(String field) {
        JsonNode value = directive.get(field);
        return value != null && !value.isNull();
    }
}
