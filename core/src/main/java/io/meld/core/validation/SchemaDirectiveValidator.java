package io.meld.core.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.meld.core.error.DirectiveValidationException;
import io.meld.core.model.DirectiveNode;
import io.meld.core.spi.DirectiveValidator;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates directive payloads against the JSON Schemas bundled under {@code schemas/directives/}.
 * One schema per directive kind; a kind without a schema is rejected.
 */
public final class SchemaDirectiveValidator implements DirectiveValidator {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaDirectiveValidator.class);

    /** Kinds with a bundled schema. */
    public static final List<String> KINDS = List.of("text", "data", "path", "define", "run", "import", "embed");

    private static final String SCHEMA_ROOT = "/schemas/directives/";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final Map<String, JsonSchema> schemas = new HashMap<>();

    public SchemaDirectiveValidator() {
        for (String kind : KINDS) {
            schemas.put(kind, SCHEMA_FACTORY.getSchema(loadSchema(kind)));
        }
        LOG.debug("Loaded {} directive schemas", schemas.size());
    }

    @Override
    public void validate(DirectiveNode node) {
        JsonSchema schema = schemas.get(node.kind());
        if (schema == null) {
            throw new DirectiveValidationException("Unknown directive kind '" + node.kind() + "'", node, List.of());
        }
        Set<ValidationMessage> errors = schema.validate(node.directive());
        if (!errors.isEmpty()) {
            List<String> violations =
                    errors.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
            throw new DirectiveValidationException(
                    "Invalid @" + node.kind() + " directive: " + String.join("; ", violations), node, violations);
        }
    }

    private static JsonNode loadSchema(String kind) {
        String resource = SCHEMA_ROOT + kind + ".schema.json";
        try (InputStream in = SchemaDirectiveValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing directive schema resource: " + resource);
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read directive schema " + resource, e);
        }
    }
}
