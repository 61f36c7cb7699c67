package io.meld.core.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import io.meld.core.error.ResolutionErrorCode;
import io.meld.core.error.ResolutionException;
import io.meld.core.model.ResolutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up a data variable and, optionally, one field of it. Misses are lenient: a missing
 * variable or field logs a warning and yields an empty string.
 */
public final class DataResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DataResolver.class);

    /**
     * Resolves {@code #{identifier.field}}.
     *
     * @param identifier data variable name
     * @param field      field name (or array index), or {@code null} for the whole value
     * @return the stringified value, or {@code ""} on a miss
     */
    public String resolve(String identifier, String field, ResolutionContext context) {
        if (!context.allowed().data()) {
            throw new ResolutionException(
                    "Data variables are not allowed in this context", ResolutionErrorCode.INVALID_CONTEXT, identifier);
        }
        JsonNode value = context.state().getDataVar(identifier);
        if (value == null) {
            LOG.warn("Data variable {} not found, resolving to empty string", identifier);
            return "";
        }
        if (field == null || field.isEmpty()) {
            return JsonValues.stringify(value);
        }
        JsonNode fieldValue = JsonValues.field(value, field);
        if (fieldValue == null) {
            LOG.warn("Field {} not found in data variable {}, resolving to empty string", field, identifier);
            return "";
        }
        return JsonValues.stringify(fieldValue);
    }
}
