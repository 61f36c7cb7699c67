package io.meld.core.resolution;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON value helpers for resolution.
 *
 * <p>
 * Thread-safe; stateless utility class.
 */
public final class JsonValues {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonValues() {}

    /**
     * String form of a value as it appears when substituted into text.
     *
     * <ul>
     * <li>string → its raw text, no quotes</li>
     * <li>number, boolean, null → {@code asText()}</li>
     * <li>object, array → compact JSON</li>
     * </ul>
     */
    public static String stringify(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "";
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    /**
     * One field of a container: a property of an object, or an element of an array when
     * {@code field} is a decimal index within bounds.
     *
     * @param container object or array to read from
     * @param field     property name or array index
     * @return the field value, or {@code null} when absent, out of range or not addressable
     */
    public static JsonNode field(JsonNode container, String field) {
        if (container.isObject()) {
            return container.get(field);
        }
        if (!container.isArray() || !field.matches("\\d{1,9}")) {
            return null;
        }
        int index = Integer.parseInt(field);
        return index < container.size() ? container.get(index) : null;
    }
}
