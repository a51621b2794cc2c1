package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.FieldError;

import java.util.List;

/**
 * One node of a structural schema.
 */
public interface SchemaNode {

    /**
     * Append every violation under {@code path}. Never stops early.
     */
    void validate(JsonNode node, String path, List<FieldError> errors);

    /**
     * Restore the shape a text-only tree (XML) lost: arrays from wrapper
     * elements, numbers and booleans from text. Returns the input when
     * nothing needs changing.
     */
    JsonNode conform(JsonNode node);

    static String child(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    static String typeOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return "null";
        if (node.isTextual()) return "string";
        if (node.isNumber()) return "number";
        if (node.isBoolean()) return "boolean";
        if (node.isArray()) return "array";
        if (node.isObject()) return "object";
        return node.getNodeType().name().toLowerCase();
    }

    static boolean isBlankText(JsonNode node) {
        return node != null && node.isTextual() && node.asText().isBlank();
    }
}
