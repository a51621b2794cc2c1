package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.questkeeper.domain.common.FieldError;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Free-form keys, uniform value schema.
 */
final class MapSchema implements SchemaNode {

    private final SchemaNode value;

    MapSchema(SchemaNode value) {
        this.value = value;
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isObject()) {
            errors.add(FieldError.of(path, "Expected object, received " + SchemaNode.typeOf(node)));
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            value.validate(field.getValue(), SchemaNode.child(path, field.getKey()), errors);
        }
    }

    @Override
    public JsonNode conform(JsonNode node) {
        if (SchemaNode.isBlankText(node)) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!node.isObject()) {
            return node;
        }
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        node.fields().forEachRemaining(f -> out.set(f.getKey(), value.conform(f.getValue())));
        return out;
    }
}
