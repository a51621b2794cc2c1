package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.questkeeper.domain.common.FieldError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed set of named fields. Unknown fields pass through untouched.
 */
public final class ObjectSchema implements SchemaNode {

    private record Field(SchemaNode schema, boolean required) {}

    private final Map<String, Field> fields = new LinkedHashMap<>();

    public ObjectSchema required(String name, SchemaNode schema) {
        fields.put(name, new Field(schema, true));
        return this;
    }

    public ObjectSchema optional(String name, SchemaNode schema) {
        fields.put(name, new Field(schema, false));
        return this;
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isObject()) {
            errors.add(FieldError.of(path, "Expected object, received " + SchemaNode.typeOf(node)));
            return;
        }
        for (Map.Entry<String, Field> entry : fields.entrySet()) {
            String fieldPath = SchemaNode.child(path, entry.getKey());
            JsonNode value = node.get(entry.getKey());
            if (value == null || value.isNull()) {
                if (entry.getValue().required()) {
                    errors.add(FieldError.of(fieldPath, "Required"));
                }
                continue;
            }
            entry.getValue().schema().validate(value, fieldPath, errors);
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
        node.fields().forEachRemaining(f -> {
            Field known = fields.get(f.getKey());
            out.set(f.getKey(), known == null ? f.getValue() : known.schema().conform(f.getValue()));
        });
        return out;
    }
}
