package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import in.questkeeper.domain.common.FieldError;

import java.util.Iterator;
import java.util.List;

final class ArraySchema implements SchemaNode {

    private final SchemaNode item;
    private final int min;
    private final int max;

    ArraySchema(SchemaNode item, int min, int max) {
        this.item = item;
        this.min = min;
        this.max = max;
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isArray()) {
            errors.add(FieldError.of(path, "Expected array, received " + SchemaNode.typeOf(node)));
            return;
        }
        if (node.size() < min) {
            errors.add(FieldError.of(path, "Array must contain at least " + min + " element(s)"));
        } else if (node.size() > max) {
            errors.add(FieldError.of(path, "Array must contain at most " + max + " element(s)"));
        }
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (element == null || element.isNull()) {
                errors.add(FieldError.of(SchemaNode.child(path, Integer.toString(i)), "Required"));
            } else {
                item.validate(element, SchemaNode.child(path, Integer.toString(i)), errors);
            }
        }
    }

    /**
     * A wrapper element arrives as an object keyed by its children's tag, holding
     * one value or a list of them; an empty wrapper arrives as blank text.
     * Child tag names are not trusted.
     */
    @Override
    public JsonNode conform(JsonNode node) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        if (node.isArray()) {
            node.forEach(element -> out.add(item.conform(element)));
            return out;
        }
        if (SchemaNode.isBlankText(node)) {
            return out;
        }
        if (node.isObject()) {
            Iterator<JsonNode> children = node.elements();
            while (children.hasNext()) {
                JsonNode child = children.next();
                if (child.isArray()) {
                    child.forEach(element -> out.add(item.conform(element)));
                } else {
                    out.add(item.conform(child));
                }
            }
            return out;
        }
        return node;
    }
}
