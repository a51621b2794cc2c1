package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import in.questkeeper.domain.common.FieldError;

import java.util.List;

final class BooleanSchema implements SchemaNode {

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isBoolean()) {
            errors.add(FieldError.of(path, "Expected boolean, received " + SchemaNode.typeOf(node)));
        }
    }

    @Override
    public JsonNode conform(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText().trim();
            if ("true".equals(text)) return BooleanNode.TRUE;
            if ("false".equals(text)) return BooleanNode.FALSE;
        }
        return node;
    }
}
