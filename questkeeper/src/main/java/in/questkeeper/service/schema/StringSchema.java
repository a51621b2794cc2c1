package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import in.questkeeper.domain.common.FieldError;

import java.util.List;
import java.util.regex.Pattern;

final class StringSchema implements SchemaNode {

    private final int min;
    private final int max;
    private final Pattern pattern;
    private final String patternMessage;

    StringSchema(int min, int max, Pattern pattern, String patternMessage) {
        this.min = min;
        this.max = max;
        this.pattern = pattern;
        this.patternMessage = patternMessage;
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isTextual()) {
            errors.add(FieldError.of(path, "Expected string, received " + SchemaNode.typeOf(node)));
            return;
        }
        String value = node.asText();
        if (value.length() < min) {
            errors.add(FieldError.of(path, "String must contain at least " + min + " character(s)"));
        } else if (value.length() > max) {
            errors.add(FieldError.of(path, "String must contain at most " + max + " character(s)"));
        } else if (pattern != null && !pattern.matcher(value).matches()) {
            errors.add(FieldError.of(path, patternMessage));
        }
    }

    @Override
    public JsonNode conform(JsonNode node) {
        if (node.isNumber() || node.isBoolean()) {
            return TextNode.valueOf(node.asText());
        }
        return node;
    }
}
