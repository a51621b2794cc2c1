package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.FieldError;

import java.util.List;
import java.util.stream.Collectors;

final class EnumSchema implements SchemaNode {

    private final List<String> values;

    EnumSchema(List<String> values) {
        this.values = List.copyOf(values);
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isTextual() || !values.contains(node.asText())) {
            String expected = values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(" | "));
            errors.add(FieldError.of(path, "Invalid enum value. Expected " + expected
                + ", received '" + node.asText() + "'"));
        }
    }

    @Override
    public JsonNode conform(JsonNode node) {
        return node;
    }
}
