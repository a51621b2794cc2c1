package in.questkeeper.service.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import in.questkeeper.domain.common.FieldError;

import java.util.List;
import java.util.regex.Pattern;

final class NumberSchema implements SchemaNode {

    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d+\\.\\d+$");

    private final double min;
    private final double max;
    private final boolean integer;

    NumberSchema(double min, double max, boolean integer) {
        this.min = min;
        this.max = max;
        this.integer = integer;
    }

    @Override
    public void validate(JsonNode node, String path, List<FieldError> errors) {
        if (!node.isNumber()) {
            errors.add(FieldError.of(path, "Expected number, received " + SchemaNode.typeOf(node)));
            return;
        }
        double value = node.asDouble();
        if (integer && value != Math.rint(value)) {
            errors.add(FieldError.of(path, "Expected integer, received float"));
        } else if (value < min) {
            errors.add(FieldError.of(path, "Number must be greater than or equal to " + format(min)));
        } else if (value > max) {
            errors.add(FieldError.of(path, "Number must be less than or equal to " + format(max)));
        }
    }

    @Override
    public JsonNode conform(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (INTEGER.matcher(text).matches()) {
                try {
                    long value = Long.parseLong(text);
                    return value == (int) value ? IntNode.valueOf((int) value) : LongNode.valueOf(value);
                } catch (NumberFormatException e) {
                    return node;
                }
            }
            if (DECIMAL.matcher(text).matches()) {
                double value = Double.parseDouble(text);
                return integer && value == Math.rint(value) ? IntNode.valueOf((int) value) : DoubleNode.valueOf(value);
            }
            return node;
        }
        if (integer && node.isFloatingPointNumber() && node.asDouble() == Math.rint(node.asDouble())) {
            return IntNode.valueOf(node.asInt());
        }
        return node;
    }

    private static String format(double bound) {
        return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
    }
}
