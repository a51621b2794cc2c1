package in.questkeeper.service.schema;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Factory for schema nodes.
 */
public final class Schemas {

    private static final Pattern HTTP_URL = Pattern.compile("^https?://\\S+$");

    public static ObjectSchema object() {
        return new ObjectSchema();
    }

    public static SchemaNode string(int min, int max) {
        return new StringSchema(min, max, null, null);
    }

    public static SchemaNode string() {
        return string(0, Integer.MAX_VALUE);
    }

    public static SchemaNode url() {
        return new StringSchema(0, 2048, HTTP_URL, "Invalid url");
    }

    public static SchemaNode integer(int min, int max) {
        return new NumberSchema(min, max, true);
    }

    public static SchemaNode integer(int min) {
        return new NumberSchema(min, Long.MAX_VALUE, true);
    }

    public static SchemaNode number(double min, double max) {
        return new NumberSchema(min, max, false);
    }

    public static SchemaNode bool() {
        return new BooleanSchema();
    }

    public static SchemaNode oneOf(String... values) {
        return new EnumSchema(List.of(values));
    }

    public static SchemaNode array(SchemaNode item, int min, int max) {
        return new ArraySchema(item, min, max);
    }

    public static SchemaNode array(SchemaNode item, int max) {
        return array(item, 0, max);
    }

    public static SchemaNode map(SchemaNode value) {
        return new MapSchema(value);
    }

    private Schemas() {}
}
