package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders a generic tree as indented XML.
 *
 * Objects become nested elements, arrays a wrapper element with one child per
 * item (tag singularized from the wrapper name, else {@code item}), scalars
 * element text. Null fields are omitted. Keys that are not valid element names
 * (free-form map keys such as skill names) are escaped by {@link XmlNames}.
 */
public final class XmlWriter {

    private static final String INDENT = "  ";
    public static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    public String write(String rootName, JsonNode tree) {
        StringBuilder out = new StringBuilder(4096);
        out.append(DECLARATION).append('\n');
        element(out, rootName, tree, "");
        return out.toString();
    }

    private void element(StringBuilder out, String key, JsonNode value, String indent) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        String name = XmlNames.encode(key);
        if (value.isObject()) {
            out.append(indent).append('<').append(name).append('>');
            boolean any = false;
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue() == null || field.getValue().isNull()) {
                    continue;
                }
                out.append('\n');
                element(out, field.getKey(), field.getValue(), indent + INDENT);
                any = true;
            }
            if (any) {
                out.append('\n').append(indent);
            }
            out.append("</").append(name).append('>');
        } else if (value.isArray()) {
            String itemName = singular(key);
            out.append(indent).append('<').append(name).append('>');
            boolean any = false;
            for (JsonNode item : value) {
                if (item == null || item.isNull()) {
                    continue;
                }
                out.append('\n');
                element(out, itemName, item, indent + INDENT);
                any = true;
            }
            if (any) {
                out.append('\n').append(indent);
            }
            out.append("</").append(name).append('>');
        } else {
            out.append(indent).append('<').append(name).append('>')
                .append(escape(value.asText()))
                .append("</").append(name).append('>');
        }
    }

    /**
     * {@code entries -> entry}, {@code classes -> class}, {@code tags -> tag}, otherwise {@code item}.
     */
    static String singular(String name) {
        if (name.length() > 3 && name.endsWith("ies")) {
            return name.substring(0, name.length() - 3) + "y";
        }
        if (name.length() > 4 && name.endsWith("sses")) {
            return name.substring(0, name.length() - 2);
        }
        if (name.length() > 1 && name.endsWith("s")) {
            return name.substring(0, name.length() - 1);
        }
        return "item";
    }

    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#39;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
