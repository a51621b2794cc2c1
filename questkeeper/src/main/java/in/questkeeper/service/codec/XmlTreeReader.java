package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Recursive-descent reader turning an XML document into a generic tree.
 *
 * The root element's children become the top-level fields. An element without
 * child elements is a leaf holding its text; any other element becomes an
 * object keyed by child tag (unescaped through {@link XmlNames}), with repeated
 * tags collapsed into an array.
 * Attributes, comments, processing instructions and the DOCTYPE are skipped.
 *
 * With leaf coercion on, {@code ^\d+$} reads as an integer, {@code ^\d+\.\d+$}
 * as a decimal and {@code true}/{@code false} as booleans; everything else stays
 * text. Not thread-safe; create one per document.
 */
public final class XmlTreeReader {

    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+\\.\\d+$");

    private final String src;
    private final boolean coerceLeaves;
    private int pos;

    private XmlTreeReader(String src, boolean coerceLeaves) {
        this.src = src;
        this.coerceLeaves = coerceLeaves;
    }

    /**
     * Read with leaf coercion.
     */
    public static JsonNode read(String xml) throws XmlFormatException {
        return read(xml, true);
    }

    public static JsonNode read(String xml, boolean coerceLeaves) throws XmlFormatException {
        if (xml == null || xml.isBlank()) {
            throw new XmlFormatException("Empty document", 0);
        }
        return new XmlTreeReader(xml, coerceLeaves).document();
    }

    private record Element(String name, List<Element> children, String text) {}

    private JsonNode document() throws XmlFormatException {
        if (src.charAt(0) == '\uFEFF') {
            pos = 1;
        }
        skipMisc();
        if (!peek('<')) {
            throw error("Expected root element");
        }
        Element root = element();
        skipMisc();
        if (pos < src.length()) {
            throw error("Unexpected content after root element");
        }
        return toNode(root);
    }

    private Element element() throws XmlFormatException {
        expect("<");
        String name = name();
        skipAttributes(name);
        if (startsWith("/>")) {
            pos += 2;
            return new Element(name, List.of(), "");
        }
        expect(">");

        List<Element> children = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw error("Unterminated element <" + name + ">");
            }
            if (startsWith("</")) {
                pos += 2;
                String closing = name();
                if (!closing.equals(name)) {
                    throw error("Mismatched closing tag </" + closing + ">, expected </" + name + ">");
                }
                skipWhitespace();
                expect(">");
                return new Element(name, children, text.toString());
            } else if (startsWith("<!--")) {
                skipPast("-->", "Unterminated comment");
            } else if (startsWith("<![CDATA[")) {
                pos += 9;
                int end = src.indexOf("]]>", pos);
                if (end < 0) {
                    throw error("Unterminated CDATA section");
                }
                text.append(src, pos, end);
                pos = end + 3;
            } else if (startsWith("<?")) {
                skipPast("?>", "Unterminated processing instruction");
            } else if (peek('<')) {
                children.add(element());
            } else {
                int end = src.indexOf('<', pos);
                if (end < 0) {
                    end = src.length();
                }
                text.append(decode(src.substring(pos, end), pos));
                pos = end;
            }
        }
    }

    private JsonNode toNode(Element element) {
        if (element.children().isEmpty()) {
            return leaf(element.text());
        }
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        for (Element child : element.children()) {
            JsonNode value = toNode(child);
            String key = XmlNames.decode(child.name());
            JsonNode existing = node.get(key);
            if (existing == null) {
                node.set(key, value);
            } else if (existing.isArray()) {
                ((ArrayNode) existing).add(value);
            } else {
                ArrayNode collapsed = JsonNodeFactory.instance.arrayNode();
                collapsed.add(existing);
                collapsed.add(value);
                node.set(key, collapsed);
            }
        }
        return node;
    }

    private JsonNode leaf(String text) {
        if (!coerceLeaves) {
            return TextNode.valueOf(text);
        }
        if (INTEGER.matcher(text).matches()) {
            try {
                long value = Long.parseLong(text);
                return value == (int) value ? IntNode.valueOf((int) value) : LongNode.valueOf(value);
            } catch (NumberFormatException e) {
                return TextNode.valueOf(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return DoubleNode.valueOf(Double.parseDouble(text));
        }
        if ("true".equals(text)) return BooleanNode.TRUE;
        if ("false".equals(text)) return BooleanNode.FALSE;
        return TextNode.valueOf(text);
    }

    private void skipAttributes(String element) throws XmlFormatException {
        while (true) {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("Unterminated start tag <" + element + ">");
            }
            if (peek('>') || startsWith("/>")) {
                return;
            }
            name();
            skipWhitespace();
            expect("=");
            skipWhitespace();
            if (!peek('"') && !peek('\'')) {
                throw error("Expected quoted attribute value in <" + element + ">");
            }
            char quote = src.charAt(pos++);
            int end = src.indexOf(quote, pos);
            if (end < 0) {
                throw error("Unterminated attribute value in <" + element + ">");
            }
            pos = end + 1;
        }
    }

    /**
     * Whitespace, comments, processing instructions and DOCTYPE outside the root.
     */
    private void skipMisc() throws XmlFormatException {
        while (true) {
            skipWhitespace();
            if (startsWith("<?")) {
                skipPast("?>", "Unterminated processing instruction");
            } else if (startsWith("<!--")) {
                skipPast("-->", "Unterminated comment");
            } else if (startsWith("<!DOCTYPE")) {
                int bracket = src.indexOf('[', pos);
                int close = src.indexOf('>', pos);
                if (bracket >= 0 && close > bracket) {
                    skipPast("]>", "Unterminated DOCTYPE");
                } else {
                    skipPast(">", "Unterminated DOCTYPE");
                }
            } else {
                return;
            }
        }
    }

    private String name() throws XmlFormatException {
        int start = pos;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':') {
                pos++;
            } else {
                break;
            }
        }
        if (start == pos) {
            throw error("Expected element name");
        }
        return src.substring(start, pos);
    }

    private String decode(String raw, int offset) throws XmlFormatException {
        int amp = raw.indexOf('&');
        if (amp < 0) {
            return raw;
        }
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '&') {
                out.append(c);
                i++;
                continue;
            }
            int semi = raw.indexOf(';', i);
            if (semi < 0) {
                throw new XmlFormatException("Unterminated entity reference", offset + i);
            }
            String entity = raw.substring(i + 1, semi);
            switch (entity) {
                case "amp" -> out.append('&');
                case "lt" -> out.append('<');
                case "gt" -> out.append('>');
                case "quot" -> out.append('"');
                case "apos" -> out.append('\'');
                default -> out.appendCodePoint(numericEntity(entity, offset + i));
            }
            i = semi + 1;
        }
        return out.toString();
    }

    private static int numericEntity(String entity, int at) throws XmlFormatException {
        try {
            if (entity.startsWith("#x") || entity.startsWith("#X")) {
                return Integer.parseInt(entity.substring(2), 16);
            }
            if (entity.startsWith("#")) {
                return Integer.parseInt(entity.substring(1));
            }
        } catch (NumberFormatException e) {
            throw new XmlFormatException("Invalid character reference &" + entity + ";", at);
        }
        throw new XmlFormatException("Unknown entity &" + entity + ";", at);
    }

    private void skipPast(String terminator, String message) throws XmlFormatException {
        int end = src.indexOf(terminator, pos);
        if (end < 0) {
            throw error(message);
        }
        pos = end + terminator.length();
    }

    private void skipWhitespace() {
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
            pos++;
        }
    }

    private void expect(String token) throws XmlFormatException {
        if (!startsWith(token)) {
            throw error("Expected '" + token + "'");
        }
        pos += token.length();
    }

    private boolean startsWith(String token) {
        return src.startsWith(token, pos);
    }

    private boolean peek(char c) {
        return pos < src.length() && src.charAt(pos) == c;
    }

    private XmlFormatException error(String message) {
        return new XmlFormatException(message, pos);
    }
}
