package in.questkeeper.service.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XML Tree Reader")
class XmlTreeReaderTest {

    @Test
    @DisplayName("Leaves are coerced to numbers and booleans")
    void testCoercion() throws Exception {
        JsonNode tree = XmlTreeReader.read("<?xml version=\"1.0\"?>\n<root><a>12</a><b>1.5</b><c>true</c>"
            + "<d>12b</d><e></e></root>");

        assertTrue(tree.get("a").isInt());
        assertEquals(12, tree.get("a").asInt());
        assertTrue(tree.get("b").isDouble());
        assertTrue(tree.get("c").isBoolean());
        assertEquals("12b", tree.get("d").asText());
        assertEquals("", tree.get("e").asText());
    }

    @Test
    @DisplayName("Raw mode keeps every leaf as text")
    void testRawMode() throws Exception {
        JsonNode tree = XmlTreeReader.read("<root><a>12</a><c>false</c></root>", false);

        assertTrue(tree.get("a").isTextual());
        assertEquals("12", tree.get("a").asText());
        assertTrue(tree.get("c").isTextual());
    }

    @Test
    @DisplayName("Repeated tags collapse into an array")
    void testRepeatedTags() throws Exception {
        JsonNode tree = XmlTreeReader.read("<root><tags><tag>a</tag><tag>b</tag><tag>c</tag></tags></root>");

        JsonNode tags = tree.get("tags").get("tag");
        assertTrue(tags.isArray());
        assertEquals(3, tags.size());
        assertEquals("c", tags.get(2).asText());
    }

    @Test
    @DisplayName("Entities, CDATA, comments and attributes are handled")
    void testTextFeatures() throws Exception {
        JsonNode tree = XmlTreeReader.read("<!-- export -->\n<root version=\"1\">"
            + "<name>Tom &amp; Jerry &#65;</name><!-- skip --><raw><![CDATA[<b>bold</b>]]></raw>"
            + "<empty/></root>");

        assertEquals("Tom & Jerry A", tree.get("name").asText());
        assertEquals("<b>bold</b>", tree.get("raw").asText());
        assertEquals("", tree.get("empty").asText());
    }

    @Test
    @DisplayName("Malformed documents report the problem and its position")
    void testMalformed() {
        XmlFormatException empty = assertThrows(XmlFormatException.class, () -> XmlTreeReader.read("   "));
        assertEquals("Empty document at position 0", empty.getMessage());

        XmlFormatException mismatched = assertThrows(XmlFormatException.class,
            () -> XmlTreeReader.read("<root><a>1</b></root>"));
        assertTrue(mismatched.getMessage().startsWith("Mismatched closing tag </b>, expected </a>"));
        assertTrue(mismatched.getPosition() > 0);

        XmlFormatException unterminated = assertThrows(XmlFormatException.class,
            () -> XmlTreeReader.read("<root><a>1</a>"));
        assertTrue(unterminated.getMessage().startsWith("Unterminated element <root>"));

        XmlFormatException entity = assertThrows(XmlFormatException.class,
            () -> XmlTreeReader.read("<root>&nbsp;</root>"));
        assertTrue(entity.getMessage().startsWith("Unknown entity &nbsp;"));

        assertThrows(XmlFormatException.class, () -> XmlTreeReader.read("<root/><extra/>"));
    }
}
