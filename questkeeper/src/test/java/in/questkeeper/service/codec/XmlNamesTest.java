package in.questkeeper.service.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("XML Names")
class XmlNamesTest {

    @Test
    @DisplayName("Valid names pass through unchanged")
    void testPlainNames() {
        assertEquals("currentHitPoints", XmlNames.encode("currentHitPoints"));
        assertEquals("animal-handling", XmlNames.encode("animal-handling"));
        assertEquals("snake_case", XmlNames.encode("snake_case"));
    }

    @Test
    @DisplayName("Spaces, leading digits and reserved characters are escaped")
    void testEscaping() {
        assertEquals("sleight_x0020_of_x0020_hand", XmlNames.encode("sleight of hand"));
        assertEquals("_x0031_st", XmlNames.encode("1st"));
        assertEquals("a_x003A_b", XmlNames.encode("a:b"));
        assertEquals("_x005F_x", XmlNames.encode("_x"));
        assertEquals(XmlNames.EMPTY, XmlNames.encode(""));
    }

    @Test
    @DisplayName("Decoding reverses encoding for awkward keys")
    void testReversible() {
        for (String key : List.of("sleight of hand", "1st", "", "_x", "_x_", "_x0041_", "a<b>&c", "héros", "x y z")) {
            String name = XmlNames.encode(key);
            assertTrue(name.matches("[\\p{L}_][\\p{L}\\p{N}_.\\-]*"), name);
            assertEquals(key, XmlNames.decode(name), name);
        }
    }
}
