package in.questkeeper.domain.character;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CharacterType {
    PC("pc"),
    NPC("npc");

    private final String wire;

    CharacterType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static CharacterType fromWire(String value) {
        for (CharacterType t : values()) {
            if (t.wire.equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown character type: " + value);
    }
}
