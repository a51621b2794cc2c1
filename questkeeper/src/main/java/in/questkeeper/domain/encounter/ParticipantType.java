package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantType {
    PC("pc"),
    NPC("npc"),
    MONSTER("monster");

    private final String wire;

    ParticipantType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static ParticipantType fromWire(String value) {
        for (ParticipantType t : values()) {
            if (t.wire.equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown participant type: " + value);
    }
}
