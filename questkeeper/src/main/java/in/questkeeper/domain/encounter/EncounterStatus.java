package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encounter lifecycle status. ACTIVE only while combat is running or paused.
 */
public enum EncounterStatus {
    DRAFT("draft"),
    ACTIVE("active"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String wire;

    EncounterStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static EncounterStatus fromWire(String value) {
        for (EncounterStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown encounter status: " + value);
    }
}
