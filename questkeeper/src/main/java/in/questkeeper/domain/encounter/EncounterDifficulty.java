package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Encounter difficulty rating.
 */
public enum EncounterDifficulty {
    TRIVIAL("trivial"),
    EASY("easy"),
    MEDIUM("medium"),
    HARD("hard"),
    DEADLY("deadly");

    private final String wire;

    EncounterDifficulty(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static EncounterDifficulty fromWire(String value) {
        for (EncounterDifficulty d : values()) {
            if (d.wire.equalsIgnoreCase(value)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + value);
    }
}
