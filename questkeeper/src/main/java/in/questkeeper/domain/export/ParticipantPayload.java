package in.questkeeper.domain.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.questkeeper.domain.encounter.ParticipantType;
import in.questkeeper.domain.encounter.Position;

import java.util.List;

/**
 * Participant as carried by an envelope. id is the real character id or a temporary one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParticipantPayload(
    String id,
    String name,
    ParticipantType type,
    int maxHitPoints,
    int currentHitPoints,
    int temporaryHitPoints,
    int armorClass,
    Integer initiative,
    @JsonProperty("isPlayer") boolean isPlayer,
    @JsonProperty("isVisible") boolean isVisible,
    String notes,
    List<String> conditions,
    Position position
) {
    public ParticipantPayload {
        notes = notes == null ? "" : notes;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Template form: full health, no initiative, no conditions, no notes.
     */
    public ParticipantPayload sanitized() {
        return new ParticipantPayload(id, name, type, maxHitPoints, maxHitPoints, 0, armorClass,
            null, isPlayer, isVisible, "", List.of(), position);
    }
}
