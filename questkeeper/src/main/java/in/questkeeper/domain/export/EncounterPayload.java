package in.questkeeper.domain.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.questkeeper.domain.encounter.EncounterDifficulty;
import in.questkeeper.domain.encounter.EncounterSettings;
import in.questkeeper.domain.encounter.EncounterStatus;

import java.util.List;

/**
 * Encounter section of an envelope. combatState and characterSheets are optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncounterPayload(
    String name,
    String description,
    List<String> tags,
    EncounterDifficulty difficulty,
    Integer estimatedDuration,
    Integer targetLevel,
    EncounterStatus status,
    @JsonProperty("isPublic") boolean isPublic,
    EncounterSettings settings,
    CombatStatePayload combatState,
    List<ParticipantPayload> participants,
    List<CharacterSheetPayload> characterSheets
) {
    public EncounterPayload {
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
        participants = participants == null ? List.of() : List.copyOf(participants);
        characterSheets = characterSheets == null ? null : List.copyOf(characterSheets);
    }
}
