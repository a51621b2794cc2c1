package in.questkeeper.service.encounter;

import com.fasterxml.jackson.annotation.JsonProperty;
import in.questkeeper.domain.encounter.EncounterDifficulty;
import in.questkeeper.domain.encounter.EncounterSettings;

import java.util.List;

/**
 * Editable encounter header, used for create and for detail updates.
 */
public record NewEncounter(
    String name,
    String description,
    List<String> tags,
    EncounterDifficulty difficulty,
    Integer estimatedDuration,
    Integer targetLevel,
    @JsonProperty("isPublic") boolean isPublic,
    EncounterSettings settings
) {
    public static NewEncounter named(String name) {
        return new NewEncounter(name, "", List.of(), null, null, null, false, null);
    }
}
