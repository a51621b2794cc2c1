package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-encounter table settings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EncounterSettings(
    boolean allowPlayerVisibility,
    boolean autoRollInitiative,
    boolean trackResources,
    boolean enableLairActions,
    Integer lairActionInitiative,     // 1..30, only meaningful with lair actions
    boolean enableGridMovement,
    int gridSize,                     // 1..50 feet per square
    Integer roundTimeLimit,           // seconds, 30..600
    Integer experienceThreshold       // 0..30
) {
    public static EncounterSettings defaults() {
        return new EncounterSettings(true, false, true, false, null, false, 5, null, null);
    }

    public EncounterSettings withAutoRollInitiative(boolean autoRoll) {
        return new EncounterSettings(allowPlayerVisibility, autoRoll, trackResources, enableLairActions,
            lairActionInitiative, enableGridMovement, gridSize, roundTimeLimit, experienceThreshold);
    }
}
