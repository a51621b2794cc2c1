package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A creature taking part in an encounter.
 *
 * Participants are keyed by their character reference, which is unique
 * within an encounter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Participant(
    String characterId,
    String name,
    ParticipantType type,
    int maxHitPoints,
    int currentHitPoints,             // may go negative
    int temporaryHitPoints,           // never negative
    int armorClass,
    Integer initiative,               // null until rolled or set
    @JsonProperty("isPlayer") boolean isPlayer,
    @JsonProperty("isVisible") boolean isVisible,
    String notes,
    List<String> conditions,
    Position position
) {
    public Participant {
        notes = notes == null ? "" : notes;
        conditions = conditions == null ? List.of() : List.copyOf(new LinkedHashSet<>(conditions));
    }

    /**
     * Fresh participant at full health with no initiative.
     */
    public static Participant of(String characterId, String name, ParticipantType type,
                                 int maxHitPoints, int armorClass, boolean isPlayer) {
        return new Participant(characterId, name, type, maxHitPoints, maxHitPoints, 0, armorClass,
            null, isPlayer, true, "", List.of(), null);
    }

    @JsonIgnore
    public boolean isDown() {
        return currentHitPoints <= 0;
    }

    public Participant withCharacterId(String newCharacterId) {
        return new Participant(newCharacterId, name, type, maxHitPoints, currentHitPoints, temporaryHitPoints,
            armorClass, initiative, isPlayer, isVisible, notes, conditions, position);
    }

    public Participant withHitPoints(int current, int temporary) {
        return new Participant(characterId, name, type, maxHitPoints, current, temporary,
            armorClass, initiative, isPlayer, isVisible, notes, conditions, position);
    }

    public Participant withInitiative(Integer value) {
        return new Participant(characterId, name, type, maxHitPoints, currentHitPoints, temporaryHitPoints,
            armorClass, value, isPlayer, isVisible, notes, conditions, position);
    }

    public Participant withNotes(String value) {
        return new Participant(characterId, name, type, maxHitPoints, currentHitPoints, temporaryHitPoints,
            armorClass, initiative, isPlayer, isVisible, value, conditions, position);
    }

    public Participant withConditions(List<String> value) {
        return new Participant(characterId, name, type, maxHitPoints, currentHitPoints, temporaryHitPoints,
            armorClass, initiative, isPlayer, isVisible, notes, value, position);
    }

    public Participant withCondition(String condition) {
        if (conditions.contains(condition)) {
            return this;
        }
        List<String> next = new ArrayList<>(conditions);
        next.add(condition);
        return withConditions(next);
    }

    public Participant withoutCondition(String condition) {
        if (!conditions.contains(condition)) {
            return this;
        }
        List<String> next = new ArrayList<>(conditions);
        next.remove(condition);
        return withConditions(next);
    }
}
