package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Partial participant change. Null fields are left untouched.
 */
public record ParticipantUpdate(
    String name,
    ParticipantType type,
    Integer maxHitPoints,
    Integer currentHitPoints,
    Integer temporaryHitPoints,
    Integer armorClass,
    Integer initiative,
    @JsonProperty("isPlayer") Boolean isPlayer,
    @JsonProperty("isVisible") Boolean isVisible,
    String notes,
    List<String> conditions,
    Position position
) {
    public Participant applyTo(Participant p) {
        return new Participant(
            p.characterId(),
            name != null ? name : p.name(),
            type != null ? type : p.type(),
            maxHitPoints != null ? maxHitPoints : p.maxHitPoints(),
            currentHitPoints != null ? currentHitPoints : p.currentHitPoints(),
            temporaryHitPoints != null ? temporaryHitPoints : p.temporaryHitPoints(),
            armorClass != null ? armorClass : p.armorClass(),
            initiative != null ? initiative : p.initiative(),
            isPlayer != null ? isPlayer : p.isPlayer(),
            isVisible != null ? isVisible : p.isVisible(),
            notes != null ? notes : p.notes(),
            conditions != null ? conditions : p.conditions(),
            position != null ? position : p.position()
        );
    }
}
