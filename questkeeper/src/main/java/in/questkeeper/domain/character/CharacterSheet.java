package in.questkeeper.domain.character;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stored character record. Owned by the character collaborator; encounters
 * only reference it by id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CharacterSheet(
    String id,
    String ownerId,
    String name,
    CharacterType type,
    String race,
    String customRace,
    CreatureSize size,
    List<CharacterClass> classes,
    AbilityScores abilityScores,
    HitPoints hitPoints,
    int armorClass,
    int speed,
    int proficiencyBonus,
    SavingThrows savingThrows,
    Map<String, Boolean> skills,
    List<EquipmentItem> equipment,
    List<Spell> spells,
    String backstory,
    String notes,
    String imageUrl,
    @JsonProperty("isPublic") boolean isPublic,
    Instant createdAt
) {
    public CharacterSheet {
        classes = classes == null ? List.of() : List.copyOf(classes);
        skills = skills == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        equipment = equipment == null ? List.of() : List.copyOf(equipment);
        spells = spells == null ? List.of() : List.copyOf(spells);
        backstory = backstory == null ? "" : backstory;
        notes = notes == null ? "" : notes;
    }

    public int dexterity() {
        return abilityScores == null ? 10 : abilityScores.dexterity();
    }

    public CharacterSheet withId(String newId, String newOwnerId, boolean newIsPublic, Instant created) {
        return new CharacterSheet(newId, newOwnerId, name, type, race, customRace, size, classes, abilityScores,
            hitPoints, armorClass, speed, proficiencyBonus, savingThrows, skills, equipment, spells, backstory,
            notes, imageUrl, newIsPublic, created);
    }
}
