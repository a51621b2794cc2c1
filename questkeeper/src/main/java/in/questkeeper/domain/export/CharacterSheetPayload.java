package in.questkeeper.domain.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import in.questkeeper.domain.character.AbilityScores;
import in.questkeeper.domain.character.CharacterClass;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.domain.character.CharacterType;
import in.questkeeper.domain.character.CreatureSize;
import in.questkeeper.domain.character.EquipmentItem;
import in.questkeeper.domain.character.HitPoints;
import in.questkeeper.domain.character.SavingThrows;
import in.questkeeper.domain.character.Spell;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Denormalized character sheet inside an envelope.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CharacterSheetPayload(
    String id,
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
    String imageUrl
) {
    public CharacterSheetPayload {
        classes = classes == null ? List.of() : List.copyOf(classes);
        skills = skills == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(skills));
        equipment = equipment == null ? List.of() : List.copyOf(equipment);
        spells = spells == null ? List.of() : List.copyOf(spells);
        backstory = backstory == null ? "" : backstory;
        notes = notes == null ? "" : notes;
    }

    /**
     * @param keepNotes private character notes are exported only when set
     */
    public static CharacterSheetPayload from(CharacterSheet c, String exportedId, boolean stripPersonalData,
                                             boolean keepNotes) {
        return new CharacterSheetPayload(
            exportedId, c.name(), c.type(), c.race(), c.customRace(), c.size(), c.classes(),
            c.abilityScores(), c.hitPoints(), c.armorClass(), c.speed(), c.proficiencyBonus(),
            c.savingThrows(), c.skills(), c.equipment(), c.spells(),
            stripPersonalData ? "" : c.backstory(),
            keepNotes && !stripPersonalData ? c.notes() : "",
            c.imageUrl());
    }

    /**
     * New private character record owned by ownerId.
     */
    public CharacterSheet toCharacter(String newId, String ownerId, Instant now) {
        return new CharacterSheet(newId, ownerId, name, type, race, customRace, size, classes, abilityScores,
            hitPoints, armorClass, speed, proficiencyBonus, savingThrows, skills, equipment, spells,
            backstory, notes, imageUrl, false, now);
    }
}
