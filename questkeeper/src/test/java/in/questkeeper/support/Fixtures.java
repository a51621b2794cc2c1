package in.questkeeper.support;

import in.questkeeper.domain.character.AbilityScores;
import in.questkeeper.domain.character.CharacterClass;
import in.questkeeper.domain.character.CharacterSheet;
import in.questkeeper.domain.character.CharacterType;
import in.questkeeper.domain.character.CreatureSize;
import in.questkeeper.domain.character.EquipmentItem;
import in.questkeeper.domain.character.HitPoints;
import in.questkeeper.domain.character.SavingThrows;
import in.questkeeper.domain.character.Spell;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.export.CharacterSheetPayload;
import in.questkeeper.domain.export.EncounterPayload;
import in.questkeeper.domain.export.ExportEnvelope;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportMetadata;
import in.questkeeper.domain.export.ParticipantPayload;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterSettings;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.encounter.ParticipantType;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Builders for encounters and participants used across tests.
 */
public final class Fixtures {

    public static final String OWNER = "owner-1";
    public static final String VIEWER = "viewer-1";
    public static final String STRANGER = "stranger-1";
    public static final String ENCOUNTER_ID = id(0xE1);
    public static final Instant CREATED = Instant.parse("2024-02-01T09:00:00Z");

    public static String id(long n) {
        return String.format("%024x", n);
    }

    public static Participant participant(long n, String name) {
        return Participant.of(id(n), name, ParticipantType.NPC, 20, 14, false);
    }

    public static Participant participant(long n, String name, int initiative) {
        return participant(n, name).withInitiative(initiative);
    }

    public static Participant player(long n, String name, int initiative) {
        return Participant.of(id(n), name, ParticipantType.PC, 30, 16, true).withInitiative(initiative);
    }

    public static Encounter encounter(Participant... participants) {
        return encounter(Arrays.asList(participants));
    }

    public static Encounter encounter(List<Participant> participants) {
        return new Encounter(ENCOUNTER_ID, OWNER, "Goblin Ambush", "Forest road", List.of("forest"),
            null, 60, 3, EncounterStatus.DRAFT, false, List.of(VIEWER), EncounterSettings.defaults(), 1,
            participants, CombatState.notStarted(), CREATED, CREATED);
    }

    /**
     * Level 3 wizard with one item and one spell, owned by {@link #OWNER}.
     */
    public static CharacterSheet sheet(long n, String name) {
        return new CharacterSheet(id(n), OWNER, name, CharacterType.PC, "Elf", null, CreatureSize.MEDIUM,
            List.of(new CharacterClass("Wizard", 3, "Evocation", 6)),
            new AbilityScores(8, 16, 12, 17, 13, 10),
            new HitPoints(18, 18, 0), 13, 30, 2,
            new SavingThrows(false, false, false, true, true, false),
            Map.of("arcana", true, "stealth", false),
            List.of(new EquipmentItem("Spellbook", 1, 3.0, 50, "Bound in red leather", false, false)),
            List.of(new Spell("Magic Missile", 1, "Evocation", "1 action", "120 feet", "V, S",
                "Instantaneous", "Three glowing darts.", true)),
            "Raised in a tower", "Owes the guild 20 gp", null, false, CREATED);
    }

    /**
     * Envelope exercising the awkward cases for text formats: a single tag, an
     * empty list, a numeric-looking name and negative hit points.
     */
    public static ExportEnvelope envelope(ExportFormat format) {
        ParticipantPayload wizard = new ParticipantPayload(id(1), "1984", ParticipantType.PC, 18, -3, 0, 13,
            null, true, true, "", List.of(), null);
        ParticipantPayload ogre = new ParticipantPayload(id(2), "Ogre", ParticipantType.MONSTER, 59, 59, 5, 11,
            8, false, false, "Hits hard & often", List.of("prone", "grappled"), null);
        EncounterPayload encounter = new EncounterPayload("Bridge <Troll>", "", List.of("bridge"), null, 45, 4,
            EncounterStatus.DRAFT, true, EncounterSettings.defaults(), null, List.of(wizard, ogre),
            List.of(CharacterSheetPayload.from(sheet(1, "1984"), id(1), false, true)));
        return new ExportEnvelope(
            new ExportMetadata("2024-03-01T10:00:00Z", OWNER, format, ExportEnvelope.SCHEMA_VERSION, "2.4.0"),
            encounter);
    }

    private Fixtures() {}
}
