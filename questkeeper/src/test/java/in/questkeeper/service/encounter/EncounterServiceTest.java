package in.questkeeper.service.encounter;

import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.FieldError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.CombatPhase;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterDifficulty;
import in.questkeeper.domain.encounter.EncounterSettings;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.infrastructure.persistence.InMemoryEncounterRepository;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.access.PermissionGuard;
import in.questkeeper.service.combat.CombatStateMachine;
import in.questkeeper.service.combat.InitiativeRoller;
import in.questkeeper.support.SequentialIds;
import in.questkeeper.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static in.questkeeper.support.Fixtures.ENCOUNTER_ID;
import static in.questkeeper.support.Fixtures.OWNER;
import static in.questkeeper.support.Fixtures.STRANGER;
import static in.questkeeper.support.Fixtures.VIEWER;
import static in.questkeeper.support.Fixtures.encounter;
import static in.questkeeper.support.Fixtures.participant;
import static in.questkeeper.support.Fixtures.player;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Encounter Service")
class EncounterServiceTest {

    private TestClock clock;
    private InMemoryEncounterRepository repository;
    private EncounterService service;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        repository = new InMemoryEncounterRepository(clock);
        repository.insert(encounter(participant(1, "Aria", 18), participant(2, "Brom", 9)));
        service = new EncounterService(repository, new EncounterLoader(repository, new PermissionGuard()),
            new SequentialIds(), clock);
    }

    @Test
    @DisplayName("Create stores a draft at version 1")
    void testCreate() {
        Encounter e = service.create(OWNER, NewEncounter.named("  Crypt  ")).orElseThrow();

        assertEquals("Crypt", e.name());
        assertEquals(EncounterStatus.DRAFT, e.status());
        assertEquals(1, e.version());
        assertEquals(EncounterSettings.defaults(), e.settings());
        assertTrue(repository.findById(e.id()).isPresent());
    }

    @Test
    @DisplayName("Create reports every invalid field")
    void testCreateValidation() {
        NewEncounter bad = new NewEncounter("", "", List.of("ok", ""), null, 0, 21, false,
            new EncounterSettings(true, false, true, false, null, false, 60, 10, null));

        ServiceResult<Encounter> result = service.create(OWNER, bad);

        assertTrue(result.error().is(ErrorCode.ENCOUNTER_VALIDATION_ERROR));
        List<String> fields = result.error().details().stream().map(FieldError::field).collect(Collectors.toList());
        assertEquals(List.of("name", "estimatedDuration", "targetLevel", "tags.1", "settings.gridSize",
            "settings.roundTimeLimit"), fields);
    }

    @Test
    @DisplayName("Shared users can read but not edit or delete")
    void testAccessRules() {
        assertTrue(service.get(ENCOUNTER_ID, VIEWER).success());
        assertTrue(service.get(ENCOUNTER_ID, STRANGER).error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));

        ServiceResult<Encounter> edit = service.updateDetails(ENCOUNTER_ID, VIEWER, NewEncounter.named("Mine now"));
        assertEquals("Only the owner can update this encounter", edit.error().message());
        assertTrue(service.delete(ENCOUNTER_ID, VIEWER).failed());
        assertTrue(repository.findById(ENCOUNTER_ID).isPresent());
    }

    @Test
    @DisplayName("Update replaces the header and keeps participants")
    void testUpdateDetails() {
        Encounter e = service.updateDetails(ENCOUNTER_ID, OWNER, NewEncounter.named("Renamed")).orElseThrow();

        assertEquals("Renamed", e.name());
        assertEquals(2, e.participants().size());
        assertEquals(2, e.version());
    }

    @Test
    @DisplayName("Duplicate gives the reader a fresh draft copy")
    void testDuplicate() {
        Encounter running = new CombatStateMachine(clock, new InitiativeRoller())
            .start(repository.findById(ENCOUNTER_ID).orElseThrow(), Map.of()).orElseThrow();
        repository.update(running);

        Encounter copy = service.duplicate(ENCOUNTER_ID, VIEWER, null).orElseThrow();

        assertNotEquals(ENCOUNTER_ID, copy.id());
        assertEquals(VIEWER, copy.ownerId());
        assertEquals("Goblin Ambush (Copy)", copy.name());
        assertEquals(EncounterStatus.DRAFT, copy.status());
        assertEquals(CombatPhase.NOT_STARTED, copy.combatState().phase());
        assertTrue(copy.sharedWith().isEmpty());
        assertEquals(2, copy.participants().size());

        assertTrue(service.duplicate(ENCOUNTER_ID, STRANGER, null).failed());
    }

    @Test
    @DisplayName("Copy names are capped at 100 characters")
    void testCopyName() {
        assertEquals("Lair (Copy)", EncounterService.copyName("Lair"));
        assertEquals(100, EncounterService.copyName("x".repeat(98)).length());
    }

    @Test
    @DisplayName("Sharing is idempotent and reversible")
    void testShareAndUnshare() {
        service.shareWith(ENCOUNTER_ID, OWNER, "friend-2");
        service.shareWith(ENCOUNTER_ID, OWNER, "friend-2");
        service.shareWith(ENCOUNTER_ID, OWNER, OWNER);
        assertEquals(List.of(VIEWER, "friend-2"), repository.findById(ENCOUNTER_ID).orElseThrow().sharedWith());
        assertTrue(service.get(ENCOUNTER_ID, "friend-2").success());

        service.unshare(ENCOUNTER_ID, OWNER, "friend-2");
        assertTrue(service.get(ENCOUNTER_ID, "friend-2").error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));

        assertTrue(service.shareWith(ENCOUNTER_ID, VIEWER, "friend-3").error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));
        assertTrue(service.shareWith(ENCOUNTER_ID, OWNER, " ").error().is(ErrorCode.ENCOUNTER_VALIDATION_ERROR));
    }

    @Test
    @DisplayName("Difficulty follows the ratio of opponents to players")
    void testCalculateDifficulty() {
        assertEquals(EncounterDifficulty.TRIVIAL, EncounterService.calculateDifficulty(encounter(player(1, "P", 10))));
        assertEquals(EncounterDifficulty.DEADLY, EncounterService.calculateDifficulty(encounter(participant(1, "G"))));
        assertEquals(EncounterDifficulty.EASY, EncounterService.calculateDifficulty(
            encounter(player(1, "P", 10), participant(2, "G"))));
        assertEquals(EncounterDifficulty.HARD, EncounterService.calculateDifficulty(
            encounter(player(1, "P", 10), participant(2, "G"), participant(3, "H"))));
        assertEquals(EncounterDifficulty.DEADLY, EncounterService.calculateDifficulty(
            encounter(player(1, "P", 10), participant(2, "G"), participant(3, "H"), participant(4, "I"))));
    }

    @Test
    @DisplayName("Delete removes the encounter for the owner")
    void testDelete() {
        assertTrue(service.delete(ENCOUNTER_ID, OWNER).orElseThrow());
        assertTrue(service.get(ENCOUNTER_ID, OWNER).error().is(ErrorCode.ENCOUNTER_NOT_FOUND));
    }
}
