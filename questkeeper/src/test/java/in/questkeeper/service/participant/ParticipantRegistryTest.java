package in.questkeeper.service.participant;

import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.StorageException;
import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ErrorKind;
import in.questkeeper.domain.common.FieldError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.encounter.ParticipantType;
import in.questkeeper.domain.encounter.ParticipantUpdate;
import in.questkeeper.infrastructure.persistence.InMemoryEncounterRepository;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.access.PermissionGuard;
import in.questkeeper.service.combat.CombatStateMachine;
import in.questkeeper.service.combat.InitiativeRoller;
import in.questkeeper.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static in.questkeeper.support.Fixtures.ENCOUNTER_ID;
import static in.questkeeper.support.Fixtures.OWNER;
import static in.questkeeper.support.Fixtures.VIEWER;
import static in.questkeeper.support.Fixtures.encounter;
import static in.questkeeper.support.Fixtures.id;
import static in.questkeeper.support.Fixtures.participant;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Participant Registry")
class ParticipantRegistryTest {

    private static final String A = id(1);
    private static final String B = id(2);
    private static final String C = id(3);

    private TestClock clock;
    private InMemoryEncounterRepository repository;
    private ParticipantRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        repository = new InMemoryEncounterRepository(clock);
        repository.insert(encounter(participant(1, "Aria", 18), participant(2, "Brom", 15), participant(3, "Cyl", 12)));
        registry = new ParticipantRegistry(new EncounterLoader(repository, new PermissionGuard()), new ParticipantValidator());
    }

    private Encounter stored() {
        return repository.findById(ENCOUNTER_ID).orElseThrow();
    }

    private static List<String> ids(Encounter e) {
        return e.participants().stream().map(Participant::characterId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("Every permutation of the participants is accepted and stored")
    void testReorderAllPermutations() {
        List<List<String>> permutations = List.of(
            List.of(A, B, C), List.of(A, C, B), List.of(B, A, C),
            List.of(B, C, A), List.of(C, A, B), List.of(C, B, A));

        for (List<String> p : permutations) {
            ServiceResult<Encounter> result = registry.reorder(ENCOUNTER_ID, OWNER, p);
            assertTrue(result.success(), "permutation " + p);
            assertEquals(p, ids(stored()));
        }
    }

    @Test
    @DisplayName("Reorder bumps the stored version")
    void testReorderBumpsVersion() {
        int before = stored().version();
        registry.reorder(ENCOUNTER_ID, OWNER, List.of(C, B, A));
        assertEquals(before + 1, stored().version());
    }

    @Test
    @DisplayName("Missing, duplicated or unknown ids leave the order untouched")
    void testReorderRejectsNonPermutations() {
        ServiceResult<Encounter> missing = registry.reorder(ENCOUNTER_ID, OWNER, List.of(A, B));
        assertEquals(ErrorKind.VALIDATION, missing.error().kind());

        ServiceResult<Encounter> duplicated = registry.reorder(ENCOUNTER_ID, OWNER, List.of(A, A, B));
        assertEquals(ErrorKind.VALIDATION, duplicated.error().kind());

        ServiceResult<Encounter> unknown = registry.reorder(ENCOUNTER_ID, OWNER, List.of(A, B, C, id(42)));
        assertTrue(unknown.error().is(ErrorCode.PARTICIPANT_NOT_FOUND));

        assertEquals(List.of(A, B, C), ids(stored()));
        assertEquals(1, stored().version());
    }

    @Test
    @DisplayName("Malformed ids are reported by position before any lookup")
    void testReorderMalformedIds() {
        ServiceResult<Encounter> result = registry.reorder(ENCOUNTER_ID, OWNER, List.of(A, "nope", C));

        assertEquals(ErrorKind.VALIDATION, result.error().kind());
        assertEquals("participantIds.1", result.error().details().get(0).field());

        assertTrue(registry.reorder("bad", OWNER, List.of(A)).error().is(ErrorKind.VALIDATION));
        assertTrue(registry.reorder(ENCOUNTER_ID, OWNER, List.of()).error().is(ErrorKind.VALIDATION));
    }

    @Test
    @DisplayName("Only the owner may reorder")
    void testReorderRequiresOwner() {
        ServiceResult<Encounter> result = registry.reorder(ENCOUNTER_ID, VIEWER, List.of(C, B, A));

        assertTrue(result.error().is(ErrorCode.INSUFFICIENT_PERMISSIONS));
        assertEquals("Only the owner can reorder participants in this encounter", result.error().message());
        assertEquals(List.of(A, B, C), ids(stored()));
    }

    @Test
    @DisplayName("A store failure surfaces as a reorder failure")
    void testReorderStoreFailure() {
        EncounterRepository failing = mock(EncounterRepository.class);
        when(failing.findById(ENCOUNTER_ID)).thenReturn(Optional.of(stored()));
        when(failing.update(any())).thenThrow(new StorageException("disk full", null));
        ParticipantRegistry r = new ParticipantRegistry(new EncounterLoader(failing, new PermissionGuard()),
            new ParticipantValidator());

        ServiceResult<Encounter> result = r.reorder(ENCOUNTER_ID, OWNER, List.of(C, B, A));

        assertTrue(result.error().is(ErrorCode.PARTICIPANT_REORDER_FAILED));
        assertEquals(ErrorKind.STORAGE, result.error().kind());
    }

    @Test
    @DisplayName("Invalid participant data is rejected with field errors")
    void testAddRejectsInvalid() {
        Participant broken = Participant.of(id(9), "Ghoul", ParticipantType.MONSTER, -1, 12, false);

        ServiceResult<Encounter> result = registry.add(ENCOUNTER_ID, OWNER, broken);

        assertEquals(ErrorKind.VALIDATION, result.error().kind());
        List<String> fields = result.error().details().stream().map(FieldError::field).collect(Collectors.toList());
        assertTrue(fields.contains("maxHitPoints"));
        assertEquals(3, stored().participants().size());
    }

    @Test
    @DisplayName("Valid participant is appended last")
    void testAddAppends() {
        Participant ghoul = Participant.of(id(9), "Ghoul", ParticipantType.MONSTER, 25, 12, false);

        ServiceResult<Encounter> result = registry.add(ENCOUNTER_ID, OWNER, ghoul);

        assertTrue(result.success());
        assertEquals(List.of(A, B, C, id(9)), ids(stored()));
        assertEquals(25, stored().findParticipant(id(9)).maxHitPoints());
    }

    @Test
    @DisplayName("Bulk add is all-or-nothing and reports indexed paths")
    void testBulkAllOrNothing() {
        Participant ok = Participant.of(id(9), "Ghoul", ParticipantType.MONSTER, 25, 12, false);
        Participant bad = Participant.of(id(10), "", ParticipantType.MONSTER, 25, 12, false);

        ServiceResult<Encounter> result = registry.addBulk(ENCOUNTER_ID, OWNER, List.of(ok, bad));

        assertEquals(ErrorKind.VALIDATION, result.error().kind());
        assertEquals("participants.1.name", result.error().details().get(0).field());
        assertEquals(3, stored().participants().size());
    }

    @Test
    @DisplayName("Duplicates and the size cap are enforced")
    void testBulkDuplicatesAndCap() {
        ServiceResult<Encounter> dup = registry.add(ENCOUNTER_ID, OWNER, participant(1, "Aria again"));
        assertEquals(ErrorKind.VALIDATION, dup.error().kind());

        List<Participant> many = new ArrayList<>();
        for (int i = 100; i < 148; i++) {
            many.add(participant(i, "Minion " + i));
        }
        ServiceResult<Encounter> tooMany = registry.addBulk(ENCOUNTER_ID, OWNER, many);
        assertEquals(ErrorKind.VALIDATION, tooMany.error().kind());
        assertEquals(3, stored().participants().size());

        assertTrue(registry.addBulk(ENCOUNTER_ID, OWNER, many.subList(0, 47)).success());
        assertEquals(50, stored().participants().size());
    }

    @Test
    @DisplayName("Removing the current participant hands the turn to the next one")
    void testRemoveDuringCombat() {
        CombatStateMachine machine = new CombatStateMachine(clock, new InitiativeRoller());
        Encounter started = machine.start(stored(), Map.of()).orElseThrow();
        started = machine.nextTurn(started).orElseThrow();
        repository.update(started);

        ServiceResult<Encounter> result = registry.remove(ENCOUNTER_ID, OWNER, B);

        assertTrue(result.success());
        Encounter after = stored();
        assertEquals(List.of(A, C), ids(after));
        assertEquals(C, after.combatState().currentEntry().participantId());
        assertTrue(registry.remove(ENCOUNTER_ID, OWNER, B).error().is(ErrorCode.PARTICIPANT_NOT_FOUND));
    }

    @Test
    @DisplayName("Update merges fields and re-sorts a running order")
    void testUpdateMerges() {
        ParticipantUpdate change = new ParticipantUpdate("Aria the Bold", null, null, null, null, null,
            null, null, null, "leader", null, null);

        ServiceResult<Encounter> result = registry.update(ENCOUNTER_ID, OWNER, A, change);

        assertTrue(result.success());
        Participant a = stored().findParticipant(A);
        assertEquals("Aria the Bold", a.name());
        assertEquals("leader", a.notes());
        assertEquals(20, a.maxHitPoints());

        ParticipantUpdate invalid = new ParticipantUpdate(null, null, null, null, null, 40,
            null, null, null, null, null, null);
        assertEquals(ErrorKind.VALIDATION, registry.update(ENCOUNTER_ID, OWNER, A, invalid).error().kind());
    }
}
