package in.questkeeper.service.combat;

import in.questkeeper.domain.common.ErrorCode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.CombatPhase;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.encounter.InitiativeEntry;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static in.questkeeper.support.Fixtures.encounter;
import static in.questkeeper.support.Fixtures.id;
import static in.questkeeper.support.Fixtures.participant;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Combat State Machine")
class CombatStateMachineTest {

    private static final String A = id(1);
    private static final String B = id(2);
    private static final String C = id(3);
    private static final Map<String, Integer> DEX = Map.of(A, 14, B, 10, C, 20);

    private TestClock clock;
    private CombatStateMachine machine;
    private Encounter fresh;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        machine = new CombatStateMachine(clock, new InitiativeRoller(new Random(7)));
        fresh = encounter(participant(1, "Aria", 18), participant(2, "Brom", 18), participant(3, "Cyl", 12));
    }

    private Encounter started() {
        return machine.start(fresh, DEX).orElseThrow();
    }

    private static List<String> order(Encounter e) {
        return e.combatState().initiativeOrder().stream()
            .map(InitiativeEntry::participantId)
            .collect(Collectors.toList());
    }

    @Test
    @DisplayName("Start sorts by initiative then dexterity and begins round 1")
    void testStartOrdersByInitiativeThenDexterity() {
        Encounter e = started();
        CombatState s = e.combatState();

        assertEquals(List.of(A, B, C), order(e));
        assertEquals(CombatPhase.ACTIVE, s.phase());
        assertEquals(EncounterStatus.ACTIVE, e.status());
        assertEquals(1, s.currentRound());
        assertEquals(0, s.currentTurn());
        assertEquals(clock.instant(), s.startedAt());
        assertEquals(A, machine.currentParticipant(e).characterId());
    }

    @Test
    @DisplayName("Missing dexterity falls back to 10")
    void testStartDefaultsDexterity() {
        Encounter e = machine.start(fresh, Map.of()).orElseThrow();
        assertTrue(e.combatState().initiativeOrder().stream().allMatch(x -> x.dexterity() == 10));
    }

    @Test
    @DisplayName("Start is rejected without participants or initiative")
    void testStartRequiresParticipants() {
        ServiceResult<Encounter> empty = machine.start(encounter(), DEX);
        assertTrue(empty.error().is(ErrorCode.COMBAT_STATE_ERROR));
        assertEquals("Cannot startCombat: encounter has no participants", empty.error().message());

        ServiceResult<Encounter> unrolled = machine.start(encounter(participant(1, "Aria")), DEX);
        assertTrue(unrolled.failed());
        assertTrue(unrolled.error().is(ErrorCode.COMBAT_STATE_ERROR));
    }

    @Test
    @DisplayName("Auto-roll fills missing initiative within 1..30")
    void testStartAutoRolls() {
        Encounter e = encounter(participant(1, "Aria"), participant(2, "Brom", 5));
        e = e.withDetails(e.name(), e.description(), e.tags(), e.difficulty(), e.estimatedDuration(),
            e.targetLevel(), e.isPublic(), e.settings().withAutoRollInitiative(true));

        Encounter s = machine.start(e, DEX).orElseThrow();

        Integer rolled = s.findParticipant(A).initiative();
        assertNotNull(rolled);
        assertTrue(rolled >= 1 && rolled <= 30);
        assertEquals(2, s.combatState().initiativeOrder().size());
    }

    @Test
    @DisplayName("Starting twice is rejected with a readable reason")
    void testStartTwiceRejected() {
        ServiceResult<Encounter> again = machine.start(started(), DEX);
        assertTrue(again.failed());
        assertEquals("Cannot startCombat: combat is already active", again.error().message());
    }

    @Test
    @DisplayName("N next turns return to the top of a new round")
    void testNextTurnWrapsRound() {
        Encounter e = started();
        e = machine.nextTurn(e).orElseThrow();
        assertEquals(1, e.combatState().currentTurn());
        assertTrue(e.combatState().initiativeOrder().get(0).hasActed());

        e = machine.nextTurn(e).orElseThrow();
        e = machine.nextTurn(e).orElseThrow();

        assertEquals(0, e.combatState().currentTurn());
        assertEquals(2, e.combatState().currentRound());
        assertTrue(e.combatState().initiativeOrder().stream().noneMatch(InitiativeEntry::hasActed));
    }

    @Test
    @DisplayName("Previous turn from the top goes back a round but never below 1")
    void testPreviousTurn() {
        Encounter e = started();
        Encounter back = machine.previousTurn(e).orElseThrow();
        assertEquals(2, back.combatState().currentTurn());
        assertEquals(1, back.combatState().currentRound());

        Encounter round2 = machine.nextTurn(machine.nextTurn(machine.nextTurn(e).orElseThrow())
            .orElseThrow()).orElseThrow();
        Encounter undo = machine.previousTurn(round2).orElseThrow();
        assertEquals(2, undo.combatState().currentTurn());
        assertEquals(1, undo.combatState().currentRound());
    }

    @Test
    @DisplayName("Downed participants are skipped")
    void testNextTurnSkipsDowned() {
        Encounter e = machine.applyDamage(started(), B, 50).orElseThrow();
        assertFalse(e.combatState().initiativeOrder().get(1).isActive());

        e = machine.nextTurn(e).orElseThrow();
        assertEquals(C, machine.currentParticipant(e).characterId());
    }

    @Test
    @DisplayName("Pause and resume count only active time")
    void testDurationExcludesPausedTime() {
        Encounter e = started();
        clock.advance(Duration.ofMinutes(5));
        e = machine.pause(e).orElseThrow();
        assertEquals(CombatPhase.PAUSED, e.combatState().phase());
        assertEquals(300_000L, e.combatState().totalDurationMs());

        clock.advance(Duration.ofHours(1));
        e = machine.resume(e).orElseThrow();
        clock.advance(Duration.ofMinutes(2));
        e = machine.end(e).orElseThrow();

        assertEquals(CombatPhase.ENDED, e.combatState().phase());
        assertEquals(EncounterStatus.COMPLETED, e.status());
        assertEquals(420_000L, e.combatState().totalDurationMs());
        assertEquals(clock.instant(), e.combatState().endedAt());
    }

    @Test
    @DisplayName("Transitions outside their phase are rejected")
    void testInvalidTransitions() {
        assertEquals("Cannot pauseCombat: combat has not started", machine.pause(fresh).error().message());
        assertEquals("Cannot resumeCombat: combat is already active", machine.resume(started()).error().message());
        assertEquals("Cannot nextTurn: combat has not started", machine.nextTurn(fresh).error().message());

        Encounter paused = machine.pause(started()).orElseThrow();
        assertEquals("Cannot nextTurn: combat is paused", machine.nextTurn(paused).error().message());

        Encounter ended = machine.end(paused).orElseThrow();
        assertEquals("Cannot endCombat: combat has ended", machine.end(ended).error().message());
        assertEquals("Cannot setInitiative: combat has ended",
            machine.setInitiative(ended, A, 5, null).error().message());
        assertNull(machine.currentParticipant(ended));
    }

    @Test
    @DisplayName("Mid-combat initiative change keeps the current participant")
    void testSetInitiativeKeepsCurrentTurn() {
        Encounter e = machine.nextTurn(started()).orElseThrow();
        assertEquals(B, machine.currentParticipant(e).characterId());

        e = machine.setInitiative(e, C, 25, null).orElseThrow();

        assertEquals(List.of(C, A, B), order(e));
        assertEquals(B, machine.currentParticipant(e).characterId());
        assertEquals(25, e.findParticipant(C).initiative());
    }

    @Test
    @DisplayName("Initiative before combat only touches the participant")
    void testSetInitiativeBeforeCombat() {
        Encounter e = machine.setInitiative(fresh, A, 3, null).orElseThrow();
        assertEquals(3, e.findParticipant(A).initiative());
        assertTrue(e.combatState().initiativeOrder().isEmpty());

        assertTrue(machine.setInitiative(fresh, A, 31, null).error().is(ErrorCode.ENCOUNTER_VALIDATION_ERROR));
        assertTrue(machine.setInitiative(fresh, id(99), 10, null).error().is(ErrorCode.PARTICIPANT_NOT_FOUND));
    }

    @Test
    @DisplayName("Temporary hit points absorb damage first")
    void testDamageUsesTemporaryHitPoints() {
        Participant tough = participant(1, "Aria", 18).withHitPoints(20, 5);
        Encounter e = machine.applyDamage(encounter(tough), A, 8).orElseThrow();

        Participant hurt = e.findParticipant(A);
        assertEquals(0, hurt.temporaryHitPoints());
        assertEquals(17, hurt.currentHitPoints());

        Encounter overkill = machine.applyDamage(e, A, 5000).orElseThrow();
        assertEquals(-999, overkill.findParticipant(A).currentHitPoints());

        assertTrue(machine.applyDamage(e, A, -1).error().is(ErrorCode.ENCOUNTER_VALIDATION_ERROR));
    }

    @Test
    @DisplayName("Healing is capped and brings a downed participant back into the order")
    void testHealingRestoresActive() {
        Encounter e = machine.applyDamage(started(), B, 25).orElseThrow();
        assertFalse(e.combatState().initiativeOrder().get(1).isActive());

        e = machine.applyHealing(e, B, 100).orElseThrow();
        assertEquals(20, e.findParticipant(B).currentHitPoints());
        assertTrue(e.combatState().initiativeOrder().get(1).isActive());
    }

    @Test
    @DisplayName("Huge damage and healing amounts clamp instead of wrapping around")
    void testExtremeAmountsClamp() {
        Encounter healed = machine.applyHealing(fresh, A, Integer.MAX_VALUE).orElseThrow();
        assertEquals(20, healed.findParticipant(A).currentHitPoints());

        Encounter floored = machine.applyDamage(fresh, A, 5000).orElseThrow();
        Encounter again = machine.applyDamage(floored, A, Integer.MAX_VALUE).orElseThrow();
        assertEquals(-999, again.findParticipant(A).currentHitPoints());

        Encounter shielded = encounter(participant(1, "Aria", 18).withHitPoints(-999, 7));
        Participant hit = machine.applyDamage(shielded, A, Integer.MAX_VALUE).orElseThrow().findParticipant(A);
        assertEquals(0, hit.temporaryHitPoints());
        assertEquals(-999, hit.currentHitPoints());

        Encounter downed = encounter(participant(1, "Aria", 18).withHitPoints(-999, 0));
        assertEquals(20, machine.applyHealing(downed, A, Integer.MAX_VALUE).orElseThrow()
            .findParticipant(A).currentHitPoints());
    }

    @Test
    @DisplayName("Conditions are trimmed, deduplicated and bounded")
    void testConditions() {
        Encounter e = machine.addCondition(fresh, A, " poisoned ").orElseThrow();
        e = machine.addCondition(e, A, "poisoned").orElseThrow();
        assertEquals(List.of("poisoned"), e.findParticipant(A).conditions());

        assertTrue(machine.addCondition(e, A, "  ").failed());
        assertTrue(machine.addCondition(e, A, "x".repeat(51)).failed());

        e = machine.removeCondition(e, A, "poisoned").orElseThrow();
        assertTrue(e.findParticipant(A).conditions().isEmpty());
    }
}
