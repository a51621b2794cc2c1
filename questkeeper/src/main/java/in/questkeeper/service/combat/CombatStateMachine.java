package in.questkeeper.service.combat;

import in.questkeeper.domain.common.ServiceError;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.CombatPhase;
import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.EncounterStatus;
import in.questkeeper.domain.encounter.InitiativeEntry;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.service.participant.ParticipantValidator;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Combat transitions as pure functions from one encounter value to the next.
 *
 * <pre>
 * NOT_STARTED --start--> ACTIVE --pause--> PAUSED --resume--> ACTIVE
 * ACTIVE | PAUSED --end--> ENDED
 * </pre>
 *
 * Nothing here touches storage; {@link CombatService} persists the results.
 */
public final class CombatStateMachine {

    public static final int DEFAULT_DEXTERITY = 10;

    private final Clock clock;
    private final InitiativeRoller roller;

    public CombatStateMachine(Clock clock, InitiativeRoller roller) {
        this.clock = clock;
        this.roller = roller;
    }

    /**
     * Build the turn order and begin round 1.
     *
     * @param dexterityById tie-break scores keyed by participant id; missing ids use 10
     */
    public ServiceResult<Encounter> start(Encounter encounter, Map<String, Integer> dexterityById) {
        CombatState state = encounter.combatState();
        if (state.phase() != CombatPhase.NOT_STARTED) {
            return reject("startCombat", state.phase());
        }
        if (encounter.participants().isEmpty()) {
            return ServiceResult.fail(ServiceError.combatState("startCombat", "encounter has no participants"));
        }

        boolean autoRoll = encounter.settings().autoRollInitiative();
        List<Participant> participants = new ArrayList<>(encounter.participants().size());
        List<InitiativeEntry> entries = new ArrayList<>();
        for (Participant p : encounter.participants()) {
            int dex = dexterityById.getOrDefault(p.characterId(), DEFAULT_DEXTERITY);
            if (p.initiative() == null && autoRoll) {
                p = p.withInitiative(roller.roll(dex));
            }
            participants.add(p);
            if (p.initiative() != null) {
                entries.add(InitiativeEntry.of(p.characterId(), p.initiative(), dex).withActive(!p.isDown()));
            }
        }
        if (entries.isEmpty()) {
            return ServiceResult.fail(ServiceError.combatState("startCombat", "no participant has an initiative value"));
        }

        List<InitiativeEntry> order = InitiativeOrder.sorted(entries);
        int first = firstActive(order);
        if (first < 0) {
            return ServiceResult.fail(ServiceError.combatState("startCombat", "no participant is able to act"));
        }

        Instant now = clock.instant();
        CombatState started = new CombatState(CombatPhase.ACTIVE, 1, first, order, now, null, null, now, 0L);
        return ServiceResult.ok(encounter.withParticipants(participants).withCombat(started, EncounterStatus.ACTIVE));
    }

    public ServiceResult<Encounter> pause(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (s.phase() != CombatPhase.ACTIVE) {
            return reject("pauseCombat", s.phase());
        }
        Instant now = clock.instant();
        CombatState paused = new CombatState(CombatPhase.PAUSED, s.currentRound(), s.currentTurn(),
            s.initiativeOrder(), s.startedAt(), now, null, null, s.totalDurationMs() + activeMillis(s, now));
        return ServiceResult.ok(encounter.withCombat(paused, encounter.status()));
    }

    public ServiceResult<Encounter> resume(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (s.phase() != CombatPhase.PAUSED) {
            return reject("resumeCombat", s.phase());
        }
        CombatState resumed = new CombatState(CombatPhase.ACTIVE, s.currentRound(), s.currentTurn(),
            s.initiativeOrder(), s.startedAt(), null, null, clock.instant(), s.totalDurationMs());
        return ServiceResult.ok(encounter.withCombat(resumed, encounter.status()));
    }

    /**
     * Advance to the next entry able to act. Passing the end starts a new round.
     */
    public ServiceResult<Encounter> nextTurn(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (s.phase() != CombatPhase.ACTIVE) {
            return reject("nextTurn", s.phase());
        }
        List<InitiativeEntry> order = new ArrayList<>(s.initiativeOrder());
        if (firstActive(order) < 0) {
            return ServiceResult.fail(ServiceError.combatState("nextTurn", "no participant is able to act"));
        }

        int turn = s.currentTurn();
        int round = s.currentRound();
        order.set(turn, order.get(turn).withActed(true));

        boolean wrapped = false;
        do {
            turn++;
            if (turn >= order.size()) {
                turn = 0;
                if (!wrapped) {
                    wrapped = true;
                    round++;
                    order.replaceAll(e -> e.withActed(false));
                }
            }
        } while (!order.get(turn).isActive());

        return ServiceResult.ok(encounter.withCombat(s.withTurn(round, turn, order), encounter.status()));
    }

    /**
     * Step back to the previous entry able to act. Wrapping under lowers the round, never below 1.
     */
    public ServiceResult<Encounter> previousTurn(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (s.phase() != CombatPhase.ACTIVE) {
            return reject("previousTurn", s.phase());
        }
        List<InitiativeEntry> order = new ArrayList<>(s.initiativeOrder());
        if (firstActive(order) < 0) {
            return ServiceResult.fail(ServiceError.combatState("previousTurn", "no participant is able to act"));
        }

        int turn = s.currentTurn();
        int round = s.currentRound();
        boolean wrapped = false;
        do {
            turn--;
            if (turn < 0) {
                turn = order.size() - 1;
                if (!wrapped) {
                    wrapped = true;
                    round = Math.max(1, round - 1);
                }
            }
        } while (!order.get(turn).isActive());
        order.set(turn, order.get(turn).withActed(false));

        return ServiceResult.ok(encounter.withCombat(s.withTurn(round, turn, order), encounter.status()));
    }

    /**
     * Set a participant's initiative. Mid-combat the order is re-sorted and the
     * current turn follows the participant who held it.
     *
     * @param dexterity tie-break score, or null to keep the existing one
     */
    public ServiceResult<Encounter> setInitiative(Encounter encounter, String participantId, int value,
                                                  Integer dexterity) {
        Participant p = encounter.findParticipant(participantId);
        if (p == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }
        if (value < ParticipantValidator.MIN_INITIATIVE || value > ParticipantValidator.MAX_INITIATIVE) {
            return ServiceResult.fail(ServiceError.validation("initiative",
                "Must be between " + ParticipantValidator.MIN_INITIATIVE + " and "
                    + ParticipantValidator.MAX_INITIATIVE + ", got " + value));
        }
        CombatState s = encounter.combatState();
        if (s.phase() == CombatPhase.ENDED) {
            return reject("setInitiative", s.phase());
        }

        Encounter updated = encounter.withParticipant(p.withInitiative(value));
        if (!s.phase().isRunning()) {
            return ServiceResult.ok(updated);
        }

        int idx = s.indexOf(participantId);
        int dex = dexterity != null ? dexterity
            : idx >= 0 ? s.initiativeOrder().get(idx).dexterity() : DEFAULT_DEXTERITY;
        CombatState resorted = InitiativeOrder.upsert(s, participantId, value, dex);
        resorted = InitiativeOrder.withActive(resorted, participantId, !p.isDown());
        return ServiceResult.ok(updated.withCombat(resorted, updated.status()));
    }

    /**
     * Temporary hit points absorb damage first; current hit points may go negative,
     * down to -{@value ParticipantValidator#MAX_HIT_POINTS}.
     */
    public ServiceResult<Encounter> applyDamage(Encounter encounter, String participantId, int amount) {
        if (amount < 0) {
            return ServiceResult.fail(ServiceError.validation("amount", "Damage must not be negative"));
        }
        Participant p = encounter.findParticipant(participantId);
        if (p == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }

        int absorbed = Math.min(p.temporaryHitPoints(), amount);
        int current = (int) Math.max(-ParticipantValidator.MAX_HIT_POINTS,
            (long) p.currentHitPoints() - (amount - absorbed));
        Participant damaged = p.withHitPoints(current, p.temporaryHitPoints() - absorbed);
        return ServiceResult.ok(withHealthChange(encounter, damaged));
    }

    /**
     * Healing raises current hit points up to the maximum.
     */
    public ServiceResult<Encounter> applyHealing(Encounter encounter, String participantId, int amount) {
        if (amount < 0) {
            return ServiceResult.fail(ServiceError.validation("amount", "Healing must not be negative"));
        }
        Participant p = encounter.findParticipant(participantId);
        if (p == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }

        int current = (int) Math.min(p.maxHitPoints(), (long) p.currentHitPoints() + amount);
        return ServiceResult.ok(withHealthChange(encounter, p.withHitPoints(current, p.temporaryHitPoints())));
    }

    public ServiceResult<Encounter> addCondition(Encounter encounter, String participantId, String condition) {
        Participant p = encounter.findParticipant(participantId);
        if (p == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }
        String c = condition == null ? "" : condition.trim();
        if (c.isEmpty() || c.length() > ParticipantValidator.MAX_CONDITION_LENGTH) {
            return ServiceResult.fail(ServiceError.validation("condition",
                "Condition must be 1 to " + ParticipantValidator.MAX_CONDITION_LENGTH + " characters"));
        }
        if (p.conditions().contains(c)) {
            return ServiceResult.ok(encounter);
        }
        if (p.conditions().size() >= ParticipantValidator.MAX_CONDITIONS) {
            return ServiceResult.fail(ServiceError.validation("conditions",
                "At most " + ParticipantValidator.MAX_CONDITIONS + " conditions allowed"));
        }
        return ServiceResult.ok(encounter.withParticipant(p.withCondition(c)));
    }

    public ServiceResult<Encounter> removeCondition(Encounter encounter, String participantId, String condition) {
        Participant p = encounter.findParticipant(participantId);
        if (p == null) {
            return ServiceResult.fail(ServiceError.participantNotFound(participantId));
        }
        String c = condition == null ? "" : condition.trim();
        return ServiceResult.ok(encounter.withParticipant(p.withoutCondition(c)));
    }

    /**
     * Finish combat. Order and counters are kept for the record.
     */
    public ServiceResult<Encounter> end(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (!s.phase().isRunning()) {
            return reject("endCombat", s.phase());
        }
        Instant now = clock.instant();
        long total = s.totalDurationMs() + (s.phase() == CombatPhase.ACTIVE ? activeMillis(s, now) : 0L);
        CombatState ended = new CombatState(CombatPhase.ENDED, s.currentRound(), s.currentTurn(),
            s.initiativeOrder(), s.startedAt(), s.pausedAt(), now, null, total);
        return ServiceResult.ok(encounter.withCombat(ended, EncounterStatus.COMPLETED));
    }

    /**
     * Participant holding the current turn, or null outside active combat.
     */
    public Participant currentParticipant(Encounter encounter) {
        CombatState s = encounter.combatState();
        if (!s.phase().isRunning()) {
            return null;
        }
        InitiativeEntry entry = s.currentEntry();
        return entry == null ? null : encounter.findParticipant(entry.participantId());
    }

    private Encounter withHealthChange(Encounter encounter, Participant changed) {
        Encounter updated = encounter.withParticipant(changed);
        CombatState s = updated.combatState();
        if (s.phase().isRunning()) {
            return updated.withCombat(InitiativeOrder.withActive(s, changed.characterId(), !changed.isDown()),
                updated.status());
        }
        return updated;
    }

    private static long activeMillis(CombatState s, Instant now) {
        return s.lastResumedAt() == null ? 0L : Math.max(0L, Duration.between(s.lastResumedAt(), now).toMillis());
    }

    private static int firstActive(List<InitiativeEntry> order) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).isActive()) {
                return i;
            }
        }
        return -1;
    }

    private static ServiceResult<Encounter> reject(String action, CombatPhase phase) {
        String reason = switch (phase) {
            case NOT_STARTED -> "combat has not started";
            case ACTIVE -> "combat is already active";
            case PAUSED -> "combat is paused";
            case ENDED -> "combat has ended";
        };
        return ServiceResult.fail(ServiceError.combatState(action, reason));
    }
}
