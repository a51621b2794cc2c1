package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Combat progress of an encounter.
 *
 * While ACTIVE, currentTurn indexes initiativeOrder. totalDurationMs counts
 * active time only; lastResumedAt marks the start of the running stretch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CombatState(
    CombatPhase phase,
    int currentRound,
    int currentTurn,
    List<InitiativeEntry> initiativeOrder,
    Instant startedAt,
    Instant pausedAt,
    Instant endedAt,
    Instant lastResumedAt,
    long totalDurationMs
) {
    public CombatState {
        phase = phase == null ? CombatPhase.NOT_STARTED : phase;
        initiativeOrder = initiativeOrder == null ? List.of() : List.copyOf(initiativeOrder);
    }

    public static CombatState notStarted() {
        return new CombatState(CombatPhase.NOT_STARTED, 0, 0, List.of(), null, null, null, null, 0L);
    }

    @JsonIgnore
    public boolean isActive() {
        return phase == CombatPhase.ACTIVE;
    }

    @JsonIgnore
    public boolean hasStarted() {
        return phase != CombatPhase.NOT_STARTED;
    }

    @JsonIgnore
    public InitiativeEntry currentEntry() {
        if (initiativeOrder.isEmpty() || currentTurn < 0 || currentTurn >= initiativeOrder.size()) {
            return null;
        }
        return initiativeOrder.get(currentTurn);
    }

    public int indexOf(String participantId) {
        for (int i = 0; i < initiativeOrder.size(); i++) {
            if (initiativeOrder.get(i).participantId().equals(participantId)) {
                return i;
            }
        }
        return -1;
    }

    public CombatState withOrder(List<InitiativeEntry> order, int turn) {
        return new CombatState(phase, currentRound, turn, order, startedAt, pausedAt, endedAt,
            lastResumedAt, totalDurationMs);
    }

    public CombatState withTurn(int round, int turn, List<InitiativeEntry> order) {
        return new CombatState(phase, round, turn, order, startedAt, pausedAt, endedAt,
            lastResumedAt, totalDurationMs);
    }
}
