package in.questkeeper.service.combat;

import in.questkeeper.domain.encounter.CombatState;
import in.questkeeper.domain.encounter.InitiativeEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turn-order arithmetic shared by combat transitions and participant edits.
 *
 * Order: initiative desc, dexterity desc, then existing position (List.sort is stable).
 * Any change keeps currentTurn on the same participant.
 */
public final class InitiativeOrder {

    public static final Comparator<InitiativeEntry> TURN_ORDER = (a, b) -> {
        int byInitiative = Integer.compare(b.initiative(), a.initiative());
        if (byInitiative != 0) {
            return byInitiative;
        }
        return Integer.compare(b.dexterity(), a.dexterity());
    };

    public static List<InitiativeEntry> sorted(List<InitiativeEntry> entries) {
        List<InitiativeEntry> copy = new ArrayList<>(entries);
        copy.sort(TURN_ORDER);
        return copy;
    }

    /**
     * Update or insert a participant's entry, re-sort, and follow the current participant.
     */
    public static CombatState upsert(CombatState state, String participantId, int initiative, int dexterity) {
        InitiativeEntry current = state.currentEntry();
        List<InitiativeEntry> entries = new ArrayList<>(state.initiativeOrder());

        int idx = state.indexOf(participantId);
        if (idx >= 0) {
            entries.set(idx, entries.get(idx).withInitiative(initiative, dexterity));
        } else {
            entries.add(InitiativeEntry.of(participantId, initiative, dexterity));
        }

        CombatState resorted = state.withOrder(sorted(entries), 0);
        int turn = current == null ? 0 : resorted.indexOf(current.participantId());
        return resorted.withOrder(resorted.initiativeOrder(), Math.max(turn, 0));
    }

    /**
     * Drop a participant's entry. If it held the turn, the next entry able to act
     * inherits it, wrapping to the top of the order without changing the round.
     */
    public static CombatState without(CombatState state, String participantId) {
        int removed = state.indexOf(participantId);
        if (removed < 0) {
            return state;
        }

        List<InitiativeEntry> entries = new ArrayList<>(state.initiativeOrder());
        entries.remove(removed);

        int turn = state.currentTurn();
        if (removed < turn) {
            turn--;
        } else if (removed == turn) {
            turn = nextActive(entries, turn);
        }
        if (turn >= entries.size()) {
            turn = 0;
        }
        return state.withOrder(entries, turn);
    }

    /**
     * Mark an entry in or out of the fight. No-op when the participant has no entry.
     */
    public static CombatState withActive(CombatState state, String participantId, boolean active) {
        int idx = state.indexOf(participantId);
        if (idx < 0 || state.initiativeOrder().get(idx).isActive() == active) {
            return state;
        }
        List<InitiativeEntry> entries = new ArrayList<>(state.initiativeOrder());
        entries.set(idx, entries.get(idx).withActive(active));
        return state.withOrder(entries, state.currentTurn());
    }

    // First active entry at or after from, wrapping; from itself when none is active.
    private static int nextActive(List<InitiativeEntry> entries, int from) {
        for (int step = 0; step < entries.size(); step++) {
            int i = (from + step) % entries.size();
            if (entries.get(i).isActive()) {
                return i;
            }
        }
        return from;
    }

    private InitiativeOrder() {}
}
