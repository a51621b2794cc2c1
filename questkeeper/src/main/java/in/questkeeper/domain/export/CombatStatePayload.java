package in.questkeeper.domain.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.questkeeper.domain.encounter.InitiativeEntry;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CombatStatePayload(
    @JsonProperty("isActive") boolean isActive,
    int currentRound,
    int currentTurn,
    long totalDuration,     // milliseconds of active combat
    String startedAt,
    String pausedAt,
    String endedAt,
    List<InitiativeEntry> initiativeOrder
) {
    public CombatStatePayload {
        initiativeOrder = initiativeOrder == null ? List.of() : List.copyOf(initiativeOrder);
    }

    /**
     * Shape of a combat that never started.
     */
    public static CombatStatePayload empty() {
        return new CombatStatePayload(false, 0, 0, 0L, null, null, null, List.of());
    }
}
