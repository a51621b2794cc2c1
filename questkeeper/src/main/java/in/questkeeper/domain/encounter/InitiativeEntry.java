package in.questkeeper.domain.encounter;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One slot in the turn order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InitiativeEntry(
    String participantId,
    int initiative,
    int dexterity,                              // tie-break
    @JsonProperty("isActive") boolean isActive, // false once removed from the fight or down
    @JsonProperty("hasActed") boolean hasActed,
    @JsonProperty("isDelayed") Boolean isDelayed,
    String readyAction
) {
    public static InitiativeEntry of(String participantId, int initiative, int dexterity) {
        return new InitiativeEntry(participantId, initiative, dexterity, true, false, null, null);
    }

    public InitiativeEntry withActed(boolean acted) {
        return new InitiativeEntry(participantId, initiative, dexterity, isActive, acted, isDelayed, readyAction);
    }

    public InitiativeEntry withActive(boolean active) {
        return new InitiativeEntry(participantId, initiative, dexterity, active, hasActed, isDelayed, readyAction);
    }

    public InitiativeEntry withInitiative(int value, int dex) {
        return new InitiativeEntry(participantId, value, dex, isActive, hasActed, isDelayed, readyAction);
    }

    public InitiativeEntry withParticipantId(String id) {
        return new InitiativeEntry(id, initiative, dexterity, isActive, hasActed, isDelayed, readyAction);
    }
}
