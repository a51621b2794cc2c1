package in.questkeeper.transport.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.encounter.Participant;
import in.questkeeper.domain.encounter.ParticipantUpdate;
import in.questkeeper.service.combat.CombatService;
import in.questkeeper.service.participant.ParticipantRegistry;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.StatusCodes;

import java.util.List;

/**
 * Participant list and combat endpoints. All mutations are owner-only in the services.
 */
public final class CombatHandlers {

    private static final TypeReference<List<Participant>> PARTICIPANT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

    private final HttpSupport http;
    private final ParticipantRegistry participants;
    private final CombatService combat;

    public CombatHandlers(HttpSupport http, ParticipantRegistry participants, CombatService combat) {
        this.http = http;
        this.participants = participants;
        this.combat = combat;
    }

    /**
     * POST /api/encounters/{id}/participants
     */
    public void addParticipant(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            Participant participant = http.mapper().readValue(body, Participant.class);
            http.sendResult(ex, participants.add(encounterId, userId, participant), StatusCodes.CREATED);
        });
    }

    /**
     * POST /api/encounters/{id}/participants/bulk - body {participants:[...]}
     */
    public void addParticipants(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            JsonNode list = http.mapper().readTree(body).path("participants");
            if (!list.isArray()) {
                http.badRequest(ex, "participants must be an array");
                return;
            }
            List<Participant> batch = http.mapper().convertValue(list, PARTICIPANT_LIST);
            http.sendResult(ex, participants.addBulk(encounterId, userId, batch), StatusCodes.CREATED);
        });
    }

    /**
     * PATCH /api/encounters/{id}/participants/{participantId}
     */
    public void updateParticipant(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        String participantId = HttpSupport.pathParam(exchange, "participantId");
        http.withBody(exchange, (ex, body) -> {
            ParticipantUpdate update = http.mapper().readValue(body, ParticipantUpdate.class);
            http.sendResult(ex, participants.update(encounterId, userId, participantId, update));
        });
    }

    /**
     * DELETE /api/encounters/{id}/participants/{participantId}
     */
    public void removeParticipant(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, participants.remove(HttpSupport.pathParam(exchange, "id"), userId,
            HttpSupport.pathParam(exchange, "participantId")));
    }

    /**
     * PUT /api/encounters/{id}/participants/order - body {participantIds:[...]}
     */
    public void reorderParticipants(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            JsonNode ids = http.mapper().readTree(body).path("participantIds");
            if (!ids.isArray()) {
                http.badRequest(ex, "participantIds must be an array");
                return;
            }
            List<String> order = http.mapper().convertValue(ids, ID_LIST);
            http.sendResult(ex, participants.reorder(encounterId, userId, order));
        });
    }

    /**
     * POST /api/encounters/{id}/combat/{action}
     */
    public void combatAction(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        String action = HttpSupport.pathParam(exchange, "action");

        ServiceResult<Encounter> result;
        switch (action) {
            case "start":
                result = combat.startCombat(encounterId, userId);
                break;
            case "pause":
                result = combat.pauseCombat(encounterId, userId);
                break;
            case "resume":
                result = combat.resumeCombat(encounterId, userId);
                break;
            case "next-turn":
                result = combat.nextTurn(encounterId, userId);
                break;
            case "previous-turn":
                result = combat.previousTurn(encounterId, userId);
                break;
            case "end":
                result = combat.endCombat(encounterId, userId);
                break;
            default:
                http.badRequest(exchange, "Unknown combat action: " + action);
                return;
        }
        http.sendResult(exchange, result);
    }

    /**
     * GET /api/encounters/{id}/combat/current
     */
    public void currentParticipant(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, combat.currentParticipant(HttpSupport.pathParam(exchange, "id"), userId));
    }

    /**
     * POST /api/encounters/{id}/combat/initiative - body {participantId, initiative, dexterity?}
     */
    public void setInitiative(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            JsonNode json = http.mapper().readTree(body);
            if (!json.path("participantId").isTextual() || !json.path("initiative").canConvertToInt()) {
                http.badRequest(ex, "participantId and initiative are required");
                return;
            }
            Integer dexterity = json.path("dexterity").canConvertToInt() ? json.path("dexterity").asInt() : null;
            http.sendResult(ex, combat.setInitiative(encounterId, userId, json.path("participantId").asText(),
                json.path("initiative").asInt(), dexterity));
        });
    }

    /**
     * POST /api/encounters/{id}/combat/damage - body {participantId, amount}
     */
    public void applyDamage(HttpServerExchange exchange) {
        hitPoints(exchange, true);
    }

    /**
     * POST /api/encounters/{id}/combat/healing - body {participantId, amount}
     */
    public void applyHealing(HttpServerExchange exchange) {
        hitPoints(exchange, false);
    }

    /**
     * POST /api/encounters/{id}/combat/conditions - body {participantId, condition, remove?}
     */
    public void condition(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            JsonNode json = http.mapper().readTree(body);
            if (!json.path("participantId").isTextual() || !json.path("condition").isTextual()) {
                http.badRequest(ex, "participantId and condition are required");
                return;
            }
            String participantId = json.path("participantId").asText();
            String condition = json.path("condition").asText();
            http.sendResult(ex, json.path("remove").asBoolean(false)
                ? combat.removeCondition(encounterId, userId, participantId, condition)
                : combat.addCondition(encounterId, userId, participantId, condition));
        });
    }

    private void hitPoints(HttpServerExchange exchange, boolean damage) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            JsonNode json = http.mapper().readTree(body);
            if (!json.path("participantId").isTextual() || !json.path("amount").canConvertToInt()) {
                http.badRequest(ex, "participantId and amount are required");
                return;
            }
            String participantId = json.path("participantId").asText();
            int amount = json.path("amount").asInt();
            http.sendResult(ex, damage
                ? combat.applyDamage(encounterId, userId, participantId, amount)
                : combat.applyHealing(encounterId, userId, participantId, amount));
        });
    }
}
