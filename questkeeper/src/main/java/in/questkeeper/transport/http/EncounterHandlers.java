package in.questkeeper.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.questkeeper.domain.common.ServiceResult;
import in.questkeeper.domain.encounter.Encounter;
import in.questkeeper.domain.export.ExportFormat;
import in.questkeeper.domain.export.ExportOptions;
import in.questkeeper.domain.export.ImportOptions;
import in.questkeeper.service.encounter.EncounterService;
import in.questkeeper.service.encounter.NewEncounter;
import in.questkeeper.service.export.ShareLinkService;
import in.questkeeper.service.template.TemplateLibrary;
import in.questkeeper.service.transfer.EncounterTransferService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Encounter CRUD, export/import, templates and sharing endpoints.
 */
public final class EncounterHandlers {
    private static final Logger log = LoggerFactory.getLogger(EncounterHandlers.class);

    private final HttpSupport http;
    private final EncounterService encounters;
    private final EncounterTransferService transfer;
    private final TemplateLibrary templates;
    private final ShareLinkService shareLinks;
    private final Duration defaultShareTtl;
    private final Clock clock;

    public EncounterHandlers(HttpSupport http, EncounterService encounters, EncounterTransferService transfer,
                             TemplateLibrary templates, ShareLinkService shareLinks, Duration defaultShareTtl,
                             Clock clock) {
        this.http = http;
        this.encounters = encounters;
        this.transfer = transfer;
        this.templates = templates;
        this.shareLinks = shareLinks;
        this.defaultShareTtl = defaultShareTtl;
        this.clock = clock;
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode body = http.mapper().createObjectNode();
        body.put("status", "ok");
        body.put("ts", Instant.now(clock).toString());
        HttpSupport.send(exchange, StatusCodes.OK, HttpSupport.JSON_TYPE, body.toString());
    }

    /**
     * GET /api/encounters
     */
    public void list(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, encounters.listForOwner(userId));
    }

    /**
     * GET /api/encounters/{id}
     */
    public void get(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, encounters.get(HttpSupport.pathParam(exchange, "id"), userId));
    }

    /**
     * POST /api/encounters
     */
    public void create(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.withBody(exchange, (ex, body) -> {
            NewEncounter request = http.mapper().readValue(body, NewEncounter.class);
            http.sendResult(ex, encounters.create(userId, request), StatusCodes.CREATED);
        });
    }

    /**
     * PATCH /api/encounters/{id}
     */
    public void update(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            NewEncounter details = http.mapper().readValue(body, NewEncounter.class);
            http.sendResult(ex, encounters.updateDetails(encounterId, userId, details));
        });
    }

    /**
     * DELETE /api/encounters/{id}
     */
    public void delete(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, encounters.delete(HttpSupport.pathParam(exchange, "id"), userId));
    }

    /**
     * POST /api/encounters/{id}/duplicate - optional body {name}
     */
    public void duplicate(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            String name = body == null || body.isBlank() ? null : textField(body, "name");
            http.sendResult(ex, encounters.duplicate(encounterId, userId, name), StatusCodes.CREATED);
        });
    }

    /**
     * GET /api/encounters/{id}/export?format=json|xml&includeCharacterSheets&includePrivateNotes&includeIds
     */
    public void export(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        ExportFormat format = format(exchange);
        if (format == null) return;

        String encounterId = HttpSupport.pathParam(exchange, "id");
        ExportOptions options = new ExportOptions(
            HttpSupport.flag(exchange, "includeCharacterSheets"),
            HttpSupport.flag(exchange, "includePrivateNotes"),
            HttpSupport.flag(exchange, "includeIds"),
            false);

        ServiceResult<String> result = transfer.export(encounterId, userId, format, options);
        if (result.failed()) {
            http.sendError(exchange, result.error());
            return;
        }
        exchange.getResponseHeaders().put(Headers.CONTENT_DISPOSITION,
            "attachment; filename=\"encounter-" + encounterId + "." + format.wire() + "\"");
        HttpSupport.send(exchange, StatusCodes.OK, format.contentType() + "; charset=utf-8", result.data());
    }

    /**
     * POST /api/encounters/import?format=json|xml&createMissingCharacters - raw envelope body
     */
    public void importEncounter(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        ExportFormat format = format(exchange);
        if (format == null) return;
        ImportOptions options = new ImportOptions(userId, HttpSupport.flag(exchange, "createMissingCharacters"));

        http.withBody(exchange, (ex, body) -> {
            ServiceResult<Encounter> result = transfer.importFrom(body, format, options);
            http.sendResult(ex, result, StatusCodes.CREATED);
        });
    }

    /**
     * POST /api/encounters/{id}/template - body {name}
     */
    public void createTemplate(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) -> {
            String name = textField(body, "name");
            http.sendResult(ex, templates.createFromEncounter(encounterId, userId, name), StatusCodes.CREATED);
        });
    }

    /**
     * GET /api/templates
     */
    public void listTemplates(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, templates.findByOwner(userId));
    }

    /**
     * DELETE /api/templates/{templateId}
     */
    public void deleteTemplate(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, templates.remove(HttpSupport.pathParam(exchange, "templateId"), userId));
    }

    /**
     * POST /api/templates/{templateId}/instantiate
     */
    public void instantiateTemplate(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String templateId = HttpSupport.pathParam(exchange, "templateId");
        http.sendResult(exchange, templates.instantiate(templateId, userId), StatusCodes.CREATED);
    }

    /**
     * POST /api/encounters/{id}/share-link?expiresInHours=
     */
    public void shareLink(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;

        Duration ttl = defaultShareTtl;
        String hours = HttpSupport.queryParam(exchange, "expiresInHours");
        if (hours != null) {
            try {
                ttl = Duration.ofHours(Long.parseLong(hours));
            } catch (NumberFormatException e) {
                http.badRequest(exchange, "expiresInHours must be a whole number");
                return;
            }
        }
        http.sendResult(exchange, shareLinks.generate(HttpSupport.pathParam(exchange, "id"), userId, ttl),
            StatusCodes.CREATED);
    }

    /**
     * POST /api/encounters/{id}/share - body {userId}
     */
    public void share(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        String encounterId = HttpSupport.pathParam(exchange, "id");
        http.withBody(exchange, (ex, body) ->
            http.sendResult(ex, encounters.shareWith(encounterId, userId, textField(body, "userId"))));
    }

    /**
     * DELETE /api/encounters/{id}/share/{userId}
     */
    public void unshare(HttpServerExchange exchange) {
        String userId = http.authenticate(exchange);
        if (userId == null) return;
        http.sendResult(exchange, encounters.unshare(HttpSupport.pathParam(exchange, "id"), userId,
            HttpSupport.pathParam(exchange, "userId")));
    }

    private ExportFormat format(HttpServerExchange exchange) {
        String value = HttpSupport.queryParam(exchange, "format");
        if (value == null) {
            return ExportFormat.JSON;
        }
        try {
            return ExportFormat.fromWire(value);
        } catch (IllegalArgumentException e) {
            log.warn("Unsupported format requested: {}", value);
            http.badRequest(exchange, "format must be json or xml");
            return null;
        }
    }

    private String textField(String body, String field) throws JsonProcessingException {
        JsonNode json = http.mapper().readTree(body);
        JsonNode value = json == null ? null : json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
