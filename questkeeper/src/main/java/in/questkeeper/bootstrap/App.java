package in.questkeeper.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.questkeeper.application.port.output.CharacterRepository;
import in.questkeeper.application.port.output.EncounterRepository;
import in.questkeeper.application.port.output.IdGenerator;
import in.questkeeper.application.port.output.TemplateRepository;
import in.questkeeper.auth.JwtService;
import in.questkeeper.config.TrackerConfig;
import in.questkeeper.infrastructure.id.ObjectIdGenerator;
import in.questkeeper.infrastructure.id.TempIdGenerator;
import in.questkeeper.infrastructure.metrics.PrometheusEncounterMetrics;
import in.questkeeper.infrastructure.metrics.PrometheusMetricsHandler;
import in.questkeeper.infrastructure.persistence.InMemoryCharacterRepository;
import in.questkeeper.infrastructure.persistence.InMemoryEncounterRepository;
import in.questkeeper.infrastructure.persistence.InMemoryTemplateRepository;
import in.questkeeper.infrastructure.persistence.PostgresCharacterRepository;
import in.questkeeper.infrastructure.persistence.PostgresEncounterRepository;
import in.questkeeper.infrastructure.persistence.PostgresTemplateRepository;
import in.questkeeper.infrastructure.persistence.SchemaMigration;
import in.questkeeper.service.access.EncounterLoader;
import in.questkeeper.service.access.PermissionGuard;
import in.questkeeper.service.codec.EnvelopeCodecs;
import in.questkeeper.service.combat.CombatService;
import in.questkeeper.service.combat.CombatStateMachine;
import in.questkeeper.service.combat.InitiativeRoller;
import in.questkeeper.service.encounter.EncounterService;
import in.questkeeper.service.export.ExportBuilder;
import in.questkeeper.service.export.ShareLinkService;
import in.questkeeper.service.participant.ParticipantRegistry;
import in.questkeeper.service.participant.ParticipantValidator;
import in.questkeeper.service.schema.EnvelopeSchema;
import in.questkeeper.service.template.TemplateLibrary;
import in.questkeeper.service.template.TemplateSanitizer;
import in.questkeeper.service.transfer.EncounterTransferService;
import in.questkeeper.service.transfer.ImportProcessor;
import in.questkeeper.transport.http.CombatHandlers;
import in.questkeeper.transport.http.EncounterHandlers;
import in.questkeeper.transport.http.HttpSupport;
import in.questkeeper.util.Json;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import io.undertow.util.Methods;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.security.SecureRandom;
import java.time.Clock;

/**
 * Process entry point: plain wiring, no container.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== QuestKeeper encounter service starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        TrackerConfig config = TrackerConfig.fromEnv();
        StartupConfigValidator.validate(config);

        Clock clock = Clock.systemUTC();
        SecureRandom random = new SecureRandom();
        ObjectMapper mapper = Json.newMapper();
        IdGenerator ids = new ObjectIdGenerator(clock, random);

        // ═══════════════════════════════════════════════════════════════
        // Storage
        // ═══════════════════════════════════════════════════════════════
        EncounterRepository encounterRepo;
        CharacterRepository characterRepo;
        TemplateRepository templateRepo;
        if (config.storageMode() == TrackerConfig.StorageMode.POSTGRES) {
            DataSource dataSource = createDataSource(config);
            new SchemaMigration(dataSource).migrate();
            encounterRepo = new PostgresEncounterRepository(dataSource, clock);
            characterRepo = new PostgresCharacterRepository(dataSource);
            templateRepo = new PostgresTemplateRepository(dataSource, ids, clock);
        } else {
            encounterRepo = new InMemoryEncounterRepository(clock);
            characterRepo = new InMemoryCharacterRepository();
            templateRepo = new InMemoryTemplateRepository(ids, clock);
        }
        log.info("✓ Storage ready ({})", config.storageMode());

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusEncounterMetrics metrics = new PrometheusEncounterMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        EncounterLoader loader = new EncounterLoader(encounterRepo, new PermissionGuard());
        EnvelopeSchema schema = new EnvelopeSchema();

        ParticipantRegistry participants = new ParticipantRegistry(loader, new ParticipantValidator());
        CombatService combat = new CombatService(loader,
            new CombatStateMachine(clock, new InitiativeRoller(random)), characterRepo, metrics);

        ExportBuilder exportBuilder = new ExportBuilder(loader, characterRepo, new TempIdGenerator(clock, random),
            clock, config.appVersion());
        ImportProcessor importProcessor = new ImportProcessor(schema, mapper, loader, characterRepo, ids, clock);
        EncounterTransferService transfer = new EncounterTransferService(exportBuilder, importProcessor,
            new EnvelopeCodecs(mapper, schema), metrics);

        TemplateLibrary templates = new TemplateLibrary(templateRepo, new TemplateSanitizer(exportBuilder),
            importProcessor, mapper);
        ShareLinkService shareLinks = new ShareLinkService(loader, mapper, random, clock, config.publicBaseUrl());
        EncounterService encounters = new EncounterService(encounterRepo, loader, ids, clock);
        log.info("✓ Encounter services initialized");

        // ═══════════════════════════════════════════════════════════════
        // JWT Service
        // ═══════════════════════════════════════════════════════════════
        JwtService jwtService = new JwtService(config.jwtSecret(), mapper, clock);

        // ═══════════════════════════════════════════════════════════════
        // HTTP handlers
        // ═══════════════════════════════════════════════════════════════
        HttpSupport http = new HttpSupport(mapper, jwtService::validateAndGetUserId);
        EncounterHandlers api = new EncounterHandlers(http, encounters, transfer, templates, shareLinks,
            config.shareLinkTtl(), clock);
        CombatHandlers fight = new CombatHandlers(http, participants, combat);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/health", api::health)
            // Encounters
            .get("/api/encounters", api::list)
            .post("/api/encounters", api::create)
            .post("/api/encounters/import", api::importEncounter)
            .get("/api/encounters/{id}", api::get)
            .add(Methods.PATCH, "/api/encounters/{id}", api::update)
            .delete("/api/encounters/{id}", api::delete)
            .post("/api/encounters/{id}/duplicate", api::duplicate)
            .get("/api/encounters/{id}/export", api::export)
            .post("/api/encounters/{id}/template", api::createTemplate)
            .post("/api/encounters/{id}/share-link", api::shareLink)
            .post("/api/encounters/{id}/share", api::share)
            .delete("/api/encounters/{id}/share/{userId}", api::unshare)
            // Templates
            .get("/api/templates", api::listTemplates)
            .delete("/api/templates/{templateId}", api::deleteTemplate)
            .post("/api/templates/{templateId}/instantiate", api::instantiateTemplate)
            // Participants
            .post("/api/encounters/{id}/participants", fight::addParticipant)
            .post("/api/encounters/{id}/participants/bulk", fight::addParticipants)
            .put("/api/encounters/{id}/participants/order", fight::reorderParticipants)
            .add(Methods.PATCH, "/api/encounters/{id}/participants/{participantId}", fight::updateParticipant)
            .delete("/api/encounters/{id}/participants/{participantId}", fight::removeParticipant)
            // Combat
            .get("/api/encounters/{id}/combat/current", fight::currentParticipant)
            .post("/api/encounters/{id}/combat/initiative", fight::setInitiative)
            .post("/api/encounters/{id}/combat/damage", fight::applyDamage)
            .post("/api/encounters/{id}/combat/healing", fight::applyHealing)
            .post("/api/encounters/{id}/combat/conditions", fight::condition)
            .post("/api/encounters/{id}/combat/{action}", fight::combatAction)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "QuestKeeper encounter service\n\n" +
                    "API:     /api/encounters, /api/templates\n" +
                    "Health:  GET /health\n" +
                    "Metrics: GET /metrics\n");
            });

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, PUT, PATCH, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type, Authorization")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                routes.handleRequest(exchange);
            }
        };

        // Services block on storage; keep them off the IO threads.
        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setHandler(new BlockingHandler(corsHandler))
            .build();
        server.start();

        log.info("✓ HTTP API server started on http://localhost:{}/", config.port());
    }

    private static DataSource createDataSource(TrackerConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPassword());
        hikari.setMaximumPoolSize(config.dbPoolSize());
        hikari.setMinimumIdle(2);
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("questkeeper-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hikari);
    }

    private App() {
    }
}
