package in.questkeeper.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus implementation of EncounterMetrics.
 *
 * Key Metrics:
 * - questkeeper_exports_total{format, outcome}
 * - questkeeper_imports_total{format, outcome}
 * - questkeeper_combat_actions_total{action, outcome}
 */
public class PrometheusEncounterMetrics implements EncounterMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEncounterMetrics.class);

    private final CollectorRegistry registry;
    private final Counter exportCounter;
    private final Counter importCounter;
    private final Counter combatActionCounter;

    public PrometheusEncounterMetrics() {
        this(new CollectorRegistry());
    }

    public PrometheusEncounterMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.exportCounter = Counter.build()
            .name("questkeeper_exports_total")
            .help("Encounter exports by format and outcome")
            .labelNames("format", "outcome")
            .register(registry);

        this.importCounter = Counter.build()
            .name("questkeeper_imports_total")
            .help("Encounter imports by format and outcome")
            .labelNames("format", "outcome")
            .register(registry);

        this.combatActionCounter = Counter.build()
            .name("questkeeper_combat_actions_total")
            .help("Combat transitions by action and outcome")
            .labelNames("action", "outcome")
            .register(registry);

        log.info("[PrometheusEncounterMetrics] Initialized encounter metrics");
    }

    @Override
    public void recordExport(String format, String outcome) {
        exportCounter.labels(format, outcome).inc();
    }

    @Override
    public void recordImport(String format, String outcome) {
        importCounter.labels(format, outcome).inc();
    }

    @Override
    public void recordCombatAction(String action, String outcome) {
        combatActionCounter.labels(action, outcome).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
