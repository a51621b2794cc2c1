package in.questkeeper.infrastructure.metrics;

/**
 * Operational counters for encounter transfer and combat.
 */
public interface EncounterMetrics {

    /**
     * Record an export attempt.
     *
     * @param format  json | xml
     * @param outcome success | error code
     */
    void recordExport(String format, String outcome);

    /**
     * Record an import attempt.
     */
    void recordImport(String format, String outcome);

    /**
     * Record a combat transition (start, next_turn, damage, ...).
     */
    void recordCombatAction(String action, String outcome);

    EncounterMetrics NOOP = new EncounterMetrics() {
        @Override
        public void recordExport(String format, String outcome) {
        }

        @Override
        public void recordImport(String format, String outcome) {
        }

        @Override
        public void recordCombatAction(String action, String outcome) {
        }
    };
}
