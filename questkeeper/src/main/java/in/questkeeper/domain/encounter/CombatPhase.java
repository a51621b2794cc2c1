package in.questkeeper.domain.encounter;

/**
 * Combat lifecycle.
 *
 * NOT_STARTED -> ACTIVE (start), ACTIVE <-> PAUSED (pause/resume),
 * ACTIVE | PAUSED -> ENDED (end). ENDED is terminal.
 */
public enum CombatPhase {
    NOT_STARTED,
    ACTIVE,
    PAUSED,
    ENDED;

    public boolean isRunning() {
        return this == ACTIVE || this == PAUSED;
    }
}
