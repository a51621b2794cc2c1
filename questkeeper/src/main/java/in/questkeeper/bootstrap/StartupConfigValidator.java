package in.questkeeper.bootstrap;

import in.questkeeper.config.TrackerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before anything is wired. Throws IllegalStateException if the
 * configuration is not fit for the requested mode; the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    public static void validate(TrackerConfig config) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", config.productionMode());

        if (config.port() < 1 || config.port() > 65535) {
            throw new IllegalStateException("❌ INVALID CONFIG: PORT must be 1..65535, got " + config.port());
        }
        if (config.shareLinkTtl().isNegative() || config.shareLinkTtl().isZero()) {
            throw new IllegalStateException("❌ INVALID CONFIG: SHARE_LINK_TTL_HOURS must be positive");
        }

        if (config.productionMode()) {
            validateProductionMode(config);
        } else {
            warnNonProductionMode(config);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(TrackerConfig config) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (TrackerConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret()) || config.jwtSecret().length() < 32) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires a JWT_SECRET of at least 32 characters\n" +
                "System refuses to start.\n" +
                "Either:\n" +
                "  1. Set JWT_SECRET to a strong secret\n" +
                "  2. Set PRODUCTION_MODE=false for local use"
            );
        }
        log.info("✓ JWT secret configured");

        if (config.storageMode() != TrackerConfig.StorageMode.POSTGRES) {
            throw new IllegalStateException(
                "❌ INVALID CONFIG: PRODUCTION MODE requires STORAGE_MODE=POSTGRES\n" +
                "In-memory storage loses every encounter on restart."
            );
        }
        log.info("✓ PostgreSQL storage at {}", config.dbUrl());
    }

    private static void warnNonProductionMode(TrackerConfig config) {
        log.warn("⚠️  NON-PRODUCTION MODE detected");
        if (TrackerConfig.DEFAULT_JWT_SECRET.equals(config.jwtSecret())) {
            log.warn("⚠️  Using the default JWT secret");
        }
        if (config.storageMode() == TrackerConfig.StorageMode.MEMORY) {
            log.warn("⚠️  In-memory storage: data is lost on restart");
        }
    }

    private StartupConfigValidator() {
    }
}
