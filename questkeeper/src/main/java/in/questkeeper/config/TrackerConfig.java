package in.questkeeper.config;

import in.questkeeper.util.Env;

import java.time.Duration;

/**
 * Process configuration, read once at startup.
 */
public record TrackerConfig(
    int port,
    StorageMode storageMode,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int dbPoolSize,
    String jwtSecret,
    String publicBaseUrl,
    Duration shareLinkTtl,
    String appVersion,
    boolean productionMode
) {
    public static final String DEFAULT_JWT_SECRET = "questkeeper-dev-secret-change-me";

    public enum StorageMode { MEMORY, POSTGRES }

    public static TrackerConfig fromEnv() {
        return new TrackerConfig(
            Env.getInt("PORT", 9090),
            StorageMode.valueOf(Env.get("STORAGE_MODE", "MEMORY").trim().toUpperCase()),
            Env.get("DB_URL", "jdbc:postgresql://localhost:5432/questkeeper"),
            Env.get("DB_USER", "postgres"),
            Env.get("DB_PASSWORD", "postgres"),
            Env.getInt("DB_POOL_SIZE", 10),
            Env.get("JWT_SECRET", DEFAULT_JWT_SECRET),
            Env.get("PUBLIC_BASE_URL", "http://localhost:9090"),
            Env.getHours("SHARE_LINK_TTL_HOURS", 24),
            Env.get("APP_VERSION", "1.0.0"),
            Env.getBool("PRODUCTION_MODE", false)
        );
    }
}
