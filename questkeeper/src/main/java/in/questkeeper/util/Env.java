package in.questkeeper.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration lookup. An environment variable wins; otherwise the matching
 * system property is used, either under the same name or in dotted lower case
 * with a {@code questkeeper.} prefix ({@code DB_POOL_SIZE} becomes
 * {@code questkeeper.db.pool.size}). Unparseable values fall back to the default.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = nonBlank(System.getenv(key));
        if (value == null) {
            value = nonBlank(System.getProperty(key));
        }
        if (value == null) {
            value = nonBlank(System.getProperty(propertyName(key)));
        }
        return value == null ? defaultValue : value;
    }

    public static int getInt(String key, int defaultValue) {
        return parsed(key, defaultValue, Integer::parseInt);
    }

    public static long getLong(String key, long defaultValue) {
        return parsed(key, defaultValue, Long::parseLong);
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    /**
     * Whole hours, e.g. {@code SHARE_LINK_TTL_HOURS=48}.
     */
    public static Duration getHours(String key, long defaultHours) {
        return Duration.ofHours(getLong(key, defaultHours));
    }

    static String propertyName(String key) {
        return "questkeeper." + key.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    private static <T> T parsed(String key, T defaultValue, Function<String, T> parser) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number, using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static String nonBlank(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private Env() {}
}
