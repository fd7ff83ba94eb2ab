package com.example.crond.daemon;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Environment-variable fallbacks for settings not given on the command line.
 */
public final class Env {
    public static final String CONFIG = "CROND_CONFIG";
    public static final String METRICS_PORT = "CROND_METRICS_PORT";
    public static final String WEBHOOK_TIMEOUT_SECONDS = "CROND_WEBHOOK_TIMEOUT_SECONDS";

    private Env() {
    }

    public static String get(String k, String d) {
        String v = System.getenv(k);
        return v == null || v.isBlank() ? d : v;
    }

    /**
     * Reads a whole number from the environment.
     *
     * @throws IllegalArgumentException when the variable is set but is not a number within [min, max]
     */
    public static long getLong(String k, long d, long min, long max) {
        return parseLong(k, get(k, null), d, min, max);
    }

    static long parseLong(String k, String raw, long d, long min, long max) {
        if (raw == null) {
            return d;
        }
        long v;
        try {
            v = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + k + ": '" + raw + "' is not a number", e);
        }
        if (v < min || v > max) {
            throw new IllegalArgumentException("invalid " + k + ": " + v + " is outside " + min + ".." + max);
        }
        return v;
    }

    /**
     * {@code $CROND_CONFIG}, else {@code ~/.config/crond/config.json}.
     */
    public static Path defaultConfigPath() {
        String fromEnv = get(CONFIG, null);
        if (fromEnv != null) {
            return Paths.get(fromEnv);
        }
        return Paths.get(System.getProperty("user.home"), ".config", "crond", "config.json");
    }
}
