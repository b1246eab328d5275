package ols;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings read from system properties, then environment variables, then defaults.
 */
public final class OlsConfig {

    private static final Logger LOG = LoggerFactory.getLogger(OlsConfig.class);

    public static final int DEFAULT_PORT = 7000;

    private OlsConfig() {}

    /** HTTP port: {@code ols.port} / {@code PORT}. */
    public static int port() {
        String raw = lookup("ols.port", "PORT");
        if (raw == null) return DEFAULT_PORT;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring invalid port '{}', using {}", raw, DEFAULT_PORT);
            return DEFAULT_PORT;
        }
    }

    /** LU pivot threshold: {@code ols.singularity.threshold} / {@code OLS_SINGULARITY_THRESHOLD}. */
    public static double singularityThreshold(double def) {
        String raw = lookup("ols.singularity.threshold", "OLS_SINGULARITY_THRESHOLD");
        if (raw == null) return def;
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring invalid singularity threshold '{}', using {}", raw, def);
            return def;
        }
    }

    private static String lookup(String property, String env) {
        String v = System.getProperty(property);
        if (v == null || v.isBlank()) v = System.getenv(env);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
