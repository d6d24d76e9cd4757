package com.goodnews.logging;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * JDBC settings for central logging, resolved from system properties, environment and
 * the optional {@code logging-db.properties} classpath file, in that order.
 */
record LogDatabaseSettings(String url, String username, String password, int poolSize) {

    static final String RESOURCE_NAME = "logging-db.properties";
    private static final int DEFAULT_POOL_SIZE = 2;

    boolean enabled() {
        return url != null && !url.isBlank();
    }

    static LogDatabaseSettings resolve() {
        Properties file = readResource();
        return new LogDatabaseSettings(
            lookup("goodnews.logging.jdbc.url", "GOODNEWS_LOGGING_JDBC_URL", file, "jdbc.url"),
            lookup("goodnews.logging.jdbc.user", "GOODNEWS_LOGGING_JDBC_USER", file, "jdbc.username"),
            lookup("goodnews.logging.jdbc.pass", "GOODNEWS_LOGGING_JDBC_PASS", file, "jdbc.password"),
            parsePoolSize(lookup("goodnews.logging.jdbc.poolSize", "GOODNEWS_LOGGING_JDBC_POOL", file, "jdbc.poolSize"))
        );
    }

    private static String lookup(String property, String env, Properties file, String fileKey) {
        String[] candidates = {System.getProperty(property), System.getenv(env), file.getProperty(fileKey)};
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.trim();
            }
        }
        return null;
    }

    private static Properties readResource() {
        Properties props = new Properties();
        try (InputStream stream = LogDatabaseSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (stream != null) {
                props.load(stream);
            }
        } catch (IOException ignored) {
            // a malformed file leaves system properties and environment in charge
        }
        return props;
    }

    private static int parsePoolSize(String raw) {
        if (raw == null) {
            return DEFAULT_POOL_SIZE;
        }
        try {
            return Math.max(1, Integer.parseInt(raw));
        } catch (NumberFormatException ex) {
            return DEFAULT_POOL_SIZE;
        }
    }
}
