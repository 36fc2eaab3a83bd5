package org.bloodmatch.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.bloodmatch.engine.domain.service.EligibilityRule;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the matching engine.
 * Values come from environment variables, then a {@code .env} file in the
 * working directory or its parent, then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final int DEFAULT_PORT = 5000;
    public static final String DEFAULT_LOG_FILE = "logs/engine/engine.log";

    static final String PORT_KEY = "BLOODMATCH_PORT";
    static final String SITES_FILE_KEY = "BLOODMATCH_SITES_FILE";
    static final String SEED_SAMPLE_DONORS_KEY = "BLOODMATCH_SEED_SAMPLE_DONORS";
    static final String COOLDOWN_DAYS_KEY = "BLOODMATCH_COOLDOWN_DAYS";
    static final String LOG_FILE_KEY = "BLOODMATCH_LOG_FILE";
    static final String FILE_LOGGING_ENABLED_KEY = "BLOODMATCH_FILE_LOGGING_ENABLED";

    // HTTP
    private final int port;

    // Domain
    private final String sitesFile;
    private final boolean seedSampleDonors;
    private final int cooldownDays;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private EngineConfig(Builder builder) {
        this.port = builder.port;
        this.sitesFile = builder.sitesFile;
        this.seedSampleDonors = builder.seedSampleDonors;
        this.cooldownDays = builder.cooldownDays;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
    }

    /**
     * Creates configuration from the process environment and any {@code .env} file.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromLookup(key -> {
            String value = System.getenv(key);
            if (isBlank(value)) {
                value = local.get(key);
            }
            if (isBlank(value)) {
                value = parent.get(key);
            }
            return value;
        });
    }

    /**
     * Creates configuration from an arbitrary key lookup; missing keys take defaults.
     */
    static EngineConfig fromLookup(Function<String, String> lookup) {
        return new Builder()
                .port(getInt(lookup, PORT_KEY, DEFAULT_PORT))
                .sitesFile(getString(lookup, SITES_FILE_KEY, ""))
                .seedSampleDonors(getBoolean(lookup, SEED_SAMPLE_DONORS_KEY, true))
                .cooldownDays(getInt(lookup, COOLDOWN_DAYS_KEY, EligibilityRule.DEFAULT_COOLDOWN_DAYS))
                .logFilePath(getString(lookup, LOG_FILE_KEY, DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(lookup, FILE_LOGGING_ENABLED_KEY, false))
                .build();
    }

    // Getters
    public int getPort() {
        return port;
    }

    /**
     * Path to a site graph JSON file, or empty to use the bundled default graph.
     */
    public String getSitesFile() {
        return sitesFile;
    }

    public boolean isSeedSampleDonors() {
        return seedSampleDonors;
    }

    public int getCooldownDays() {
        return cooldownDays;
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    // Lookup helpers
    private static String getString(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> lookup, String key, int defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid integer for %s: %s, using default: %d", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(Function<String, String> lookup, String key, boolean defaultValue) {
        String value = lookup.apply(key);
        if (isBlank(value)) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "port=" + port +
                ", sitesFile='" + sitesFile + '\'' +
                ", seedSampleDonors=" + seedSampleDonors +
                ", cooldownDays=" + cooldownDays +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private int port = DEFAULT_PORT;
        private String sitesFile = "";
        private boolean seedSampleDonors = true;
        private int cooldownDays = EligibilityRule.DEFAULT_COOLDOWN_DAYS;
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535");
            }
            this.port = port;
            return this;
        }

        public Builder sitesFile(String sitesFile) {
            this.sitesFile = Objects.requireNonNull(sitesFile, "sitesFile must not be null");
            return this;
        }

        public Builder seedSampleDonors(boolean seedSampleDonors) {
            this.seedSampleDonors = seedSampleDonors;
            return this;
        }

        public Builder cooldownDays(int cooldownDays) {
            if (cooldownDays < 1) {
                throw new IllegalArgumentException("cooldownDays must be at least 1");
            }
            this.cooldownDays = cooldownDays;
            return this;
        }

        public Builder logFilePath(String logFilePath) {
            this.logFilePath = Objects.requireNonNull(logFilePath, "logFilePath must not be null");
            return this;
        }

        public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
            this.fileLoggingEnabled = fileLoggingEnabled;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
