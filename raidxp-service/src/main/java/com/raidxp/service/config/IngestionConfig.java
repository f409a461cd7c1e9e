package com.raidxp.service.config;

import com.raidxp.api.exceptions.ConfigurationException;
import com.raidxp.api.model.QuestAcceptance;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Process configuration for the ingestion service.
 *
 * <p>Each key is looked up in the environment, then as a JVM system property,
 * then falls back to its default:
 * <pre>
 * RAIDXP_DB_URL                 jdbc:h2:file:./raidxp;AUTO_SERVER=TRUE
 * RAIDXP_DB_USER / _PASSWORD    sa / (empty)
 * RAIDXP_LOG_FILE               ./server.log
 * RAIDXP_RULES_FILE             ./rules.yaml
 * RAIDXP_XP_FILE                (unset: XP table from the rule document)
 * RAIDXP_POLL_INTERVAL_MS       250
 * RAIDXP_QUEST_ROTATION_MINUTES 60
 * RAIDXP_QUEST_ACCEPTANCE       IMPLICIT | EXPLICIT
 * RAIDXP_MAX_APPLY_ATTEMPTS     3
 * RAIDXP_RETRY_BACKOFF_MS       500
 * </pre>
 */
public final class IngestionConfig {

    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final Path logFile;
    private final Path rulesFile;
    private final Path xpFile;
    private final Duration pollInterval;
    private final Duration questRotationInterval;
    private final QuestAcceptance questAcceptance;
    private final int maxApplyAttempts;
    private final Duration retryBackoff;

    private IngestionConfig(Lookup lookup) {
        this.dbUrl = lookup.get("RAIDXP_DB_URL", "jdbc:h2:file:./raidxp;AUTO_SERVER=TRUE");
        this.dbUser = lookup.get("RAIDXP_DB_USER", "sa");
        this.dbPassword = lookup.get("RAIDXP_DB_PASSWORD", "");
        this.logFile = Paths.get(lookup.get("RAIDXP_LOG_FILE", "./server.log"));
        this.rulesFile = Paths.get(lookup.get("RAIDXP_RULES_FILE", "./rules.yaml"));
        String xp = lookup.get("RAIDXP_XP_FILE", "");
        this.xpFile = xp.isBlank() ? null : Paths.get(xp);
        this.pollInterval = Duration.ofMillis(lookup.positiveLong("RAIDXP_POLL_INTERVAL_MS", 250));
        this.questRotationInterval = Duration.ofMinutes(lookup.positiveLong("RAIDXP_QUEST_ROTATION_MINUTES", 60));
        this.questAcceptance = lookup.acceptance("RAIDXP_QUEST_ACCEPTANCE");
        this.maxApplyAttempts = lookup.positiveInt("RAIDXP_MAX_APPLY_ATTEMPTS", 3);
        this.retryBackoff = Duration.ofMillis(lookup.nonNegativeLong("RAIDXP_RETRY_BACKOFF_MS", 500));
    }

    /**
     * Reads the process environment and system properties.
     *
     * @throws ConfigurationException if a value is invalid
     */
    public static IngestionConfig load() {
        return load(System::getenv, System::getProperty);
    }

    public static IngestionConfig load(UnaryOperator<String> env, UnaryOperator<String> properties) {
        return new IngestionConfig(new Lookup(env, properties));
    }

    public String getDbUrl() {
        return dbUrl;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public Path getLogFile() {
        return logFile;
    }

    public Path getRulesFile() {
        return rulesFile;
    }

    /** Separate XP award document, if configured. */
    public Optional<Path> getXpFile() {
        return Optional.ofNullable(xpFile);
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getQuestRotationInterval() {
        return questRotationInterval;
    }

    public QuestAcceptance getQuestAcceptance() {
        return questAcceptance;
    }

    public int getMaxApplyAttempts() {
        return maxApplyAttempts;
    }

    public Duration getRetryBackoff() {
        return retryBackoff;
    }

    @Override
    public String toString() {
        return "IngestionConfig{dbUrl=" + dbUrl + ", logFile=" + logFile + ", rulesFile=" + rulesFile
                + ", xpFile=" + xpFile + ", pollInterval=" + pollInterval
                + ", questRotationInterval=" + questRotationInterval + ", questAcceptance=" + questAcceptance
                + ", maxApplyAttempts=" + maxApplyAttempts + ", retryBackoff=" + retryBackoff + "}";
    }

    private static final class Lookup {
        private final UnaryOperator<String> env;
        private final UnaryOperator<String> properties;

        Lookup(UnaryOperator<String> env, UnaryOperator<String> properties) {
            this.env = env;
            this.properties = properties;
        }

        String get(String key, String defaultValue) {
            String value = env.apply(key);
            if (value == null || value.isBlank()) {
                value = properties.apply(key);
            }
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        long positiveLong(String key, long defaultValue) {
            long value = parseLong(key, defaultValue);
            if (value <= 0) {
                throw new ConfigurationException(key + " must be positive, got " + value);
            }
            return value;
        }

        int positiveInt(String key, int defaultValue) {
            long value = positiveLong(key, defaultValue);
            if (value > Integer.MAX_VALUE) {
                throw new ConfigurationException(key + " is too large, got " + value);
            }
            return (int) value;
        }

        long nonNegativeLong(String key, long defaultValue) {
            long value = parseLong(key, defaultValue);
            if (value < 0) {
                throw new ConfigurationException(key + " cannot be negative, got " + value);
            }
            return value;
        }

        QuestAcceptance acceptance(String key) {
            String value = get(key, QuestAcceptance.IMPLICIT.name());
            try {
                return QuestAcceptance.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(key + " must be IMPLICIT or EXPLICIT, got '" + value + "'", e);
            }
        }

        private long parseLong(String key, long defaultValue) {
            String value = get(key, Long.toString(defaultValue));
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
            }
        }
    }
}
