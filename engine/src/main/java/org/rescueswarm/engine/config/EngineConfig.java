package org.rescueswarm.engine.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.rescueswarm.engine.domain.model.DispatchConfig;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable configuration for the dispatch engine process.
 * Values come from the environment, then a .env file in the working directory
 * or its parent, then defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final int DEFAULT_HTTP_PORT = 8000;
    public static final int DEFAULT_DISPATCH_INTERVAL = 10;
    public static final String DEFAULT_LOG_FILE = "logs/engine/engine.log";

    // Prefix for DispatchConfig overrides, e.g. DISPATCH_MERGE_RADIUS_METERS
    static final String DISPATCH_ENV_PREFIX = "DISPATCH_";

    // HTTP surface
    private final int httpPort;

    // Scheduler
    private final int dispatchIntervalSeconds;
    private final boolean schedulerEnabled;
    private final boolean replanOnNewVictim;

    // Route publishing; empty means log only
    private final String routePublishUrl;

    // Logging
    private final String logFilePath;
    private final boolean fileLoggingEnabled;

    private final DispatchConfig dispatchConfig;

    private EngineConfig(Builder builder) {
        this.httpPort = builder.httpPort;
        this.dispatchIntervalSeconds = builder.dispatchIntervalSeconds;
        this.schedulerEnabled = builder.schedulerEnabled;
        this.replanOnNewVictim = builder.replanOnNewVictim;
        this.routePublishUrl = builder.routePublishUrl;
        this.logFilePath = builder.logFilePath;
        this.fileLoggingEnabled = builder.fileLoggingEnabled;
        this.dispatchConfig = builder.dispatchConfig;
    }

    /**
     * Creates configuration from environment variables and an optional .env file.
     */
    public static EngineConfig fromEnvironment() {
        Dotenv local = Dotenv.configure().ignoreIfMissing().load();
        Dotenv parent = Dotenv.configure().directory("../").ignoreIfMissing().load();
        return fromSource(key -> {
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
     * Creates configuration from an arbitrary key lookup. Missing keys yield null.
     */
    static EngineConfig fromSource(Function<String, String> source) {
        return new Builder()
                .httpPort(getInt(source, "ENGINE_HTTP_PORT", DEFAULT_HTTP_PORT))
                .dispatchIntervalSeconds(getInt(source, "DISPATCH_INTERVAL_SECONDS", DEFAULT_DISPATCH_INTERVAL))
                .schedulerEnabled(getBoolean(source, "DISPATCH_SCHEDULER_ENABLED", true))
                .replanOnNewVictim(getBoolean(source, "REPLAN_ON_NEW_VICTIM", true))
                .routePublishUrl(getString(source, "ROUTE_PUBLISH_URL", ""))
                .logFilePath(getString(source, "ENGINE_LOG_FILE", DEFAULT_LOG_FILE))
                .fileLoggingEnabled(getBoolean(source, "ENGINE_FILE_LOGGING_ENABLED", false))
                .dispatchConfig(readDispatchConfig(source))
                .build();
    }

    public int getHttpPort() {
        return httpPort;
    }

    public int getDispatchIntervalSeconds() {
        return dispatchIntervalSeconds;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public boolean isReplanOnNewVictim() {
        return replanOnNewVictim;
    }

    public String getRoutePublishUrl() {
        return routePublishUrl;
    }

    public boolean isRoutePublishingEnabled() {
        return !routePublishUrl.isEmpty();
    }

    public String getLogFilePath() {
        return logFilePath;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public DispatchConfig getDispatchConfig() {
        return dispatchConfig;
    }

    private static DispatchConfig readDispatchConfig(Function<String, String> source) {
        Map<String, Double> overrides = new HashMap<>();
        for (String key : DispatchConfig.keys()) {
            String envKey = DISPATCH_ENV_PREFIX + key.toUpperCase(Locale.ROOT);
            String value = source.apply(envKey);
            if (isBlank(value)) {
                continue;
            }
            try {
                overrides.put(key, Double.parseDouble(value.trim()));
            } catch (NumberFormatException e) {
                LOG.warning(() -> String.format("Invalid number for %s: %s, using default", envKey, value));
            }
        }
        return DispatchConfig.fromMap(overrides);
    }

    private static String getString(Function<String, String> source, String key, String defaultValue) {
        String value = source.apply(key);
        if (isBlank(value)) {
            LOG.fine(() -> String.format("Using default for %s: %s", key, defaultValue));
            return defaultValue;
        }
        return value.trim();
    }

    private static int getInt(Function<String, String> source, String key, int defaultValue) {
        String value = source.apply(key);
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

    private static boolean getBoolean(Function<String, String> source, String key, boolean defaultValue) {
        String value = source.apply(key);
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
                "httpPort=" + httpPort +
                ", dispatchIntervalSeconds=" + dispatchIntervalSeconds +
                ", schedulerEnabled=" + schedulerEnabled +
                ", replanOnNewVictim=" + replanOnNewVictim +
                ", routePublishUrl='" + routePublishUrl + '\'' +
                ", fileLoggingEnabled=" + fileLoggingEnabled +
                ", dispatch=" + dispatchConfig +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private int httpPort = DEFAULT_HTTP_PORT;
        private int dispatchIntervalSeconds = DEFAULT_DISPATCH_INTERVAL;
        private boolean schedulerEnabled = true;
        private boolean replanOnNewVictim = true;
        private String routePublishUrl = "";
        private String logFilePath = DEFAULT_LOG_FILE;
        private boolean fileLoggingEnabled = false;
        private DispatchConfig dispatchConfig = DispatchConfig.defaults();

        public Builder httpPort(int httpPort) {
            if (httpPort < 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort must be between 0 and 65535");
            }
            this.httpPort = httpPort;
            return this;
        }

        public Builder dispatchIntervalSeconds(int dispatchIntervalSeconds) {
            if (dispatchIntervalSeconds < 1) {
                throw new IllegalArgumentException("dispatchIntervalSeconds must be at least 1");
            }
            this.dispatchIntervalSeconds = dispatchIntervalSeconds;
            return this;
        }

        public Builder schedulerEnabled(boolean schedulerEnabled) {
            this.schedulerEnabled = schedulerEnabled;
            return this;
        }

        public Builder replanOnNewVictim(boolean replanOnNewVictim) {
            this.replanOnNewVictim = replanOnNewVictim;
            return this;
        }

        public Builder routePublishUrl(String routePublishUrl) {
            this.routePublishUrl = Objects.requireNonNull(routePublishUrl, "routePublishUrl must not be null");
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

        public Builder dispatchConfig(DispatchConfig dispatchConfig) {
            this.dispatchConfig = Objects.requireNonNull(dispatchConfig, "dispatchConfig must not be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
