package org.cloudfoundry.logcache.core.config;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import org.cloudfoundry.logcache.exception.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads {@link LogCacheConfig} from environment variables, one {@link ConfigOption} at a time.
 *
 * <p>Blank values count as unset. All missing required variables are reported in a single
 * {@link ConfigException}.
 */
public final class EnvironmentConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnvironmentConfigLoader.class);
    static final String REDACTED = "(redacted)";

    private final Map<String, String> environment;

    public EnvironmentConfigLoader(Map<String, String> environment) {
        this.environment = ImmutableMap.copyOf(Preconditions.checkNotNull(environment, "environment"));
    }

    /** Loads from the process environment. */
    public static LogCacheConfig loadFromSystem() throws ConfigException {
        return new EnvironmentConfigLoader(System.getenv()).load();
    }

    public LogCacheConfig load() throws ConfigException {
        Map<ConfigOption, String> values = new EnumMap<>(ConfigOption.class);
        List<String> missing = new ArrayList<>();
        for (ConfigOption option : ConfigOption.values()) {
            String raw = environment.get(option.getEnvName());
            if (Strings.isNullOrEmpty(raw) || raw.trim().isEmpty()) {
                if (option.isRequired()) {
                    missing.add(option.getEnvName());
                    continue;
                }
                raw = option.getDefaultValue();
            }
            values.put(option, raw.trim());
        }
        if (!missing.isEmpty()) {
            throw new ConfigException(
                    "missing required environment variables: " + Joiner.on(", ").join(missing));
        }

        return LogCacheConfig.builder()
                .addr(values.get(ConfigOption.ADDR))
                .apiServer(values.get(ConfigOption.API_SERVER))
                .token(values.get(ConfigOption.TOKEN))
                .appSelector(values.get(ConfigOption.APP_SELECTOR))
                .namespace(values.get(ConfigOption.NAMESPACE))
                .queryTimeout(parseQueryTimeout(values.get(ConfigOption.QUERY_TIMEOUT)))
                .tls(
                        TlsPaths.builder()
                                .caPath(values.get(ConfigOption.CA_PATH))
                                .certPath(values.get(ConfigOption.CERT_PATH))
                                .keyPath(values.get(ConfigOption.KEY_PATH))
                                .build())
                .build();
    }

    /** Logs every reported option at info level. Secrets are redacted. */
    public static void report(LogCacheConfig config) {
        for (ConfigOption option : ConfigOption.values()) {
            if (option.isReported()) {
                LOGGER.info("{}: {}", option.getEnvName(), reportedValue(option, config));
            }
        }
    }

    static String reportedValue(ConfigOption option, LogCacheConfig config) {
        return option.isSecret() ? REDACTED : option.valueOf(config);
    }

    private static Duration parseQueryTimeout(String value) throws ConfigException {
        long seconds;
        try {
            seconds = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigException(
                    ConfigOption.QUERY_TIMEOUT.getEnvName() + " must be a whole number of seconds: " + value,
                    e);
        }
        if (seconds < 0) {
            throw new ConfigException(
                    ConfigOption.QUERY_TIMEOUT.getEnvName() + " must not be negative: " + value);
        }
        return Duration.ofSeconds(seconds);
    }
}
