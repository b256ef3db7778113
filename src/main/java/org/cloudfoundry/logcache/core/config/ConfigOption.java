package org.cloudfoundry.logcache.core.config;

import java.util.function.Function;

/** Every environment variable the process reads, with its requirements and default. */
public enum ConfigOption {
    ADDR("ADDR", true, null, true, LogCacheConfig::getAddr),
    API_SERVER("API_SERVER", true, null, true, LogCacheConfig::getApiServer),
    TOKEN("TOKEN", true, null, true, LogCacheConfig::getToken),
    APP_SELECTOR("APP_SELECTOR", true, null, true, LogCacheConfig::getAppSelector),
    NAMESPACE("NAMESPACE", false, "", false, LogCacheConfig::getNamespace),
    QUERY_TIMEOUT(
            "QUERY_TIMEOUT",
            false,
            String.valueOf(LogCacheConfig.DEFAULT_QUERY_TIMEOUT.getSeconds()),
            true,
            c -> String.valueOf(c.getQueryTimeout().getSeconds())),
    CA_PATH("CA_PATH", true, null, true, c -> c.getTls().getCaPath()),
    CERT_PATH("CERT_PATH", true, null, true, c -> c.getTls().getCertPath()),
    KEY_PATH("KEY_PATH", true, null, true, c -> c.getTls().getKeyPath());

    private final String envName;
    private final boolean required;
    private final String defaultValue;
    private final boolean reported;
    private final Function<LogCacheConfig, String> accessor;

    ConfigOption(
            String envName,
            boolean required,
            String defaultValue,
            boolean reported,
            Function<LogCacheConfig, String> accessor) {
        this.envName = envName;
        this.required = required;
        this.defaultValue = defaultValue;
        this.reported = reported;
        this.accessor = accessor;
    }

    public String getEnvName() {
        return envName;
    }

    public boolean isRequired() {
        return required;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public boolean isReported() {
        return reported;
    }

    public boolean isSecret() {
        return this == TOKEN;
    }

    String valueOf(LogCacheConfig config) {
        return accessor.apply(config);
    }
}
