package org.cloudfoundry.logcache.core.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Process configuration, populated from the environment by {@link EnvironmentConfigLoader}.
 *
 * <p>Immutable DTO; the token is left out of {@link #toString()}.
 */
@Value
@Builder
public class LogCacheConfig {
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(10);

    /** Address to listen on. */
    @NonNull String addr;

    @NonNull String apiServer;

    @ToString.Exclude @NonNull String token;

    @NonNull String appSelector;

    @Builder.Default String namespace = "";

    /** Maximum allowed runtime for a single PromQL query. Smaller timeouts are recommended. */
    @Builder.Default Duration queryTimeout = DEFAULT_QUERY_TIMEOUT;

    @NonNull TlsPaths tls;
}
