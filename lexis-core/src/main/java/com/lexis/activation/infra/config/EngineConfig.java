/*
 * Copyright (c) 2025 Lexis Activation Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.lexis.activation.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Immutable engine configuration.
 *
 * <p>Values resolve in this order, later sources winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code activation.properties} (classpath, then file system)</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <table>
 *   <caption>Settings</caption>
 *   <tr><th>Property</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>activation.cache.ttl-minutes</td><td>ACTIVATION_CACHE_TTL_MINUTES</td><td>60</td></tr>
 *   <tr><td>activation.cache.max-size</td><td>ACTIVATION_CACHE_MAX_SIZE</td><td>10000</td></tr>
 *   <tr><td>activation.cache.enabled</td><td>ACTIVATION_CACHE_ENABLED</td><td>true</td></tr>
 *   <tr><td>activation.rule.max-depth</td><td>ACTIVATION_RULE_MAX_DEPTH</td><td>32</td></tr>
 *   <tr><td>activation.reasoner.timeout-ms</td><td>ACTIVATION_REASONER_TIMEOUT_MS</td><td>30000</td></tr>
 *   <tr><td>activation.dispatcher.threads</td><td>ACTIVATION_DISPATCHER_THREADS</td><td>4</td></tr>
 * </table>
 *
 * <p>Malformed values are logged and ignored; the previous source's value is kept.
 */
public final class EngineConfig {

    private static final Logger logger = Logger.getLogger(EngineConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "activation.properties";

    static final String ENV_CACHE_TTL_MINUTES = "ACTIVATION_CACHE_TTL_MINUTES";
    static final String ENV_CACHE_MAX_SIZE = "ACTIVATION_CACHE_MAX_SIZE";
    static final String ENV_CACHE_ENABLED = "ACTIVATION_CACHE_ENABLED";
    static final String ENV_RULE_MAX_DEPTH = "ACTIVATION_RULE_MAX_DEPTH";
    static final String ENV_REASONER_TIMEOUT_MS = "ACTIVATION_REASONER_TIMEOUT_MS";
    static final String ENV_DISPATCHER_THREADS = "ACTIVATION_DISPATCHER_THREADS";

    static final String PROP_CACHE_TTL_MINUTES = "activation.cache.ttl-minutes";
    static final String PROP_CACHE_MAX_SIZE = "activation.cache.max-size";
    static final String PROP_CACHE_ENABLED = "activation.cache.enabled";
    static final String PROP_RULE_MAX_DEPTH = "activation.rule.max-depth";
    static final String PROP_REASONER_TIMEOUT_MS = "activation.reasoner.timeout-ms";
    static final String PROP_DISPATCHER_THREADS = "activation.dispatcher.threads";

    private final Duration verdictTtl;
    private final long cacheMaxSize;
    private final boolean cacheEnabled;
    private final int maxRuleDepth;
    private final Duration reasonerTimeout;
    private final int dispatcherThreads;

    private EngineConfig(Builder builder) {
        this.verdictTtl = builder.verdictTtl;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheEnabled = builder.cacheEnabled;
        this.maxRuleDepth = builder.maxRuleDepth;
        this.reasonerTimeout = builder.reasonerTimeout;
        this.dispatcherThreads = builder.dispatcherThreads;
        validate();
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Defaults, then {@value #DEFAULT_PROPERTIES}, then environment variables.
     */
    public static EngineConfig load() {
        return load(DEFAULT_PROPERTIES);
    }

    public static EngineConfig load(String propertiesPath) {
        return load(readProperties(propertiesPath), System.getenv());
    }

    static EngineConfig load(Properties properties, Map<String, String> environment) {
        Builder builder = builder();
        builder.apply(properties::getProperty, PROP_CACHE_TTL_MINUTES, PROP_CACHE_MAX_SIZE, PROP_CACHE_ENABLED,
                PROP_RULE_MAX_DEPTH, PROP_REASONER_TIMEOUT_MS, PROP_DISPATCHER_THREADS);
        builder.apply(environment::get, ENV_CACHE_TTL_MINUTES, ENV_CACHE_MAX_SIZE, ENV_CACHE_ENABLED,
                ENV_RULE_MAX_DEPTH, ENV_REASONER_TIMEOUT_MS, ENV_DISPATCHER_THREADS);
        return builder.build();
    }

    private static Properties readProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + path);
                return props;
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath properties " + path + ": " + e.getMessage());
        }

        Path file = Path.of(path);
        if (Files.isRegularFile(file)) {
            try (Reader reader = Files.newBufferedReader(file)) {
                props.load(reader);
                logger.info("Loaded " + props.size() + " properties from file: " + path);
            } catch (IOException e) {
                logger.warning("Could not read properties file " + path + ": " + e.getMessage());
            }
        } else {
            logger.fine("No " + path + " found, using defaults and environment");
        }
        return props;
    }

    private void validate() {
        if (verdictTtl.isNegative() || verdictTtl.isZero()) {
            throw new IllegalArgumentException("verdictTtl must be positive: " + verdictTtl);
        }
        if (cacheMaxSize <= 0) {
            throw new IllegalArgumentException("cacheMaxSize must be positive: " + cacheMaxSize);
        }
        if (maxRuleDepth < 1) {
            throw new IllegalArgumentException("maxRuleDepth must be at least 1: " + maxRuleDepth);
        }
        if (reasonerTimeout.isNegative() || reasonerTimeout.isZero()) {
            throw new IllegalArgumentException("reasonerTimeout must be positive: " + reasonerTimeout);
        }
        if (dispatcherThreads < 1) {
            throw new IllegalArgumentException("dispatcherThreads must be at least 1: " + dispatcherThreads);
        }
    }

    public Duration getVerdictTtl() {
        return verdictTtl;
    }

    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public int getMaxRuleDepth() {
        return maxRuleDepth;
    }

    public Duration getReasonerTimeout() {
        return reasonerTimeout;
    }

    public int getDispatcherThreads() {
        return dispatcherThreads;
    }

    public Builder toBuilder() {
        return builder()
                .verdictTtl(verdictTtl)
                .cacheMaxSize(cacheMaxSize)
                .cacheEnabled(cacheEnabled)
                .maxRuleDepth(maxRuleDepth)
                .reasonerTimeout(reasonerTimeout)
                .dispatcherThreads(dispatcherThreads);
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "verdictTtl=" + verdictTtl +
                ", cacheMaxSize=" + cacheMaxSize +
                ", cacheEnabled=" + cacheEnabled +
                ", maxRuleDepth=" + maxRuleDepth +
                ", reasonerTimeout=" + reasonerTimeout +
                ", dispatcherThreads=" + dispatcherThreads +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration verdictTtl = Duration.ofMinutes(60);
        private long cacheMaxSize = 10_000;
        private boolean cacheEnabled = true;
        private int maxRuleDepth = 32;
        private Duration reasonerTimeout = Duration.ofSeconds(30);
        private int dispatcherThreads = 4;

        private Builder() {
        }

        public Builder verdictTtl(Duration ttl) {
            this.verdictTtl = Objects.requireNonNull(ttl, "ttl");
            return this;
        }

        public Builder cacheMaxSize(long maxSize) {
            this.cacheMaxSize = maxSize;
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public Builder maxRuleDepth(int depth) {
            this.maxRuleDepth = depth;
            return this;
        }

        public Builder reasonerTimeout(Duration timeout) {
            this.reasonerTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        public Builder dispatcherThreads(int threads) {
            this.dispatcherThreads = threads;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }

        /**
         * Applies one source. Keys are, in order: TTL minutes, max size, enabled, max depth,
         * timeout millis, dispatcher threads.
         */
        private void apply(Function<String, String> source, String... keys) {
            Long ttl = parseLong(source, keys[0]);
            if (ttl != null) verdictTtl = Duration.ofMinutes(ttl);
            Long maxSize = parseLong(source, keys[1]);
            if (maxSize != null) cacheMaxSize = maxSize;
            String enabled = trimmed(source.apply(keys[2]));
            if (enabled != null) cacheEnabled = Boolean.parseBoolean(enabled);
            Long depth = parseLong(source, keys[3]);
            if (depth != null) maxRuleDepth = depth.intValue();
            Long timeoutMs = parseLong(source, keys[4]);
            if (timeoutMs != null) reasonerTimeout = Duration.ofMillis(timeoutMs);
            Long threads = parseLong(source, keys[5]);
            if (threads != null) dispatcherThreads = threads.intValue();
        }

        private static Long parseLong(Function<String, String> source, String key) {
            String value = trimmed(source.apply(key));
            if (value == null) {
                return null;
            }
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                logger.warning("Ignoring non-numeric value for " + key + ": '" + value + "'");
                return null;
            }
        }

        private static String trimmed(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
