package com.lexis.activation.infra.cache;

import com.lexis.activation.infra.config.EngineConfig;

import java.util.logging.Logger;

/**
 * Builds the verdict cache described by an {@link EngineConfig}.
 */
public final class VerdictCacheFactory {

    private static final Logger logger = Logger.getLogger(VerdictCacheFactory.class.getName());

    private VerdictCacheFactory() {
    }

    public static VerdictCache create(EngineConfig config) {
        if (!config.isCacheEnabled()) {
            logger.info("Verdict cache disabled, every dispatch will reach the reasoner");
            return NoOpVerdictCache.INSTANCE;
        }
        return CaffeineVerdictCache.builder()
                .maxSize(config.getCacheMaxSize())
                .ttl(config.getVerdictTtl())
                .recordStats(true)
                .build();
    }
}
