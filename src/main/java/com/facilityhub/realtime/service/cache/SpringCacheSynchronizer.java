package com.facilityhub.realtime.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

/**
 * Clears the server-side cache named after the invalidation key. The caches
 * themselves are filled by {@code @Cacheable} read models of the host
 * application; this service only evicts them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SpringCacheSynchronizer implements CacheSynchronizer {

    private final CacheManager cacheManager;

    @Override
    public void invalidate(String key) {
        // getCache() would create missing caches on a dynamic manager
        if (!cacheManager.getCacheNames().contains(key)) {
            log.trace("No cache named '{}', nothing to invalidate", key);
            return;
        }
        Cache cache = cacheManager.getCache(key);
        if (cache != null) {
            cache.clear();
            log.debug("Cleared cache '{}'", key);
        }
    }
}
