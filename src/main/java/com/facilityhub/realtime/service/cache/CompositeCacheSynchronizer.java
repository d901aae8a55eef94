package com.facilityhub.realtime.service.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Invalidates a key on every delegate. A failing delegate does not stop the others.
 */
@Slf4j
public class CompositeCacheSynchronizer implements CacheSynchronizer {

    private final List<CacheSynchronizer> delegates;

    public CompositeCacheSynchronizer(List<CacheSynchronizer> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static CompositeCacheSynchronizer of(CacheSynchronizer... delegates) {
        return new CompositeCacheSynchronizer(List.of(delegates));
    }

    @Override
    public void invalidate(String key) {
        RuntimeException first = null;
        for (CacheSynchronizer delegate : delegates) {
            try {
                delegate.invalidate(key);
            } catch (RuntimeException e) {
                log.warn("{} failed to invalidate '{}': {}", delegate.getClass().getSimpleName(), key, e.getMessage());
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }
}
