package com.facilityhub.realtime.service.cache;

/**
 * Marks a named result set as stale so its next read goes back to the store.
 * Invalidating an unknown key does nothing.
 */
public interface CacheSynchronizer {

    void invalidate(String key);
}
