package com.sashkomusic.coverartagent.domain.service;

import com.sashkomusic.coverartagent.domain.model.CacheKey;
import com.sashkomusic.coverartagent.domain.model.ResolvedRecord;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last MusicBrainz record resolved per (artist, album). Lives as long as the process;
 * entries are never evicted and only ever hold records that were actually found.
 */
@Component
public class ResolutionCache {

    private final Map<CacheKey, ResolvedRecord> entries = new ConcurrentHashMap<>();

    public Optional<ResolvedRecord> lookup(CacheKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public void store(CacheKey key, ResolvedRecord record) {
        entries.put(key, record);
    }

    public int size() {
        return entries.size();
    }
}
