package com.exportscan.service.cache;

import com.exportscan.model.RunSnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Remembers the last few completed runs so callers can look them up again.
 *
 * Bounded by size and TTL (see {@code CacheConfig}); has no influence on matching.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecentRunsService {

    private final Cache<String, RunSnapshot> recentRunsCache;

    public void record(RunSnapshot snapshot) {
        recentRunsCache.put(snapshot.runId(), snapshot);
        log.debug("Recorded run {} ({} vs {})", snapshot.runId(), snapshot.sourceName(), snapshot.targetName());
    }

    public Optional<RunSnapshot> find(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(recentRunsCache.getIfPresent(runId));
    }

    /**
     * Retained runs, newest first.
     */
    public List<RunSnapshot> list() {
        return recentRunsCache.asMap().values().stream()
                .sorted(Comparator.comparing(RunSnapshot::completedAt).reversed())
                .toList();
    }

    public long size() {
        recentRunsCache.cleanUp();
        return recentRunsCache.estimatedSize();
    }
}
