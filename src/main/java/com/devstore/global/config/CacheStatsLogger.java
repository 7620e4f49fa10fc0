package com.devstore.global.config;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CacheStatsLogger {

    private static final Logger log = LoggerFactory.getLogger(CacheStatsLogger.class);
    private final CacheManager cacheManager;

    public CacheStatsLogger(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    @Scheduled(fixedRateString = "${app.cache.stats-log-interval-ms:60000}",
            initialDelayString = "${app.cache.stats-log-interval-ms:60000}")
    public void logCacheStats() {
        List<String> lines = collectStats();
        if (!lines.isEmpty()) {
            log.info("Caffeine cache stats: {}", String.join(", ", lines));
        }
    }

    /**
     * 캐시별 "이름[hits=..., misses=..., hitRate=..%, size=...]" 요약. 요청이 없었던 캐시는 건너뛴다.
     */
    List<String> collectStats() {
        List<String> lines = new ArrayList<>();
        for (String cacheName : cacheManager.getCacheNames()) {
            if (cacheManager.getCache(cacheName) instanceof CaffeineCache caffeineCache) {
                CacheStats stats = caffeineCache.getNativeCache().stats();
                if (stats.requestCount() == 0) {
                    continue;
                }
                lines.add(String.format("%s[hits=%d, misses=%d, hitRate=%.1f%%, size=%d]",
                        cacheName, stats.hitCount(), stats.missCount(), stats.hitRate() * 100,
                        caffeineCache.getNativeCache().estimatedSize()));
            }
        }
        return lines;
    }
}
