package com.kotsin.predictive.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.predictive.config.AnalyticsConfig;
import com.kotsin.predictive.model.DashboardInsights;
import com.kotsin.predictive.model.MetricHistory;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * DashboardCacheService - TTL cache of dashboard payloads keyed by the full input.
 *
 * The key holds the histories themselves and compares them by value: name, category,
 * period and every observation. Two inputs share an entry only when they are equal, so a
 * hit always returns the payload that input would have produced. Caffeine handles
 * concurrency and eviction.
 */
@Service
@Slf4j
public class DashboardCacheService {

    private final boolean enabled;
    private final Cache<Fingerprint, DashboardInsights> cache;

    public DashboardCacheService(AnalyticsConfig config) {
        AnalyticsConfig.Cache settings = config.getCache().copy();
        this.enabled = settings.isEnabled();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(settings.getTtl())
                .maximumSize(settings.getMaximumSize())
                .build();
        log.info("Dashboard cache: enabled={} ttl={} maximumSize={}",
                enabled, settings.getTtl(), settings.getMaximumSize());
    }

    public Optional<DashboardInsights> get(Fingerprint fingerprint) {
        if (!enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    public void put(Fingerprint fingerprint, DashboardInsights insights) {
        if (enabled) {
            cache.put(fingerprint, insights);
        }
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public static Fingerprint fingerprint(List<MetricHistory> histories) {
        return new Fingerprint(List.copyOf(histories));
    }

    /**
     * Cache key over an immutable copy of the input list. Histories and observations are
     * value types, so equality covers every timestamp and value in input order.
     */
    @Value
    public static class Fingerprint {
        List<MetricHistory> histories;
    }
}
