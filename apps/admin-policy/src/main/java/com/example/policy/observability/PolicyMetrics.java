package com.example.policy.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer counters for rule-store writes and capability tree cache lookups.
 * Tag values are bounded to the fixed kinds below.
 */
@Slf4j
@Component
public class PolicyMetrics {

    public static final String KIND_ROLE = "role";
    public static final String KIND_PAGE = "page";
    public static final String KIND_FIELD = "field";
    public static final String KIND_GROUPING = "grouping";

    private static final String METRIC_PREFIX = "policy";
    private static final String TAG_KIND = "kind";
    private static final String TAG_RESULT = "result";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> addedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> removedCounters = new ConcurrentHashMap<>();

    private final Counter treeCacheHit;
    private final Counter treeCacheMiss;

    public PolicyMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.treeCacheHit = Counter.builder(METRIC_PREFIX + ".tree.cache")
                .tag(TAG_RESULT, "hit")
                .description("Capability tree cache hits")
                .register(meterRegistry);

        this.treeCacheMiss = Counter.builder(METRIC_PREFIX + ".tree.cache")
                .tag(TAG_RESULT, "miss")
                .description("Capability tree cache misses")
                .register(meterRegistry);

        log.info("Policy metrics initialized");
    }

    /**
     * Record rules written to the store.
     */
    public void recordAdded(String kind, int count) {
        if (count > 0) {
            addedCounters.computeIfAbsent(kind, k -> Counter.builder(METRIC_PREFIX + ".rules.added")
                    .description("Rules added to the rule store")
                    .tag(TAG_KIND, k)
                    .register(meterRegistry)).increment(count);
        }
    }

    /**
     * Record rules removed from the store.
     */
    public void recordRemoved(String kind, int count) {
        if (count > 0) {
            removedCounters.computeIfAbsent(kind, k -> Counter.builder(METRIC_PREFIX + ".rules.removed")
                    .description("Rules removed from the rule store")
                    .tag(TAG_KIND, k)
                    .register(meterRegistry)).increment(count);
        }
    }

    public void recordTreeCacheHit() {
        treeCacheHit.increment();
    }

    public void recordTreeCacheMiss() {
        treeCacheMiss.increment();
    }
}
