package com.example.policy.capability.service;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.capability.model.CapabilityOption;
import com.example.policy.config.properties.CapabilityCacheProperties;
import com.example.policy.observability.PolicyMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Process-wide memo of capability trees keyed by root node identity.
 * Entries have no time-based expiry; the admin hierarchy is assumed immutable after startup.
 * Beyond {@code app.capability-cache.maximum-size} roots an entry may be evicted and is rebuilt
 * on its next lookup.
 */
@Slf4j
@Service
public class CapabilityTreeCache {

    private final Cache<AdminNode, List<CapabilityOption>> trees;
    private final CapabilityTreeBuilder builder;
    private final PolicyMetrics metrics;

    public CapabilityTreeCache(
            CapabilityTreeBuilder builder,
            CapabilityCacheProperties properties,
            PolicyMetrics metrics) {
        this.builder = builder;
        this.metrics = metrics;

        // weakKeys compares keys by identity
        this.trees = Caffeine.newBuilder()
                .weakKeys()
                .maximumSize(properties.maximumSize())
                .build();

        log.info("Capability tree cache initialized (max-entries={})", properties.maximumSize());
    }

    /**
     * Get the tree for the given root, building it on first access.
     */
    @NonNull
    public List<CapabilityOption> get(@NonNull AdminNode root) {
        List<CapabilityOption> cached = trees.getIfPresent(root);
        if (cached != null) {
            log.debug("Capability tree cache hit for root: {}", root.uniqueId());
            metrics.recordTreeCacheHit();
            return cached;
        }
        return trees.get(root, key -> {
            log.debug("Capability tree cache miss for root: {}, building", key.uniqueId());
            metrics.recordTreeCacheMiss();
            return builder.build(key);
        });
    }

    /**
     * Drop the tree of one root, e.g. after the hierarchy was reloaded.
     */
    public void invalidate(@NonNull AdminNode root) {
        trees.invalidate(root);
        log.debug("Invalidated capability tree for root: {}", root.uniqueId());
    }

    public void invalidateAll() {
        trees.invalidateAll();
        log.debug("Invalidated all capability trees");
    }

    public long size() {
        trees.cleanUp();
        return trees.estimatedSize();
    }
}
