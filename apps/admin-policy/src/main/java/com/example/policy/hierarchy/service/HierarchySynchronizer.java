package com.example.policy.hierarchy.service;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.common.PolicyConstants;
import com.example.policy.observability.PolicyMetrics;
import com.example.policy.policy.model.GroupingRelation;
import com.example.policy.policy.model.PolicyDiff;
import com.example.policy.policy.store.RuleStoreOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Keeps the resource containment namespace ({@code g2}) in line with the admin hierarchy.
 * Each node except the root contributes an edge from its owning application to itself.
 */
@Slf4j
@Service
public class HierarchySynchronizer {

    private final RuleStoreOperations ruleStore;
    private final PolicyMetrics metrics;

    public HierarchySynchronizer(RuleStoreOperations ruleStore, PolicyMetrics metrics) {
        this.ruleStore = ruleStore;
        this.metrics = metrics;
    }

    /**
     * Containment edges of the hierarchy below the given group, depth-first.
     */
    @NonNull
    public static Set<GroupingRelation> deriveRelations(@NonNull AdminNode group) {
        Set<GroupingRelation> relations = new LinkedHashSet<>();
        collect(group, relations);
        return relations;
    }

    private static void collect(AdminNode group, Set<GroupingRelation> relations) {
        for (AdminNode node : group.children()) {
            if (node.isRoot()) {
                continue;
            }
            relations.add(new GroupingRelation(node.app().uniqueId(), node.uniqueId()));
            if (node.isGroup()) {
                collect(node, relations);
            }
        }
    }

    /**
     * Remove stale edges and add missing ones.
     *
     * @return the applied difference
     */
    @NonNull
    public Mono<PolicyDiff<GroupingRelation>> sync(@NonNull AdminNode root) {
        Set<GroupingRelation> desired = deriveRelations(root);
        return ruleStore.getFilteredNamedGroupingPolicy(PolicyConstants.RESOURCE_GROUPING, 0)
                .map(rows -> {
                    Set<GroupingRelation> current = new LinkedHashSet<>();
                    rows.forEach(row -> current.add(GroupingRelation.fromRow(row)));
                    return PolicyDiff.compute(current, desired);
                })
                .flatMap(diff -> {
                    Mono<Integer> removal = diff.toRemove().isEmpty()
                            ? Mono.just(0)
                            : ruleStore.removeNamedGroupingPolicies(PolicyConstants.RESOURCE_GROUPING,
                                    diff.removeRows(GroupingRelation::toRow))
                            .doOnNext(removed -> metrics.recordRemoved(PolicyMetrics.KIND_GROUPING, removed));
                    Mono<Integer> addition = diff.toAdd().isEmpty()
                            ? Mono.just(0)
                            : ruleStore.addNamedGroupingPolicies(PolicyConstants.RESOURCE_GROUPING,
                                    diff.addRows(GroupingRelation::toRow))
                            .doOnNext(added -> metrics.recordAdded(PolicyMetrics.KIND_GROUPING, added));
                    return removal.then(addition).thenReturn(diff);
                })
                .doOnSuccess(diff -> log.info("Synchronized resource hierarchy of {}: removed={}, added={}",
                        root.uniqueId(), diff.toRemove().size(), diff.toAdd().size()))
                .doOnError(e -> log.error("Failed to synchronize resource hierarchy of {}: {}",
                        root.uniqueId(), e.getMessage()));
    }
}
