package com.example.policy.policy.service;

import com.example.policy.common.PolicyConstants;
import com.example.policy.observability.PolicyMetrics;
import com.example.policy.permission.codec.PermissionCodec;
import com.example.policy.policy.model.GroupingRelation;
import com.example.policy.policy.model.PolicyDiff;
import com.example.policy.policy.model.PolicyRule;
import com.example.policy.policy.store.RuleStoreOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and reconciles the role assignments and page permissions of one subject.
 *
 * <p>Read-diff-write is not atomic. Callers must not reconcile the same subject concurrently,
 * otherwise a rule added between the read and the write can be lost.
 */
@Slf4j
@Service
public class SubjectPolicyService {

    private final RuleStoreOperations ruleStore;
    private final PolicyMetrics metrics;

    public SubjectPolicyService(RuleStoreOperations ruleStore, PolicyMetrics metrics) {
        this.ruleStore = ruleStore;
        this.metrics = metrics;
    }

    /**
     * Page permissions of a subject, encoded from field v1 onward (effect included),
     * e.g. {@code users#admin:page#page#allow}.
     * These four-field keys are for display only. They are not option values and cannot be
     * passed back to {@link #updateSubjectPermissions}, which takes three-field keys.
     *
     * @param implicit include permissions inherited through roles
     */
    @NonNull
    public Mono<List<String>> getSubjectPermissions(@NonNull String subject, boolean implicit) {
        Mono<List<List<String>>> rules = implicit
                ? ruleStore.getImplicitPermissionsForUser(subject)
                .map(rows -> rows.stream()
                        .filter(row -> row.size() >= 2
                                && PolicyConstants.PAGE_DOMAIN.equals(row.get(row.size() - 2)))
                        .toList())
                : ruleStore.getFilteredPolicy(0, subject, "", "", PolicyConstants.PAGE_DOMAIN);
        return rules.map(rows -> rows.stream()
                .map(row -> PermissionCodec.encode(row.subList(1, row.size())))
                .distinct()
                .toList());
    }

    /**
     * Replace every role of the subject with the comma separated role keys.
     * A role equal to the subject itself is dropped; longer cycles are not detected.
     *
     * @return the role edges now stored for the subject
     */
    @NonNull
    public Mono<Set<GroupingRelation>> updateSubjectRoles(@NonNull String subject, @Nullable String roleKeys) {
        Set<GroupingRelation> roles = parseRoles(subject, roleKeys);
        List<List<String>> rows = roles.stream().map(GroupingRelation::toRow).toList();

        return ruleStore.deleteRolesForUser(subject)
                .then(rows.isEmpty()
                        ? Mono.just(0)
                        : ruleStore.addNamedGroupingPolicies(PolicyConstants.ROLE_GROUPING, rows))
                .doOnNext(added -> {
                    metrics.recordAdded(PolicyMetrics.KIND_ROLE, added);
                    log.info("Replaced roles for subject {}: {}", subject, roles.stream()
                            .map(GroupingRelation::child)
                            .toList());
                })
                .doOnError(e -> log.error("Failed to update roles for subject {}: {}", subject, e.getMessage()))
                .thenReturn(roles);
    }

    /**
     * Reconcile the page permissions of a subject with the desired encoded permissions.
     * Only the difference is written; unchanged rules cause no store call.
     *
     * @return the desired permissions
     */
    @NonNull
    public Mono<List<String>> updateSubjectPermissions(@NonNull String subject, @NonNull List<String> permissions) {
        return Mono.fromCallable(() -> desiredPageRules(subject, permissions))
                .flatMap(desired -> ruleStore.getFilteredPolicy(0, subject, "", "", PolicyConstants.PAGE_DOMAIN)
                        .map(rows -> toRules(rows))
                        .map(current -> PolicyDiff.compute(current, desired)))
                .flatMap(diff -> applyDiff(diff, PolicyMetrics.KIND_PAGE)
                        .doOnSuccess(v -> log.info("Reconciled page permissions for subject {}: removed={}, added={}",
                                subject, diff.toRemove().size(), diff.toAdd().size())))
                .doOnError(e -> log.error("Failed to update permissions for subject {}: {}",
                        subject, e.getMessage()))
                .thenReturn(permissions);
    }

    /**
     * Issue the remove batch, then the add batch. Empty batches are not sent.
     */
    @NonNull
    Mono<Void> applyDiff(@NonNull PolicyDiff<PolicyRule> diff, @NonNull String kind) {
        Mono<Integer> removal = diff.toRemove().isEmpty()
                ? Mono.just(0)
                : ruleStore.removePolicies(diff.removeRows(PolicyRule::toRow))
                .doOnNext(removed -> metrics.recordRemoved(kind, removed));
        Mono<Integer> addition = diff.toAdd().isEmpty()
                ? Mono.just(0)
                : ruleStore.addPolicies(diff.addRows(PolicyRule::toRow))
                .doOnNext(added -> metrics.recordAdded(kind, added));
        return removal.then(addition).then();
    }

    /**
     * Role edges for the subject; blank keys and the subject's own role are skipped.
     */
    @NonNull
    public static Set<GroupingRelation> parseRoles(@NonNull String subject, @Nullable String roleKeys) {
        Set<GroupingRelation> roles = new LinkedHashSet<>();
        if (roleKeys == null) {
            return roles;
        }
        for (String key : roleKeys.split(",")) {
            String role = key.trim();
            if (role.isEmpty()) {
                continue;
            }
            String roleSubject = PolicyConstants.ROLE_PREFIX + role;
            if (roleSubject.equals(subject)) {
                log.debug("Skipping self role edge for subject {}", subject);
                continue;
            }
            roles.add(new GroupingRelation(subject, roleSubject));
        }
        return roles;
    }

    private static Set<PolicyRule> desiredPageRules(String subject, List<String> permissions) {
        Set<PolicyRule> rules = new LinkedHashSet<>();
        for (String permission : permissions) {
            rules.add(PolicyRule.allow(subject, PermissionCodec.decode(permission, 3)));
        }
        return rules;
    }

    private static Set<PolicyRule> toRules(List<List<String>> rows) {
        Set<PolicyRule> rules = new LinkedHashSet<>();
        for (List<String> row : rows) {
            rules.add(PolicyRule.fromRow(row));
        }
        return rules;
    }
}
