package com.example.policy.field.service;

import com.example.policy.common.PolicyConstants;
import com.example.policy.common.exception.AmbiguousFieldPolicyException;
import com.example.policy.field.model.FieldEffectMatrix;
import com.example.policy.field.model.FieldPolicyMatrix;
import com.example.policy.field.model.FieldPolicyRow;
import com.example.policy.field.util.FieldActionNamespace;
import com.example.policy.observability.PolicyMetrics;
import com.example.policy.permission.codec.PermissionCodec;
import com.example.policy.policy.model.PolicyEffect;
import com.example.policy.policy.model.PolicyRule;
import com.example.policy.policy.store.RuleStoreOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Field-level allow/deny rules of one page action, rendered as an editable matrix.
 *
 * <p>Field rules are stored as {@code [subject, adminId, page:action, field, eft]}. Rules whose
 * domain field is {@code page} share the same prefix but belong to page permissions; they are
 * excluded from both the read and the replace path.
 */
@Slf4j
@Service
public class FieldPolicyService {

    private final RuleStoreOperations ruleStore;
    private final PolicyMetrics metrics;

    public FieldPolicyService(RuleStoreOperations ruleStore, PolicyMetrics metrics) {
        this.ruleStore = ruleStore;
        this.metrics = metrics;
    }

    /**
     * Place every row in exactly one column: allow or deny if a stored rule says so, default otherwise.
     *
     * @param permission page action key, {@code adminId#admin:list#page}
     */
    @NonNull
    public Mono<FieldPolicyMatrix> buildMatrix(
            @NonNull String subject, @NonNull String permission, @NonNull List<FieldPolicyRow> rows) {
        return storedFieldRules(subject, permission)
                .map(rules -> {
                    Set<String> allowed = new LinkedHashSet<>();
                    Set<String> denied = new LinkedHashSet<>();
                    for (PolicyRule rule : rules) {
                        String key = PermissionCodec.encode(rule.fields());
                        if (rule.effect() == PolicyEffect.ALLOW) {
                            allowed.add(key);
                        } else {
                            denied.add(key);
                        }
                    }
                    List<FieldPolicyRow> defaults = new ArrayList<>(rows.size());
                    List<FieldPolicyRow> allow = new ArrayList<>(rows.size());
                    List<FieldPolicyRow> deny = new ArrayList<>(rows.size());
                    for (FieldPolicyRow row : rows) {
                        boolean isAllowed = allowed.contains(row.rol());
                        boolean isDenied = !isAllowed && denied.contains(row.rol());
                        defaults.add(row.in(FieldPolicyMatrix.DEFAULT_COLUMN, !isAllowed && !isDenied));
                        allow.add(row.in(FieldPolicyMatrix.ALLOW_COLUMN, isAllowed));
                        deny.add(row.in(FieldPolicyMatrix.DENY_COLUMN, isDenied));
                    }
                    return new FieldPolicyMatrix(defaults, allow, deny);
                });
    }

    /**
     * Evaluate every row for the subject, including inherited and denied rules.
     */
    @NonNull
    public Mono<FieldEffectMatrix> computeEffects(@NonNull String subject, @NonNull List<FieldPolicyRow> rows) {
        return Flux.fromIterable(rows)
                .concatMap(row -> Mono.fromCallable(() -> PermissionCodec.decode(row.rol(), 3))
                        .flatMap(fields -> ruleStore.enforce(subject, fields)))
                .collectList()
                .map(effects -> {
                    List<FieldPolicyRow> allow = new ArrayList<>(rows.size());
                    List<FieldPolicyRow> deny = new ArrayList<>(rows.size());
                    for (int i = 0; i < rows.size(); i++) {
                        boolean allowed = effects.get(i);
                        allow.add(rows.get(i).in(FieldPolicyMatrix.ALLOW_COLUMN, allowed));
                        deny.add(rows.get(i).in(FieldPolicyMatrix.DENY_COLUMN, !allowed));
                    }
                    return new FieldEffectMatrix(allow, deny);
                });
    }

    /**
     * Replace the field rules of the page action with the checked allow and deny rows.
     * An absent or empty matrix changes nothing.
     *
     * @throws AmbiguousFieldPolicyException (as error signal) if a row is checked in both allow and deny
     */
    @NonNull
    public Mono<Void> applyMatrix(
            @NonNull String subject, @NonNull String permission, @Nullable FieldPolicyMatrix matrix) {
        if (matrix == null || matrix.isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> desiredRules(subject, matrix))
                .flatMap(desired -> storedFieldRules(subject, permission)
                        .flatMap(existing -> {
                            Mono<Integer> removal = existing.isEmpty()
                                    ? Mono.just(0)
                                    : ruleStore.removePolicies(existing.stream().map(PolicyRule::toRow).toList())
                                    .doOnNext(removed -> metrics.recordRemoved(PolicyMetrics.KIND_FIELD, removed));
                            Mono<Integer> addition = desired.isEmpty()
                                    ? Mono.just(0)
                                    : ruleStore.addPolicies(desired.stream().map(PolicyRule::toRow).toList())
                                    .doOnNext(added -> metrics.recordAdded(PolicyMetrics.KIND_FIELD, added));
                            return removal.then(addition)
                                    .doOnSuccess(v -> log.info(
                                            "Replaced field rules for subject {} on {}: removed={}, added={}",
                                            subject, permission, existing.size(), desired.size()));
                        }))
                .doOnError(e -> log.error("Failed to update field rules for subject {} on {}: {}",
                        subject, permission, e.getMessage()))
                .then();
    }

    /**
     * Stored field rules matching {@code (subject, v1, v2, *, *)}, page rules excluded.
     */
    private Mono<List<PolicyRule>> storedFieldRules(String subject, String permission) {
        return Mono.fromCallable(() -> PermissionCodec.decode(permission, 3))
                .flatMap(fields -> ruleStore.getFilteredPolicy(0, subject, fields.get(0),
                        FieldActionNamespace.toStoredAction(fields.get(1)), "", ""))
                .map(rows -> rows.stream()
                        .map(PolicyRule::fromRow)
                        .filter(rule -> !PolicyConstants.PAGE_DOMAIN.equals(rule.domain()))
                        .toList());
    }

    private static Set<PolicyRule> desiredRules(String subject, FieldPolicyMatrix matrix) {
        Set<String> allowKeys = checkedKeys(matrix.allow());
        Set<String> denyKeys = checkedKeys(matrix.deny());

        Set<String> conflicts = new LinkedHashSet<>(allowKeys);
        conflicts.retainAll(denyKeys);
        if (!conflicts.isEmpty()) {
            throw new AmbiguousFieldPolicyException(subject, conflicts);
        }

        Set<PolicyRule> rules = new LinkedHashSet<>();
        for (String key : allowKeys) {
            rules.add(PolicyRule.allow(subject, PermissionCodec.decode(key, 3)));
        }
        for (String key : denyKeys) {
            rules.add(PolicyRule.deny(subject, PermissionCodec.decode(key, 3)));
        }
        return rules;
    }

    private static Set<String> checkedKeys(List<FieldPolicyRow> rows) {
        Set<String> keys = new LinkedHashSet<>();
        for (FieldPolicyRow row : rows) {
            if (row.checked()) {
                keys.add(row.rol());
            }
        }
        return keys;
    }
}
