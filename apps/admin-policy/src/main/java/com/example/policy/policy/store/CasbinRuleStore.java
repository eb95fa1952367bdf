package com.example.policy.policy.store;

import com.example.policy.common.PolicyConstants;
import com.example.policy.common.exception.RuleStoreException;
import lombok.extern.slf4j.Slf4j;
import org.casbin.jcasbin.main.Enforcer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * {@link RuleStoreOperations} backed by a jCasbin enforcer.
 * Enforcer calls block, so they run on the bounded elastic scheduler.
 * Batch writes are narrowed to the rules that actually change, because jCasbin
 * rejects a whole batch when part of it is already present (add) or absent (remove).
 */
@Slf4j
@Service
public class CasbinRuleStore implements RuleStoreOperations {

    private final Enforcer enforcer;
    private final Scheduler scheduler;

    @Autowired
    public CasbinRuleStore(Enforcer enforcer) {
        this(enforcer, Schedulers.boundedElastic());
    }

    public CasbinRuleStore(Enforcer enforcer, Scheduler scheduler) {
        this.enforcer = enforcer;
        this.scheduler = scheduler;
    }

    @Override
    @NonNull
    public Mono<Boolean> enforce(@NonNull String subject, @NonNull List<String> fields) {
        return call("enforce", () -> {
            Object[] request = new Object[fields.size() + 1];
            request[0] = subject;
            for (int i = 0; i < fields.size(); i++) {
                request[i + 1] = fields.get(i);
            }
            boolean allowed = enforcer.enforce(request);
            log.debug("Enforce subject={} fields={} -> {}", subject, fields, allowed);
            return allowed;
        });
    }

    @Override
    @NonNull
    public Mono<List<List<String>>> getFilteredPolicy(int fieldIndex, @NonNull String... fieldValues) {
        return call("getFilteredPolicy", () -> copy(enforcer.getFilteredPolicy(fieldIndex, fieldValues)));
    }

    @Override
    @NonNull
    public Mono<List<List<String>>> getImplicitPermissionsForUser(@NonNull String subject) {
        return call("getImplicitPermissionsForUser", () -> copy(enforcer.getImplicitPermissionsForUser(subject)));
    }

    @Override
    @NonNull
    public Mono<Integer> addPolicies(@NonNull Collection<List<String>> rules) {
        return call("addPolicies", () -> {
            List<List<String>> missing = new ArrayList<>();
            for (List<String> rule : rules) {
                if (!enforcer.hasPolicy(rule) && !missing.contains(rule)) {
                    missing.add(new ArrayList<>(rule));
                }
            }
            if (missing.size() < rules.size()) {
                log.debug("Skipping {} policies already present", rules.size() - missing.size());
            }
            if (!missing.isEmpty() && !enforcer.addPolicies(missing)) {
                throw new RuleStoreException("addPolicies", "enforcer rejected " + missing.size() + " rules");
            }
            return missing.size();
        });
    }

    @Override
    @NonNull
    public Mono<Integer> removePolicies(@NonNull Collection<List<String>> rules) {
        return call("removePolicies", () -> {
            List<List<String>> present = new ArrayList<>();
            for (List<String> rule : rules) {
                if (enforcer.hasPolicy(rule) && !present.contains(rule)) {
                    present.add(new ArrayList<>(rule));
                }
            }
            if (present.size() < rules.size()) {
                log.warn("Skipping {} policies no longer present in the store", rules.size() - present.size());
            }
            if (!present.isEmpty() && !enforcer.removePolicies(present)) {
                throw new RuleStoreException("removePolicies", "enforcer rejected " + present.size() + " rules");
            }
            return present.size();
        });
    }

    @Override
    @NonNull
    public Mono<List<List<String>>> getFilteredNamedGroupingPolicy(
            @NonNull String namespace, int fieldIndex, @NonNull String... fieldValues) {
        return call("getFilteredNamedGroupingPolicy",
                () -> copy(enforcer.getFilteredNamedGroupingPolicy(namespace, fieldIndex, fieldValues)));
    }

    @Override
    @NonNull
    public Mono<Integer> addNamedGroupingPolicies(
            @NonNull String namespace, @NonNull Collection<List<String>> rules) {
        return call("addNamedGroupingPolicies", () -> {
            List<List<String>> missing = new ArrayList<>();
            for (List<String> rule : rules) {
                if (!enforcer.hasNamedGroupingPolicy(namespace, rule) && !missing.contains(rule)) {
                    missing.add(new ArrayList<>(rule));
                }
            }
            if (!missing.isEmpty() && !enforcer.addNamedGroupingPolicies(namespace, missing)) {
                throw new RuleStoreException("addNamedGroupingPolicies",
                        "enforcer rejected " + missing.size() + " " + namespace + " edges");
            }
            return missing.size();
        });
    }

    @Override
    @NonNull
    public Mono<Integer> removeNamedGroupingPolicies(
            @NonNull String namespace, @NonNull Collection<List<String>> rules) {
        return call("removeNamedGroupingPolicies", () -> {
            List<List<String>> present = new ArrayList<>();
            for (List<String> rule : rules) {
                if (enforcer.hasNamedGroupingPolicy(namespace, rule) && !present.contains(rule)) {
                    present.add(new ArrayList<>(rule));
                }
            }
            if (present.size() < rules.size()) {
                log.warn("Skipping {} {} edges no longer present in the store",
                        rules.size() - present.size(), namespace);
            }
            if (!present.isEmpty() && !enforcer.removeNamedGroupingPolicies(namespace, present)) {
                throw new RuleStoreException("removeNamedGroupingPolicies",
                        "enforcer rejected " + present.size() + " " + namespace + " edges");
            }
            return present.size();
        });
    }

    @Override
    @NonNull
    public Mono<Boolean> deleteRolesForUser(@NonNull String subject) {
        return call("deleteRolesForUser", () -> {
            boolean hadRoles = !enforcer.getFilteredNamedGroupingPolicy(
                    PolicyConstants.ROLE_GROUPING, 0, subject).isEmpty();
            if (hadRoles) {
                enforcer.deleteRolesForUser(subject);
            }
            return hadRoles;
        });
    }

    private <T> Mono<T> call(String operation, Callable<T> callable) {
        return Mono.fromCallable(callable)
                .subscribeOn(scheduler)
                .onErrorMap(e -> !(e instanceof RuleStoreException), e -> new RuleStoreException(operation, e));
    }

    private static List<List<String>> copy(List<List<String>> rows) {
        List<List<String>> result = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            result.add(List.copyOf(row));
        }
        return result;
    }
}
