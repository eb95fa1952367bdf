package com.example.policy.capability.service;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.capability.model.CapabilityOption;
import com.example.policy.capability.util.CapabilityTreeFilter;
import com.example.policy.config.properties.PolicyProperties;
import com.example.policy.permission.model.PermissionKey;
import com.example.policy.policy.store.RuleStoreOperations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Page/action options a subject may see. The root subject gets the whole tree.
 */
@Slf4j
@Service
public class CapabilityOptionService {

    private final CapabilityTreeCache treeCache;
    private final RuleStoreOperations ruleStore;
    private final AdminNode adminSite;
    private final String rootSubject;

    public CapabilityOptionService(
            CapabilityTreeCache treeCache,
            RuleStoreOperations ruleStore,
            AdminNode adminSite,
            PolicyProperties properties) {
        this.treeCache = treeCache;
        this.ruleStore = ruleStore;
        this.adminSite = adminSite;
        this.rootSubject = properties.rootSubject();
    }

    /**
     * All options of the configured admin site.
     */
    @NonNull
    public List<CapabilityOption> getAllOptions() {
        return treeCache.get(adminSite);
    }

    @NonNull
    public Mono<List<CapabilityOption>> getOptionsForSubject(@NonNull String subject) {
        return getOptionsForSubject(subject, adminSite);
    }

    /**
     * Options of the given root filtered to those the subject is granted.
     * Every distinct option value is enforced once, then the tree is filtered synchronously.
     */
    @NonNull
    public Mono<List<CapabilityOption>> getOptionsForSubject(@NonNull String subject, @NonNull AdminNode root) {
        List<CapabilityOption> options = treeCache.get(root);
        if (rootSubject.equals(subject)) {
            return Mono.just(options);
        }
        return Flux.fromIterable(CapabilityTreeFilter.collectValues(options))
                .flatMap(value -> enforcePermission(subject, value)
                        .filter(Boolean::booleanValue)
                        .map(allowed -> value))
                .collect(Collectors.toSet())
                .map(granted -> {
                    log.debug("Subject {} granted {} option values", subject, granted.size());
                    return CapabilityTreeFilter.filter(options, option -> granted.contains(option.value()));
                });
    }

    /**
     * Evaluate one encoded permission for the subject.
     */
    @NonNull
    public Mono<Boolean> enforcePermission(@NonNull String subject, @NonNull String permission) {
        return Mono.fromCallable(() -> PermissionKey.parse(permission).fields())
                .flatMap(fields -> ruleStore.enforce(subject, fields));
    }
}
