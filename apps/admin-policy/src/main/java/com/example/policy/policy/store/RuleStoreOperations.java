package com.example.policy.policy.store;

import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;

/**
 * Asynchronous access to the rule engine's policy store.
 * Rows are positional: {@code [subject, v1, v2, v3, eft]} for policies and
 * {@code [parent, child]} for grouping namespaces.
 */
public interface RuleStoreOperations {

    /**
     * Live evaluation of a request against the stored policies.
     */
    @NonNull
    Mono<Boolean> enforce(@NonNull String subject, @NonNull List<String> fields);

    /**
     * Policies whose fields starting at {@code fieldIndex} match the given values; an empty value matches anything.
     */
    @NonNull
    Mono<List<List<String>>> getFilteredPolicy(int fieldIndex, @NonNull String... fieldValues);

    /**
     * Policies of the subject and of every role it inherits.
     */
    @NonNull
    Mono<List<List<String>>> getImplicitPermissionsForUser(@NonNull String subject);

    /**
     * Add policies; rules already present are skipped.
     *
     * @return number of rules actually added
     */
    @NonNull
    Mono<Integer> addPolicies(@NonNull Collection<List<String>> rules);

    /**
     * Remove policies; rules no longer present are skipped, never failing the batch.
     *
     * @return number of rules actually removed
     */
    @NonNull
    Mono<Integer> removePolicies(@NonNull Collection<List<String>> rules);

    @NonNull
    Mono<List<List<String>>> getFilteredNamedGroupingPolicy(
            @NonNull String namespace, int fieldIndex, @NonNull String... fieldValues);

    /**
     * Add grouping edges; edges already present are skipped.
     */
    @NonNull
    Mono<Integer> addNamedGroupingPolicies(@NonNull String namespace, @NonNull Collection<List<String>> rules);

    /**
     * Remove grouping edges; edges no longer present are skipped.
     */
    @NonNull
    Mono<Integer> removeNamedGroupingPolicies(@NonNull String namespace, @NonNull Collection<List<String>> rules);

    /**
     * Remove every role edge of the subject in the {@code g} namespace.
     */
    @NonNull
    Mono<Boolean> deleteRolesForUser(@NonNull String subject);
}
