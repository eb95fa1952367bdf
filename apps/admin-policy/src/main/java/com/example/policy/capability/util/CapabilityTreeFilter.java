package com.example.policy.capability.util;

import com.example.policy.capability.model.CapabilityOption;
import org.springframework.lang.NonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Pure functions over capability option trees.
 */
public final class CapabilityTreeFilter {

    private CapabilityTreeFilter() {}

    /**
     * Keep the options accepted by the predicate, recursing into the children of kept options.
     * A kept option whose children are all rejected becomes a leaf. Sibling order is preserved
     * and the input tree is never modified.
     */
    @NonNull
    public static List<CapabilityOption> filter(
            @NonNull List<CapabilityOption> options,
            @NonNull Predicate<CapabilityOption> predicate) {
        List<CapabilityOption> result = new ArrayList<>();
        for (CapabilityOption option : options) {
            if (!predicate.test(option)) {
                continue;
            }
            if (option.hasChildren()) {
                option = option.withChildren(filter(option.children(), predicate));
            }
            result.add(option);
        }
        return List.copyOf(result);
    }

    /**
     * All option values of the tree in depth-first order, without duplicates.
     */
    @NonNull
    public static Set<String> collectValues(@NonNull List<CapabilityOption> options) {
        Set<String> values = new LinkedHashSet<>();
        collect(options, values);
        return values;
    }

    private static void collect(List<CapabilityOption> options, Set<String> values) {
        for (CapabilityOption option : options) {
            values.add(option.value());
            if (option.hasChildren()) {
                collect(option.children(), values);
            }
        }
    }
}
