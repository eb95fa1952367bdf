package com.example.policy.policy.service;

import com.example.policy.observability.PolicyMetrics;
import com.example.policy.util.CasbinTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.casbin.jcasbin.main.SyncedEnforcer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Reconciliation against an in-memory jCasbin enforcer.
 */
@DisplayName("SubjectPolicyService with jCasbin")
class SubjectPolicyReconciliationTest {

    private SyncedEnforcer enforcer;
    private SubjectPolicyService service;

    @BeforeEach
    void setUp() {
        enforcer = CasbinTestSupport.newEnforcer();
        service = new SubjectPolicyService(
                CasbinTestSupport.newRuleStore(enforcer),
                new PolicyMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("should leave exactly the requested roles")
    void shouldReplaceRoles() {
        enforcer.addNamedGroupingPolicy("g", "u:x", "r:a");
        enforcer.addNamedGroupingPolicy("g", "u:x", "r:b");
        enforcer.addNamedGroupingPolicy("g", "u:y", "r:a");

        StepVerifier.create(service.updateSubjectRoles("u:x", "b,c"))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(enforcer.getFilteredNamedGroupingPolicy("g", 0, "u:x"))
                .containsExactlyInAnyOrder(List.of("u:x", "r:b"), List.of("u:x", "r:c"));
        assertThat(enforcer.getFilteredNamedGroupingPolicy("g", 0, "u:y"))
                .containsExactly(List.of("u:y", "r:a"));
    }

    @Test
    @DisplayName("should reconcile page rules without touching field rules")
    void shouldReconcilePageRules() {
        enforcer.addPolicy("u:x", "users", "admin:page", "page", "allow");
        enforcer.addPolicy("u:x", "roles", "admin:page", "page", "allow");
        enforcer.addPolicy("u:x", "users", "page:list", "email", "deny");

        StepVerifier.create(service.updateSubjectPermissions("u:x",
                        List.of("users#admin:page#page", "users#admin:list#page")))
                .expectNextCount(1)
                .verifyComplete();

        assertThat(enforcer.getFilteredPolicy(0, "u:x")).containsExactlyInAnyOrder(
                List.of("u:x", "users", "admin:page", "page", "allow"),
                List.of("u:x", "users", "admin:list", "page", "allow"),
                List.of("u:x", "users", "page:list", "email", "deny"));
    }

    @Test
    @DisplayName("should clear every page rule for an empty permission list")
    void shouldClearPageRules() {
        enforcer.addPolicy("u:x", "users", "admin:page", "page", "allow");

        StepVerifier.create(service.updateSubjectPermissions("u:x", List.of()))
                .expectNext(List.of())
                .verifyComplete();

        assertThat(enforcer.getFilteredPolicy(0, "u:x")).isEmpty();
    }

    @Test
    @DisplayName("should include page rules inherited through roles in implicit mode")
    void shouldListImplicitPermissions() {
        enforcer.addPolicy("r:viewer", "users", "admin:page", "page", "allow");
        enforcer.addPolicy("u:x", "roles", "admin:page", "page", "allow");
        enforcer.addNamedGroupingPolicy("g", "u:x", "r:viewer");

        StepVerifier.create(service.getSubjectPermissions("u:x", true))
                .assertNext(permissions -> assertThat(permissions).containsExactlyInAnyOrder(
                        "roles#admin:page#page#allow", "users#admin:page#page#allow"))
                .verifyComplete();

        StepVerifier.create(service.getSubjectPermissions("u:x", false))
                .expectNext(List.of("roles#admin:page#page#allow"))
                .verifyComplete();
    }
}
