package com.example.policy.policy.service;

import com.example.policy.common.exception.MalformedPermissionKeyException;
import com.example.policy.observability.PolicyMetrics;
import com.example.policy.policy.model.GroupingRelation;
import com.example.policy.policy.store.RuleStoreOperations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SubjectPolicyService")
class SubjectPolicyServiceTest {

    private static final String SUBJECT = "u:alice";

    @Mock
    private RuleStoreOperations ruleStore;

    private SimpleMeterRegistry registry;
    private SubjectPolicyService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new SubjectPolicyService(ruleStore, new PolicyMetrics(registry));
    }

    @Nested
    @DisplayName("getSubjectPermissions")
    class GetSubjectPermissions {

        @Test
        @DisplayName("should encode direct page rules from the first domain field")
        void shouldEncodeDirectRules() {
            when(ruleStore.getFilteredPolicy(0, SUBJECT, "", "", "page")).thenReturn(Mono.just(List.of(
                    List.of(SUBJECT, "users", "admin:page", "page", "allow"),
                    List.of(SUBJECT, "users", "admin:list", "page", "allow"))));

            StepVerifier.create(service.getSubjectPermissions(SUBJECT, false))
                    .expectNext(List.of("users#admin:page#page#allow", "users#admin:list#page#allow"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should keep only inherited page rules and drop duplicates")
        void shouldFilterImplicitRules() {
            when(ruleStore.getImplicitPermissionsForUser(SUBJECT)).thenReturn(Mono.just(List.of(
                    List.of(SUBJECT, "users", "admin:page", "page", "allow"),
                    List.of("r:viewer", "users", "admin:page", "page", "allow"),
                    List.of("r:viewer", "users", "page:list", "password", "deny"))));

            StepVerifier.create(service.getSubjectPermissions(SUBJECT, true))
                    .expectNext(List.of("users#admin:page#page#allow"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("updateSubjectPermissions")
    class UpdateSubjectPermissions {

        @Test
        @DisplayName("should not write anything when stored rules already match")
        void shouldSkipUnchanged() {
            when(ruleStore.getFilteredPolicy(0, SUBJECT, "", "", "page")).thenReturn(Mono.just(List.of(
                    List.of(SUBJECT, "users", "admin:page", "page", "allow"))));

            StepVerifier.create(service.updateSubjectPermissions(SUBJECT, List.of("users#admin:page#page")))
                    .expectNext(List.of("users#admin:page#page"))
                    .verifyComplete();

            verify(ruleStore, never()).addPolicies(anyCollection());
            verify(ruleStore, never()).removePolicies(anyCollection());
        }

        @Test
        @DisplayName("should remove stale rules and add missing ones")
        void shouldApplyDifference() {
            when(ruleStore.getFilteredPolicy(0, SUBJECT, "", "", "page")).thenReturn(Mono.just(List.of(
                    List.of(SUBJECT, "users", "admin:page", "page", "allow"),
                    List.of(SUBJECT, "roles", "admin:page", "page", "allow"))));
            when(ruleStore.removePolicies(List.of(List.of(SUBJECT, "roles", "admin:page", "page", "allow"))))
                    .thenReturn(Mono.just(1));
            when(ruleStore.addPolicies(List.of(List.of(SUBJECT, "users", "admin:list", "page", "allow"))))
                    .thenReturn(Mono.just(1));

            StepVerifier.create(service.updateSubjectPermissions(SUBJECT,
                            List.of("users#admin:page#page", "users#admin:list#page")))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(registry.get("policy.rules.added").tag("kind", "page").counter().count()).isEqualTo(1.0);
            assertThat(registry.get("policy.rules.removed").tag("kind", "page").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail before touching the store when a key is malformed")
        void shouldRejectMalformedKey() {
            StepVerifier.create(service.updateSubjectPermissions(SUBJECT, List.of("users#admin:page")))
                    .expectError(MalformedPermissionKeyException.class)
                    .verify();

            verifyNoInteractions(ruleStore);
        }
    }

    @Nested
    @DisplayName("updateSubjectRoles")
    class UpdateSubjectRoles {

        @Test
        @DisplayName("should replace the roles of the subject")
        void shouldReplaceRoles() {
            when(ruleStore.deleteRolesForUser(SUBJECT)).thenReturn(Mono.just(true));
            when(ruleStore.addNamedGroupingPolicies("g",
                    List.of(List.of(SUBJECT, "r:editor"), List.of(SUBJECT, "r:viewer"))))
                    .thenReturn(Mono.just(2));

            StepVerifier.create(service.updateSubjectRoles(SUBJECT, "editor, viewer"))
                    .assertNext(roles -> assertThat(roles).containsExactly(
                            new GroupingRelation(SUBJECT, "r:editor"),
                            new GroupingRelation(SUBJECT, "r:viewer")))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should only clear roles when no role keys are given")
        void shouldClearRoles() {
            when(ruleStore.deleteRolesForUser(SUBJECT)).thenReturn(Mono.just(true));

            StepVerifier.create(service.updateSubjectRoles(SUBJECT, null))
                    .assertNext(roles -> assertThat(roles).isEmpty())
                    .verifyComplete();

            verify(ruleStore, never()).addNamedGroupingPolicies(anyString(), anyCollection());
        }
    }

    @Nested
    @DisplayName("parseRoles")
    class ParseRoles {

        @Test
        @DisplayName("should trim keys and skip blanks")
        void shouldTrimAndSkipBlanks() {
            assertThat(SubjectPolicyService.parseRoles(SUBJECT, " a ,, b,  "))
                    .containsExactly(new GroupingRelation(SUBJECT, "r:a"), new GroupingRelation(SUBJECT, "r:b"));
        }

        @Test
        @DisplayName("should drop a role pointing at the subject itself")
        void shouldDropSelfRole() {
            assertThat(SubjectPolicyService.parseRoles("r:admin", "admin,auditor"))
                    .containsExactly(new GroupingRelation("r:admin", "r:auditor"));
        }

        @Test
        @DisplayName("should return no roles for an empty string")
        void shouldHandleEmptyString() {
            assertThat(SubjectPolicyService.parseRoles(SUBJECT, "")).isEmpty();
        }
    }
}
