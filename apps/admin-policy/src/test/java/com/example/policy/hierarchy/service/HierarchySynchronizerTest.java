package com.example.policy.hierarchy.service;

import com.example.policy.admin.model.SimpleAdminNode;
import com.example.policy.observability.PolicyMetrics;
import com.example.policy.policy.model.GroupingRelation;
import com.example.policy.util.CasbinTestSupport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.casbin.jcasbin.main.SyncedEnforcer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.example.policy.util.AdminSiteTestBuilder.anAdminSite;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HierarchySynchronizer")
class HierarchySynchronizerTest {

    @Nested
    @DisplayName("deriveRelations")
    class DeriveRelations {

        @Test
        @DisplayName("should link every node to its owning group depth-first")
        void shouldDeriveEdges() {
            assertThat(HierarchySynchronizer.deriveRelations(anAdminSite().build())).containsExactly(
                    new GroupingRelation("admin", "users"),
                    new GroupingRelation("admin", "system"),
                    new GroupingRelation("system", "settings"),
                    new GroupingRelation("system", "audit"),
                    new GroupingRelation("admin", "hidden"),
                    new GroupingRelation("admin", "reports"));
        }

        @Test
        @DisplayName("should produce no edges for an empty site")
        void shouldHandleEmptySite() {
            assertThat(HierarchySynchronizer.deriveRelations(SimpleAdminNode.site("admin"))).isEmpty();
        }
    }

    @Nested
    @DisplayName("sync")
    class Sync {

        private SyncedEnforcer enforcer;
        private SimpleMeterRegistry registry;
        private HierarchySynchronizer synchronizer;

        @BeforeEach
        void setUp() {
            enforcer = CasbinTestSupport.newEnforcer();
            registry = new SimpleMeterRegistry();
            synchronizer = new HierarchySynchronizer(
                    CasbinTestSupport.newRuleStore(enforcer), new PolicyMetrics(registry));
        }

        @Test
        @DisplayName("should remove stale edges and add only missing ones")
        void shouldSyncIncrementally() {
            enforcer.addNamedGroupingPolicy("g2", "admin", "users");
            enforcer.addNamedGroupingPolicy("g2", "admin", "legacy");

            StepVerifier.create(synchronizer.sync(anAdminSite().build()))
                    .assertNext(diff -> {
                        assertThat(diff.toRemove()).containsExactly(new GroupingRelation("admin", "legacy"));
                        assertThat(diff.toAdd()).hasSize(5).doesNotContain(new GroupingRelation("admin", "users"));
                    })
                    .verifyComplete();

            assertThat(enforcer.getNamedGroupingPolicy("g2")).hasSize(6)
                    .contains(List.of("system", "settings"))
                    .doesNotContain(List.of("admin", "legacy"));
            assertThat(registry.get("policy.rules.added").tag("kind", "grouping").counter().count())
                    .isEqualTo(5.0);
        }

        @Test
        @DisplayName("should leave role edges untouched")
        void shouldIgnoreRoleNamespace() {
            enforcer.addNamedGroupingPolicy("g", "u:x", "r:admin");

            StepVerifier.create(synchronizer.sync(anAdminSite().build()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(enforcer.getNamedGroupingPolicy("g")).containsExactly(List.of("u:x", "r:admin"));
        }

        @Test
        @DisplayName("should apply nothing on a second run")
        void shouldBeIdempotent() {
            SimpleAdminNode site = anAdminSite().build();
            synchronizer.sync(site).block();

            StepVerifier.create(synchronizer.sync(site))
                    .assertNext(diff -> assertThat(diff.isEmpty()).isTrue())
                    .verifyComplete();
        }
    }
}
