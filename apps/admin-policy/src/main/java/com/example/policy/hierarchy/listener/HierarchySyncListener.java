package com.example.policy.hierarchy.listener;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.config.properties.PolicyProperties;
import com.example.policy.hierarchy.service.HierarchySynchronizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the hierarchy synchronization once the application is ready, unless
 * {@code app.policy.sync-hierarchy-on-startup} is false.
 * A failure is logged and does not stop the application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HierarchySyncListener {

    private static final Duration SYNC_TIMEOUT = Duration.ofSeconds(30);

    private final HierarchySynchronizer synchronizer;
    private final AdminNode adminSite;
    private final PolicyProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.syncHierarchyOnStartup()) {
            log.debug("Startup hierarchy sync disabled");
            return;
        }
        synchronizer.sync(adminSite)
                .timeout(SYNC_TIMEOUT)
                .subscribe(
                        diff -> log.debug("Startup hierarchy sync applied: {}", diff),
                        e -> log.warn("Startup hierarchy sync failed, continuing without it: {}", e.getMessage())
                );
    }
}
