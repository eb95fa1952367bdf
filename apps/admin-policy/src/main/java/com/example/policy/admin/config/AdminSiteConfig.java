package com.example.policy.admin.config;

import com.example.policy.admin.model.AdminNode;
import com.example.policy.admin.model.SimpleAdminNode;
import com.example.policy.config.properties.AdminSiteProperties;
import com.example.policy.config.properties.AdminSiteProperties.NodeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the admin hierarchy from {@code app.admin.site} when the enclosing service
 * does not register its own {@link AdminNode} root.
 */
@Slf4j
@Configuration
public class AdminSiteConfig {

    @Bean
    @ConditionalOnMissingBean(AdminNode.class)
    public AdminNode adminSite(AdminSiteProperties properties) {
        SimpleAdminNode site = SimpleAdminNode.site(properties.id());
        for (NodeProperties node : properties.nodes()) {
            site.addChild(toNode(node));
        }
        log.info("Configured admin site '{}' with {} top-level nodes", properties.id(), properties.nodes().size());
        return site;
    }

    static SimpleAdminNode toNode(NodeProperties properties) {
        if (properties.id() == null || properties.id().isBlank()) {
            throw new IllegalArgumentException("Admin node id is required (label=" + properties.label() + ")");
        }
        SimpleAdminNode node = SimpleAdminNode.of(
                properties.id(), properties.kind(), properties.label(), properties.sort());
        properties.actions().forEach(node::withAction);
        for (NodeProperties child : properties.children()) {
            node.addChild(toNode(child));
        }
        return node;
    }
}
