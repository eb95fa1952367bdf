package com.example.policy.config.properties;

import com.example.policy.admin.model.AdminNodeKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Declarative admin hierarchy for services that do not provide their own {@code AdminNode} tree.
 */
@ConfigurationProperties(prefix = "app.admin.site")
public record AdminSiteProperties(
        String id,
        List<NodeProperties> nodes
) {
    public AdminSiteProperties {
        if (id == null || id.isBlank()) {
            id = "admin";
        }
        if (nodes == null) {
            nodes = List.of();
        }
    }

    public record NodeProperties(
            String id,
            String label,
            Integer sort,
            AdminNodeKind kind,
            Map<String, String> actions,
            List<NodeProperties> children
    ) {
        public NodeProperties {
            if (kind == null) {
                kind = children != null && !children.isEmpty() ? AdminNodeKind.GROUP : AdminNodeKind.PAGE;
            }
            if (actions == null) {
                actions = Map.of();
            }
            if (children == null) {
                children = List.of();
            }
        }
    }
}
