package com.example.policy.config.properties;

import com.example.policy.common.PolicyConstants;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.policy")
public record PolicyProperties(
        String rootSubject,
        Boolean syncHierarchyOnStartup,
        CasbinProperties casbin
) {
    public PolicyProperties {
        if (rootSubject == null || rootSubject.isBlank()) {
            rootSubject = PolicyConstants.USER_PREFIX + "root";
        }
        if (syncHierarchyOnStartup == null) {
            syncHierarchyOnStartup = true;
        }
        if (casbin == null) {
            casbin = new CasbinProperties(null, null);
        }
    }

    public record CasbinProperties(
            String modelLocation,
            String policyLocation
    ) {
        public CasbinProperties {
            if (modelLocation == null || modelLocation.isBlank()) {
                modelLocation = "classpath:casbin/model.conf";
            }
        }
    }

    public static PolicyProperties defaults() {
        return new PolicyProperties(null, null, null);
    }
}
