package com.example.policy.policy.config;

import com.example.policy.config.properties.PolicyProperties;
import lombok.extern.slf4j.Slf4j;
import org.casbin.jcasbin.main.SyncedEnforcer;
import org.casbin.jcasbin.model.Model;
import org.casbin.jcasbin.persist.file_adapter.FileAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Creates the jCasbin enforcer that backs the rule store.
 * The model is read from {@code app.policy.casbin.model-location}; an optional CSV policy
 * seeds the in-memory store. Auto-save is off, the enforcer itself is the store of record.
 */
@Slf4j
@Configuration
public class CasbinConfig {

    @Bean
    public SyncedEnforcer casbinEnforcer(PolicyProperties properties, ResourceLoader resourceLoader)
            throws IOException {
        PolicyProperties.CasbinProperties casbin = properties.casbin();
        Model model = loadModel(resourceLoader.getResource(casbin.modelLocation()));

        SyncedEnforcer enforcer;
        Resource policy = casbin.policyLocation() != null
                ? resourceLoader.getResource(casbin.policyLocation())
                : null;
        if (policy != null && policy.exists()) {
            try (InputStream in = policy.getInputStream()) {
                enforcer = new SyncedEnforcer(model, new FileAdapter(in));
            }
            log.info("Casbin enforcer initialized from {} with seed policy {} ({} rules)",
                    casbin.modelLocation(), casbin.policyLocation(), enforcer.getPolicy().size());
        } else {
            enforcer = new SyncedEnforcer(model);
            log.info("Casbin enforcer initialized from {} with an empty policy", casbin.modelLocation());
        }
        enforcer.enableAutoSave(false);
        return enforcer;
    }

    public static Model loadModel(Resource resource) throws IOException {
        if (!resource.exists()) {
            throw new IllegalStateException("Casbin model not found: " + resource.getDescription());
        }
        Model model = new Model();
        model.loadModelFromText(resource.getContentAsString(StandardCharsets.UTF_8));
        return model;
    }
}
