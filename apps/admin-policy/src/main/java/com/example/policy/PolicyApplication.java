package com.example.policy;

import com.example.policy.config.properties.AdminSiteProperties;
import com.example.policy.config.properties.CapabilityCacheProperties;
import com.example.policy.config.properties.PolicyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        PolicyProperties.class,
        CapabilityCacheProperties.class,
        AdminSiteProperties.class
})
public class PolicyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyApplication.class, args);
    }

}
