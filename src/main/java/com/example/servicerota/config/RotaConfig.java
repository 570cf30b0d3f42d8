package com.example.servicerota.config;

import com.example.servicerota.availability.CoverageChecker;
import com.example.servicerota.role.RoleDefinitions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RotaConfig {

    /**
     * 役割定義（優先順）
     */
    @Bean
    public RoleDefinitions roleDefinitions() {
        return RoleDefinitions.standard();
    }

    @Bean
    public CoverageChecker coverageChecker(RotaSettings settings) {
        return new CoverageChecker(settings.getCoverageLimitedThreshold());
    }
}
