package com.dredd.adapter.spring;

import com.dredd.config.ConfigLoader;
import com.dredd.config.RuleEngineConfig;
import com.dredd.core.RuleRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration for the rule engine.
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "dredd", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RuleEngineProperties.class)
public class RuleEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RuleEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RuleEngineConfig ruleEngineConfig(RuleEngineProperties properties) {
        if (properties.getConfigPath() == null || properties.getConfigPath().isBlank()) {
            log.info("No dredd.config-path set, using default rule engine configuration");
            return RuleEngineConfig.defaults();
        }
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleRunner ruleRunner(RuleEngineConfig config) {
        log.info("Creating RuleRunner: {}", config.name());
        return new RuleRunner(config);
    }
}
