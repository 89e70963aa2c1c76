package com.pipe.adapter.spring;

import com.pipe.condition.ConditionRegistry;
import com.pipe.condition.DefaultConditionRegistry;
import com.pipe.config.ConfigLoader;
import com.pipe.config.SchedulerConfig;
import com.pipe.tick.DefaultTickEvaluator;
import com.pipe.tick.TickEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the condition engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "pipe", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ConditionProperties.class)
public class ConditionAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConditionAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public ConditionRegistry conditionRegistry() {
        return DefaultConditionRegistry.withDefaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerConfig schedulerConfig(ConditionProperties properties, ConditionRegistry registry) {
        return ConfigLoader.load(properties.getConfigPath(), registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock conditionClock(SchedulerConfig config) {
        log.info("Condition clock uses zone {}", config.zone());
        return Clock.system(config.zone());
    }

    @Bean
    @ConditionalOnMissingBean
    public TickEvaluator tickEvaluator(SchedulerConfig config) {
        log.info("Creating TickEvaluator: {}", config.name());
        return new DefaultTickEvaluator(config);
    }
}
