package com.cascade.adapter.spring;

import com.cascade.config.CascadeConfig;
import com.cascade.config.ConfigLoader;
import com.cascade.core.TriggerProcessor;
import com.cascade.dispatch.DispatchBatcher;
import com.cascade.dispatch.InMemoryWorkItemGateway;
import com.cascade.dispatch.UpdateDispatcher;
import com.cascade.dispatch.WorkItemGateway;
import com.cascade.engine.DefaultRuleEngine;
import com.cascade.engine.RuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Cascade.
 */
@Configuration
@ConditionalOnProperty(prefix = "cascade", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CascadeProperties.class)
public class CascadeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CascadeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CascadeConfig cascadeConfig(CascadeProperties properties) {
        log.info("Loading Cascade configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleEngine ruleEngine() {
        return new DefaultRuleEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchBatcher dispatchBatcher() {
        return new DispatchBatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkItemGateway workItemGateway() {
        log.warn("No WorkItemGateway defined, using an in-memory work item store");
        return new InMemoryWorkItemGateway();
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateDispatcher updateDispatcher(WorkItemGateway gateway, DispatchBatcher batcher) {
        return new UpdateDispatcher(gateway, batcher);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerProcessor triggerProcessor(CascadeConfig config, RuleEngine ruleEngine,
                                             WorkItemGateway gateway, UpdateDispatcher dispatcher) {
        log.info("Creating TriggerProcessor: {} v{} with {} rules",
                config.name(), config.version(), config.rules().size());
        return new TriggerProcessor(config.rules(), config.parentTypes(), ruleEngine, gateway, dispatcher);
    }
}
