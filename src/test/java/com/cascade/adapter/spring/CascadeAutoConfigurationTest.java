package com.cascade.adapter.spring;

import com.cascade.config.CascadeConfig;
import com.cascade.core.TriggerProcessor;
import com.cascade.dispatch.InMemoryWorkItemGateway;
import com.cascade.dispatch.PatchRequest;
import com.cascade.dispatch.WorkItemGateway;
import com.cascade.engine.RuleEngine;
import com.cascade.model.WorkItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CascadeAutoConfiguration.
 */
class CascadeAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(CascadeAutoConfiguration.class)
            .withPropertyValues("cascade.config-path=classpath:cascade-test.yaml");

    @Test
    @DisplayName("Should create the processing beans from the configured file")
    void shouldCreateBeans() {
        contextRunner.run(context -> {
            assertEquals("test-cascade", context.getBean(CascadeConfig.class).name());
            assertNotNull(context.getBean(RuleEngine.class));
            assertNotNull(context.getBean(TriggerProcessor.class));
            assertInstanceOf(InMemoryWorkItemGateway.class, context.getBean(WorkItemGateway.class));
        });
    }

    @Test
    @DisplayName("Should use an application-provided gateway")
    void shouldBackOffForCustomGateway() {
        contextRunner
                .withBean(WorkItemGateway.class, NoOpGateway::new)
                .run(context -> assertInstanceOf(NoOpGateway.class, context.getBean(WorkItemGateway.class)));
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBeDisabled() {
        contextRunner
                .withPropertyValues("cascade.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(TriggerProcessor.class).isEmpty()));
    }

    @Test
    @DisplayName("Should fail to start with a broken configuration path")
    void shouldFailForMissingConfiguration() {
        contextRunner
                .withPropertyValues("cascade.config-path=classpath:missing.yaml")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    static class NoOpGateway implements WorkItemGateway {

        @Override
        public Optional<WorkItem> getWorkItem(String url) {
            return Optional.empty();
        }

        @Override
        public void patch(PatchRequest request) {
        }
    }
}
