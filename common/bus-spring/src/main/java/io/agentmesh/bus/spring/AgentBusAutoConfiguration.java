package io.agentmesh.bus.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.runtime.AgentBusController;
import io.agentmesh.bus.runtime.BacklogPump;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration that exposes an {@link AgentBusController} built from {@code agentmesh.bus.*}
 * properties and registers the context's {@link Agent} beans with it.
 */
@AutoConfiguration(afterName = {
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
    "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"
})
@ConditionalOnClass(AgentBusController.class)
@ConditionalOnProperty(prefix = "agentmesh.bus", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(AgentBusProperties.class)
public class AgentBusAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AgentBusAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    AgentBusController agentBusController(AgentBusProperties properties,
                                          ObjectProvider<MeterRegistry> meterRegistry,
                                          ObjectProvider<ObjectMapper> objectMapper,
                                          ObjectProvider<Clock> clock) {
        AgentBusController controller = new AgentBusController(
            properties.toSettings(),
            clock.getIfAvailable(Clock::systemUTC),
            meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
            objectMapper.getIfAvailable(ObjectMapper::new));
        log.info("Agent bus configured (failureThreshold={}, dispatchTimeout={})",
            properties.getFailureThreshold(), properties.getDispatchTimeout());
        return controller;
    }

    @Bean
    AgentBeanRegistrar agentBusAgentRegistrar(AgentBusController controller, ObjectProvider<Agent> agents) {
        return new AgentBeanRegistrar(controller, agents);
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "agentmesh.bus.pump", name = "enabled", havingValue = "true")
    BacklogPump agentBusBacklogPump(AgentBusController controller,
                                    AgentBusProperties properties,
                                    ObjectProvider<BacklogResponseListener> listener) {
        BacklogResponseListener target = listener.getIfAvailable(() ->
            response -> log.debug("Backlog response {} ({}) for {}", response.id(), response.method(), response.recipient()));
        return new BacklogPump(controller, properties.getPump().getIdleInterval(), target::onResponse);
    }
}
