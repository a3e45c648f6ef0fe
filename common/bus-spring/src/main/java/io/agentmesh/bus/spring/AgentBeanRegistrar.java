package io.agentmesh.bus.spring;

import io.agentmesh.bus.agent.Agent;
import io.agentmesh.bus.runtime.AgentBusController;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;

/**
 * Registers every {@link Agent} bean with the controller once all singletons exist, so agents may
 * depend on the controller themselves.
 */
final class AgentBeanRegistrar implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(AgentBeanRegistrar.class);

    private final AgentBusController controller;
    private final ObjectProvider<Agent> agents;

    AgentBeanRegistrar(AgentBusController controller, ObjectProvider<Agent> agents) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.agents = Objects.requireNonNull(agents, "agents");
    }

    @Override
    public void afterSingletonsInstantiated() {
        List<Agent> discovered = agents.orderedStream().toList();
        discovered.forEach(controller::register);
        log.info("Registered {} agent bean(s) with the agent bus", discovered.size());
    }
}
