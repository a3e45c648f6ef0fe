package io.agentmesh.bus.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agentmesh.bus.runtime.BusSettings;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AgentBusPropertiesTest {

    @Test
    void defaultsMatchCoreSettings() {
        AgentBusProperties properties = AgentBusProperties.defaults();

        assertThat(properties.isEnabled()).isTrue();
        assertThat(properties.toSettings()).isEqualTo(BusSettings.defaults());
        assertThat(properties.getPump().isEnabled()).isFalse();
        assertThat(properties.getPump().getIdleInterval()).isEqualTo(Duration.ofMillis(50));
    }

    @Test
    void overridesAreCarriedIntoSettings() {
        AgentBusProperties properties = new AgentBusProperties(true, 2, Duration.ofSeconds(10), 1,
            Duration.ofSeconds(3), Duration.ofSeconds(1), 5, 100, 10, 16,
            new AgentBusProperties.Pump(true, Duration.ofMillis(5)));

        BusSettings settings = properties.toSettings();

        assertThat(settings.breaker().failureThreshold()).isEqualTo(2);
        assertThat(settings.breaker().recoveryTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.breaker().halfOpenSuccessThreshold()).isEqualTo(1);
        assertThat(settings.dispatchTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(settings.healthWindow()).isEqualTo(5);
        assertThat(settings.eventLogCapacity()).isEqualTo(100);
        assertThat(settings.sharedContextLimit()).isEqualTo(16);
        assertThat(properties.getPump().isEnabled()).isTrue();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new AgentBusProperties(null, 0, null, null, null, null, null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("agentmesh.bus.failure-threshold must be >= 1");
        assertThatThrownBy(() -> new AgentBusProperties(null, null, null, null, Duration.ZERO, null, null, null, null, null, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("agentmesh.bus.dispatch-timeout must be positive");
        assertThatThrownBy(() -> new AgentBusProperties.Pump(true, Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("agentmesh.bus.pump.idle-interval must be positive");
    }
}
