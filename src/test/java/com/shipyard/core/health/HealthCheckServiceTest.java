package com.shipyard.core.health;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PingCmd;
import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.engine.PipelineDefinitions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("nothing wired -> pipelines and docker DOWN, reporting DEGRADED")
    void nothingWired() {
        var service = new HealthCheckService(null, null, new ShipyardProperties());
        List<HealthStatus> results = service.checkAll();

        assertEquals(3, results.size());
        assertEquals(HealthStatus.Status.DOWN, component(results, "pipelines").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "docker").status());
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "change-requests").status());
        assertFalse(service.isHealthy());
    }

    @Test
    @DisplayName("reachable daemon and defined pipelines -> healthy even without reporting")
    void healthyWithoutReporting() {
        var dockerClient = mock(DockerClient.class);
        when(dockerClient.pingCmd()).thenReturn(mock(PingCmd.class));
        var properties = new ShipyardProperties();
        var service = new HealthCheckService(dockerClient, new PipelineDefinitions(properties), properties);

        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "docker").status());
        assertTrue(component(results, "pipelines").detail().contains("ci"));
        assertTrue(service.isHealthy());
    }

    @Test
    @DisplayName("ping failure -> docker DOWN with the error")
    void pingFailure() {
        var dockerClient = mock(DockerClient.class);
        var ping = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(ping);
        when(ping.exec()).thenThrow(new RuntimeException("Connection refused"));

        var docker = component(new HealthCheckService(dockerClient, null, new ShipyardProperties()).checkAll(), "docker");

        assertEquals(HealthStatus.Status.DOWN, docker.status());
        assertTrue(docker.detail().contains("Connection refused"));
    }

    @Test
    @DisplayName("configured change-request host -> UP")
    void scmConfigured() {
        var properties = new ShipyardProperties();
        properties.getScm().setOwner("acme");
        properties.getScm().setRepo("adder");
        properties.getScm().setToken("t0ken");

        var status = component(new HealthCheckService(null, null, properties).checkAll(), "change-requests");

        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("https://api.github.com", status.metadata().get("apiUrl"));
    }
}
