package com.shipyard.core.health;

import com.github.dockerjava.api.DockerClient;
import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.engine.PipelineDefinitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final DockerClient dockerClient;
    private final PipelineDefinitions definitions;
    private final ShipyardProperties properties;

    public HealthCheckService(
            @Autowired(required = false) DockerClient dockerClient,
            @Autowired(required = false) PipelineDefinitions definitions,
            ShipyardProperties properties) {
        this.dockerClient = dockerClient;
        this.definitions = definitions;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPipelines());
        results.add(checkDocker());
        results.add(checkChangeRequestHost());
        return results;
    }

    /** UP only when no component is DOWN. */
    public boolean isHealthy() {
        return checkAll().stream().noneMatch(s -> s.status() == HealthStatus.Status.DOWN);
    }

    private HealthStatus checkPipelines() {
        if (definitions != null) {
            return new HealthStatus("pipelines", HealthStatus.Status.UP,
                    "Pipelines defined: " + String.join(", ", definitions.names()), Map.of());
        }
        return new HealthStatus("pipelines", HealthStatus.Status.DOWN,
                "Pipeline definitions not available", Map.of());
    }

    private HealthStatus checkDocker() {
        if (dockerClient == null) {
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "No Docker client configured", Map.of());
        }
        try {
            dockerClient.pingCmd().exec();
            return new HealthStatus("docker", HealthStatus.Status.UP,
                    "Docker daemon reachable", Map.of());
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", HealthStatus.Status.DOWN,
                    "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkChangeRequestHost() {
        var scm = properties.getScm();
        if (properties.isScmConfigured()) {
            return new HealthStatus("change-requests", HealthStatus.Status.UP,
                    "Reporting to " + scm.getOwner() + "/" + scm.getRepo(),
                    Map.of("apiUrl", scm.getApiUrl()));
        }
        // Runs still work; only reporting is off.
        return new HealthStatus("change-requests", HealthStatus.Status.DEGRADED,
                "No token configured; reports will not be posted", Map.of());
    }
}
