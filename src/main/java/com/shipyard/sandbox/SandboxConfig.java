package com.shipyard.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.ArtifactRegistry;
import com.shipyard.core.collaborator.ExecutionSandbox;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    public DockerClient dockerClient(ShipyardProperties properties) {
        String dockerHost = resolveDockerHost(properties.getDocker().getHost(), System.getenv("DOCKER_HOST"));
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ArtifactRegistry artifactRegistry(DockerClient dockerClient, ShipyardProperties properties) {
        var registry = properties.getRegistry();
        return new DockerArtifactRegistry(dockerClient, registry.getHost(),
                registry.getUsername(), registry.getPassword(),
                properties.getCommandTimeout(), properties.getPullTimeout());
    }

    @Bean
    public ExecutionSandbox executionSandbox(DockerClient dockerClient) {
        return new DockerExecutionSandbox(dockerClient);
    }

    static String resolveDockerHost(String configured, String fromEnv) {
        if (configured != null && !configured.isBlank()) return configured;
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
        return DEFAULT_UNIX_SOCKET;
    }
}
