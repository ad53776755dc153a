package com.shipyard.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.CommandResult;
import com.shipyard.core.collaborator.ExecutionSandbox;
import com.shipyard.core.model.ArtifactTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an already-pulled image once with the given arguments appended to its
 * entrypoint. Only standard output is captured. The container is always removed.
 */
public class DockerExecutionSandbox implements ExecutionSandbox {

    private static final Logger log = LoggerFactory.getLogger(DockerExecutionSandbox.class);

    private final DockerClient dockerClient;

    public DockerExecutionSandbox(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public CommandResult run(ArtifactTag tag, List<String> args, Duration timeout) {
        String containerId;
        try {
            containerId = dockerClient.createContainerCmd(tag.reference())
                    .withCmd(args)
                    .exec()
                    .getId();
        } catch (RuntimeException e) {
            throw new CollaboratorException("Could not create container from " + tag.reference()
                    + ": " + e.getMessage(), e);
        }

        try {
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Running {} {} (container {})", tag.reference(), args, containerId);

            Integer exitCode;
            try {
                exitCode = dockerClient.waitContainerCmd(containerId)
                        .exec(new WaitContainerResultCallback())
                        .awaitStatusCode(timeout.toSeconds(), TimeUnit.SECONDS);
            } catch (RuntimeException e) {
                throw new CollaboratorException("Container " + containerId + " did not finish within "
                        + timeout.toSeconds() + "s: " + e.getMessage(), e);
            }

            String stdout = captureStdout(containerId);
            return new CommandResult(exitCode != null ? exitCode : -1, stdout);
        } catch (CollaboratorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorException("Could not run " + tag.reference() + ": " + e.getMessage(), e);
        } finally {
            remove(containerId);
        }
    }

    private String captureStdout(String containerId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            // stderr is logged, never compared
                            if (frame.getStreamType() == StreamType.STDERR) {
                                log.debug("[{}] stderr: {}", containerId,
                                        new String(frame.getPayload(), StandardCharsets.UTF_8).stripTrailing());
                            } else {
                                sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while reading output of container " + containerId, e);
        }
        return sb.toString();
    }

    private void remove(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.debug("Removed container {}", containerId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }
}
