package com.shipyard.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.BuildImageResultCallback;
import com.github.dockerjava.api.command.InspectImageResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.PushResponseItem;
import com.shipyard.core.collaborator.ArtifactNotFoundException;
import com.shipyard.core.collaborator.ArtifactRegistry;
import com.shipyard.core.collaborator.CollaboratorException;
import com.shipyard.core.collaborator.PublishResult;
import com.shipyard.core.model.ArtifactTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Docker-backed registry: builds the image once with every tag applied, checks that
 * all tags resolve to the same image, then pushes each tag.
 * <p>
 * Pull is read-only; this class never removes or retags images on pull.
 */
public class DockerArtifactRegistry implements ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(DockerArtifactRegistry.class);

    private final DockerClient dockerClient;
    private final String registryHost;
    private final String username;
    private final String password;
    private final Duration buildTimeout;
    private final Duration pullTimeout;

    public DockerArtifactRegistry(DockerClient dockerClient, String registryHost, String username,
                                  String password, Duration buildTimeout, Duration pullTimeout) {
        this.dockerClient = dockerClient;
        this.registryHost = registryHost;
        this.username = username;
        this.password = password;
        this.buildTimeout = buildTimeout;
        this.pullTimeout = pullTimeout;
    }

    @Override
    public PublishResult publish(Path buildContext, List<ArtifactTag> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new IllegalArgumentException("At least one tag is required to publish");
        }
        if (!Files.isDirectory(buildContext)) {
            throw new CollaboratorException("Build context is not a directory: " + buildContext.toAbsolutePath());
        }

        var references = new LinkedHashSet<String>();
        tags.forEach(t -> references.add(t.reference()));

        String imageId;
        try {
            log.info("Building {} from {}", references, buildContext.toAbsolutePath());
            imageId = dockerClient.buildImageCmd(buildContext.toFile())
                    .withTags(references)
                    .exec(new BuildImageResultCallback())
                    .awaitImageId(buildTimeout.toSeconds(), TimeUnit.SECONDS);
        } catch (CollaboratorException e) {
            throw e;
        } catch (Exception e) {
            throw new CollaboratorException("Image build failed: " + e.getMessage(), e);
        }

        for (ArtifactTag tag : tags) {
            String resolved = inspect(tag).getId();
            if (!sameImage(imageId, resolved)) {
                throw new CollaboratorException(tag.reference() + " resolves to " + resolved
                        + ", expected build output " + imageId);
            }
        }

        for (ArtifactTag tag : tags) {
            push(tag);
        }

        String digest = digestOf(tags.get(0), imageId);
        log.info("Published {} as {}", digest, references);
        return new PublishResult(digest, List.copyOf(tags));
    }

    @Override
    public void pull(ArtifactTag tag) {
        try {
            boolean done = dockerClient.pullImageCmd(tag.repositoryPath())
                    .withTag(tag.tag())
                    .withAuthConfig(authConfig())
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(pullTimeout.toSeconds(), TimeUnit.SECONDS);
            if (!done) {
                throw new CollaboratorException("Timed out pulling " + tag.reference()
                        + " after " + pullTimeout.toSeconds() + "s");
            }
        } catch (NotFoundException e) {
            throw new ArtifactNotFoundException(tag.reference(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while pulling " + tag.reference(), e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (RuntimeException e) {
            if (looksLikeMissingManifest(e.getMessage())) {
                throw new ArtifactNotFoundException(tag.reference(), e);
            }
            throw new CollaboratorException("Pull of " + tag.reference() + " failed: " + e.getMessage(), e);
        }
    }

    private void push(ArtifactTag tag) {
        var callback = new PushCallback();
        try {
            boolean done = dockerClient.pushImageCmd(tag.repositoryPath())
                    .withTag(tag.tag())
                    .withAuthConfig(authConfig())
                    .exec(callback)
                    .awaitCompletion(buildTimeout.toSeconds(), TimeUnit.SECONDS);
            if (!done) {
                throw new CollaboratorException("Timed out pushing " + tag.reference());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException("Interrupted while pushing " + tag.reference(), e);
        } catch (CollaboratorException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CollaboratorException("Push of " + tag.reference() + " failed: " + e.getMessage(), e);
        }
        if (callback.error != null) {
            throw new CollaboratorException("Push of " + tag.reference() + " rejected: " + callback.error);
        }
        log.info("Pushed {}", tag.reference());
    }

    private InspectImageResponse inspect(ArtifactTag tag) {
        try {
            return dockerClient.inspectImageCmd(tag.reference()).exec();
        } catch (NotFoundException e) {
            throw new ArtifactNotFoundException(tag.reference(), e);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Could not inspect " + tag.reference() + ": " + e.getMessage(), e);
        }
    }

    /** Registry digest when the push recorded one, otherwise the local image id. */
    private String digestOf(ArtifactTag tag, String imageId) {
        try {
            List<String> repoDigests = dockerClient.inspectImageCmd(tag.reference()).exec().getRepoDigests();
            if (repoDigests != null) {
                for (String repoDigest : repoDigests) {
                    if (repoDigest.startsWith(tag.repositoryPath() + "@")) {
                        return repoDigest.substring(repoDigest.indexOf('@') + 1);
                    }
                }
            }
        } catch (RuntimeException e) {
            log.debug("No repo digest for {}: {}", tag.reference(), e.getMessage());
        }
        return imageId;
    }

    private AuthConfig authConfig() {
        var auth = new AuthConfig().withRegistryAddress(registryHost);
        if (username != null && !username.isBlank()) {
            auth = auth.withUsername(username).withPassword(password);
        }
        return auth;
    }

    static boolean sameImage(String builtId, String resolvedId) {
        if (builtId == null || resolvedId == null) return false;
        return stripAlgorithm(builtId).equals(stripAlgorithm(resolvedId))
                || stripAlgorithm(resolvedId).startsWith(stripAlgorithm(builtId));
    }

    private static String stripAlgorithm(String id) {
        int colon = id.indexOf(':');
        return colon >= 0 ? id.substring(colon + 1) : id;
    }

    private static boolean looksLikeMissingManifest(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("manifest unknown") || lower.contains("not found");
    }

    private static final class PushCallback extends ResultCallback.Adapter<PushResponseItem> {
        private volatile String error;

        @Override
        public void onNext(PushResponseItem item) {
            if (item.isErrorIndicated()) {
                error = item.getErrorDetail() != null ? item.getErrorDetail().getMessage() : item.getError();
            }
        }
    }
}
