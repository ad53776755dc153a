package com.shipyard.core.stage;

import com.shipyard.config.ShipyardProperties;
import com.shipyard.core.collaborator.ArtifactRegistry;
import com.shipyard.core.collaborator.PublishResult;
import com.shipyard.core.model.ArtifactTag;
import com.shipyard.core.model.DerivedTags;
import com.shipyard.core.model.FailureKind;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.tagging.TagDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;

/**
 * Builds the artifact once and publishes it under the mutable and immutable tags.
 * Succeeds only if the registry confirms both tags.
 */
@Component
public class BuildAndPublishStageHandler implements StageHandler {

    private static final Logger log = LoggerFactory.getLogger(BuildAndPublishStageHandler.class);

    /** Payload key under which the published tags are handed to later stages. */
    public static final String PAYLOAD_TAGS = "tags";

    private final ArtifactRegistry registry;
    private final TagDeriver tagDeriver;
    private final Path buildContext;

    @Autowired
    public BuildAndPublishStageHandler(ArtifactRegistry registry, TagDeriver tagDeriver,
                                       ShipyardProperties properties) {
        this(registry, tagDeriver, Path.of(properties.getCi().getBuildContext()));
    }

    BuildAndPublishStageHandler(ArtifactRegistry registry, TagDeriver tagDeriver, Path buildContext) {
        this.registry = registry;
        this.tagDeriver = tagDeriver;
        this.buildContext = buildContext;
    }

    @Override
    public StageKind kind() {
        return StageKind.BUILD_AND_PUBLISH;
    }

    @Override
    public StageResult handle(Stage stage, StageContext context) {
        Instant startedAt = Instant.now();
        DerivedTags derived = tagDeriver.deriveTags(context.trigger().refName(), context.trigger().commitId());
        List<ArtifactTag> requested = derived.asList();

        log.info("Publishing {} as {}", buildContext, requested);
        PublishResult published = registry.publish(buildContext, requested);

        var payload = new HashMap<String, Object>();
        payload.put("digest", published.digest());
        payload.put(PAYLOAD_TAGS, published.tags());

        if (!new HashSet<>(published.tags()).containsAll(requested)) {
            return StageResult.failure(stage, FailureKind.ASSERTION,
                    "registry confirmed " + published.tags() + " but " + requested + " were requested",
                    payload, startedAt);
        }
        return StageResult.success(stage,
                "published " + derived.mutableTag().tag() + ", " + derived.immutableTag().tag(),
                payload, startedAt);
    }
}
