package com.shipyard.core.stage;

import com.shipyard.core.model.DeploymentCheck;
import com.shipyard.core.model.Stage;
import com.shipyard.core.model.StageKind;
import com.shipyard.core.model.StageResult;
import com.shipyard.core.verify.DeploymentVerifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;

/**
 * Adapts the {@link DeploymentVerifier} to the stage contract.
 */
@Component
public class DeployVerifyStageHandler implements StageHandler {

    /** Payload key holding the {@link DeploymentCheck}. */
    public static final String PAYLOAD_CHECK = "deploymentCheck";

    private final DeploymentVerifier verifier;

    public DeployVerifyStageHandler(DeploymentVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public StageKind kind() {
        return StageKind.DEPLOY_VERIFY;
    }

    @Override
    public StageResult handle(Stage stage, StageContext context) {
        Instant startedAt = Instant.now();
        DeploymentCheck check = verifier.verify(context.trigger().refName(), context.trigger().commitId());

        var payload = new HashMap<String, Object>();
        payload.put(PAYLOAD_CHECK, check);
        payload.put("stdout", check.stdout());
        payload.put("exitCode", check.exitCode());
        if (check.tag() != null) {
            payload.put("pulledTag", check.tag().reference());
        }

        if (check.passed()) {
            return StageResult.success(stage, check.message(), payload, startedAt);
        }
        return StageResult.failure(stage, check.failureKind(), check.message(), payload, startedAt);
    }
}
