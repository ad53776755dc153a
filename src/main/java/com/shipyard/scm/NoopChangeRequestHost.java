package com.shipyard.scm;

import com.shipyard.core.collaborator.ChangeRequestHost;
import com.shipyard.core.model.ChangeRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Used when no change-request host is configured: finds nothing, posts nothing.
 */
public class NoopChangeRequestHost implements ChangeRequestHost {

    private static final Logger log = LoggerFactory.getLogger(NoopChangeRequestHost.class);

    @Override
    public Optional<ChangeRequest> findOpenByHeadCommit(String commitId) {
        return Optional.empty();
    }

    @Override
    public void postComment(int changeRequest, String body) {
        log.info("Change-request host not configured; dropping comment for #{}", changeRequest);
    }
}
