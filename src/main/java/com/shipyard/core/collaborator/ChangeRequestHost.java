package com.shipyard.core.collaborator;

import com.shipyard.core.model.ChangeRequest;

import java.util.Optional;

/**
 * The source host's change-request (pull request) surface.
 */
public interface ChangeRequestHost {

    /**
     * Finds the open change request whose head is the given commit.
     *
     * @return the change request, or empty if none is open for that commit
     * @throws CollaboratorException if the host cannot be queried
     */
    Optional<ChangeRequest> findOpenByHeadCommit(String commitId);

    /**
     * Posts a comment on a change request.
     *
     * @throws CollaboratorException if the host rejects or cannot receive the comment
     */
    void postComment(int changeRequest, String body);
}
