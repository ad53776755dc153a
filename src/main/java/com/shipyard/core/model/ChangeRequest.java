package com.shipyard.core.model;

import java.io.Serializable;

/**
 * An open review unit (pull request) that pipeline status is reported against.
 *
 * @param number     change request number on the host
 * @param headCommit commit identifier at the head of the change request
 * @param url        browser link, may be {@code null}
 */
public record ChangeRequest(
    int number,
    String headCommit,
    String url
) implements Serializable {}
