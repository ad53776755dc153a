package com.shipyard.core.model;

/**
 * The side effect a stage performs when it runs.
 */
public enum StageKind {
    TEST,
    COVERAGE_CHECK,
    BUILD_AND_PUBLISH,
    SECURITY_SCAN,
    DEPLOY_VERIFY
}
