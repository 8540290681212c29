package io.shotmatrix.model;

public enum FailureArtifactType {
    PAGE_SOURCE,
    SCREENSHOT,
    DEVICE_LOGS
}
