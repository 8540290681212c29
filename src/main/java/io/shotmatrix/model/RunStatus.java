package io.shotmatrix.model;

public enum RunStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILED,
    CANCELLED
}
