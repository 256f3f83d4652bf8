package io.scanrelay.model;

public enum ErrorKind {
    TASK_FAILURE,
    TIMEOUT_EXCEEDED,
    CANCELLED
}
