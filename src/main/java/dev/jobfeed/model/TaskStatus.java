package dev.jobfeed.model;

public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isInFlight() {
        return this == PENDING || this == RUNNING;
    }
}
