package dev.jobfeed.model;

/**
 * Operations a schedule can target.
 */
public enum TaskType {
    FETCH_JOBS,
    DEACTIVATE_STALE
}
