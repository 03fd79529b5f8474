package dev.jobfeed.scheduler;

/**
 * What to do with occurrences missed while the service was down, beyond the misfire threshold.
 * Either way at most one missed occurrence is fired and the schedule resumes at its next natural time.
 */
public enum CatchUpPolicy {
    /** Fire the most recent missed occurrence once. */
    FIRE_ONCE,
    /** Drop missed occurrences. */
    SKIP
}
