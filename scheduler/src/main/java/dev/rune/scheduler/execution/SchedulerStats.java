package dev.rune.scheduler.execution;

/**
 * Running totals of a {@link SchedulerDaemon} since it was constructed.
 *
 * @param totalChecks ticks that queried for due schedules
 * @param totalExecutions dispatches published to the broker
 * @param totalFailures dispatches that failed, including those whose outcome could not be recorded
 */
public record SchedulerStats(long totalChecks, long totalExecutions, long totalFailures) {}
