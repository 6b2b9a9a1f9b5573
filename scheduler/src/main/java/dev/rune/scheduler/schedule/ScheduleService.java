package dev.rune.scheduler.schedule;

import dev.rune.scheduler.Constants;
import dev.rune.scheduler.database.ScheduleStore;
import dev.rune.scheduler.exceptions.InvalidScheduleException;
import dev.rune.scheduler.exceptions.ScheduleConflictException;
import dev.rune.scheduler.exceptions.WorkflowNotFoundException;
import dev.rune.scheduler.workflow.WorkflowGraph;
import dev.rune.scheduler.workflow.WorkflowStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, changes and removes schedules on behalf of the management layer, keeping the
 * workflow's trigger marker in step.
 */
public class ScheduleService {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

  private final ScheduleStore scheduleStore;
  private final WorkflowStore workflowStore;
  private final Clock clock;

  public ScheduleService(ScheduleStore scheduleStore, WorkflowStore workflowStore, Clock clock) {
    this.scheduleStore = Objects.requireNonNull(scheduleStore);
    this.workflowStore = Objects.requireNonNull(workflowStore);
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * When a schedule should next fire.
   *
   * <p>A schedule that has never fired runs at {@code startAt}, or immediately if that time has
   * passed. After any attempt the next run is one interval after {@code now}, so the cadence
   * follows actual fire times rather than wall-clock boundaries.
   */
  public static Instant calculateNextRun(
      Instant now, int intervalSeconds, Instant startAt, @Nullable Instant lastRunAt) {
    if (lastRunAt == null) {
      return startAt.isAfter(now) ? startAt : now;
    }
    return now.plusSeconds(intervalSeconds);
  }

  static void validateInterval(int intervalSeconds) {
    if (intervalSeconds <= 0 || intervalSeconds > Constants.MAX_INTERVAL_SECONDS) {
      throw new InvalidScheduleException(
          "interval_seconds must be between 1 and %d, got %d"
              .formatted(Constants.MAX_INTERVAL_SECONDS, intervalSeconds));
    }
  }

  public ScheduleRecord createSchedule(
      long workflowId, int intervalSeconds, @Nullable Instant startAt) {
    return createSchedule(workflowId, intervalSeconds, startAt, true);
  }

  /**
   * Creates the schedule of a workflow and marks the workflow as scheduled.
   *
   * @param startAt first fire time; {@code null} means now
   * @throws WorkflowNotFoundException if the workflow does not exist
   * @throws InvalidScheduleException if the interval is out of range or the workflow has no
   *     trigger node
   * @throws ScheduleConflictException if the workflow already has a schedule
   */
  public ScheduleRecord createSchedule(
      long workflowId, int intervalSeconds, @Nullable Instant startAt, boolean active) {
    validateInterval(intervalSeconds);

    WorkflowGraph graph =
        workflowStore
            .getWorkflowGraph(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    if (!graph.hasTriggerNode()) {
      throw new InvalidScheduleException(
          "Workflow %d must have a trigger node to be scheduled".formatted(workflowId));
    }

    if (scheduleStore.findByWorkflowId(workflowId).isPresent()) {
      throw new ScheduleConflictException(workflowId);
    }

    Instant now = clock.instant();
    Instant start = startAt != null ? startAt : now;
    Instant nextRun = calculateNextRun(now, intervalSeconds, start, null);

    ScheduleRecord record =
        scheduleStore.insertScheduleAndMark(
            workflowId, intervalSeconds, start, nextRun, active, now);

    logger.info(
        "Created schedule {} for workflow {}: every {} seconds, next run at {}",
        record.id(),
        workflowId,
        intervalSeconds,
        record.nextRunAt());
    return record;
  }

  public Optional<ScheduleRecord> getSchedule(long workflowId) {
    return scheduleStore.findByWorkflowId(workflowId);
  }

  public Optional<ScheduleRecord> getScheduleById(long scheduleId) {
    return scheduleStore.findById(scheduleId);
  }

  /**
   * Applies the given changes; {@code null} leaves a field as it is. The next run time is only
   * recomputed when the interval or the start time is given, so pausing and resuming keeps the
   * cadence.
   */
  public ScheduleRecord updateSchedule(
      ScheduleRecord schedule,
      @Nullable Integer intervalSeconds,
      @Nullable Instant startAt,
      @Nullable Boolean active) {
    if (intervalSeconds != null) {
      validateInterval(intervalSeconds);
    }
    Instant now = clock.instant();
    int newInterval = intervalSeconds != null ? intervalSeconds : schedule.intervalSeconds();
    Instant newStart = startAt != null ? startAt : schedule.startAt();
    boolean newActive = active != null ? active : schedule.active();
    Instant nextRun =
        (intervalSeconds != null || startAt != null)
            ? calculateNextRun(now, newInterval, newStart, schedule.lastRunAt())
            : schedule.nextRunAt();

    ScheduleRecord updated =
        scheduleStore
            .updateSchedule(schedule.id(), newInterval, newStart, nextRun, newActive, now)
            .orElseThrow(
                () ->
                    new InvalidScheduleException(
                        "Schedule %d no longer exists".formatted(schedule.id())));

    logger.info(
        "Updated schedule {} for workflow {}: every {} seconds, active={}, next run at {}",
        updated.id(),
        updated.workflowId(),
        updated.intervalSeconds(),
        updated.active(),
        updated.nextRunAt());
    return updated;
  }

  /** Deletes the schedule and returns its workflow to manual triggering. */
  public void deleteSchedule(ScheduleRecord schedule) {
    scheduleStore.deleteScheduleAndUnmark(schedule.id(), schedule.workflowId());
    logger.info("Deleted schedule {} for workflow {}", schedule.id(), schedule.workflowId());
  }

  /** Removes the schedule of a workflow that is being deleted. */
  public boolean deleteScheduleForWorkflow(long workflowId) {
    boolean deleted = scheduleStore.deleteScheduleForWorkflow(workflowId);
    if (deleted) {
      logger.info("Deleted schedule of removed workflow {}", workflowId);
    }
    return deleted;
  }

  public List<ScheduleRecord> listDueSchedules(Instant now, int lookAheadSeconds) {
    return scheduleStore.listDueSchedules(now.plusSeconds(lookAheadSeconds));
  }

  public List<ScheduleRecord> listSchedulesForWorkflows(Collection<Long> workflowIds) {
    return scheduleStore.listSchedulesForWorkflows(workflowIds);
  }

  public List<ScheduleRecord> listSchedules(boolean activeOnly) {
    return scheduleStore.listSchedules(activeOnly);
  }
}
