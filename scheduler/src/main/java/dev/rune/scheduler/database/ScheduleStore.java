package dev.rune.scheduler.database;

import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Persistence of schedule records. At most one schedule exists per workflow. */
public interface ScheduleStore {

  /**
   * Inserts a new schedule with zero counters and sets the workflow's trigger marker to {@code scheduled} as one
   * atomic write. If the marker cannot be written the schedule is not kept.
   *
   * @throws dev.rune.scheduler.exceptions.ScheduleConflictException if the workflow already has a
   *     schedule
   */
  ScheduleRecord insertScheduleAndMark(
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now);

  Optional<ScheduleRecord> findById(long scheduleId);

  Optional<ScheduleRecord> findByWorkflowId(long workflowId);

  /** Overwrites the user-controlled fields; counters and last-run fields are left alone. */
  Optional<ScheduleRecord> updateSchedule(
      long scheduleId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now);

  /**
   * Deletes a schedule and sets the workflow's trigger marker back to {@code manual} as one atomic
   * write. If the marker cannot be written the schedule is kept.
   */
  boolean deleteScheduleAndUnmark(long scheduleId, long workflowId);

  boolean deleteScheduleForWorkflow(long workflowId);

  /** Active schedules with {@code nextRunAt <= horizon}, earliest first. */
  List<ScheduleRecord> listDueSchedules(Instant horizon);

  List<ScheduleRecord> listSchedulesForWorkflows(Collection<Long> workflowIds);

  List<ScheduleRecord> listSchedules(boolean activeOnly);

  /**
   * Applies one attempt's bookkeeping in a single atomic write: last run time, run count,
   * consecutive failures, last error, deactivation at {@code maxConsecutiveFailures}, and the next
   * run time {@code attemptedAt + interval}.
   *
   * @return the updated record, or empty if the schedule no longer exists
   */
  Optional<ScheduleRecord> recordOutcome(
      long scheduleId, AttemptOutcome outcome, int maxConsecutiveFailures);

  /** Whether the store can be reached right now. Never throws. */
  boolean isHealthy();
}
