package dev.rune.scheduler.utils;

import dev.rune.scheduler.database.ScheduleStore;
import dev.rune.scheduler.exceptions.ScheduleConflictException;
import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.workflow.TriggerType;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryScheduleStore implements ScheduleStore {

  private static final Comparator<ScheduleRecord> BY_NEXT_RUN =
      Comparator.comparing(ScheduleRecord::nextRunAt).thenComparing(ScheduleRecord::id);

  private final Map<Long, ScheduleRecord> records = new LinkedHashMap<>();
  private final InMemoryWorkflowStore markers;
  private long nextId = 1;

  public final AtomicInteger listDueCalls = new AtomicInteger();
  public volatile RuntimeException listDueFailure;
  public volatile RuntimeException recordOutcomeFailure;
  public volatile boolean healthy = true;

  /** Trigger markers written alongside schedules go to {@code markers}. */
  public InMemoryScheduleStore(InMemoryWorkflowStore markers) {
    this.markers = markers;
  }

  private ScheduleRecord insertSchedule(
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now) {
    if (records.values().stream().anyMatch(r -> r.workflowId() == workflowId)) {
      throw new ScheduleConflictException(workflowId);
    }
    var record =
        new ScheduleRecord(
            nextId++,
            workflowId,
            intervalSeconds,
            startAt,
            nextRunAt,
            null,
            active,
            0,
            0,
            null,
            now,
            now);
    records.put(record.id(), record);
    return record;
  }

  @Override
  public synchronized ScheduleRecord insertScheduleAndMark(
      long workflowId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now) {
    var record = insertSchedule(workflowId, intervalSeconds, startAt, nextRunAt, active, now);
    try {
      markers.setTriggerType(workflowId, TriggerType.SCHEDULED);
    } catch (RuntimeException e) {
      records.remove(record.id());
      throw e;
    }
    return record;
  }

  /** Stores {@code record} as is, replacing any record with the same id. */
  public synchronized ScheduleRecord put(ScheduleRecord record) {
    records.put(record.id(), record);
    nextId = Math.max(nextId, record.id() + 1);
    return record;
  }

  @Override
  public synchronized Optional<ScheduleRecord> findById(long scheduleId) {
    return Optional.ofNullable(records.get(scheduleId));
  }

  @Override
  public synchronized Optional<ScheduleRecord> findByWorkflowId(long workflowId) {
    return records.values().stream().filter(r -> r.workflowId() == workflowId).findFirst();
  }

  @Override
  public synchronized Optional<ScheduleRecord> updateSchedule(
      long scheduleId,
      int intervalSeconds,
      Instant startAt,
      Instant nextRunAt,
      boolean active,
      Instant now) {
    var old = records.get(scheduleId);
    if (old == null) {
      return Optional.empty();
    }
    var updated =
        new ScheduleRecord(
            old.id(),
            old.workflowId(),
            intervalSeconds,
            startAt,
            nextRunAt,
            old.lastRunAt(),
            active,
            old.runCount(),
            old.failureCount(),
            old.lastError(),
            old.createdAt(),
            now);
    records.put(scheduleId, updated);
    return Optional.of(updated);
  }

  @Override
  public synchronized boolean deleteScheduleAndUnmark(long scheduleId, long workflowId) {
    var removed = records.remove(scheduleId);
    if (removed == null) {
      return false;
    }
    try {
      markers.setTriggerType(workflowId, TriggerType.MANUAL);
    } catch (RuntimeException e) {
      records.put(scheduleId, removed);
      throw e;
    }
    return true;
  }

  @Override
  public synchronized boolean deleteScheduleForWorkflow(long workflowId) {
    return records.values().removeIf(r -> r.workflowId() == workflowId);
  }

  @Override
  public synchronized List<ScheduleRecord> listDueSchedules(Instant horizon) {
    listDueCalls.incrementAndGet();
    if (listDueFailure != null) {
      throw listDueFailure;
    }
    return records.values().stream()
        .filter(ScheduleRecord::active)
        .filter(r -> !r.nextRunAt().isAfter(horizon))
        .sorted(BY_NEXT_RUN)
        .toList();
  }

  @Override
  public synchronized List<ScheduleRecord> listSchedulesForWorkflows(
      Collection<Long> workflowIds) {
    return records.values().stream()
        .filter(r -> workflowIds.contains(r.workflowId()))
        .sorted(BY_NEXT_RUN)
        .toList();
  }

  @Override
  public synchronized List<ScheduleRecord> listSchedules(boolean activeOnly) {
    return records.values().stream()
        .filter(r -> !activeOnly || r.active())
        .sorted(BY_NEXT_RUN)
        .toList();
  }

  @Override
  public synchronized Optional<ScheduleRecord> recordOutcome(
      long scheduleId, AttemptOutcome outcome, int maxConsecutiveFailures) {
    if (recordOutcomeFailure != null) {
      throw recordOutcomeFailure;
    }
    var old = records.get(scheduleId);
    if (old == null) {
      return Optional.empty();
    }
    var updated = afterAttempt(old, outcome, maxConsecutiveFailures);
    records.put(scheduleId, updated);
    return Optional.of(updated);
  }

  @Override
  public boolean isHealthy() {
    return healthy;
  }

  // same bookkeeping as the UPDATE in ScheduleDAO.recordOutcome
  private static ScheduleRecord afterAttempt(
      ScheduleRecord old, AttemptOutcome outcome, int maxConsecutiveFailures) {
    Instant at = outcome.attemptedAt();
    int failures = outcome.success() ? 0 : old.failureCount() + 1;
    boolean stillActive =
        old.active() && (outcome.success() || failures < maxConsecutiveFailures);
    return new ScheduleRecord(
        old.id(),
        old.workflowId(),
        old.intervalSeconds(),
        old.startAt(),
        at.plusSeconds(old.intervalSeconds()),
        at,
        stillActive,
        old.runCount() + 1,
        failures,
        outcome.success() ? null : outcome.error(),
        old.createdAt(),
        at);
  }
}
