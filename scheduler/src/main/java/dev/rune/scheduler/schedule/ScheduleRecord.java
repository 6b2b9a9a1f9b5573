package dev.rune.scheduler.schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A persisted schedule: fire workflow {@code workflowId} every {@code intervalSeconds}, starting
 * at {@code startAt}.
 *
 * <p>{@code runCount} counts every attempt. {@code failureCount} counts consecutive failed
 * attempts and is reset by a success.
 */
public record ScheduleRecord(
    long id,
    long workflowId,
    int intervalSeconds,
    Instant startAt,
    Instant nextRunAt,
    @Nullable Instant lastRunAt,
    boolean active,
    long runCount,
    int failureCount,
    @Nullable String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public ScheduleRecord {
    Objects.requireNonNull(startAt, "startAt must not be null");
    Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public Duration interval() {
    return Duration.ofSeconds(intervalSeconds);
  }

  public boolean isDue(Instant now) {
    return !nextRunAt.isAfter(now);
  }
}
