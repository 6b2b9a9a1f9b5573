package dev.rune.scheduler.schedule;

import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/** Result of one dispatch attempt, as recorded against its schedule. */
public record AttemptOutcome(Instant attemptedAt, boolean success, @Nullable String error) {

  public AttemptOutcome {
    Objects.requireNonNull(attemptedAt, "attemptedAt must not be null");
    if (success) {
      error = null;
    } else if (error == null || error.isEmpty()) {
      error = "Unknown error";
    }
  }

  public static AttemptOutcome succeeded(Instant attemptedAt) {
    return new AttemptOutcome(attemptedAt, true, null);
  }

  public static AttemptOutcome failed(Instant attemptedAt, String error) {
    return new AttemptOutcome(attemptedAt, false, error);
  }
}
