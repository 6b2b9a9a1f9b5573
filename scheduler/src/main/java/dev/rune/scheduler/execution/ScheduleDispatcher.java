package dev.rune.scheduler.execution;

import dev.rune.scheduler.Constants;
import dev.rune.scheduler.credentials.CredentialResolver;
import dev.rune.scheduler.database.ScheduleStore;
import dev.rune.scheduler.messaging.WorkflowRunPublisher;
import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.workflow.WorkflowGraph;
import dev.rune.scheduler.workflow.WorkflowStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires a single due schedule: load the workflow, resolve its credentials, publish a run request,
 * and record the outcome against the schedule. Errors become failure outcomes; only the outcome
 * write itself can fail, and that is reported as {@link DispatchResult.Status#BOOKKEEPING_LOST}.
 */
public class ScheduleDispatcher {
  private static final Logger logger = LoggerFactory.getLogger(ScheduleDispatcher.class);

  static final String WORKFLOW_NOT_FOUND = "Workflow not found";
  static final String PUBLISH_FAILED = "Failed to publish workflow to queue";

  private final ScheduleStore scheduleStore;
  private final WorkflowStore workflowStore;
  private final CredentialResolver credentialResolver;
  private final WorkflowRunPublisher runPublisher;
  private final Clock clock;
  private final int maxConsecutiveFailures;

  public ScheduleDispatcher(
      ScheduleStore scheduleStore,
      WorkflowStore workflowStore,
      CredentialResolver credentialResolver,
      WorkflowRunPublisher runPublisher,
      Clock clock,
      int maxConsecutiveFailures) {
    this.scheduleStore = Objects.requireNonNull(scheduleStore);
    this.workflowStore = Objects.requireNonNull(workflowStore);
    this.credentialResolver = Objects.requireNonNull(credentialResolver);
    this.runPublisher = Objects.requireNonNull(runPublisher);
    this.clock = Objects.requireNonNull(clock);
    this.maxConsecutiveFailures = maxConsecutiveFailures;
  }

  public static String newExecutionId() {
    return Constants.EXECUTION_ID_PREFIX
        + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
  }

  public DispatchResult dispatch(ScheduleRecord schedule) {
    Instant now = clock.instant();
    if (!schedule.isDue(now)) {
      logger.debug(
          "Schedule {} not due until {}, skipping this tick", schedule.id(), schedule.nextRunAt());
      return new DispatchResult(
          schedule.id(), schedule.workflowId(), DispatchResult.Status.SKIPPED, null, null);
    }

    String executionId = null;
    AttemptOutcome outcome = AttemptOutcome.failed(now, "Dispatch did not complete");
    DispatchResult result;
    try {
      Optional<WorkflowGraph> graph = workflowStore.getWorkflowGraph(schedule.workflowId());
      if (graph.isEmpty()) {
        logger.error(
            "Workflow {} for schedule {} not found", schedule.workflowId(), schedule.id());
        outcome = AttemptOutcome.failed(now, WORKFLOW_NOT_FOUND);
      } else {
        WorkflowGraph resolved = credentialResolver.resolve(graph.get());
        executionId = newExecutionId();
        if (runPublisher.publishWorkflowRun(schedule.workflowId(), executionId, resolved)) {
          logger.info(
              "Triggered scheduled workflow {} (execution {})",
              schedule.workflowId(),
              executionId);
          outcome = AttemptOutcome.succeeded(now);
        } else {
          logger.error(
              "Failed to queue scheduled workflow {} (execution {})",
              schedule.workflowId(),
              executionId);
          outcome = AttemptOutcome.failed(now, PUBLISH_FAILED);
        }
      }
    } catch (Exception e) {
      logger.error(
          "Error executing schedule {} for workflow {}: {}",
          schedule.id(),
          schedule.workflowId(),
          describe(e));
      outcome = AttemptOutcome.failed(now, describe(e));
    } finally {
      result = recordOutcome(schedule, outcome, executionId);
    }
    return result;
  }

  private DispatchResult recordOutcome(
      ScheduleRecord schedule, AttemptOutcome outcome, String executionId) {
    DispatchResult.Status status =
        outcome.success() ? DispatchResult.Status.SUCCEEDED : DispatchResult.Status.FAILED;
    try {
      Optional<ScheduleRecord> updated =
          scheduleStore.recordOutcome(schedule.id(), outcome, maxConsecutiveFailures);
      if (updated.isEmpty()) {
        logger.warn(
            "Schedule {} was deleted while firing; outcome not recorded", schedule.id());
      } else if (schedule.active() && !updated.get().active()) {
        logger.warn(
            "Schedule {} for workflow {} disabled after {} consecutive failures",
            schedule.id(),
            schedule.workflowId(),
            updated.get().failureCount());
      }
    } catch (RuntimeException e) {
      logger.error(
          "Bookkeeping lost for schedule {} (workflow {}, success={}, error={})",
          schedule.id(),
          schedule.workflowId(),
          outcome.success(),
          outcome.error(),
          e);
      return new DispatchResult(
          schedule.id(),
          schedule.workflowId(),
          DispatchResult.Status.BOOKKEEPING_LOST,
          executionId,
          outcome.error());
    }
    return new DispatchResult(
        schedule.id(), schedule.workflowId(), status, executionId, outcome.error());
  }

  static String describe(Throwable t) {
    String message = t.getMessage();
    return (message == null || message.isBlank()) ? t.getClass().getSimpleName() : message;
  }
}
