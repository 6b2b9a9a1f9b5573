package dev.rune.scheduler.workflow;

import java.util.Optional;

/**
 * Read access to stored workflow definitions. The trigger marker is written together with the
 * schedule, see {@link dev.rune.scheduler.database.ScheduleStore#insertScheduleAndMark}.
 */
public interface WorkflowStore {

  Optional<WorkflowGraph> getWorkflowGraph(long workflowId);
}
