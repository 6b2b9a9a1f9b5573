package dev.rune.scheduler.database;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.rune.scheduler.DbSetupTestBase;
import dev.rune.scheduler.credentials.CredentialEncryption;
import dev.rune.scheduler.credentials.CredentialResolver;
import dev.rune.scheduler.exceptions.ScheduleConflictException;
import dev.rune.scheduler.exceptions.SchedulerDatabaseException;
import dev.rune.scheduler.execution.DispatchResult;
import dev.rune.scheduler.execution.ScheduleDispatcher;
import dev.rune.scheduler.messaging.WorkflowRunPublisher;
import dev.rune.scheduler.migrations.MigrationManager;
import dev.rune.scheduler.schedule.AttemptOutcome;
import dev.rune.scheduler.schedule.ScheduleService;
import dev.rune.scheduler.utils.MutableClock;
import dev.rune.scheduler.utils.RecordingPublisher;
import dev.rune.scheduler.utils.TestGraphs;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
@Timeout(value = 2, unit = TimeUnit.MINUTES)
public class SystemDatabaseTest extends DbSetupTestBase {

  private static SystemDatabase sysdb;

  private MutableClock clock;
  private Instant now;

  @BeforeAll
  static void migrate() {
    MigrationManager.runMigrations(dataSource, schedulerConfig.databaseSchema());
    sysdb = new SystemDatabase(dataSource, schedulerConfig, null);
  }

  @BeforeEach
  void reset() throws Exception {
    truncate("public.scheduler_schedules", "public.workflows", "public.workflow_credentials");
    clock = new MutableClock(Instant.parse("2026-09-01T10:00:00Z"));
    now = clock.instant();
  }

  @Test
  public void insertAndRead() {
    var inserted = sysdb.insertScheduleAndMark(11, 60, now, now, true, now);

    assertEquals(11, inserted.workflowId());
    assertEquals(60, inserted.intervalSeconds());
    assertEquals(now, inserted.nextRunAt());
    assertNull(inserted.lastRunAt());
    assertEquals(0, inserted.runCount());
    assertEquals(now, inserted.createdAt());

    assertEquals(inserted, sysdb.findById(inserted.id()).orElseThrow());
    assertEquals(inserted, sysdb.findByWorkflowId(11).orElseThrow());
    assertTrue(sysdb.findById(inserted.id() + 100).isEmpty());
  }

  @Test
  public void oneSchedulePerWorkflow() {
    sysdb.insertScheduleAndMark(11, 60, now, now, true, now);
    var e =
        assertThrows(
            ScheduleConflictException.class, () -> sysdb.insertScheduleAndMark(11, 30, now, now, true, now));
    assertEquals(11, e.workflowId());
  }

  @Test
  public void dueSchedulesInOrder() {
    var later = sysdb.insertScheduleAndMark(1, 60, now, now.plusSeconds(50), true, now);
    var overdue = sysdb.insertScheduleAndMark(2, 60, now, now.minusSeconds(50), true, now);
    var dueNow = sysdb.insertScheduleAndMark(3, 60, now, now, true, now);
    sysdb.insertScheduleAndMark(4, 60, now, now.minusSeconds(100), false, now);
    sysdb.insertScheduleAndMark(5, 60, now, now.plusSeconds(500), true, now);

    assertEquals(List.of(overdue, dueNow), sysdb.listDueSchedules(now));
    assertEquals(List.of(overdue, dueNow, later), sysdb.listDueSchedules(now.plusSeconds(60)));
  }

  @Test
  public void outcomesAndAutoDisable() {
    var schedule = sysdb.insertScheduleAndMark(1, 10, now, now, true, now);

    var afterSuccess = sysdb.recordOutcome(schedule.id(), AttemptOutcome.succeeded(now), 2).orElseThrow();
    assertEquals(1, afterSuccess.runCount());
    assertEquals(0, afterSuccess.failureCount());
    assertEquals(now, afterSuccess.lastRunAt());
    assertEquals(now.plusSeconds(10), afterSuccess.nextRunAt());

    var t1 = now.plusSeconds(10);
    var afterFailure =
        sysdb.recordOutcome(schedule.id(), AttemptOutcome.failed(t1, "broker down"), 2).orElseThrow();
    assertEquals(1, afterFailure.failureCount());
    assertEquals("broker down", afterFailure.lastError());
    assertTrue(afterFailure.active());

    var t2 = now.plusSeconds(20);
    var disabled =
        sysdb.recordOutcome(schedule.id(), AttemptOutcome.failed(t2, "broker down"), 2).orElseThrow();
    assertFalse(disabled.active());
    assertEquals(2, disabled.failureCount());
    assertEquals(3, disabled.runCount());
    assertEquals(t2.plusSeconds(10), disabled.nextRunAt());

    assertEquals(t2, disabled.lastRunAt());
    assertEquals("broker down", disabled.lastError());
    assertEquals(t2, disabled.updatedAt());

    assertTrue(sysdb.recordOutcome(9999, AttemptOutcome.succeeded(now), 2).isEmpty());
  }

  @Test
  public void updateAndDelete() {
    var schedule = sysdb.insertScheduleAndMark(1, 60, now, now, true, now);
    var later = now.plusSeconds(5);

    var updated = sysdb.updateSchedule(schedule.id(), 120, now, now.plusSeconds(120), false, later);
    assertEquals(120, updated.orElseThrow().intervalSeconds());
    assertFalse(updated.orElseThrow().active());
    assertEquals(later, updated.orElseThrow().updatedAt());
    assertTrue(sysdb.updateSchedule(9999, 60, now, now, true, now).isEmpty());

    assertTrue(sysdb.deleteScheduleAndUnmark(schedule.id(), 1));
    assertFalse(sysdb.deleteScheduleAndUnmark(schedule.id(), 1));

    sysdb.insertScheduleAndMark(2, 60, now, now, true, now);
    assertTrue(sysdb.deleteScheduleForWorkflow(2));
    assertTrue(sysdb.listSchedules(false).isEmpty());
  }

  @Test
  public void listsByWorkflow() {
    var a = sysdb.insertScheduleAndMark(1, 60, now, now, true, now);
    var b = sysdb.insertScheduleAndMark(2, 60, now, now.plusSeconds(1), false, now);
    sysdb.insertScheduleAndMark(3, 60, now, now.plusSeconds(2), true, now);

    assertEquals(List.of(a, b), sysdb.listSchedulesForWorkflows(List.of(1L, 2L)));
    assertTrue(sysdb.listSchedulesForWorkflows(List.of()).isEmpty());
    assertEquals(2, sysdb.listSchedules(true).size());
    assertEquals(3, sysdb.listSchedules(false).size());
  }

  @Test
  public void workflowGraphLookup() throws Exception {
    long id = insertWorkflow(TestGraphs.triggeredJson("1"));

    var graph = sysdb.getWorkflowGraph(id).orElseThrow();
    assertEquals(2, graph.nodes().size());
    assertTrue(graph.hasTriggerNode());
    assertTrue(sysdb.getWorkflowGraph(id + 1).isEmpty());
  }

  @Test
  public void scheduleAndMarkerWrittenTogether() throws Exception {
    long id = insertWorkflow(TestGraphs.triggeredJson("1"));
    assertNull(triggerTypeOf(id));

    var schedule = sysdb.insertScheduleAndMark(id, 60, now, now, true, now);
    assertEquals("scheduled", triggerTypeOf(id));
    assertEquals(schedule, sysdb.findByWorkflowId(id).orElseThrow());

    assertThrows(
        ScheduleConflictException.class,
        () -> sysdb.insertScheduleAndMark(id, 30, now, now, true, now));
    assertEquals(schedule, sysdb.findByWorkflowId(id).orElseThrow());

    assertTrue(sysdb.deleteScheduleAndUnmark(schedule.id(), id));
    assertEquals("manual", triggerTypeOf(id));
    assertTrue(sysdb.findByWorkflowId(id).isEmpty());
    assertFalse(sysdb.deleteScheduleAndUnmark(schedule.id(), id));
  }

  @Test
  public void failedMarkerWriteRollsBackCreate() throws Exception {
    long id = insertWorkflow(TestGraphs.triggeredJson("1"));
    // marker writes go to a table that does not exist
    var broken =
        new SystemDatabase(
            dataSource,
            schedulerConfig.withWorkflowsTable("missing_workflows"),
            DbRetry.Options.defaults().withMaxAttempts(1));

    var failing = new ScheduleService(broken, sysdb, clock);
    var e =
        assertThrows(SchedulerDatabaseException.class, () -> failing.createSchedule(id, 60, null));
    assertEquals("42P01", ((SQLException) e.databaseException()).getSQLState());
    assertTrue(sysdb.findByWorkflowId(id).isEmpty());
    assertNull(triggerTypeOf(id));

    var service = new ScheduleService(sysdb, sysdb, clock);
    var schedule = service.createSchedule(id, 60, null);
    assertEquals(id, schedule.workflowId());
    assertEquals("scheduled", triggerTypeOf(id));
  }

  @Test
  public void failedMarkerWriteRollsBackDelete() throws Exception {
    long id = insertWorkflow(TestGraphs.triggeredJson("1"));
    var schedule = sysdb.insertScheduleAndMark(id, 60, now, now, true, now);
    var broken =
        new SystemDatabase(
            dataSource,
            schedulerConfig.withWorkflowsTable("missing_workflows"),
            DbRetry.Options.defaults().withMaxAttempts(1));

    assertThrows(
        SchedulerDatabaseException.class,
        () -> new ScheduleService(broken, sysdb, clock).deleteSchedule(schedule));
    assertEquals(schedule, sysdb.findById(schedule.id()).orElseThrow());
    assertEquals("scheduled", triggerTypeOf(id));
  }

  @Test
  public void healthCheckRunsQuery() {
    assertTrue(sysdb.isHealthy());

    var pool = SystemDatabase.createDataSource(schedulerConfig);
    var separate = new SystemDatabase(pool, schedulerConfig, null);
    assertTrue(separate.isHealthy());
    separate.close();
    assertFalse(separate.isHealthy());
  }

  @Test
  public void credentialLookup() throws Exception {
    long id = insertCredential("api", "bearer", "payload");

    var record = sysdb.getCredential(String.valueOf(id)).orElseThrow();
    assertEquals(String.valueOf(id), record.id());
    assertEquals("api", record.name());
    assertEquals("bearer", record.type());
    assertEquals("payload", record.encryptedPayload());

    assertTrue(sysdb.getCredential(String.valueOf(id + 1)).isEmpty());
    assertTrue(sysdb.getCredential("not-a-number").isEmpty());
  }

  @Test
  public void scheduleAndDispatchAgainstDatabase() throws Exception {
    var encryption = new CredentialEncryption(CredentialEncryption.generateKey());
    long credentialId =
        insertCredential("api", "bearer", encryption.encrypt(Map.of("token", "db-token")));
    long workflowId = insertWorkflow(TestGraphs.triggeredJson(String.valueOf(credentialId)));

    var service = new ScheduleService(sysdb, sysdb, clock);
    var schedule = service.createSchedule(workflowId, 300, now.minusSeconds(1));
    assertEquals("scheduled", triggerTypeOf(workflowId));

    var sink = new RecordingPublisher();
    var dispatcher =
        new ScheduleDispatcher(
            sysdb,
            sysdb,
            new CredentialResolver(sysdb, encryption),
            new WorkflowRunPublisher(sink, "workflow_queue"),
            clock,
            5);

    var due = service.listDueSchedules(now, 60);
    assertEquals(1, due.size());
    var result = dispatcher.dispatch(due.get(0));

    assertEquals(DispatchResult.Status.SUCCEEDED, result.status());
    var body = sink.published().get(0).body();
    assertEquals(String.valueOf(workflowId), body.get("workflow_id").asText());
    assertEquals(
        "db-token", body.at("/workflow_definition/nodes/1/credentials/values/token").asText());

    var updated = service.getScheduleById(schedule.id()).orElseThrow();
    assertEquals(1, updated.runCount());
    assertEquals(now.plusSeconds(300), updated.nextRunAt());

    service.deleteSchedule(updated);
    assertEquals("manual", triggerTypeOf(workflowId));
  }
}
