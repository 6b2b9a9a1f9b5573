package dev.rune.scheduler.execution;

import dev.rune.scheduler.config.SchedulerConfig;
import dev.rune.scheduler.credentials.CredentialResolver;
import dev.rune.scheduler.database.ScheduleStore;
import dev.rune.scheduler.exceptions.BrokerUnavailableException;
import dev.rune.scheduler.messaging.BrokerConnector;
import dev.rune.scheduler.messaging.MessagePublisher;
import dev.rune.scheduler.messaging.WorkflowRunPublisher;
import dev.rune.scheduler.schedule.ScheduleRecord;
import dev.rune.scheduler.workflow.WorkflowStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background poller that fires due schedules.
 *
 * <p>{@link #start()} connects to the message broker and then starts a poll thread which waits one
 * poll interval and runs a tick, over and over. A tick fetches every active schedule due within
 * the look-ahead window and dispatches them concurrently on a fixed pool, returning only once all
 * of them have recorded their outcome. Ticks never overlap.
 *
 * <p>While polling, a separate timer checks the database and the broker connection every
 * health-check interval and logs the result together with the running {@link SchedulerStats}.
 */
public class SchedulerDaemon {
  private static final Logger logger = LoggerFactory.getLogger(SchedulerDaemon.class);

  private final SchedulerConfig config;
  private final ScheduleStore scheduleStore;
  private final WorkflowStore workflowStore;
  private final CredentialResolver credentialResolver;
  private final BrokerConnector brokerConnector;
  private final Clock clock;

  private final ReentrantLock tickLock = new ReentrantLock();

  private final AtomicLong totalChecks = new AtomicLong();
  private final AtomicLong totalExecutions = new AtomicLong();
  private final AtomicLong totalFailures = new AtomicLong();

  private volatile DaemonState state = DaemonState.STOPPED;
  private volatile boolean running = false;
  private Thread pollThread;
  private CountDownLatch stopSignal;
  private CountDownLatch shutdownLatch;
  private CountDownLatch terminated = new CountDownLatch(0);
  private ExecutorService dispatchPool;
  private ScheduledExecutorService healthCheckTimer;
  private volatile MessagePublisher publisher;
  private ScheduleDispatcher dispatcher;

  public SchedulerDaemon(
      SchedulerConfig config,
      ScheduleStore scheduleStore,
      WorkflowStore workflowStore,
      CredentialResolver credentialResolver,
      BrokerConnector brokerConnector,
      Clock clock) {
    this.config = Objects.requireNonNull(config);
    this.scheduleStore = Objects.requireNonNull(scheduleStore);
    this.workflowStore = Objects.requireNonNull(workflowStore);
    this.credentialResolver = Objects.requireNonNull(credentialResolver);
    this.brokerConnector = Objects.requireNonNull(brokerConnector);
    this.clock = Objects.requireNonNull(clock);
  }

  public DaemonState state() {
    return state;
  }

  public SchedulerStats stats() {
    return new SchedulerStats(totalChecks.get(), totalExecutions.get(), totalFailures.get());
  }

  /**
   * Connects to the broker and starts polling.
   *
   * @throws BrokerUnavailableException if the broker cannot be reached; the daemon stays stopped
   */
  public synchronized void start() {
    if (state != DaemonState.STOPPED) {
      logger.warn("Scheduler daemon is already running");
      return;
    }

    state = DaemonState.CONNECTING;
    logger.info(
        "Starting scheduler daemon (poll interval {}s, look-ahead {}s, health check interval {}s,"
            + " max concurrent dispatches {})",
        config.pollIntervalSeconds(),
        config.lookAheadSeconds(),
        config.healthCheckIntervalSeconds(),
        config.maxConcurrentDispatches());

    try {
      publisher = brokerConnector.connect();
    } catch (RuntimeException e) {
      state = DaemonState.STOPPED;
      logger.error("Failed to connect to message broker; scheduler not started", e);
      throw (e instanceof BrokerUnavailableException bue)
          ? bue
          : new BrokerUnavailableException("Failed to connect to message broker", e);
    }

    dispatcher =
        new ScheduleDispatcher(
            scheduleStore,
            workflowStore,
            credentialResolver,
            new WorkflowRunPublisher(publisher, config.broker().queueName()),
            clock,
            config.maxConsecutiveFailures());
    dispatchPool =
        Executors.newFixedThreadPool(config.maxConcurrentDispatches(), new DispatchThreadFactory());

    running = true;
    stopSignal = new CountDownLatch(1);
    shutdownLatch = new CountDownLatch(1);
    terminated = new CountDownLatch(1);
    state = DaemonState.POLLING;
    pollThread = new Thread(this::pollLoop, "SchedulerPollThread");
    pollThread.setDaemon(true);
    pollThread.start();

    long healthCheckMs = config.healthCheckInterval().toMillis();
    healthCheckTimer =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "SchedulerHealthCheck");
              t.setDaemon(true);
              return t;
            });
    healthCheckTimer.scheduleAtFixedRate(
        () -> {
          try {
            runHealthCheck();
          } catch (RuntimeException e) {
            logger.error("Health check error", e);
          }
        },
        healthCheckMs,
        healthCheckMs,
        TimeUnit.MILLISECONDS);
    logger.info("Scheduler polling loop started");
  }

  /**
   * Checks that the schedule store and the broker connection are usable and logs the result.
   *
   * @return true if both are healthy
   */
  public boolean runHealthCheck() {
    boolean dbHealthy = checkQuietly("database", scheduleStore::isHealthy);
    MessagePublisher current = publisher;
    boolean mqHealthy = current != null && checkQuietly("message broker", current::isHealthy);

    if (dbHealthy && mqHealthy) {
      var stats = stats();
      logger.info(
          "HEALTHCHECK OK | Checks: {} | Executions: {} | Failures: {}",
          stats.totalChecks(),
          stats.totalExecutions(),
          stats.totalFailures());
      return true;
    }
    logger.error(
        "HEALTHCHECK FAILED | DB: {} | MQ: {}", dbHealthy ? "OK" : "FAIL", mqHealthy ? "OK" : "FAIL");
    return false;
  }

  private static boolean checkQuietly(String what, BooleanSupplier check) {
    try {
      return check.getAsBoolean();
    } catch (RuntimeException e) {
      logger.error("{} health check failed", what, e);
      return false;
    }
  }

  private void pollLoop() {
    try {
      while (running) {
        try {
          if (stopSignal.await(config.pollInterval().toMillis(), TimeUnit.MILLISECONDS)) {
            break;
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          logger.warn("SchedulerPollThread interrupted while waiting");
          break;
        }

        if (!running) {
          break;
        }

        try {
          runTick();
        } catch (RuntimeException e) {
          logger.error("Error in scheduler polling loop", e);
        }
      }
    } finally {
      shutdownLatch.countDown();
      logger.debug("SchedulerPollThread has ended");
    }
  }

  /**
   * Runs one tick now and returns the result of every schedule it fetched. Waits for a tick that
   * is already in progress.
   *
   * @throws IllegalStateException if the daemon is not polling
   */
  public List<DispatchResult> runTick() {
    if (state != DaemonState.POLLING) {
      throw new IllegalStateException("Scheduler daemon is not polling");
    }

    tickLock.lock();
    try {
      totalChecks.incrementAndGet();
      Instant now = clock.instant();
      List<ScheduleRecord> due;
      try {
        due = scheduleStore.listDueSchedules(now.plus(config.lookAhead()));
      } catch (RuntimeException e) {
        logger.error("Failed to fetch due schedules", e);
        return List.of();
      }

      Map<Long, ScheduleRecord> unique = new LinkedHashMap<>();
      for (ScheduleRecord schedule : due) {
        unique.putIfAbsent(schedule.id(), schedule);
      }
      if (unique.isEmpty()) {
        logger.debug("No schedules due at {}", now);
        return List.of();
      }
      logger.info("Found {} schedule(s) due for execution", unique.size());

      List<Callable<DispatchResult>> tasks = new ArrayList<>(unique.size());
      for (ScheduleRecord schedule : unique.values()) {
        tasks.add(() -> dispatcher.dispatch(schedule));
      }

      List<DispatchResult> results = new ArrayList<>(tasks.size());
      try {
        for (Future<DispatchResult> future : dispatchPool.invokeAll(tasks)) {
          try {
            DispatchResult result = future.get();
            count(result);
            results.add(result);
          } catch (ExecutionException e) {
            totalFailures.incrementAndGet();
            logger.error("Schedule dispatch task failed", e.getCause());
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.warn("Interrupted while waiting for scheduled dispatches");
      }
      return results;
    } finally {
      tickLock.unlock();
    }
  }

  private void count(DispatchResult result) {
    switch (result.status()) {
      case SUCCEEDED -> totalExecutions.incrementAndGet();
      case FAILED, BOOKKEEPING_LOST -> totalFailures.incrementAndGet();
      case SKIPPED -> {}
    }
  }

  /**
   * Stops polling, lets the current tick finish, then releases the dispatch pool and the broker
   * connection.
   */
  public synchronized void stop() {
    if (state == DaemonState.STOPPED) {
      logger.debug("Scheduler daemon is not running");
      return;
    }
    logger.info("Stopping scheduler daemon");

    running = false;
    healthCheckTimer.shutdownNow();
    stopSignal.countDown();
    try {
      shutdownLatch.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.warn("Interrupted waiting for SchedulerPollThread; interrupting it");
      pollThread.interrupt();
    }

    dispatchPool.shutdown();
    try {
      if (!dispatchPool.awaitTermination(config.broker().timeoutMs(), TimeUnit.MILLISECONDS)) {
        logger.warn("Dispatch pool did not terminate in time");
        dispatchPool.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatchPool.shutdownNow();
    }

    var stats = stats();
    logger.info(
        "Final statistics: total checks {}, total executions {}, total failures {}",
        stats.totalChecks(),
        stats.totalExecutions(),
        stats.totalFailures());

    publisher.close();
    pollThread = null;
    dispatchPool = null;
    healthCheckTimer = null;
    publisher = null;
    dispatcher = null;
    state = DaemonState.STOPPED;
    terminated.countDown();
    logger.info("Scheduler daemon stopped");
  }

  /** Blocks until {@link #stop()} has completed. Returns at once if the daemon is not running. */
  public void awaitTermination() throws InterruptedException {
    CountDownLatch latch;
    synchronized (this) {
      latch = terminated;
    }
    latch.await();
  }

  public synchronized boolean isStopped() {
    return state == DaemonState.STOPPED;
  }

  private static class DispatchThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "SchedulerDispatch-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
