package dev.rune.scheduler.utils;

import dev.rune.scheduler.json.JSONUtil;
import dev.rune.scheduler.messaging.MessagePublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;

/** Keeps published messages as parsed JSON; can be told to refuse them. */
public class RecordingPublisher implements MessagePublisher {

  public record Published(String queueName, JsonNode body) {}

  private final List<Published> published = new CopyOnWriteArrayList<>();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();

  public volatile boolean accept = true;
  public volatile long publishDelayMs = 0;
  public volatile boolean closed = false;
  public volatile boolean healthy = true;

  @Override
  public boolean publish(String queueName, Object message) {
    int current = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(current, Math::max);
    try {
      if (publishDelayMs > 0) {
        Thread.sleep(publishDelayMs);
      }
      if (!accept) {
        return false;
      }
      published.add(new Published(queueName, JSONUtil.readTree(JSONUtil.toJson(message))));
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      inFlight.decrementAndGet();
    }
  }

  public List<Published> published() {
    return List.copyOf(published);
  }

  public int maxInFlight() {
    return maxInFlight.get();
  }

  @Override
  public boolean isHealthy() {
    return healthy && !closed;
  }

  @Override
  public void close() {
    closed = true;
  }
}
