package com.streamfirst.splitter.adapters;

import com.streamfirst.splitter.domain.SplitterEvent;
import com.streamfirst.splitter.ports.EventPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of EventPort. Keeps an append-only log per topic and delivers each
 * notification synchronously to matching subscribers within the same JVM. A failing subscriber
 * is logged and does not affect the publisher or other subscribers.
 */
@Slf4j
public class InMemoryEventAdapter implements EventPort {

  private final Map<String, List<SplitterEvent>> topicLogs = new ConcurrentHashMap<>();
  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final AtomicLong subscriptionCounter = new AtomicLong(1);
  private volatile boolean connected = true;

  private record Subscription(String topic, Class<? extends SplitterEvent> eventType,
                              Consumer<SplitterEvent> handler) {}

  @Override
  public void publish(String topic, SplitterEvent event) {
    if (!connected) {
      throw new IllegalStateException("Event port is closed");
    }
    Objects.requireNonNull(event, "Event cannot be null");

    log.debug("Publishing event to topic '{}': {}", topic, event);
    topicLogs.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(event);

    int delivered = 0;
    for (Subscription subscription : subscriptions.values()) {
      if (!subscription.topic().equals(topic) || !subscription.eventType().isInstance(event)) {
        continue;
      }
      try {
        subscription.handler().accept(event);
        delivered++;
      } catch (Exception e) {
        log.error("Error delivering {} to subscriber for topic '{}'",
            event.getClass().getSimpleName(), topic, e);
      }
    }

    log.trace("Published event to topic '{}' - delivered to {} subscribers", topic, delivered);
  }

  @Override
  public <E extends SplitterEvent> String subscribe(
      String topic, Class<E> eventType, Consumer<? super E> handler) {
    String subscriptionId = "sub-" + subscriptionCounter.getAndIncrement();
    subscriptions.put(
        subscriptionId,
        new Subscription(topic, eventType, event -> handler.accept(eventType.cast(event))));

    log.info(
        "Subscribed to topic '{}' for type '{}' with ID {}",
        topic,
        eventType.getSimpleName(),
        subscriptionId);
    return subscriptionId;
  }

  @Override
  public boolean unsubscribe(String subscriptionId) {
    Subscription removed = subscriptions.remove(subscriptionId);
    if (removed == null) {
      log.debug("Subscription '{}' not found", subscriptionId);
      return false;
    }
    log.info("Unsubscribed subscription '{}' from topic '{}'", subscriptionId, removed.topic());
    return true;
  }

  @Override
  public List<SplitterEvent> history(String topic) {
    return List.copyOf(topicLogs.getOrDefault(topic, List.of()));
  }

  /** Stops accepting notifications and drops all subscriptions. The log is kept. */
  public void close() {
    log.info("Closing event port");
    connected = false;
    subscriptions.clear();
  }

  /** Gets all topics that have received at least one notification. */
  public Set<String> getTopics() {
    return new HashSet<>(topicLogs.keySet());
  }
}
