package com.streamfirst.splitter.ports;

import com.streamfirst.splitter.domain.SplitterEvent;

import java.util.List;
import java.util.function.Consumer;

/**
 * Port for publishing splitter notifications.
 * Notifications are append-only: once published they are never modified or withdrawn.
 */
public interface EventPort {

    /**
     * Publishes a notification synchronously to a topic.
     *
     * @param topic the topic to publish to
     * @param event the notification to publish
     * @throws IllegalStateException if the port is closed
     */
    void publish(String topic, SplitterEvent event);

    /**
     * Subscribes to a topic with type-safe event handling.
     * Only notifications of the specified type are passed to the handler.
     *
     * @param topic the topic to subscribe to
     * @param eventType the expected notification type
     * @param handler the handler to process received notifications
     * @return subscription ID for managing this specific subscription
     */
    <E extends SplitterEvent> String subscribe(String topic, Class<E> eventType, Consumer<? super E> handler);

    /**
     * Unsubscribes a specific subscription by its ID.
     *
     * @param subscriptionId the subscription ID to remove
     * @return true if subscription was found and removed, false otherwise
     */
    boolean unsubscribe(String subscriptionId);

    /**
     * Gets every notification published to a topic, in publication order.
     *
     * @param topic the topic to read
     * @return an immutable snapshot of the topic's log
     */
    List<SplitterEvent> history(String topic);

    /**
     * Gets the notifications of one type published to a topic, in publication order.
     */
    default <E extends SplitterEvent> List<E> history(String topic, Class<E> eventType) {
        return history(topic).stream()
            .filter(eventType::isInstance)
            .map(eventType::cast)
            .toList();
    }
}
