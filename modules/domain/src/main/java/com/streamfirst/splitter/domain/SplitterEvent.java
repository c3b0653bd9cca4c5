package com.streamfirst.splitter.domain;

import java.time.Instant;

/**
 * An immutable, append-only notification emitted by the splitter.
 * Notifications are observational: the core never reads them back.
 */
public interface SplitterEvent {

    /** Topic every splitter notification is published on unless configured otherwise. */
    String DEFAULT_TOPIC = "splitter.notifications";

    EventId eventId();

    Instant occurredAt();
}
