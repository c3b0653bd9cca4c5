package com.streamfirst.splitter.domain;

import java.util.UUID;
import lombok.NonNull;

/**
 * Strong type for notification identifiers.
 */
public record EventId(@NonNull String value) {

  public EventId {
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Event ID cannot be null or empty");
    }
  }

  /** Generates a new unique EventId with the given prefix. */
  public static EventId generate(String prefix) {
    return new EventId(prefix + "-" + UUID.randomUUID());
  }

  @Override
  public @NonNull String toString() {
    return value;
  }
}
