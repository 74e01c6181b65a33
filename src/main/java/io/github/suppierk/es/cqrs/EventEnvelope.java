/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.es.cqrs;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The persisted unit of the event log: a {@link DomainEvent} positioned within the stream of its
 * aggregate.
 *
 * <p>Versions are strictly increasing per aggregate id and type pair, start at {@code 1} and have
 * no gaps - they are assigned by {@link #createMany(String, String, long, List, Map, Clock)} upon
 * append. Metadata is opaque to the library and is carried through unchanged.
 *
 * @param aggregateId of the aggregate the event belongs to
 * @param aggregateType tag of the aggregate the event belongs to
 * @param version of the aggregate after this event was applied, at least {@code 1}
 * @param payload is the event itself
 * @param metadata supplied by the caller of the append
 * @param createdAt formatted as per {@link #CREATED_AT_FORMAT}
 * @param <E> is the type of the event
 */
// @formatter:off
public record EventEnvelope<E extends DomainEvent<?>>(
    String aggregateId,
    String aggregateType,
    long version,
    E payload,
    Map<String, String> metadata,
    String createdAt
) {
// @formatter:on

  /** Format of {@link #createdAt()} stamped by the library, RFC 2822 compatible. */
  public static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.RFC_1123_DATE_TIME;

  public EventEnvelope {
    if (aggregateId == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    if (aggregateType == null) {
      throw new IllegalArgumentException("Aggregate type cannot be null");
    }

    if (version < 1) {
      throw new IllegalArgumentException("Version must be positive, got %d".formatted(version));
    }

    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null");
    }

    if (createdAt == null) {
      throw new IllegalArgumentException("Creation timestamp cannot be null");
    }

    if (hasNullEntries(metadata)) {
      throw new IllegalArgumentException("Metadata cannot contain null keys or values");
    }

    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * @param metadata to check, can be {@code null}
   * @return {@code true} if the map has a {@code null} key or value, which envelopes cannot carry
   */
  public static boolean hasNullEntries(final Map<?, ?> metadata) {
    if (metadata == null) {
      return false;
    }

    for (Map.Entry<?, ?> entry : metadata.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null) {
        return true;
      }
    }

    return false;
  }

  /**
   * Wraps freshly produced events, assigning versions {@code currentVersion + 1} up to {@code
   * currentVersion + events.size()} in the order of the input.
   *
   * @param aggregateId of the aggregate which produced the events
   * @param aggregateType tag of the aggregate which produced the events
   * @param currentVersion of the aggregate the events were produced against
   * @param events to wrap
   * @param metadata to attach to every event
   * @param clock to stamp the creation time with
   * @return envelopes in the order of assignment, empty if there were no events
   * @param <E> is the type of the event
   */
  public static <E extends DomainEvent<?>> List<EventEnvelope<E>> createMany(
      final String aggregateId,
      final String aggregateType,
      final long currentVersion,
      final List<? extends E> events,
      final Map<String, String> metadata,
      final Clock clock) {
    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    if (events.isEmpty()) {
      return Collections.emptyList();
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    final String createdAt = CREATED_AT_FORMAT.format(OffsetDateTime.now(clock));
    final List<EventEnvelope<E>> envelopes = new ArrayList<>(events.size());

    long version = currentVersion;
    for (E event : events) {
      version++;
      envelopes.add(
          new EventEnvelope<>(aggregateId, aggregateType, version, event, metadata, createdAt));
    }

    return Collections.unmodifiableList(envelopes);
  }

  /**
   * @return name of the wrapped event variant
   */
  public String eventName() {
    return payload.name();
  }
}
