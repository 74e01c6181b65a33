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

package io.github.suppierk.es.json;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.DomainException;
import io.github.suppierk.es.cqrs.ErrorKind;
import io.github.suppierk.es.cqrs.EventEnvelope;
import java.util.Map;

/**
 * Jackson based codec shared by the stores: events, metadata and whole {@link EventRecord}s to and
 * from JSON strings.
 *
 * <p>Events are written through the declared event type, so polymorphic type information declared
 * on a {@code sealed} event interface is always included. Every failure is reported as an {@link
 * ErrorKind#INTERNAL} {@link DomainException}: {@link #INVALID_JSON} when the input is not JSON at
 * all, {@link #SERIALIZATION_FAILED} otherwise.
 *
 * @param <E> is the type of the events
 */
public final class JsonEventCodec<E extends DomainEvent<?>> {
  /** Code of the failures caused by malformed input. */
  public static final String INVALID_JSON = "INVALID_JSON";

  /** Code of the remaining serialization failures. */
  public static final String SERIALIZATION_FAILED = "SERIALIZATION_FAILED";

  private static final TypeReference<Map<String, String>> METADATA_TYPE = new TypeReference<>() {};

  private final Class<E> eventClass;
  private final ObjectWriter eventWriter;
  private final ObjectReader eventReader;
  private final ObjectWriter metadataWriter;
  private final ObjectReader metadataReader;
  private final ObjectWriter recordWriter;
  private final ObjectReader recordReader;

  /**
   * @param objectMapper configured by the caller
   * @param eventClass declared event type, typically a {@code sealed} interface
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public JsonEventCodec(final ObjectMapper objectMapper, final Class<E> eventClass) {
    if (objectMapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    this.eventClass = eventClass;
    this.eventWriter = objectMapper.writerFor(eventClass);
    this.eventReader = objectMapper.readerFor(eventClass);
    this.metadataWriter = objectMapper.writerFor(METADATA_TYPE);
    this.metadataReader = objectMapper.readerFor(METADATA_TYPE);
    this.recordWriter = objectMapper.writerFor(EventRecord.class);
    this.recordReader = objectMapper.readerFor(EventRecord.class);
  }

  public Class<E> getEventClass() {
    return eventClass;
  }

  public String encodePayload(final E event) {
    try {
      return eventWriter.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw failure("Unable to serialize event '%s'".formatted(event.name()), e);
    }
  }

  public E decodePayload(final String json) {
    try {
      return eventReader.readValue(json);
    } catch (JsonProcessingException e) {
      throw failure("Unable to deserialize event as '%s'".formatted(eventClass.getName()), e);
    }
  }

  public String encodeMetadata(final Map<String, String> metadata) {
    try {
      return metadataWriter.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw failure("Unable to serialize metadata", e);
    }
  }

  /**
   * @param json to decode, {@code null} decodes to an empty map
   * @return decoded metadata
   */
  public Map<String, String> decodeMetadata(final String json) {
    if (json == null) {
      return Map.of();
    }

    final Map<String, String> metadata;
    try {
      metadata = metadataReader.readValue(json);
    } catch (JsonProcessingException e) {
      throw failure("Unable to deserialize metadata", e);
    }

    if (EventEnvelope.hasNullEntries(metadata)) {
      throw new DomainException(
          ErrorKind.INTERNAL, "Metadata contains null values", SERIALIZATION_FAILED, Map.of(), null);
    }

    return metadata == null ? Map.of() : metadata;
  }

  /**
   * @param envelope to convert
   * @return single line JSON representation of the envelope
   */
  public String encodeRecord(final EventEnvelope<E> envelope) {
    final var eventRecord =
        new EventRecord(
            envelope.aggregateId(),
            envelope.aggregateType(),
            envelope.version(),
            encodePayload(envelope.payload()),
            envelope.metadata(),
            envelope.createdAt());

    try {
      return recordWriter.writeValueAsString(eventRecord);
    } catch (JsonProcessingException e) {
      throw failure("Unable to serialize event record", e);
    }
  }

  /**
   * Reads the outer record only, leaving the payload undecoded.
   *
   * @param json single line JSON representation of the record
   * @return decoded record
   */
  public EventRecord decodeRecord(final String json) {
    try {
      return recordReader.readValue(json);
    } catch (JsonProcessingException e) {
      throw failure("Unable to deserialize event record", e);
    }
  }

  /**
   * @param eventRecord to convert
   * @return envelope with the decoded payload
   * @throws DomainException if a required field is missing or the metadata has {@code null} values
   */
  public EventEnvelope<E> toEnvelope(final EventRecord eventRecord) {
    if (eventRecord.aggregateId() == null
        || eventRecord.aggregateType() == null
        || eventRecord.payload() == null
        || eventRecord.createdAt() == null
        || eventRecord.version() < 1
        || EventEnvelope.hasNullEntries(eventRecord.meta())) {
      throw new DomainException(
          ErrorKind.INTERNAL,
          "Event record is incomplete",
          SERIALIZATION_FAILED,
          Map.of(
              "aggregate_id", String.valueOf(eventRecord.aggregateId()),
              "version", String.valueOf(eventRecord.version())),
          null);
    }

    return new EventEnvelope<>(
        eventRecord.aggregateId(),
        eventRecord.aggregateType(),
        eventRecord.version(),
        decodePayload(eventRecord.payload()),
        eventRecord.meta() == null ? Map.of() : eventRecord.meta(),
        eventRecord.createdAt());
  }

  private static DomainException failure(final String message, final JsonProcessingException e) {
    final String code = e instanceof JsonParseException ? INVALID_JSON : SERIALIZATION_FAILED;
    return new DomainException(ErrorKind.INTERNAL, message, code, Map.of(), e);
  }
}
