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

package io.github.suppierk.es.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.es.async.DomainEventHandler;
import io.github.suppierk.es.cqrs.AbstractEventStore;
import io.github.suppierk.es.cqrs.Aggregate;
import io.github.suppierk.es.cqrs.BoundedContext;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.DomainException;
import io.github.suppierk.es.cqrs.ErrorKind;
import io.github.suppierk.es.cqrs.EventEnvelope;
import io.github.suppierk.es.json.EventRecord;
import io.github.suppierk.es.json.JsonEventCodec;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link io.github.suppierk.es.cqrs.EventStore} keeping the log in a single append-only UTF-8 text
 * file, one JSON {@link EventRecord} per line.
 *
 * <ul>
 *   <li>The file is created on first use if it does not exist, its parent directory is not.
 *   <li>Every retrieval scans and parses the whole file and filters records in memory - there is
 *       no index, the cost of each call grows with the log.
 *   <li>Payloads are decoded only for the records which passed the filter, so logs shared by
 *       several aggregate types can be read by each of their stores.
 *   <li>An append serializes the whole batch and writes it to the end of the file at once.
 *   <li>No locking is performed - several processes writing to the same file can interleave their
 *       batches.
 * </ul>
 *
 * <p>Every {@link IOException} is reported as an {@link ErrorKind#INTERNAL} {@link
 * DomainException} with {@link #IO_FAILURE} code and the file path in its extensions.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the events
 */
// @formatter:off
public final class FileEventStore<
  A extends Aggregate,
  E extends DomainEvent<A>
> extends AbstractEventStore<A, E> {
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(FileEventStore.class);

  /** Code of the failures caused by the file system. */
  public static final String IO_FAILURE = "IO_FAILURE";

  private final Path path;
  private final JsonEventCodec<E> codec;

  /**
   * Creates a store using a default {@link ObjectMapper} and the UTC system clock.
   *
   * @param path of the log file
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   */
  public FileEventStore(
      final Path path, final Supplier<A> aggregateFactory, final Class<E> eventClass) {
    this(path, aggregateFactory, eventClass, new ObjectMapper(), Clock.systemUTC());
  }

  /**
   * @param path of the log file
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   * @param objectMapper to serialize records with
   * @param clock to stamp appended envelopes with
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public FileEventStore(
      final Path path,
      final Supplier<A> aggregateFactory,
      final Class<E> eventClass,
      final ObjectMapper objectMapper,
      final Clock clock) {
    super(aggregateFactory, clock);
    this.path = throwIllegalArgumentIfNull(path, "Path");
    this.codec =
        new JsonEventCodec<>(
            throwIllegalArgumentIfNull(objectMapper, "Object mapper"),
            throwIllegalArgumentIfNull(eventClass, "Event class"));
  }

  /**
   * Wires a new store and the given handlers into a {@link BoundedContext}.
   *
   * @param path of the log file
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   * @param domainEventHandlers to notify after every append
   * @return a new bounded context over a new store
   * @param <A> is the type of the aggregate
   * @param <E> is the type of the events
   */
  public static <A extends Aggregate, E extends DomainEvent<A>>
      BoundedContext<A, E> createBoundedContext(
          final Path path,
          final Supplier<A> aggregateFactory,
          final Class<E> eventClass,
          final List<? extends DomainEventHandler<A, E>> domainEventHandlers) {
    return new BoundedContext<>(
        new FileEventStore<>(path, aggregateFactory, eventClass), domainEventHandlers);
  }

  public Path getPath() {
    return path;
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieve(final String aggregateId) {
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return read(
        eventRecord ->
            belongsToAggregate(
                eventRecord.aggregateId(), eventRecord.aggregateType(), nonNullAggregateId));
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieveForQuery() {
    return read(
        eventRecord -> matchesQuery(eventRecord.aggregateId(), eventRecord.aggregateType(), null));
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieveForQuery(final String aggregateId) {
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return read(
        eventRecord ->
            matchesQuery(
                eventRecord.aggregateId(), eventRecord.aggregateType(), nonNullAggregateId));
  }

  /** {@inheritDoc} */
  @Override
  protected void persist(final List<EventEnvelope<E>> envelopes) {
    final var batch = new StringBuilder();
    for (EventEnvelope<E> envelope : envelopes) {
      batch.append(codec.encodeRecord(envelope)).append('\n');
    }

    final byte[] bytes = batch.toString().getBytes(StandardCharsets.UTF_8);
    try (OutputStream outputStream =
        Files.newOutputStream(
            path,
            StandardOpenOption.CREATE,
            StandardOpenOption.WRITE,
            StandardOpenOption.APPEND)) {
      outputStream.write(bytes);
    } catch (IOException e) {
      throw ioFailure("Unable to append events to the log", e);
    }

    LOG.debug("Wrote {} records to '{}'", envelopes.size(), path);
  }

  private List<EventEnvelope<E>> read(final Predicate<EventRecord> filter) {
    final List<String> lines;
    try {
      ensureLogExists();
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw ioFailure("Unable to read the log", e);
    }

    final List<EventEnvelope<E>> envelopes = new ArrayList<>();
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }

      final EventRecord eventRecord = codec.decodeRecord(line);
      if (filter.test(eventRecord)) {
        envelopes.add(codec.toEnvelope(eventRecord));
      }
    }

    return envelopes;
  }

  private void ensureLogExists() throws IOException {
    Files.write(path, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.APPEND);
  }

  private DomainException ioFailure(final String message, final IOException cause) {
    return new DomainException(
        ErrorKind.INTERNAL, message, IO_FAILURE, Map.of("path", path.toString()), cause);
  }
}
