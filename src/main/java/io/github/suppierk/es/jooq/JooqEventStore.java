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

package io.github.suppierk.es.jooq;

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
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep6;
import org.jooq.Record;
import org.jooq.Record6;
import org.jooq.Result;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link io.github.suppierk.es.cqrs.EventStore} keeping the log in a relational table through
 * jOOQ.
 *
 * <p>Every event is a row ordered by an identity {@code sequence_number} column, payload and
 * metadata are stored as JSON text the same way {@link io.github.suppierk.es.file.FileEventStore}
 * writes them. Filtering happens in the database, an append inserts the whole batch in a single
 * transaction.
 *
 * <p>The {@link DSLContext} is resolved through {@link DslContextProvider} on every call, keyed by
 * the aggregate type of the store. Every jOOQ {@link DataAccessException} is reported as an {@link
 * ErrorKind#INTERNAL} {@link DomainException} with {@link #SQL_FAILURE} code.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the events
 */
// @formatter:off
public final class JooqEventStore<
  A extends Aggregate,
  E extends DomainEvent<A>
> extends AbstractEventStore<A, E> {
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(JooqEventStore.class);

  /** Table used when none is given. */
  public static final String DEFAULT_TABLE_NAME = "event_store";

  /** Code of the failures caused by the database. */
  public static final String SQL_FAILURE = "SQL_FAILURE";

  // @formatter:off
  private static final Field<Long> SEQUENCE_NUMBER =
      DSL.field(DSL.name("sequence_number"), SQLDataType.BIGINT.identity(true));
  private static final Field<String> AGGREGATE_ID =
      DSL.field(DSL.name("aggregate_id"), SQLDataType.VARCHAR(255).nullable(false));
  private static final Field<String> AGGREGATE_TYPE =
      DSL.field(DSL.name("aggregate_type"), SQLDataType.VARCHAR(255).nullable(false));
  private static final Field<Long> VERSION =
      DSL.field(DSL.name("version"), SQLDataType.BIGINT.nullable(false));
  private static final Field<String> PAYLOAD =
      DSL.field(DSL.name("payload"), SQLDataType.CLOB.nullable(false));
  private static final Field<String> META =
      DSL.field(DSL.name("meta"), SQLDataType.CLOB.nullable(false));
  private static final Field<String> CREATED_AT =
      DSL.field(DSL.name("created_at"), SQLDataType.VARCHAR(64).nullable(false));
  // @formatter:on

  private final DslContextProvider dslContextProvider;
  private final String tableName;
  private final Table<Record> table;
  private final JsonEventCodec<E> codec;

  /**
   * Creates a store over {@link #DEFAULT_TABLE_NAME} using a default {@link ObjectMapper} and the
   * UTC system clock.
   *
   * @param dslContextProvider to resolve the database with
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider,
      final Supplier<A> aggregateFactory,
      final Class<E> eventClass) {
    this(
        dslContextProvider,
        DEFAULT_TABLE_NAME,
        aggregateFactory,
        eventClass,
        new ObjectMapper(),
        Clock.systemUTC());
  }

  /**
   * @param dslContextProvider to resolve the database with
   * @param tableName holding the events
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   * @param objectMapper to serialize payloads and metadata with
   * @param clock to stamp appended envelopes with
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider,
      final String tableName,
      final Supplier<A> aggregateFactory,
      final Class<E> eventClass,
      final ObjectMapper objectMapper,
      final Clock clock) {
    super(aggregateFactory, clock);
    this.dslContextProvider = throwIllegalArgumentIfNull(dslContextProvider, "DSLContext provider");
    this.tableName = throwIllegalArgumentIfNull(tableName, "Table name");
    this.table = DSL.table(DSL.name(tableName));
    this.codec =
        new JsonEventCodec<>(
            throwIllegalArgumentIfNull(objectMapper, "Object mapper"),
            throwIllegalArgumentIfNull(eventClass, "Event class"));
  }

  /**
   * Wires a new store over {@link #DEFAULT_TABLE_NAME} and the given handlers into a {@link
   * BoundedContext}. The table is expected to exist.
   *
   * @param dslContextProvider to resolve the database with
   * @param aggregateFactory creating aggregates in their default state
   * @param eventClass declared event type
   * @param domainEventHandlers to notify after every append
   * @return a new bounded context over a new store
   * @param <A> is the type of the aggregate
   * @param <E> is the type of the events
   */
  public static <A extends Aggregate, E extends DomainEvent<A>>
      BoundedContext<A, E> createBoundedContext(
          final DslContextProvider dslContextProvider,
          final Supplier<A> aggregateFactory,
          final Class<E> eventClass,
          final List<? extends DomainEventHandler<A, E>> domainEventHandlers) {
    return new BoundedContext<>(
        new JooqEventStore<>(dslContextProvider, aggregateFactory, eventClass),
        domainEventHandlers);
  }

  public String getTableName() {
    return tableName;
  }

  /**
   * Creates the event table and its lookup index unless they exist already.
   *
   * @throws DomainException if the database failed
   */
  public void createSchema() {
    try {
      final DSLContext dsl = dsl();

      dsl.createTableIfNotExists(table)
          .column(SEQUENCE_NUMBER)
          .column(AGGREGATE_ID)
          .column(AGGREGATE_TYPE)
          .column(VERSION)
          .column(PAYLOAD)
          .column(META)
          .column(CREATED_AT)
          .constraints(DSL.constraint(DSL.name(tableName + "_pk")).primaryKey(SEQUENCE_NUMBER))
          .execute();

      dsl.createIndexIfNotExists(DSL.name(tableName + "_aggregate_idx"))
          .on(table, AGGREGATE_ID, AGGREGATE_TYPE)
          .execute();
    } catch (DataAccessException e) {
      throw sqlFailure("Unable to create the event table", e);
    }

    LOG.debug("Ensured event table '{}' exists", tableName);
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieve(final String aggregateId) {
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return read(AGGREGATE_ID.eq(nonNullAggregateId).and(AGGREGATE_TYPE.eq(getAggregateType())));
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieveForQuery() {
    return read(AGGREGATE_TYPE.eq(getAggregateType()));
  }

  /** {@inheritDoc} */
  @Override
  public List<EventEnvelope<E>> retrieveForQuery(final String aggregateId) {
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return read(AGGREGATE_ID.eq(nonNullAggregateId).or(AGGREGATE_TYPE.eq(getAggregateType())));
  }

  /** {@inheritDoc} */
  @Override
  protected void persist(final List<EventEnvelope<E>> envelopes) {
    final List<EventRecord> eventRecords = new ArrayList<>(envelopes.size());
    for (EventEnvelope<E> envelope : envelopes) {
      eventRecords.add(
          new EventRecord(
              envelope.aggregateId(),
              envelope.aggregateType(),
              envelope.version(),
              codec.encodePayload(envelope.payload()),
              envelope.metadata(),
              envelope.createdAt()));
    }

    try {
      dsl()
          .transaction(
              configuration -> {
                // @formatter:off
                InsertValuesStep6<Record, String, String, Long, String, String, String> insert =
                    DSL.using(configuration)
                        .insertInto(table, AGGREGATE_ID, AGGREGATE_TYPE, VERSION, PAYLOAD, META, CREATED_AT);
                // @formatter:on

                for (EventRecord eventRecord : eventRecords) {
                  insert =
                      insert.values(
                          eventRecord.aggregateId(),
                          eventRecord.aggregateType(),
                          eventRecord.version(),
                          eventRecord.payload(),
                          codec.encodeMetadata(eventRecord.meta()),
                          eventRecord.createdAt());
                }

                insert.execute();
              });
    } catch (DataAccessException e) {
      throw sqlFailure("Unable to append events to the event table", e);
    }

    LOG.debug("Inserted {} rows into '{}'", envelopes.size(), tableName);
  }

  private List<EventEnvelope<E>> read(final Condition condition) {
    final Result<Record6<String, String, Long, String, String, String>> rows;
    try {
      rows =
          dsl()
              .select(AGGREGATE_ID, AGGREGATE_TYPE, VERSION, PAYLOAD, META, CREATED_AT)
              .from(table)
              .where(condition)
              .orderBy(SEQUENCE_NUMBER.asc())
              .fetch();
    } catch (DataAccessException e) {
      throw sqlFailure("Unable to read the event table", e);
    }

    final List<EventEnvelope<E>> envelopes = new ArrayList<>(rows.size());
    for (Record6<String, String, Long, String, String, String> row : rows) {
      final var eventRecord =
          new EventRecord(
              row.value1(),
              row.value2(),
              row.value3() == null ? 0L : row.value3(),
              row.value4(),
              codec.decodeMetadata(row.value5()),
              row.value6());

      envelopes.add(codec.toEnvelope(eventRecord));
    }

    return envelopes;
  }

  private DSLContext dsl() {
    return throwIllegalStateIfNull(dslContextProvider.apply(getAggregateType()), "DSLContext");
  }

  private DomainException sqlFailure(final String message, final DataAccessException cause) {
    return new DomainException(
        ErrorKind.INTERNAL, message, SQL_FAILURE, Map.of("table", tableName), cause);
  }
}
