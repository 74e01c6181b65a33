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
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the medium-independent part of the {@link EventStore} contract: aggregate
 * reconstruction and version assignment.
 *
 * <p>Subclasses only decide how envelopes are persisted and how they are found again.
 *
 * <p><b>Design note</b>: the aggregate type tag is resolved once upon construction from a blank
 * aggregate, so every envelope written or matched by the store uses the same tag.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the event
 */
// @formatter:off
public abstract non-sealed class AbstractEventStore<
  A extends Aggregate,
  E extends DomainEvent<A>
>
extends
        Suspicious
implements
        EventStore<A, E>
{
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(AbstractEventStore.class);

  private final Supplier<A> aggregateFactory;
  private final String aggregateType;
  private final Clock clock;

  /**
   * @param aggregateFactory creating aggregates in their default state
   * @param clock to stamp appended envelopes with
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if the factory produces {@code null} or an aggregate without a
   *     type tag
   */
  protected AbstractEventStore(final Supplier<A> aggregateFactory, final Clock clock) {
    this.aggregateFactory = throwIllegalArgumentIfNull(aggregateFactory, "Aggregate factory");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.aggregateType = throwIllegalStateIfNull(newAggregate().aggregateType(), "Aggregate type");
  }

  /**
   * @return type tag written to and matched against every envelope of this store
   */
  public final String getAggregateType() {
    return aggregateType;
  }

  /**
   * @return a new aggregate in its default state
   */
  protected final A newAggregate() {
    return throwIllegalStateIfNull(aggregateFactory.get(), "New aggregate");
  }

  /**
   * Persists the envelopes durably, in the given order.
   *
   * @param envelopes to persist, never empty
   * @throws DomainException if the medium failed
   */
  protected abstract void persist(final List<EventEnvelope<E>> envelopes);

  /**
   * @return identity for a new aggregate, a random UUID unless overridden
   */
  protected String newAggregateId() {
    return UUID.randomUUID().toString();
  }

  /** {@inheritDoc} */
  @Override
  public final AggregateContext<A> reconstruct() {
    final AggregateContext<A> context =
        AggregateContext.blank(
            throwIllegalStateIfNull(newAggregateId(), "New aggregate id"), newAggregate());

    LOG.debug("Allocated {} '{}' at version {}", aggregateType, context.id(), context.version());
    return context;
  }

  /** {@inheritDoc} */
  @Override
  public final AggregateContext<A> reconstruct(final String aggregateId) {
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    final AggregateContext<A> context = AggregateContext.blank(nonNullAggregateId, newAggregate());

    for (EventEnvelope<E> envelope : retrieve(nonNullAggregateId)) {
      context.replay(envelope);
    }

    LOG.debug(
        "Reconstructed {} '{}' at version {}", aggregateType, context.id(), context.version());
    return context;
  }

  /** {@inheritDoc} */
  @Override
  public final List<EventEnvelope<E>> append(
      final List<? extends E> events,
      final AggregateContext<A> context,
      final Map<String, String> metadata) {
    final List<? extends E> nonNullEvents = throwIllegalArgumentIfNull(events, "Events");
    final AggregateContext<A> nonNullContext = throwIllegalArgumentIfNull(context, "Context");
    final Map<String, String> nonNullMetadata = throwIllegalArgumentIfNull(metadata, "Metadata");
    if (EventEnvelope.hasNullEntries(nonNullMetadata)) {
      throw new IllegalArgumentException("Metadata cannot contain null keys or values");
    }

    final List<EventEnvelope<E>> envelopes =
        EventEnvelope.createMany(
            nonNullContext.id(),
            aggregateType,
            nonNullContext.version(),
            nonNullEvents,
            nonNullMetadata,
            clock);

    if (envelopes.isEmpty()) {
      return envelopes;
    }

    persist(envelopes);

    LOG.debug(
        "Appended {} events to {} '{}', now at version {}",
        envelopes.size(),
        aggregateType,
        nonNullContext.id(),
        envelopes.get(envelopes.size() - 1).version());
    return envelopes;
  }

  /**
   * Filter used by {@link #retrieve(String)}.
   *
   * @param recordAggregateId stored next to the event
   * @param recordAggregateType stored next to the event
   * @param aggregateId requested by the caller
   * @return {@code true} if the stored event belongs to the requested aggregate of this store type
   */
  protected final boolean belongsToAggregate(
      final String recordAggregateId, final String recordAggregateType, final String aggregateId) {
    return aggregateId.equals(recordAggregateId) && aggregateType.equals(recordAggregateType);
  }

  /**
   * Filter used by {@link #retrieveForQuery()} and {@link #retrieveForQuery(String)}.
   *
   * @param recordAggregateId stored next to the event
   * @param recordAggregateType stored next to the event
   * @param aggregateId requested by the caller, {@code null} when absent
   * @return {@code true} if the stored event matches the identifier or the store aggregate type
   */
  protected final boolean matchesQuery(
      final String recordAggregateId, final String recordAggregateType, final String aggregateId) {
    return (aggregateId != null && aggregateId.equals(recordAggregateId))
        || aggregateType.equals(recordAggregateType);
  }
}
