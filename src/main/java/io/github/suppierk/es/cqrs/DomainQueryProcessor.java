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

import java.util.List;
import java.util.function.Supplier;

/**
 * Stateless processor building a {@link DomainProjection}:
 *
 * <ul>
 *   <li>Create a blank projection.
 *   <li>Retrieve the slice via {@link EventStore#retrieveForQuery()} or {@link
 *       EventStore#retrieveForQuery(String)}.
 *   <li>Fold {@link DomainProjection#populate(EventEnvelope)} over the slice in retrieval order.
 * </ul>
 *
 * <p>A single instance can be shared freely, e.g. as a constant next to the projection.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the events
 * @param <P> is the type of the projection
 */
// @formatter:off
public final class DomainQueryProcessor<
  A extends Aggregate,
  E extends DomainEvent<A>,
  P extends DomainProjection<A, E>
> extends Suspicious {
// @formatter:on
  private final Supplier<P> projectionFactory;

  /**
   * @param projectionFactory creating blank projections
   * @throws IllegalArgumentException if the factory is {@code null}
   */
  public DomainQueryProcessor(final Supplier<P> projectionFactory) {
    this.projectionFactory = throwIllegalArgumentIfNull(projectionFactory, "Projection factory");
  }

  /**
   * @param store to read events from
   * @return projection folded over every event of the store aggregate type
   * @throws DomainException if the store failed
   */
  public P process(final EventStore<A, E> store) {
    return fold(throwIllegalArgumentIfNull(store, "Store").retrieveForQuery());
  }

  /**
   * @param store to read events from
   * @param aggregateId to match events by, in addition to the store aggregate type
   * @return projection folded over the union of both matches
   * @throws DomainException if the store failed
   */
  public P process(final EventStore<A, E> store, final String aggregateId) {
    final EventStore<A, E> nonNullStore = throwIllegalArgumentIfNull(store, "Store");
    final String nonNullAggregateId = throwIllegalArgumentIfNull(aggregateId, "Aggregate id");
    return fold(nonNullStore.retrieveForQuery(nonNullAggregateId));
  }

  private P fold(final List<EventEnvelope<E>> envelopes) {
    final P projection = throwIllegalStateIfNull(projectionFactory.get(), "New projection");

    for (EventEnvelope<E> envelope : throwIllegalStateIfNull(envelopes, "Retrieved events")) {
      projection.populate(envelope);
    }

    return projection;
  }
}
