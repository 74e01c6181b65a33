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

/**
 * Represents a read model built by folding events, independent of the write-side {@link
 * Aggregate}.
 *
 * <p>In terms of 'read-write' {@link DomainProjection} is a 'read' representation, whereas {@link
 * DomainCommand} is its 'write' counterpart.
 *
 * <p>Projections are rebuilt from scratch by {@link DomainQueryProcessor} on every query. The slice
 * they are folded over comes from {@link EventStore#retrieveForQuery(String)} and can interleave
 * events of several aggregate instances - {@link #populate(EventEnvelope)} must track whatever
 * identity it needs through {@link EventEnvelope#aggregateId()}.
 *
 * @param <A> is the type of the aggregate whose events are folded
 * @param <E> is the type of the events
 */
// @formatter:off
@FunctionalInterface
public interface DomainProjection<
  A extends Aggregate,
  E extends DomainEvent<A>
> {
// @formatter:on

  /**
   * @param envelope to fold into this projection
   */
  void populate(final EventEnvelope<E> envelope);
}
