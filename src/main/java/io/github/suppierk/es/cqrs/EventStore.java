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
import java.util.Map;

/**
 * Durable, append-only log of {@link EventEnvelope}s for a single {@link Aggregate} and {@link
 * DomainEvent} pair.
 *
 * <p>Every failure of the underlying medium must be reported as an {@link ErrorKind#INTERNAL}
 * {@link DomainException}.
 *
 * <p><b>Concurrency</b>: stores assume a single writer per aggregate identifier. Two concurrent
 * executions against the same identifier may both reconstruct the same version and both append,
 * leaving duplicated versions in the log - no optimistic concurrency check is performed.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the event
 */
// @formatter:off
public interface EventStore<
  A extends Aggregate,
  E extends DomainEvent<A>
> {
// @formatter:on

  /**
   * @return a blank context at version {@code 0} with a newly allocated identifier
   */
  AggregateContext<A> reconstruct();

  /**
   * Folds every event of the aggregate, in retrieval order, into a default aggregate.
   *
   * @param aggregateId of the aggregate to rebuild
   * @return context at the version of the last folded event, {@code 0} if there were none
   */
  AggregateContext<A> reconstruct(String aggregateId);

  /**
   * Assigns versions {@code context.version() + 1} up to {@code context.version() +
   * events.size()}, persists the envelopes and returns them. An empty input is a no-op which
   * leaves the log untouched.
   *
   * @param events produced by the command
   * @param context the events were produced against
   * @param metadata to attach to every event
   * @return persisted envelopes in the order of assignment
   */
  List<EventEnvelope<E>> append(
      List<? extends E> events, AggregateContext<A> context, Map<String, String> metadata);

  /**
   * @param aggregateId of the aggregate
   * @return envelopes of the aggregate with the store aggregate type, in append order
   */
  List<EventEnvelope<E>> retrieve(String aggregateId);

  /**
   * @return envelopes of every aggregate with the store aggregate type, in append order
   */
  List<EventEnvelope<E>> retrieveForQuery();

  /**
   * Retrieves the slice used to build projections: envelopes matching the identifier <b>or</b>
   * the store aggregate type. The result is broader than {@link #retrieve(String)}.
   *
   * @param aggregateId to match envelopes by
   * @return union of the matches by identifier and by aggregate type, in append order
   */
  List<EventEnvelope<E>> retrieveForQuery(String aggregateId);
}
