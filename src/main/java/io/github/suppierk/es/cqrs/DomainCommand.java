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

import io.github.suppierk.es.authorization.AnonymousDomainClient;
import io.github.suppierk.es.authorization.DomainClient;
import java.util.List;
import java.util.Optional;

/**
 * Represents a unit of intent which, given the current state of the {@link Aggregate}, decides what
 * happened.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s - {@link
 * #before(EventStore)} then returns an enriched copy rather than mutating the command.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Accept Dispatch' instead of 'Set
 * Dispatch accepted timestamp'.
 *
 * <p>The command is executed by {@link BoundedContext} as follows:
 *
 * <ol>
 *   <li>{@link #before(EventStore)} is invoked once with access to the store.
 *   <li>The aggregate identified by {@link #aggregateId()} of the enriched command is
 *       reconstructed.
 *   <li>{@link #handle(AggregateContext)} decides which {@link DomainEvent}s happened.
 *   <li>Exactly those events are appended to the store.
 * </ol>
 *
 * @param <A> is the type of the aggregate this command targets
 * @param <E> is the type of the events this command produces
 */
// @formatter:off
public interface DomainCommand<
  A extends Aggregate,
  E extends DomainEvent<A>
> {
// @formatter:on

  /**
   * Defined as {@code aggregateId()} rather than {@code id()} so that records can keep a plain
   * {@code id} component.
   *
   * @return identifier of the aggregate this command targets, empty to create a new aggregate
   */
  Optional<String> aggregateId();

  /**
   * Optional pre-processing hook, e.g. to build a cross-aggregate {@link DomainProjection} used
   * for validation in {@link #handle(AggregateContext)}.
   *
   * @param store to read from
   * @return the command to continue the execution with, this command by default
   * @throws DomainException to abort the execution before anything is reconstructed
   */
  default DomainCommand<A, E> before(final EventStore<A, E> store) {
    return this;
  }

  /**
   * The core decision function - must not have side effects other than its return value.
   *
   * @param context reconstructed state of the targeted aggregate
   * @return events which happened, can be empty
   * @throws DomainException with {@link ErrorKind#USERINPUT} kind if a domain rule was violated,
   *     nothing is appended in this case
   */
  List<E> handle(final AggregateContext<A> context);

  /**
   * @return the client who issued the command
   */
  default DomainClient domainClient() {
    return AnonymousDomainClient.getInstance();
  }
}
