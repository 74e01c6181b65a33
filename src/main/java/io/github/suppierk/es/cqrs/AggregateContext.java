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

import java.util.UUID;

/**
 * Result of the aggregate reconstruction: identifier, current version and current state.
 *
 * <p>Context is never persisted - it is created blank at the start of every command execution,
 * folded over the retrieved events and handed to the {@link DomainCommand}.
 *
 * @param <A> is the type of the aggregate
 */
public final class AggregateContext<A extends Aggregate> {
  private final String id;
  private final A aggregate;
  private long version;

  private AggregateContext(final String id, final A aggregate) {
    this.id = id;
    this.aggregate = aggregate;
    this.version = 0L;
  }

  /**
   * @param id of the aggregate
   * @param aggregate in its default state
   * @return a new context at version {@code 0}
   * @param <A> is the type of the aggregate
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public static <A extends Aggregate> AggregateContext<A> blank(final String id, final A aggregate) {
    if (id == null) {
      throw new IllegalArgumentException("Aggregate id cannot be null");
    }

    if (aggregate == null) {
      throw new IllegalArgumentException("Aggregate cannot be null");
    }

    return new AggregateContext<>(id, aggregate);
  }

  /**
   * @param aggregate in its default state
   * @return a new context at version {@code 0} with a freshly generated identifier
   * @param <A> is the type of the aggregate
   */
  public static <A extends Aggregate> AggregateContext<A> blank(final A aggregate) {
    return blank(UUID.randomUUID().toString(), aggregate);
  }

  /**
   * Applies the event to the aggregate and moves the context to the event version.
   *
   * @param envelope to fold into this context
   * @param <E> is the type of the event
   */
  public <E extends DomainEvent<A>> void replay(final EventEnvelope<E> envelope) {
    if (envelope == null) {
      throw new IllegalArgumentException("Envelope cannot be null");
    }

    envelope.payload().apply(aggregate);
    version = envelope.version();
  }

  public String id() {
    return id;
  }

  /**
   * @return version of the last folded event, {@code 0} if nothing was folded
   */
  public long version() {
    return version;
  }

  public A aggregate() {
    return aggregate;
  }

  @Override
  public String toString() {
    return "AggregateContext{id=%s, version=%d, aggregate=%s}".formatted(id, version, aggregate);
  }
}
