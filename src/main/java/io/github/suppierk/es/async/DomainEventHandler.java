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

package io.github.suppierk.es.async;

import io.github.suppierk.es.cqrs.Aggregate;
import io.github.suppierk.es.cqrs.BoundedContext;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.EventEnvelope;
import java.util.List;

/**
 * Post-commit consumer of the envelopes a command execution has durably appended.
 *
 * <p>Notification is fire-and-forget: {@link BoundedContext} invokes handlers sequentially in
 * registration order after the append, and a failing handler is logged but never reported to the
 * caller of the execution. Handlers needing stronger delivery guarantees must take care of their
 * own durability and retries.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the events
 */
// @formatter:off
@FunctionalInterface
public interface DomainEventHandler<
  A extends Aggregate,
  E extends DomainEvent<A>
> {
// @formatter:on

  /**
   * @return an instance of handler which does not perform any operations
   * @param <A> is the type of the aggregate
   * @param <E> is the type of the events
   */
  @SuppressWarnings("unchecked")
  static <A extends Aggregate, E extends DomainEvent<A>> DomainEventHandler<A, E> empty() {
    return (DomainEventHandler<A, E>) NoOp.INSTANCE;
  }

  /**
   * @param envelopes appended by the command execution, in version order, can be empty
   * @throws Exception if the handler failed - it will be logged and ignored
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void handle(final List<EventEnvelope<E>> envelopes) throws Exception;

  /** Default implementation of the handler ignoring everything */
  // @formatter:off
  final class NoOp<
    A extends Aggregate,
    E extends DomainEvent<A>
  > implements DomainEventHandler<A, E> {
  // @formatter:on
    private static final NoOp<?, ?> INSTANCE = new NoOp<>();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void handle(final List<EventEnvelope<E>> envelopes) {
      // Do nothing
    }
  }
}
