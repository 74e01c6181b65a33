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

import io.github.suppierk.es.async.DomainEventHandler;
import io.github.suppierk.es.authorization.DomainClient;
import io.github.suppierk.es.authorization.UnauthorizedException;
import io.github.suppierk.java.Try;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Class to accept and execute {@link DomainCommand}s against a single {@link EventStore}:
 *
 * <ul>
 *   <li>Assert that the {@link DomainClient} can issue the {@link DomainCommand}.
 *   <li>Run {@link DomainCommand#before(EventStore)}.
 *   <li>Reconstruct the targeted aggregate.
 *   <li>Run {@link DomainCommand#handle(AggregateContext)}.
 *   <li>Append exactly the produced events.
 *   <li>Notify every registered {@link DomainEventHandler} with the appended envelopes.
 * </ul>
 *
 * <p>The execution is terminal on the first failure of the first five steps - the exception is
 * propagated as is, without retries, and no later step runs. Handler failures are only logged.
 *
 * <p><b>Design note</b>: there is no isolation between concurrent executions targeting the same
 * aggregate. Both can reconstruct the same version and both append, breaking the monotonic version
 * sequence of the aggregate. Callers must guarantee a single writer per aggregate identifier.
 *
 * @param <A> is the type of the aggregate
 * @param <E> is the type of the events
 */
// @formatter:off
public non-sealed class BoundedContext<
  A extends Aggregate,
  E extends DomainEvent<A>
> extends Suspicious {
// @formatter:on
  private static final Logger LOG = LoggerFactory.getLogger(BoundedContext.class);

  private final ReentrantReadWriteLock lock;
  private final EventStore<A, E> eventStore;
  private final List<DomainEventHandler<A, E>> domainEventHandlers;

  /**
   * @param eventStore to execute commands against
   * @throws IllegalArgumentException if the store is {@code null}
   */
  public BoundedContext(final EventStore<A, E> eventStore) {
    this(eventStore, List.of());
  }

  /**
   * @param eventStore to execute commands against
   * @param domainEventHandlers to notify, in the given order
   * @throws IllegalArgumentException if any of the arguments or handlers is {@code null}
   */
  public BoundedContext(
      final EventStore<A, E> eventStore,
      final List<? extends DomainEventHandler<A, E>> domainEventHandlers) {
    this.lock = new ReentrantReadWriteLock();
    this.eventStore = throwIllegalArgumentIfNull(eventStore, "Event store");
    this.domainEventHandlers = new ArrayList<>();

    for (DomainEventHandler<A, E> handler :
        throwIllegalArgumentIfNull(domainEventHandlers, "Domain event handlers")) {
      this.domainEventHandlers.add(throwIllegalArgumentIfNull(handler, "Domain event handler"));
    }
  }

  /**
   * @return the store commands are executed against
   */
  public final EventStore<A, E> getEventStore() {
    return eventStore;
  }

  /**
   * Registers a handler to be notified after the handlers registered before it.
   *
   * @param domainEventHandler to register
   * @return this context
   * @throws IllegalArgumentException if the handler is {@code null}
   */
  public final BoundedContext<A, E> addDomainEventHandler(
      final DomainEventHandler<A, E> domainEventHandler) {
    final DomainEventHandler<A, E> nonNullHandler =
        throwIllegalArgumentIfNull(domainEventHandler, "Domain event handler");

    final var writeLock = lock.writeLock();
    writeLock.lock();
    try {
      domainEventHandlers.add(nonNullHandler);
    } finally {
      writeLock.unlock();
    }

    return this;
  }

  /**
   * @return a snapshot of the registered handlers in notification order
   */
  public final List<DomainEventHandler<A, E>> getDomainEventHandlers() {
    final var readLock = lock.readLock();
    readLock.lock();
    try {
      return List.copyOf(domainEventHandlers);
    } finally {
      readLock.unlock();
    }
  }

  /**
   * @return {@code true} if handler registration is in progress
   */
  final boolean isAnyWriteLockHeld() {
    return lock.isWriteLocked();
  }

  /**
   * @param domainClient issuing the command
   * @param command being issued
   * @return {@code true} if the client can issue the command, {@code false} otherwise
   */
  protected boolean canBeUsedBy(final DomainClient domainClient, final DomainCommand<A, E> command) {
    return true;
  }

  /**
   * Executes the command without metadata.
   *
   * @param command to execute
   * @see #execute(DomainCommand, Map)
   */
  public final void execute(final DomainCommand<A, E> command) {
    execute(command, Map.of());
  }

  /**
   * Executes the command.
   *
   * @param command to execute
   * @param metadata to attach to every appended event
   * @throws IllegalArgumentException if any of the arguments is {@code null} or the metadata has
   *     {@code null} keys or values
   * @throws IllegalStateException if the command returned {@code null} where a value is expected
   * @throws UnauthorizedException if the client is not allowed to issue the command
   * @throws DomainException raised by the command or by the store
   */
  public final void execute(final DomainCommand<A, E> command, final Map<String, String> metadata) {
    final DomainCommand<A, E> nonNullCommand = throwIllegalArgumentIfNull(command, "Command");
    final Map<String, String> nonNullMetadata = throwIllegalArgumentIfNull(metadata, "Metadata");
    if (EventEnvelope.hasNullEntries(nonNullMetadata)) {
      throw new IllegalArgumentException("Metadata cannot contain null keys or values");
    }

    final DomainClient nonNullDomainClient =
        throwIllegalStateIfNull(nonNullCommand.domainClient(), "Command's client");

    if (!canBeUsedBy(nonNullDomainClient, nonNullCommand)) {
      throw new UnauthorizedException(
          "Client '%s' is not allowed to use '%s' command"
              .formatted(
                  nonNullDomainClient.domainRole(), nonNullCommand.getClass().getSimpleName()));
    }

    final DomainCommand<A, E> preparedCommand =
        throwIllegalStateIfNull(nonNullCommand.before(eventStore), "Command returned by before");
    final Optional<String> aggregateId =
        throwIllegalStateIfNull(preparedCommand.aggregateId(), "Command aggregate id");

    final AggregateContext<A> context =
        aggregateId.isPresent()
            ? eventStore.reconstruct(aggregateId.get())
            : eventStore.reconstruct();

    final List<E> events =
        throwIllegalStateIfNull(preparedCommand.handle(context), "Command events");

    final List<EventEnvelope<E>> committedEvents =
        eventStore.append(events, context, nonNullMetadata);

    notifyHandlers(committedEvents);
  }

  private void notifyHandlers(final List<EventEnvelope<E>> committedEvents) {
    for (DomainEventHandler<A, E> handler : getDomainEventHandlers()) {
      final Try<DomainEventHandler<A, E>> outcome =
          Try.of(
              () -> {
                handler.handle(committedEvents);
                return handler;
              });

      outcome.ifFailure(
          reason ->
              LOG.warn(
                  "Domain event handler '{}' failed to process {} events",
                  handler.getClass().getName(),
                  committedEvents.size(),
                  reason));
    }
  }
}
