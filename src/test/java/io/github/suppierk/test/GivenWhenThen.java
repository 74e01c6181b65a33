package io.github.suppierk.test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.es.cqrs.Aggregate;
import io.github.suppierk.es.cqrs.AggregateContext;
import io.github.suppierk.es.cqrs.DomainCommand;
import io.github.suppierk.es.cqrs.DomainEvent;
import io.github.suppierk.es.cqrs.DomainException;
import io.github.suppierk.es.cqrs.ErrorKind;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fluent runner for command tests: given prior events, when the command is executed, then it
 * produces the expected events or fails with the expected error.
 *
 * <p>Runs {@code before}, reconstruction and {@code handle} against a {@link GivenEventStore}, no
 * event is persisted.
 */
// @formatter:off
public final class GivenWhenThen<
  A extends Aggregate,
  E extends DomainEvent<A>
> {
// @formatter:on
  private final Supplier<A> aggregateFactory;
  private List<? extends E> givenEvents = List.of();
  private DomainCommand<A, E> command;
  private List<? extends E> expectedEvents;
  private ErrorKind expectedKind;
  private String expectedCode;

  private GivenWhenThen(Supplier<A> aggregateFactory) {
    this.aggregateFactory = aggregateFactory;
  }

  public static <A extends Aggregate, E extends DomainEvent<A>> GivenWhenThen<A, E> forAggregate(
      Supplier<A> aggregateFactory) {
    return new GivenWhenThen<>(aggregateFactory);
  }

  public GivenWhenThen<A, E> given(List<? extends E> events) {
    this.givenEvents = events;
    return this;
  }

  public GivenWhenThen<A, E> when(DomainCommand<A, E> command) {
    this.command = command;
    return this;
  }

  public GivenWhenThen<A, E> then(List<? extends E> events) {
    this.expectedEvents = events;
    this.expectedKind = null;
    this.expectedCode = null;
    return this;
  }

  public GivenWhenThen<A, E> thenError(ErrorKind kind) {
    return thenError(kind, null);
  }

  /**
   * @param kind expected error kind
   * @param code expected error code, {@code null} to skip the check
   * @return this runner
   */
  public GivenWhenThen<A, E> thenError(ErrorKind kind, String code) {
    this.expectedEvents = null;
    this.expectedKind = kind;
    this.expectedCode = code;
    return this;
  }

  public void run() {
    assertNotNull(command, "Command must be set with when()");
    final GivenEventStore<A, E> store = new GivenEventStore<>(aggregateFactory, givenEvents);

    if (expectedKind != null) {
      final DomainException exception =
          assertThrows(DomainException.class, () -> execute(store));
      assertEquals(expectedKind, exception.getKind());
      if (expectedCode != null) {
        assertEquals(Optional.of(expectedCode), exception.getCode());
      }
    } else {
      assertNotNull(expectedEvents, "Expectation must be set with then() or thenError()");
      final List<E> producedEvents = assertDoesNotThrow(() -> execute(store));
      assertEquals(expectedEvents, producedEvents);
    }
  }

  private List<E> execute(GivenEventStore<A, E> store) {
    final DomainCommand<A, E> prepared = command.before(store);
    final Optional<String> aggregateId = prepared.aggregateId();
    final AggregateContext<A> context =
        aggregateId.isPresent() ? store.reconstruct(aggregateId.get()) : store.reconstruct();
    return prepared.handle(context);
  }
}
