package io.github.suppierk.test.dispatch;

import io.github.suppierk.es.cqrs.ErrorKind;
import io.github.suppierk.test.GivenEventStore;
import io.github.suppierk.test.GivenWhenThen;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DispatchCommandTest {
  static final String ACCEPTED_AT = "Tue, 2 Jan 2024 04:00:00 GMT";

  static GivenWhenThen<Dispatch, DispatchEvent> scenario() {
    return GivenWhenThen.forAggregate(Dispatch::new);
  }

  @Nested
  class RequestCommand {
    @Test
    void new_dispatch_must_be_requested_for_the_given_client_and_dispatcher() {
      scenario()
          .given(List.of())
          .when(new Request("C1", "D1"))
          .then(List.of(new DispatchEvent.Requested(GivenEventStore.AGGREGATE_ID, "C1", "D1")))
          .run();
    }
  }

  @Nested
  class AcceptCommand {
    @Test
    void requested_dispatcher_must_be_able_to_accept() {
      scenario()
          .given(List.of(new DispatchEvent.Requested(GivenEventStore.AGGREGATE_ID, "C1", "D1")))
          .when(new Accept(GivenEventStore.AGGREGATE_ID, "D1", ACCEPTED_AT))
          .then(List.of(new DispatchEvent.Accepted("D1", ACCEPTED_AT)))
          .run();
    }

    @Test
    void other_dispatcher_must_be_refused() {
      scenario()
          .given(List.of(new DispatchEvent.Requested(GivenEventStore.AGGREGATE_ID, "C1", "D1")))
          .when(new Accept(GivenEventStore.AGGREGATE_ID, "D2", ACCEPTED_AT))
          .thenError(ErrorKind.USERINPUT, Accept.NOT_REQUESTED)
          .run();
    }

    @Test
    void unknown_dispatch_must_be_refused() {
      scenario()
          .given(List.of())
          .when(new Accept(GivenEventStore.AGGREGATE_ID, "D1", ACCEPTED_AT))
          .thenError(ErrorKind.USERINPUT)
          .run();
    }

    @Test
    void accepted_dispatch_must_not_be_accepted_again() {
      scenario()
          .given(
              List.of(
                  new DispatchEvent.Requested(GivenEventStore.AGGREGATE_ID, "C1", "D1"),
                  new DispatchEvent.Accepted("D1", ACCEPTED_AT)))
          .when(new Accept(GivenEventStore.AGGREGATE_ID, "D1", ACCEPTED_AT))
          .thenError(ErrorKind.USERINPUT, Accept.ALREADY_ACCEPTED)
          .run();
    }
  }
}
