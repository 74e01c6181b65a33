package io.github.suppierk.test.dispatch;

import io.github.suppierk.es.cqrs.AggregateContext;
import io.github.suppierk.es.cqrs.DomainCommand;
import java.util.List;
import java.util.Optional;

/** Creates a new dispatch. */
public record Request(String client, String dispatcher)
    implements DomainCommand<Dispatch, DispatchEvent> {

  @Override
  public Optional<String> aggregateId() {
    return Optional.empty();
  }

  @Override
  public List<DispatchEvent> handle(AggregateContext<Dispatch> context) {
    return List.of(new DispatchEvent.Requested(context.id(), client, dispatcher));
  }
}
