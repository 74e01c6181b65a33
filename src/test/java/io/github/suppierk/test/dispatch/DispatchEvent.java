package io.github.suppierk.test.dispatch;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.github.suppierk.es.cqrs.DomainEvent;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = DispatchEvent.Requested.class, name = "Requested"),
  @JsonSubTypes.Type(value = DispatchEvent.Accepted.class, name = "Accepted")
})
public sealed interface DispatchEvent extends DomainEvent<Dispatch>
    permits DispatchEvent.Requested, DispatchEvent.Accepted {

  record Requested(String id, String client, String dispatcher) implements DispatchEvent {
    @Override
    public void apply(Dispatch aggregate) {
      aggregate.requested(id, client, dispatcher);
    }
  }

  record Accepted(String dispatcher, String acceptedAt) implements DispatchEvent {
    @Override
    public void apply(Dispatch aggregate) {
      aggregate.accepted(acceptedAt);
    }
  }
}
