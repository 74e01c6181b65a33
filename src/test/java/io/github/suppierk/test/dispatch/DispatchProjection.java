package io.github.suppierk.test.dispatch;

import io.github.suppierk.es.cqrs.DomainProjection;
import io.github.suppierk.es.cqrs.DomainQueryProcessor;
import io.github.suppierk.es.cqrs.EventEnvelope;
import java.util.ArrayList;
import java.util.List;

/** Read model listing dispatches with their acceptance state. */
public final class DispatchProjection implements DomainProjection<Dispatch, DispatchEvent> {
  public static final DomainQueryProcessor<Dispatch, DispatchEvent, DispatchProjection> PROCESSOR =
      new DomainQueryProcessor<>(DispatchProjection::new);

  private final List<DispatchView> views = new ArrayList<>();

  @Override
  public void populate(EventEnvelope<DispatchEvent> envelope) {
    final DispatchEvent event = envelope.payload();

    if (event instanceof DispatchEvent.Requested requested) {
      views.add(
          new DispatchView(
              envelope.aggregateId(), requested.client(), requested.dispatcher(), null));
    } else if (event instanceof DispatchEvent.Accepted accepted) {
      for (int i = 0; i < views.size(); i++) {
        final DispatchView view = views.get(i);
        if (view.id().equals(envelope.aggregateId())) {
          views.set(
              i, new DispatchView(view.id(), view.client(), view.dispatcher(), accepted.acceptedAt()));
        }
      }
    }
  }

  public List<DispatchView> views() {
    return List.copyOf(views);
  }

  public boolean isAssignedTo(String dispatchId, String dispatcher) {
    return views.stream()
        .anyMatch(view -> view.id().equals(dispatchId) && view.dispatcher().equals(dispatcher));
  }

  public record DispatchView(String id, String client, String dispatcher, String acceptedAt) {}
}
