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

/**
 * Represents an immutable fact which happened to the {@link Aggregate}.
 *
 * <p>It is highly recommended to declare events of one aggregate as Java {@link Record}s
 * implementing a {@code sealed} interface which extends this one - the sealed interface is then
 * used as the event type of the {@link EventStore} and carries serialization annotations for all of
 * its variants.
 *
 * <p>Events must carry the minimal payload required to mutate the state and must never consult
 * anything but themselves and the aggregate while doing so.
 *
 * @param <A> is the type of the aggregate this event is applied to
 */
public interface DomainEvent<A extends Aggregate> {
  /**
   * Mutates the aggregate in place.
   *
   * @param aggregate to apply this event to
   */
  void apply(A aggregate);

  /**
   * @return a name of this variant used for diagnostics
   */
  default String name() {
    return getClass().getSimpleName();
  }
}
