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
 * Represents the consistency boundary of the domain - the state object rebuilt by folding {@link
 * DomainEvent}s.
 *
 * <p>Aggregates must be reproducible purely from their events: the state at version {@code N} is
 * whatever applying the first {@code N} events recorded for the aggregate id and type in order
 * yields, nothing else may influence it. Stores create blank instances through a {@link
 * java.util.function.Supplier} given to them upon construction.
 */
public interface Aggregate {
  /**
   * The type tag is persisted next to every event and separates the streams of different
   * aggregates which happen to share the same identifier.
   *
   * @return a stable type tag of the aggregate, e.g. {@code dispatch}
   */
  String aggregateType();
}
