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

/**
 * Defines general contract rules used by the codebase.
 *
 * <p>Here is an example to help explain how different domain objects are related to each other -
 * let's assume that we are a driver in a car which keeps a logbook instead of a dashboard:
 *
 * <ul>
 *   <li>We, as a driver, are a {@link io.github.suppierk.es.authorization.DomainClient} - we can
 *       ask the car to do things and inspect what it did.
 *   <li>The car itself is an {@link io.github.suppierk.es.cqrs.Aggregate} - its current speed or
 *       turning angle is never stored, only the logbook is.
 *   <li>Every line of the logbook is a {@link io.github.suppierk.es.cqrs.DomainEvent} wrapped in
 *       an {@link io.github.suppierk.es.cqrs.EventEnvelope}:
 *       <ul>
 *         <li>{@code Turned Left by 15 degrees} or {@code Accelerated to 60 km/h} are facts, the
 *             current state of the car is obtained by reading the logbook from the first line and
 *             applying each fact in order.
 *       </ul>
 *   <li>We, as a driver, control the car via {@link io.github.suppierk.es.cqrs.DomainCommand}s:
 *       <ul>
 *         <li>We might send a {@link io.github.suppierk.es.cqrs.DomainCommand} to {@code Turn
 *             Left}, which looks at the current state of the car and either writes {@code Turned
 *             Left} into the logbook or refuses because the wheel is already fully turned.
 *       </ul>
 *   <li>We, as a driver, inspect the car via {@link io.github.suppierk.es.cqrs.DomainProjection}s:
 *       <ul>
 *         <li>A speedometer is a projection - it reads the same logbook but keeps only what it
 *             needs to present, and it may read the logbooks of other cars on the road too.
 *       </ul>
 *   <li>Passengers can be told about what just happened via {@link
 *       io.github.suppierk.es.async.DomainEventHandler}s - if nobody listens, the car still drives.
 *   <li>The car, its logbook kept by an {@link io.github.suppierk.es.cqrs.EventStore} and the
 *       actions we can do, form a {@link io.github.suppierk.es.cqrs.BoundedContext} describing
 *       possible interactions.
 * </ul>
 */
package io.github.suppierk.es.cqrs;
