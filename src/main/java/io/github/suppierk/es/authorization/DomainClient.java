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

package io.github.suppierk.es.authorization;

import java.io.Serializable;

/**
 * Describes the party issuing {@link io.github.suppierk.es.cqrs.DomainCommand}s - a user, another
 * service or a scheduled job.
 *
 * <p>{@link io.github.suppierk.es.cqrs.BoundedContext} consults the client before running the
 * command pipeline and refuses the command with {@link UnauthorizedException} when the client is
 * not allowed to issue it.
 */
public interface DomainClient extends Serializable {
  /**
   * @return assumed client's role within the domain, used for authorization and error reporting
   */
  String domainRole();
}
