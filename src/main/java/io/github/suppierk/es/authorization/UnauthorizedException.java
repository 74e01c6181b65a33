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

import io.github.suppierk.es.cqrs.DomainException;
import io.github.suppierk.es.cqrs.ErrorKind;
import java.io.Serial;
import java.util.Map;

/**
 * Raised when a {@link DomainClient} is not allowed to issue a command.
 *
 * <p>Being a refusal of the input, it is always of {@link ErrorKind#USERINPUT} kind and carries
 * the {@link #CODE} classification code.
 */
public class UnauthorizedException extends DomainException {
  @Serial private static final long serialVersionUID = -1160395087434416285L;

  /** Classification code of every instance. */
  public static final String CODE = "UNAUTHORIZED";

  public UnauthorizedException() {
    this(null, null);
  }

  /**
   * @param message the detail message
   */
  public UnauthorizedException(String message) {
    this(message, null);
  }

  /**
   * @param message the detail message
   * @param cause the cause, {@code null} is permitted
   */
  public UnauthorizedException(String message, Throwable cause) {
    super(ErrorKind.USERINPUT, message, CODE, Map.of(), cause);
  }

  /**
   * @param cause the cause, its description becomes the detail message
   */
  public UnauthorizedException(Throwable cause) {
    this(cause == null ? null : cause.toString(), cause);
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/403">403 Forbidden</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 403;
  }
}
