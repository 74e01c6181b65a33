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

import java.io.Serial;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single failure type of the event sourcing pipeline.
 *
 * <p>Stores translate storage and serialization failures into {@link ErrorKind#INTERNAL} instances,
 * command authors raise {@link ErrorKind#USERINPUT} instances from {@link
 * DomainCommand#before(EventStore)} or {@link DomainCommand#handle(AggregateContext)}. The {@link
 * BoundedContext} never catches them - the first one raised aborts the execution and reaches the
 * caller as is.
 *
 * <p>Besides the message every instance can carry a fixed classification code and a map of string
 * extensions for structured context (file path, line number, offending value and so on).
 */
public class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4467925314387416020L;

  private final ErrorKind kind;
  private final String code;
  private final Map<String, String> extensions;

  /**
   * @param kind of the failure
   * @param message human-readable description of the failure
   */
  public DomainException(ErrorKind kind, String message) {
    this(kind, message, null, Map.of(), null);
  }

  /**
   * @param kind of the failure
   * @param message human-readable description of the failure
   * @param code optional fixed classification code, can be {@code null}
   * @param extensions structured context of the failure, can be {@code null}
   * @param cause of the failure, can be {@code null}
   * @throws IllegalArgumentException if the kind is {@code null}
   */
  public DomainException(
      ErrorKind kind,
      String message,
      String code,
      Map<String, String> extensions,
      Throwable cause) {
    super(message, cause);

    if (kind == null) {
      throw new IllegalArgumentException("Error kind cannot be null");
    }

    this.kind = kind;
    this.code = code;
    this.extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
  }

  /**
   * @param message human-readable description of the failure
   * @param cause of the failure, can be {@code null}
   * @return a new {@link ErrorKind#INTERNAL} exception without code and extensions
   */
  public static DomainException internal(String message, Throwable cause) {
    return new DomainException(ErrorKind.INTERNAL, message, null, Map.of(), cause);
  }

  /**
   * @param message human-readable description of the violated domain rule
   * @return a new {@link ErrorKind#USERINPUT} exception without code and extensions
   */
  public static DomainException userInput(String message) {
    return new DomainException(ErrorKind.USERINPUT, message);
  }

  /**
   * @param message human-readable description of the violated domain rule
   * @param code fixed classification code of the violated domain rule
   * @return a new {@link ErrorKind#USERINPUT} exception without extensions
   */
  public static DomainException userInput(String message, String code) {
    return new DomainException(ErrorKind.USERINPUT, message, code, Map.of(), null);
  }

  /**
   * @param newCode classification code of the copy
   * @return a copy of this exception with the given code, sharing the cause
   */
  public DomainException withCode(String newCode) {
    return new DomainException(kind, getMessage(), newCode, extensions, getCause());
  }

  /**
   * @param key of the extension
   * @param value of the extension
   * @return a copy of this exception with the extension added or replaced, sharing the cause
   * @throws IllegalArgumentException if the key or value is {@code null}
   */
  public DomainException withExtension(String key, String value) {
    if (key == null || value == null) {
      throw new IllegalArgumentException("Extension key and value cannot be null");
    }

    final Map<String, String> newExtensions = new HashMap<>(extensions);
    newExtensions.put(key, value);
    return new DomainException(kind, getMessage(), code, newExtensions, getCause());
  }

  public final ErrorKind getKind() {
    return kind;
  }

  /**
   * @return classification code, if one was assigned
   */
  public final Optional<String> getCode() {
    return Optional.ofNullable(code);
  }

  /**
   * @return immutable structured context of the failure
   */
  public final Map<String, String> getExtensions() {
    return extensions;
  }

  /**
   * @return {@code true} if the caller supplied invalid input and retrying it unchanged is
   *     pointless
   */
  public final boolean isUserInput() {
    return kind == ErrorKind.USERINPUT;
  }

  @Override
  public String toString() {
    return "%s{kind=%s, code=%s, message=%s, extensions=%s}"
        .formatted(getClass().getSimpleName(), kind, code, getMessage(), extensions);
  }
}
