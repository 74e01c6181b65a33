package io.github.suppierk.es.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DomainExceptionTest {
  @Test
  void when_kind_is_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new DomainException(null, "message"));
  }

  @Test
  void factories_must_assign_the_kind() {
    final var cause = new IOException("disk");
    final var internal = DomainException.internal("broken", cause);
    final var userInput = DomainException.userInput("invalid", "CODE");

    assertEquals(ErrorKind.INTERNAL, internal.getKind());
    assertFalse(internal.isUserInput());
    assertSame(cause, internal.getCause());
    assertEquals(Optional.empty(), internal.getCode());

    assertEquals(ErrorKind.USERINPUT, userInput.getKind());
    assertTrue(userInput.isUserInput());
    assertEquals(Optional.of("CODE"), userInput.getCode());
    assertEquals("invalid", userInput.getMessage());
  }

  @Test
  void extensions_must_be_copied_and_immutable() {
    final var extensions = new HashMap<String, String>();
    extensions.put("path", "/tmp/log");

    final var exception =
        new DomainException(ErrorKind.INTERNAL, "broken", "IO", extensions, null);
    extensions.put("line", "3");

    assertEquals(Map.of("path", "/tmp/log"), exception.getExtensions());
    assertThrows(
        UnsupportedOperationException.class, () -> exception.getExtensions().put("k", "v"));
  }

  @Test
  void copies_must_keep_everything_but_the_changed_part() {
    final var cause = new IllegalStateException();
    final var original =
        new DomainException(ErrorKind.USERINPUT, "invalid", null, Map.of("a", "1"), cause);

    final var withCode = original.withCode("RULE");
    final var withExtension = withCode.withExtension("b", "2");

    assertEquals(Optional.empty(), original.getCode());
    assertEquals(Optional.of("RULE"), withCode.getCode());
    assertEquals(Map.of("a", "1", "b", "2"), withExtension.getExtensions());
    assertEquals(ErrorKind.USERINPUT, withExtension.getKind());
    assertEquals("invalid", withExtension.getMessage());
    assertSame(cause, withExtension.getCause());
    assertThrows(IllegalArgumentException.class, () -> original.withExtension(null, "v"));
  }
}
