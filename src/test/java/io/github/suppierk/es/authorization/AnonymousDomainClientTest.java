package io.github.suppierk.es.authorization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.github.suppierk.test.AnotherDomainClient;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import org.junit.jupiter.api.Test;

class AnonymousDomainClientTest {
  @Test
  void when_client_is_used_essential_properties_are_not_null() {
    assertNotNull(AnonymousDomainClient.getInstance());
    assertEquals(AnonymousDomainClient.ROLE, AnonymousDomainClient.getInstance().domainRole());
    assertNotEquals(
        AnonymousDomainClient.getInstance().domainRole(),
        AnotherDomainClient.getInstance().domainRole());
  }

  @Test
  void deserialization_must_keep_the_singleton() throws Exception {
    final var bytes = new ByteArrayOutputStream();
    try (var output = new ObjectOutputStream(bytes)) {
      output.writeObject(AnonymousDomainClient.getInstance());
    }

    try (var input = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
      assertSame(AnonymousDomainClient.getInstance(), input.readObject());
    }
  }
}
