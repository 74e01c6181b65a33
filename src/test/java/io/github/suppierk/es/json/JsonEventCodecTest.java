package io.github.suppierk.es.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.es.cqrs.DomainException;
import io.github.suppierk.es.cqrs.ErrorKind;
import io.github.suppierk.es.cqrs.EventEnvelope;
import io.github.suppierk.test.dispatch.DispatchEvent;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JsonEventCodecTest {
  static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static final JsonEventCodec<DispatchEvent> CODEC =
      new JsonEventCodec<>(OBJECT_MAPPER, DispatchEvent.class);

  @Test
  void when_any_of_the_constructor_arguments_is_null_throw_illegal_argument_exception() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new JsonEventCodec<>(null, DispatchEvent.class));
    assertThrows(
        IllegalArgumentException.class,
        () -> new JsonEventCodec<DispatchEvent>(OBJECT_MAPPER, null));
  }

  @Nested
  class Payload {
    @Test
    void payload_must_carry_the_variant_name() throws Exception {
      final String json = CODEC.encodePayload(new DispatchEvent.Accepted("D1", "now"));

      assertEquals("Accepted", OBJECT_MAPPER.readTree(json).get("type").asText());
      assertEquals(new DispatchEvent.Accepted("D1", "now"), CODEC.decodePayload(json));
    }

    @Test
    void unknown_variant_must_fail_with_serialization_code() {
      final var exception =
          assertThrows(
              DomainException.class, () -> CODEC.decodePayload("{\"type\":\"Cancelled\"}"));

      assertEquals(ErrorKind.INTERNAL, exception.getKind());
      assertEquals(Optional.of(JsonEventCodec.SERIALIZATION_FAILED), exception.getCode());
    }

    @Test
    void malformed_json_must_fail_with_invalid_json_code() {
      final var exception = assertThrows(DomainException.class, () -> CODEC.decodePayload("{"));

      assertEquals(ErrorKind.INTERNAL, exception.getKind());
      assertEquals(Optional.of(JsonEventCodec.INVALID_JSON), exception.getCode());
    }
  }

  @Nested
  class Metadata {
    @Test
    void missing_metadata_must_decode_to_empty() {
      assertTrue(CODEC.decodeMetadata(null).isEmpty());
      assertTrue(CODEC.decodeMetadata("null").isEmpty());
    }

    @Test
    void null_metadata_value_must_fail_with_serialization_code() {
      final var exception =
          assertThrows(DomainException.class, () -> CODEC.decodeMetadata("{\"k\":null}"));

      assertEquals(ErrorKind.INTERNAL, exception.getKind());
      assertEquals(Optional.of(JsonEventCodec.SERIALIZATION_FAILED), exception.getCode());
    }

    @Test
    void metadata_must_survive_encoding() {
      final var metadata = Map.of("trace", "t-1", "user", "u-1");

      assertEquals(metadata, CODEC.decodeMetadata(CODEC.encodeMetadata(metadata)));
    }
  }

  @Nested
  class Records {
    @Test
    void fields_must_be_written_in_a_fixed_order() {
      final var envelope =
          new EventEnvelope<DispatchEvent>(
              "a", "dispatch", 1, new DispatchEvent.Accepted("D1", "now"), Map.of(), "then");

      final String json = CODEC.encodeRecord(envelope);

      assertTrue(json.startsWith("{\"aggregate_id\":\"a\",\"aggregate_type\":\"dispatch\""));
      assertTrue(json.endsWith("\"meta\":{},\"created_at\":\"then\"}"));
      assertEquals(-1, json.indexOf('\n'));
    }

    @Test
    void outer_record_must_be_readable_without_decoding_the_payload() {
      final var eventRecord =
          CODEC.decodeRecord(
              "{\"aggregate_id\":\"a\",\"aggregate_type\":\"invoice\",\"version\":3,"
                  + "\"payload\":\"not even json\",\"meta\":null,\"created_at\":\"then\"}");

      assertEquals("a", eventRecord.aggregateId());
      assertEquals("invoice", eventRecord.aggregateType());
      assertEquals(3L, eventRecord.version());
      assertEquals("not even json", eventRecord.payload());
    }

    @Test
    void incomplete_record_must_not_become_an_envelope() {
      final var eventRecord = new EventRecord(null, "dispatch", 1, "{}", Map.of(), "then");

      final var exception =
          assertThrows(DomainException.class, () -> CODEC.toEnvelope(eventRecord));

      assertEquals(ErrorKind.INTERNAL, exception.getKind());
      assertEquals(Optional.of(JsonEventCodec.SERIALIZATION_FAILED), exception.getCode());
    }

    @Test
    void record_with_null_metadata_value_must_not_become_an_envelope() {
      final var eventRecord =
          CODEC.decodeRecord(
              "{\"aggregate_id\":\"a\",\"aggregate_type\":\"dispatch\",\"version\":1,"
                  + "\"payload\":\"{}\",\"meta\":{\"k\":null},\"created_at\":\"then\"}");

      final var exception =
          assertThrows(DomainException.class, () -> CODEC.toEnvelope(eventRecord));

      assertEquals(ErrorKind.INTERNAL, exception.getKind());
      assertEquals(Optional.of(JsonEventCodec.SERIALIZATION_FAILED), exception.getCode());
    }

    @Test
    void complete_record_must_become_an_envelope_with_empty_metadata_by_default() {
      final var eventRecord =
          new EventRecord(
              "a",
              "dispatch",
              2,
              CODEC.encodePayload(new DispatchEvent.Accepted("D1", "now")),
              null,
              "then");

      final var envelope = CODEC.toEnvelope(eventRecord);

      assertEquals(2L, envelope.version());
      assertEquals(new DispatchEvent.Accepted("D1", "now"), envelope.payload());
      assertTrue(envelope.metadata().isEmpty());
    }
  }
}
