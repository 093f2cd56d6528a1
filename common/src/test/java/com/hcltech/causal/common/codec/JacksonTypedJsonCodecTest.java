package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonTypedJsonCodecTest {

    record Arrow(String from, String to) {}

    @Test
    void roundTrip_record() {
        JacksonTypedJsonCodec<Arrow> c = new JacksonTypedJsonCodec<>(Arrow.class);
        Arrow arrow = new Arrow("smoking", "cancer");
        String json = c.encode(arrow).valueOrThrow();

        assertEquals("{\"from\":\"smoking\",\"to\":\"cancer\"}", json);
        assertEquals(arrow, c.decode(json).valueOrThrow());
    }

    @Test
    void baseMapper_isCopied_soLaterChangesDoNotLeakIn() {
        ObjectMapper base = new ObjectMapper();
        JacksonTypedJsonCodec<Arrow> c = new JacksonTypedJsonCodec<>(base, Arrow.class);
        base.enable(SerializationFeature.INDENT_OUTPUT);
        assertFalse(c.encode(new Arrow("a", "b")).valueOrThrow().contains("\n"));
    }

    @Test
    void decode_with_bad_json_returns_error() {
        var result = new JacksonTypedJsonCodec<>(Arrow.class).decode("{ this is not valid json");
        assertTrue(result.isError());
        assertTrue(result.getErrors().get(0).startsWith("Failed to decode from JSON"));
    }

    @Test
    void decode_of_json_null_is_an_error_not_a_null_value() {
        var result = new JacksonTypedJsonCodec<>(Arrow.class).decode("null");
        assertTrue(result.isError());
    }

    @Test
    void constructors_validate_null_arguments() {
        assertThrows(NullPointerException.class, () -> new JacksonTypedJsonCodec<>(null, Arrow.class));
        assertThrows(NullPointerException.class, () -> new JacksonTypedJsonCodec<>((Class<Arrow>) null));
    }
}
