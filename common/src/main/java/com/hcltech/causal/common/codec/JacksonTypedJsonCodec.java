package com.hcltech.causal.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.causal.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    /** The mapper is copied, so later changes to {@code baseMapper} do not leak into the codec. */
    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        if (json == null) return ErrorsOr.error("Failed to decode from JSON: input is null");
        try {
            T value = mapper.readValue(json, klass);
            return value == null
                    ? ErrorsOr.error("Failed to decode from JSON: document is empty or null")
                    : ErrorsOr.lift(value);
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}
