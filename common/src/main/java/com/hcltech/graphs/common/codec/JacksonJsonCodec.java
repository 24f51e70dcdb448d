package com.hcltech.graphs.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

/** Untyped JSON: decodes to maps, lists and boxed scalars. */
public final class JacksonJsonCodec implements Codec<Object, String> {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this.mapper = new ObjectMapper();
        this.mapper.findAndRegisterModules();
    }

    @Override
    public ErrorsOr<String> encode(Object value) {
        try {
            return ErrorsOr.lift(mapper.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: {0} {1}", e);
        }
    }

    @Override
    public ErrorsOr<Object> decode(String json) {
        try {
            return ErrorsOr.lift(mapper.readValue(json, Object.class));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: {0} {1}", e);
        }
    }
}
