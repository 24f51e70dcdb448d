package com.hcltech.graphs.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.Objects;

public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;
    private final TypeReference<T> typeRef; // optional for generic types
    private final ObjectWriter writer;

    public JacksonTypedJsonCodec(Class<T> klass) {
        this(new ObjectMapper(), klass);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
        this.typeRef = null;
        this.writer = mapper.writerFor(klass);
    }

    /**
     * Use this ctor if T is generic (e.g., List<AnalysisResult>)
     */
    public JacksonTypedJsonCodec(TypeReference<T> typeRef) {
        this(new ObjectMapper(), typeRef);
    }

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, TypeReference<T> typeRef) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = null;
        this.typeRef = Objects.requireNonNull(typeRef);
        this.writer = mapper.writerFor(typeRef);
    }

    /** Writes as the declared type, so polymorphic type ids survive inside collections. */
    @Override
    public ErrorsOr<String> encode(T value) {
        try {
            return ErrorsOr.lift(writer.writeValueAsString(value));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to encode to JSON: " + e.getMessage());
        }
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        try {
            return ErrorsOr.lift(klass != null ? mapper.readValue(json, klass) : mapper.readValue(json, typeRef));
        } catch (Exception e) {
            return ErrorsOr.error("Failed to decode from JSON: " + e.getMessage());
        }
    }
}
