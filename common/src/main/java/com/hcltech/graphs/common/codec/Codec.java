package com.hcltech.graphs.common.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.List;

/**
 * Two-way conversion that reports failure as {@link ErrorsOr} instead of throwing.
 */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    default Codec<To, From> invert() {
        return new Codec<To, From>() {
            @Override
            public ErrorsOr<From> encode(To to) {
                return Codec.this.decode(to);
            }

            @Override
            public ErrorsOr<To> decode(From from) {
                return Codec.this.encode(from);
            }
        };
    }

    static <T> Codec<List<T>, String> lines(Codec<T, String> itemCodec) {
        return new LineSeparatedListCodec<>(itemCodec);
    }

    static Codec<Object, String> json() {
        return new JacksonJsonCodec();
    }

    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(klass);
    }

    static <T> Codec<T, String> typeRefCodec(TypeReference<T> typeRef) {
        return new JacksonTypedJsonCodec<>(typeRef);
    }
}
