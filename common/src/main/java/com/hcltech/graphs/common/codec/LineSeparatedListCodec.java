package com.hcltech.graphs.common.codec;

import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One item per line. Decoding skips blank lines and reports every bad line, each prefixed with
 * its 1-based line number.
 */
public final class LineSeparatedListCodec<T> implements Codec<List<T>, String> {
    private final Codec<T, String> item;

    public LineSeparatedListCodec(Codec<T, String> item) {
        this.item = Objects.requireNonNull(item, "item");
    }

    @Override
    public ErrorsOr<String> encode(List<T> from) {
        if (from == null || from.isEmpty()) return ErrorsOr.lift("");
        StringBuilder sb = new StringBuilder();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < from.size(); i++) {
            if (i > 0) sb.append('\n');
            ErrorsOr<String> encoded = item.encode(from.get(i));
            if (encoded.isError()) errors.addAll(encoded.getErrors());
            else sb.append(encoded.valueOrThrow());
        }
        return errors.isEmpty() ? ErrorsOr.lift(sb.toString()) : ErrorsOr.errors(errors);
    }

    @Override
    public ErrorsOr<List<T>> decode(String to) {
        if (to == null || to.isBlank()) return ErrorsOr.lift(List.of());
        String[] lines = to.split("\\r?\\n", -1);

        List<T> out = new ArrayList<>(lines.length);
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) continue;
            ErrorsOr<T> decoded = item.decode(lines[i]).addPrefixIfError("Line " + (i + 1) + ": ");
            if (decoded.isError())
                errors.addAll(decoded.getErrors());
            else
                out.add(decoded.valueOrThrow());
        }
        return errors.isEmpty() ? ErrorsOr.lift(out) : ErrorsOr.errors(errors);
    }
}
