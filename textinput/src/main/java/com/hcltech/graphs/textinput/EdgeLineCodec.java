package com.hcltech.graphs.textinput;

import com.hcltech.graphs.common.codec.Codec;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;

/** {@code "0 1"} or {@code "0 1 10"}, whitespace separated. */
public final class EdgeLineCodec implements Codec<EdgeLine, String> {

    static final String FORMAT_ERROR = "Invalid edge. Each line should be: from to [capacity]";

    @Override
    public ErrorsOr<String> encode(EdgeLine line) {
        String base = line.from() + " " + line.to();
        return ErrorsOr.lift(line.capacity() == null ? base : base + " " + line.capacity());
    }

    @Override
    public ErrorsOr<EdgeLine> decode(String text) {
        String[] parts = text.trim().split("\\s+");
        if (parts.length < 2 || parts.length > 3) return ErrorsOr.error(FORMAT_ERROR + ", got '" + text.trim() + "'");

        List<String> errors = new ArrayList<>();
        Integer from = AdjacencyLineCodec.parseInt(parts[0]);
        Integer to = AdjacencyLineCodec.parseInt(parts[1]);
        if (from == null) errors.add("Invalid node number: " + parts[0]);
        if (to == null) errors.add("Invalid node number: " + parts[1]);
        Integer capacity = null;
        if (parts.length == 3) {
            capacity = AdjacencyLineCodec.parseInt(parts[2]);
            if (capacity == null || capacity <= 0) errors.add("Capacity must be a positive integer: " + parts[2]);
        }
        return errors.isEmpty() ? ErrorsOr.lift(new EdgeLine(from, to, capacity)) : ErrorsOr.errors(errors);
    }
}
