package com.hcltech.graphs.textinput;

import com.hcltech.graphs.common.codec.Codec;
import com.hcltech.graphs.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code "0: 1 2"} &lt;-&gt; {@code AdjacencyLine(0, [1, 2])}. The neighbour list may be empty ({@code "3:"}).
 */
public final class AdjacencyLineCodec implements Codec<AdjacencyLine, String> {

    static final String FORMAT_ERROR = "Invalid format. Each line should be: node: neighbor1 neighbor2 ...";

    @Override
    public ErrorsOr<String> encode(AdjacencyLine line) {
        String neighbors = line.neighbors().stream().map(String::valueOf).collect(Collectors.joining(" "));
        return ErrorsOr.lift(neighbors.isEmpty() ? line.node() + ":" : line.node() + ": " + neighbors);
    }

    @Override
    public ErrorsOr<AdjacencyLine> decode(String text) {
        String[] parts = text.trim().split(":", -1);
        if (parts.length != 2) return ErrorsOr.error(FORMAT_ERROR);

        List<String> errors = new ArrayList<>();
        Integer node = parseInt(parts[0].trim());
        if (node == null) errors.add("Invalid node number: " + parts[0].trim());

        List<Integer> neighbors = new ArrayList<>();
        String rest = parts[1].trim();
        if (!rest.isEmpty()) {
            for (String token : rest.split("\\s+")) {
                Integer neighbor = parseInt(token);
                if (neighbor == null) errors.add("Invalid neighbor: " + token);
                else neighbors.add(neighbor);
            }
        }
        return errors.isEmpty() ? ErrorsOr.lift(new AdjacencyLine(node, neighbors)) : ErrorsOr.errors(errors);
    }

    static Integer parseInt(String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
