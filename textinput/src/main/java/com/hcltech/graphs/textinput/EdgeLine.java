package com.hcltech.graphs.textinput;

/** One {@code from to [capacity]} line; {@code capacity} is null when the column is absent. */
public record EdgeLine(int from, int to, Integer capacity) {}
