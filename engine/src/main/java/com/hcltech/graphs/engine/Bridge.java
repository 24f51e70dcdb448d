package com.hcltech.graphs.engine;

/** Edge {@code u-v} whose removal disconnects the graph; {@code u} is the DFS parent. */
public record Bridge(int u, int v) {}
