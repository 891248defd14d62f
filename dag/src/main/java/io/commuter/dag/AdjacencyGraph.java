package io.commuter.dag;

import java.util.*;

/** Immutable graph: nodes + (from→to) edges. Duplicate edges are kept. */
public record AdjacencyGraph<N>(List<N> nodes, List<DirectedEdge<N>> edges) implements DiGraph<N, DirectedEdge<N>> {
    public AdjacencyGraph {
        nodes = List.copyOf(new LinkedHashSet<>(nodes));
        edges = List.copyOf(edges);
        for (DirectedEdge<N> e : edges) {
            if (!nodes.contains(e.from()) || !nodes.contains(e.to()))
                throw new IllegalArgumentException("Edge " + e + " refers to a node outside " + nodes);
        }
    }

    @SafeVarargs
    public static <N> AdjacencyGraph<N> of(List<N> nodes, DirectedEdge<N>... edges) {
        return new AdjacencyGraph<>(nodes, Arrays.asList(edges));
    }

    @Override
    public List<DirectedEdge<N>> outbounds(N node) {
        List<DirectedEdge<N>> result = new ArrayList<>();
        for (DirectedEdge<N> e : edges) if (e.from().equals(node)) result.add(e);
        return result;
    }
}
