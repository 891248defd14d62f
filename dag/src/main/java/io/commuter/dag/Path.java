package io.commuter.dag;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/** A non-empty sequence of edges where each edge starts where the previous one ended. */
public record Path<N, E extends Edge<N>>(List<E> edges) {
    public Path {
        edges = List.copyOf(edges);
        if (edges.isEmpty()) throw new IllegalArgumentException("A path needs at least one edge");
        for (int i = 1; i < edges.size(); i++) {
            if (!Objects.equals(edges.get(i - 1).to(), edges.get(i).from()))
                throw new IllegalArgumentException("Edges " + edges.get(i - 1) + " and " + edges.get(i) + " are not connected");
        }
    }

    public static <N, E extends Edge<N>> Path<N, E> of(E edge) {
        return new Path<>(List.of(edge));
    }

    public N source() {
        return edges.get(0).from();
    }

    public N destination() {
        return edges.get(edges.size() - 1).to();
    }

    public int length() {
        return edges.size();
    }

    /** True when both paths start at the same node and end at the same node. */
    public boolean isCoterminalWith(Path<N, E> other) {
        return source().equals(other.source()) && destination().equals(other.destination());
    }

    /** True if {@code node} is the start of any edge on this path. */
    public boolean leavesFrom(N node) {
        for (E e : edges) if (e.from().equals(node)) return true;
        return false;
    }

    public Path<N, E> append(E next) {
        List<E> extended = new ArrayList<>(edges.size() + 1);
        extended.addAll(edges);
        extended.add(next);
        return new Path<>(extended);
    }

    public String describe(Function<? super E, String> label, String separator) {
        return edges.stream().map(label).collect(Collectors.joining(separator));
    }
}
