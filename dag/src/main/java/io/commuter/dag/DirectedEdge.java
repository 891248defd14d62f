package io.commuter.dag;

import java.util.Objects;

/** Plain (from→to) edge. */
public record DirectedEdge<N>(N from, N to) implements Edge<N> {
    public DirectedEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
