package io.commuter.dag;

import java.util.List;

/**
 * Minimal view of a directed graph: its nodes, and the edges leaving each node.
 * Nothing is assumed about what a node is beyond {@code equals}.
 */
public interface DiGraph<N, E extends Edge<N>> {

    /** Nodes in a stable order. Path enumeration starts from each of them in this order. */
    List<N> nodes();

    /** Edges whose {@link Edge#from()} is {@code node}, in a stable order. */
    List<E> outbounds(N node);

    default String asString() {
        StringBuilder builder = new StringBuilder();
        for (N node : nodes()) {
            for (E edge : outbounds(node)) {
                builder.append(node)
                        .append(" -> ")
                        .append(edge.to())
                        .append(System.lineSeparator());
            }
        }
        return builder.toString();
    }
}
