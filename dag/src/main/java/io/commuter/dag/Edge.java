package io.commuter.dag;

/** A directed edge between two nodes of a {@link DiGraph}. */
public interface Edge<N> {
    N from();

    N to();
}
