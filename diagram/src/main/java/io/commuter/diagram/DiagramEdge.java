package io.commuter.diagram;

import io.commuter.dag.Edge;

import java.util.Objects;

/** Graph view of a {@link DiagramMap}: set indices plus the index of the map in the diagram. */
public record DiagramEdge(Integer from, Integer to, int mapIndex) implements Edge<Integer> {
    public DiagramEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
