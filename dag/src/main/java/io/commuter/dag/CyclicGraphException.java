package io.commuter.dag;

import java.util.List;

/** The graph has at least one cycle, so its paths cannot all be enumerated. */
public class CyclicGraphException extends IllegalStateException {
    private final List<?> cycle;

    public CyclicGraphException(Path<?, ?> offending) {
        super("Graph contains at least one cycle - this is currently unsupported. Offending path: " + offending.edges());
        this.cycle = offending.edges();
    }

    /** The edges of the path that closed the cycle. */
    public List<?> cycle() {
        return cycle;
    }
}
