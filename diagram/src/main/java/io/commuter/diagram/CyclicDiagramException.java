package io.commuter.diagram;

import io.commuter.dag.CyclicGraphException;

public class CyclicDiagramException extends CommutativeDiagramException {

    public CyclicDiagramException(CyclicGraphException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public CommutativeDiagramError kind() {
        return CommutativeDiagramError.CYCLIC_GRAPH;
    }
}
