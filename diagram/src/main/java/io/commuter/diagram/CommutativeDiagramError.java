package io.commuter.diagram;

/** Why a verification run could not reach a verdict. */
public enum CommutativeDiagramError {
    /** The diagram's maps form a cycle. */
    CYCLIC_GRAPH,
    /** An element failed a set's check predicate. */
    PROPERTY_CHECK,
    /** The diagram routed an element somewhere its type does not fit, or a map returned null. */
    CONTRACT_VIOLATION
}
