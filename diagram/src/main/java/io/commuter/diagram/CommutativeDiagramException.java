package io.commuter.diagram;

/** Fatal outcome of a verification run. A diagram that does not commute is a result, not one of these. */
public abstract class CommutativeDiagramException extends RuntimeException {

    protected CommutativeDiagramException(String message) {
        super(message);
    }

    protected CommutativeDiagramException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract CommutativeDiagramError kind();
}
