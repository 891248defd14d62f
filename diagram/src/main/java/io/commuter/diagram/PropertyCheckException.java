package io.commuter.diagram;

public class PropertyCheckException extends CommutativeDiagramException {
    private final Element element;

    public PropertyCheckException(String message, Element element) {
        super(message);
        this.element = element;
    }

    /** The element that failed the check. */
    public Element element() {
        return element;
    }

    @Override
    public CommutativeDiagramError kind() {
        return CommutativeDiagramError.PROPERTY_CHECK;
    }
}
