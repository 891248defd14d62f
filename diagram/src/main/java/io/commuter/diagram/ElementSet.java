package io.commuter.diagram;

/**
 * A node of a {@link Diagram}, seen without its element type.
 */
public interface ElementSet {

    /**
     * The explicitly seeded elements. Lazy, finite, and restartable: every call starts a fresh iteration.
     * Empty for sets that are only populated by mapping into them.
     */
    Iterable<Element> elements();

    /** False means the element breaks the set's invariant; verification fails. */
    boolean check(Element element);

    /** False means the element is silently left out of verification. */
    boolean filter(Element element);

    /** Label for logs and messages. */
    String name();
}
