package io.commuter.diagram;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * An edge of a {@link Diagram}: a named function from the set at index {@code from} to the set at index {@code to}.
 * The function is typed; {@link #apply(Element)} is the erased entry point used by the checker.
 */
public final class DiagramMap {
    private final int from;
    private final int to;
    private final String name;
    private final Class<?> inputType;
    private final Function<Element, Optional<Element>> erased;

    private DiagramMap(int from, int to, String name, Class<?> inputType, Function<Element, Optional<Element>> erased) {
        this.from = from;
        this.to = to;
        this.name = Objects.requireNonNull(name, "name");
        this.inputType = inputType;
        this.erased = erased;
    }

    public static <A, B> DiagramMap of(int from, int to, Class<A> inputType, Function<? super A, ? extends B> fn, String name) {
        Objects.requireNonNull(inputType, "inputType");
        Objects.requireNonNull(fn, "fn");
        if (inputType.isPrimitive())
            throw new IllegalArgumentException("Use the boxed type instead of " + inputType + " for map " + name);
        Function<Element, Optional<Element>> erased = input -> input.as(inputType).map(a -> {
            B out = fn.apply(a);
            if (out == null)
                throw new ContractViolationException("Map " + name + " returned null for " + input.name());
            return Element.of(out);
        });
        return new DiagramMap(from, to, name, inputType, erased);
    }

    /** Empty if {@code input} is not of this map's input type. */
    public Optional<Element> apply(Element input) {
        return erased.apply(input);
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public String name() {
        return name;
    }

    public Class<?> inputType() {
        return inputType;
    }

    @Override
    public String toString() {
        return "DiagramMap(" + from + " -(" + name + ")-> " + to + ")";
    }
}
