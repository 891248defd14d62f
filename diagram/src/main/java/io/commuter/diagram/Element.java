package io.commuter.diagram;

import java.util.Optional;

/**
 * A value whose concrete type is only known at runtime.
 * <p>
 * Elements flow between the sets of a {@link Diagram}; each set and map recovers the concrete type with
 * {@link #as(Class)}. Any non-null Java value with a meaningful {@code equals} and {@code toString}
 * can be wrapped with {@link #of(Object)}.
 */
public interface Element {

    /** Runtime type tag. */
    Class<?> type();

    Object value();

    /**
     * Structural equality against an element of possibly different type.
     * Elements of different runtime types are never equal; this never throws.
     */
    boolean sameAs(Element other);

    /** Display form used in counterexamples and error messages. */
    String name();

    /** Safe downcast: empty if the value is not an instance of {@code type}. */
    default <T> Optional<T> as(Class<T> type) {
        Object v = value();
        return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
    }

    static Element of(Object value) {
        return new ValueElement(value);
    }
}
