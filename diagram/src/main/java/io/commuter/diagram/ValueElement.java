package io.commuter.diagram;

import java.util.Objects;

/** Default {@link Element}: the type tag is the value's runtime class. */
public record ValueElement(Object value) implements Element {
    public ValueElement {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Class<?> type() {
        return value.getClass();
    }

    @Override
    public boolean sameAs(Element other) {
        return other != null && type().equals(other.type()) && value.equals(other.value());
    }

    @Override
    public String name() {
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return name();
    }
}
