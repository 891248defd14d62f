package io.commuter.diagram;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * An {@link ElementSet} holding values of one concrete type.
 * <p>
 * Immutable. Start from {@link #of(Class, List)} (with generating elements) or {@link #generatedOnly(Class)}
 * (populated only by maps into it), then add a check and/or a filter:
 * <pre>{@code
 * TypedSet.generatedOnly(Integer.class).checked(x -> x >= 0).filtered(x -> x % 2 == 0)
 * }</pre>
 */
public final class TypedSet<T> implements ElementSet {
    private final Class<T> type;
    private final List<T> generating;
    private final Predicate<? super T> property;
    private final Predicate<? super T> filter;
    private final @Nullable String name;

    private TypedSet(Class<T> type, List<T> generating, Predicate<? super T> property, Predicate<? super T> filter, @Nullable String name) {
        this.type = Objects.requireNonNull(type, "type");
        if (type.isPrimitive())
            throw new IllegalArgumentException("Use the boxed type instead of " + type + " for set elements");
        this.generating = List.copyOf(generating);
        this.property = Objects.requireNonNull(property, "property");
        this.filter = Objects.requireNonNull(filter, "filter");
        this.name = name;
    }

    public static <T> TypedSet<T> of(Class<T> type, List<T> generating) {
        return new TypedSet<>(type, generating, x -> true, x -> true, null);
    }

    @SafeVarargs
    public static <T> TypedSet<T> of(Class<T> type, T... generating) {
        return of(type, Arrays.asList(generating));
    }

    public static <T> TypedSet<T> generatedOnly(Class<T> type) {
        return of(type, List.of());
    }

    /** Same set with {@code property} as its check predicate. */
    public TypedSet<T> checked(Predicate<? super T> property) {
        return new TypedSet<>(type, generating, property, filter, name);
    }

    /** Same set with {@code filter} as its filter predicate. */
    public TypedSet<T> filtered(Predicate<? super T> filter) {
        return new TypedSet<>(type, generating, property, filter, name);
    }

    public TypedSet<T> named(String name) {
        return new TypedSet<>(type, generating, property, filter, Objects.requireNonNull(name, "name"));
    }

    public Class<T> type() {
        return type;
    }

    public List<T> generating() {
        return generating;
    }

    @Override
    public Iterable<Element> elements() {
        return () -> generating.stream().map(Element::of).iterator();
    }

    @Override
    public boolean check(Element element) {
        return property.test(downcast(element));
    }

    @Override
    public boolean filter(Element element) {
        return filter.test(downcast(element));
    }

    @Override
    public String name() {
        return name != null ? name : type.getSimpleName();
    }

    private T downcast(Element element) {
        return element.as(type).orElseThrow(() -> new ContractViolationException(
                "Element " + element.name() + " of type " + element.type().getName()
                        + " was routed into set " + name() + " of type " + type.getName()));
    }

    @Override
    public String toString() {
        return "TypedSet(" + name() + ", " + generating.size() + " generating)";
    }
}
