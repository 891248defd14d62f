package io.commuter.diagram;

import io.commuter.common.errorsor.ErrorsOr;
import io.commuter.dag.DiGraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sets (the nodes, identified by index) and ordered maps between them (the edges).
 * Immutable; the graph view is computed on demand from the maps.
 */
public final class Diagram implements DiGraph<Integer, DiagramEdge> {
    private final List<ElementSet> sets;
    private final List<DiagramMap> maps;

    private Diagram(List<? extends ElementSet> sets, List<DiagramMap> maps) {
        this.sets = List.copyOf(sets);
        this.maps = List.copyOf(maps);
    }

    /** Validates map indices, collecting every error. */
    public static ErrorsOr<Diagram> build(List<? extends ElementSet> sets, List<DiagramMap> maps) {
        return DiagramValidation.validate(sets, maps).map(ok -> new Diagram(sets, maps));
    }

    /** @throws IllegalArgumentException listing every invalid map */
    public static Diagram of(List<? extends ElementSet> sets, List<DiagramMap> maps) {
        return build(sets, maps).fold(d -> d, errors -> {
            throw new IllegalArgumentException("Invalid diagram: " + String.join("; ", errors));
        });
    }

    public List<ElementSet> sets() {
        return sets;
    }

    public List<DiagramMap> maps() {
        return maps;
    }

    public ElementSet set(int index) {
        return sets.get(index);
    }

    public DiagramMap map(int index) {
        return maps.get(index);
    }

    @Override
    public List<Integer> nodes() {
        List<Integer> result = new ArrayList<>(sets.size());
        for (int i = 0; i < sets.size(); i++) result.add(i);
        return result;
    }

    @Override
    public List<DiagramEdge> outbounds(Integer node) {
        List<DiagramEdge> result = new ArrayList<>();
        for (int i = 0; i < maps.size(); i++) {
            DiagramMap m = maps.get(i);
            if (m.from() == node) result.add(new DiagramEdge(m.from(), m.to(), i));
        }
        return result;
    }

    /** One line per map, e.g. {@code #0 Triple -((+,id))-> #1 Pair}. */
    public String describe() {
        StringBuilder builder = new StringBuilder();
        for (DiagramMap m : maps) {
            builder.append(label(m.from()))
                    .append(" -(").append(m.name()).append(")-> ")
                    .append(label(m.to()))
                    .append(System.lineSeparator());
        }
        return builder.toString();
    }

    String label(int index) {
        return "#" + index + " " + sets.get(index).name();
    }

    @Override
    public String toString() {
        return "Diagram(" + sets.size() + " sets, " + maps.size() + " maps)";
    }
}
