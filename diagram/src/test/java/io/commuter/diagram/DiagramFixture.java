package io.commuter.diagram;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reusable fixture for diagram tests.
 * - Integer tuples as records
 * - Cartesian products for generating sets
 * - The associativity diagram, correct and broken
 */
public final class DiagramFixture {

    public record Triple(int a, int b, int c) {}

    public record Pair(int a, int b) {}

    public static List<Integer> range(int fromInclusive, int toExclusive) {
        List<Integer> result = new ArrayList<>();
        for (int i = fromInclusive; i < toExclusive; i++) result.add(i);
        return result;
    }

    /** All (a, b, c) with a outermost and c innermost. */
    public static List<Triple> triples(List<Integer> xs) {
        List<Triple> result = new ArrayList<>();
        for (int a : xs) for (int b : xs) for (int c : xs) result.add(new Triple(a, b, c));
        return result;
    }

    public static final Function<Triple, Pair> LEFT_ADD = t -> new Pair(t.a() + t.b(), t.c());
    public static final Function<Triple, Pair> RIGHT_ADD = t -> new Pair(t.a(), t.b() + t.c());
    public static final Function<Triple, Pair> BROKEN_RIGHT_ADD = t -> new Pair(t.a(), t.b() + t.c() + (t.c() == 4 ? 1 : 0));
    public static final Function<Pair, Integer> SUM = p -> p.a() + p.b();

    /**
     * #0 triples ─(+,id)→ #1 pairs ─(+)→ #3 sums
     * #0 triples ─(id,+)→ #2 pairs ─(+)→ #3 sums
     */
    public static Diagram associativity(List<Integer> generating, Function<Triple, Pair> rightAdd) {
        return Diagram.of(
                List.of(
                        TypedSet.of(Triple.class, triples(generating)).named("triples"),
                        TypedSet.generatedOnly(Pair.class).named("left pairs"),
                        TypedSet.generatedOnly(Pair.class).named("right pairs"),
                        TypedSet.generatedOnly(Integer.class).named("sums")),
                List.of(
                        DiagramMap.of(0, 1, Triple.class, LEFT_ADD, "(+,id)"),
                        DiagramMap.of(0, 2, Triple.class, rightAdd, "(id,+)"),
                        DiagramMap.of(2, 3, Pair.class, SUM, "(+)"),
                        DiagramMap.of(1, 3, Pair.class, SUM, "(+)")));
    }

    public static Diagram associativity() {
        return associativity(range(0, 20), RIGHT_ADD);
    }

    public static Diagram brokenAssociativity() {
        return associativity(range(0, 20), BROKEN_RIGHT_ADD);
    }

    /** #0 → #1 through a single map, for tests about one hop. */
    public static <A, B> Diagram singleHop(TypedSet<A> source, TypedSet<B> target, Function<? super A, ? extends B> fn, String name) {
        return Diagram.of(List.of(source, target), List.of(DiagramMap.of(0, 1, source.type(), fn, name)));
    }

    private DiagramFixture() {}
}
