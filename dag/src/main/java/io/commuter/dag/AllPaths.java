package io.commuter.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates every path of length one or more in an acyclic graph.
 * <p>
 * Depth first from each node in {@link DiGraph#nodes()} order, then through each outbound edge in
 * {@link DiGraph#outbounds} order. Every prefix is recorded, not only the maximal paths, so the result
 * contains each path exactly as many times as it can be walked. No pruning or memoisation: the count can
 * grow exponentially with depth and fan-out.
 */
public final class AllPaths {
    private static final Logger log = LoggerFactory.getLogger(AllPaths.class);

    private AllPaths() {}

    /**
     * @throws CyclicGraphException if a walk returns to a node it already passed through
     */
    public static <N, E extends Edge<N>> List<Path<N, E>> allPaths(DiGraph<N, E> graph) {
        List<Path<N, E>> paths = new ArrayList<>();
        List<N> nodes = graph.nodes();
        for (N initial : nodes) {
            for (E outbound : graph.outbounds(initial)) {
                Path<N, E> seed = Path.of(outbound);
                paths.add(seed);
                search(graph, seed, paths, initial);
            }
        }
        log.debug("Enumerated {} paths over {} nodes", paths.size(), nodes.size());
        return paths;
    }

    private static <N, E extends Edge<N>> void search(DiGraph<N, E> graph, Path<N, E> current, List<Path<N, E>> paths, N initial) {
        N destination = current.destination();
        // Returning to the start of this search, or to any node passed on the way, closes a cycle.
        if (destination.equals(initial) || current.leavesFrom(destination))
            throw new CyclicGraphException(current);

        for (E next : graph.outbounds(destination)) {
            Path<N, E> extended = current.append(next);
            paths.add(extended);
            search(graph, extended, paths, initial);
        }
    }
}
