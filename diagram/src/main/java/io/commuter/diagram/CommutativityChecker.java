package io.commuter.diagram;

import io.commuter.common.IEnvGetter;
import io.commuter.common.errorsor.ErrorsOr;
import io.commuter.dag.AllPaths;
import io.commuter.dag.CyclicGraphException;
import io.commuter.dag.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether a {@link Diagram} commutes.
 * <p>
 * Every ordered pair of paths with the same source and destination (a path paired with itself included) is
 * checked by pushing each generating element of the source set through both paths. Filters and checks of every
 * set on the way apply: a filtered element is dropped for that pair, a failed check aborts the run. The first
 * disagreement in pair-then-element order is reported; parallel runs report the same one.
 */
public final class CommutativityChecker {
    private static final Logger log = LoggerFactory.getLogger(CommutativityChecker.class);
    static final String PATH_SEPARATOR = " -> ";

    private final CheckerConfig config;

    public CommutativityChecker(CheckerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public static CommutativityChecker withDefaults() {
        return new CommutativityChecker(CheckerConfig.defaults());
    }

    public static CommutativityChecker fromEnv(IEnvGetter env) {
        return new CommutativityChecker(CheckerConfig.fromEnv(env));
    }

    public CheckerConfig config() {
        return config;
    }

    /**
     * @throws CyclicDiagramException      if the maps form a cycle
     * @throws PropertyCheckException      if an element fails a set's check
     * @throws ContractViolationException  if an element reaches a map or set of another type
     */
    public CommutativeDiagramResult check(Diagram diagram) {
        Objects.requireNonNull(diagram, "diagram");
        try {
            List<PathPair> pairs = coterminalPairs(paths(diagram));
            log.debug("Checking {} co-terminal path pairs of {}", pairs.size(), diagram);

            Optional<CommutativeDiagramResult.DoesNotCommute> failure = config.parallel()
                    ? firstFailureInParallel(diagram, pairs)
                    : firstFailure(diagram, pairs);
            if (failure.isPresent()) {
                log.info("Diagram does not commute: {}", failure.get().reason());
                return failure.get();
            }
            return CommutativeDiagramResult.COMMUTES;
        } catch (CommutativeDiagramException e) {
            log.warn("Verification aborted ({}): {}", e.kind(), e.getMessage());
            throw e;
        }
    }

    /** {@link #check(Diagram)} with the fatal outcomes turned into errors. */
    public ErrorsOr<CommutativeDiagramResult> verify(Diagram diagram) {
        try {
            return ErrorsOr.lift(check(diagram));
        } catch (CommutativeDiagramException e) {
            return ErrorsOr.error(e.kind() + ": " + e.getMessage());
        }
    }

    static List<Path<Integer, DiagramEdge>> paths(Diagram diagram) {
        try {
            return AllPaths.allPaths(diagram);
        } catch (CyclicGraphException e) {
            throw new CyclicDiagramException(e);
        }
    }

    static List<PathPair> coterminalPairs(List<Path<Integer, DiagramEdge>> paths) {
        List<PathPair> pairs = new ArrayList<>();
        for (Path<Integer, DiagramEdge> left : paths)
            for (Path<Integer, DiagramEdge> right : paths)
                if (left.isCoterminalWith(right)) pairs.add(new PathPair(left, right));
        return pairs;
    }

    private Optional<CommutativeDiagramResult.DoesNotCommute> firstFailure(Diagram diagram, List<PathPair> pairs) {
        for (PathPair pair : pairs) {
            Optional<CommutativeDiagramResult.DoesNotCommute> result = checkPair(diagram, pair);
            if (result.isPresent()) return result;
        }
        return Optional.empty();
    }

    /**
     * Pairs run concurrently; futures are inspected in pair order so the lowest failing pair wins.
     * A pair is skipped once a lower-ranked pair has failed, which never changes the outcome.
     */
    private Optional<CommutativeDiagramResult.DoesNotCommute> firstFailureInParallel(Diagram diagram, List<PathPair> pairs) {
        AtomicInteger threadCount = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(),
                r -> new Thread(r, "commuter-checker-" + threadCount.incrementAndGet()));
        AtomicInteger lowestFailure = new AtomicInteger(Integer.MAX_VALUE);
        try {
            List<Future<Optional<CommutativeDiagramResult.DoesNotCommute>>> futures = new ArrayList<>(pairs.size());
            for (int i = 0; i < pairs.size(); i++) {
                final int index = i;
                futures.add(pool.submit(() -> {
                    if (index > lowestFailure.get()) return Optional.<CommutativeDiagramResult.DoesNotCommute>empty();
                    try {
                        Optional<CommutativeDiagramResult.DoesNotCommute> result = checkPair(diagram, pairs.get(index));
                        if (result.isPresent()) lowestFailure.accumulateAndGet(index, Math::min);
                        return result;
                    } catch (RuntimeException e) {
                        lowestFailure.accumulateAndGet(index, Math::min);
                        throw e;
                    }
                }));
            }
            for (Future<Optional<CommutativeDiagramResult.DoesNotCommute>> future : futures) {
                Optional<CommutativeDiagramResult.DoesNotCommute> result = future.get();
                if (result.isPresent()) return result;
            }
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking " + diagram, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw new IllegalStateException("Unexpected failure while checking " + diagram, e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    static Optional<CommutativeDiagramResult.DoesNotCommute> checkPair(Diagram diagram, PathPair pair) {
        int sourceIndex = pair.left().source();
        ElementSet source = diagram.set(sourceIndex);
        for (Element element : source.elements()) {
            if (!source.filter(element)) continue;
            if (!source.check(element))
                throw new PropertyCheckException("Element does not satisfy source set property: " + element.name()
                        + " (source set " + diagram.label(sourceIndex) + ")", element);

            Optional<Element> left = replay(diagram, pair.left(), element);
            if (left.isEmpty()) continue;
            Optional<Element> right = replay(diagram, pair.right(), element);
            if (right.isEmpty()) continue;

            if (!left.get().sameAs(right.get())) {
                return Optional.of(CommutativeDiagramResult.DoesNotCommute.of(
                        describe(diagram, pair.left()), describe(diagram, pair.right()),
                        element, left.get(), right.get()));
            }
        }
        return Optional.empty();
    }

    /** Pushes {@code input} along {@code path}; empty if some set on the way filters it out. */
    static Optional<Element> replay(Diagram diagram, Path<Integer, DiagramEdge> path, Element input) {
        Element current = input;
        List<String> travelled = new ArrayList<>();
        for (DiagramEdge edge : path.edges()) {
            DiagramMap map = diagram.map(edge.mapIndex());
            ElementSet target = diagram.set(edge.to());
            Element argument = current;
            current = map.apply(argument).orElseThrow(() -> new ContractViolationException(
                    "Map " + map.name() + " expects " + map.inputType().getName() + " but was given "
                            + argument.name() + " of type " + argument.type().getName()));
            travelled.add(map.name());

            if (!target.filter(current)) return Optional.empty();
            if (!target.check(current))
                throw new PropertyCheckException("Element does not satisfy target set property: " + current.name()
                        + " (target set " + diagram.label(edge.to()) + ", reached from " + input.name()
                        + " via " + String.join(PATH_SEPARATOR, travelled) + ")", current);
        }
        return Optional.of(current);
    }

    static String describe(Diagram diagram, Path<Integer, DiagramEdge> path) {
        return path.describe(edge -> diagram.map(edge.mapIndex()).name(), PATH_SEPARATOR);
    }

    record PathPair(Path<Integer, DiagramEdge> left, Path<Integer, DiagramEdge> right) {}
}
