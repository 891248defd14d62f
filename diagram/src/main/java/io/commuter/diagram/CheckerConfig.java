package io.commuter.diagram;

import io.commuter.common.IEnvGetter;

/**
 * How the checker runs.
 *
 * @param parallel    check path pairs on a thread pool instead of the calling thread
 * @param parallelism pool size when {@code parallel}
 */
public record CheckerConfig(boolean parallel, int parallelism) {
    public static final String PARALLEL_ENV = "COMMUTER_PARALLEL";
    public static final String PARALLELISM_ENV = "COMMUTER_PARALLELISM";

    public CheckerConfig {
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be at least 1 but was " + parallelism);
    }

    public static CheckerConfig defaults() {
        return new CheckerConfig(false, Runtime.getRuntime().availableProcessors());
    }

    public static CheckerConfig parallel(int parallelism) {
        return new CheckerConfig(true, parallelism);
    }

    /** Defaults overridden by {@value #PARALLEL_ENV} and {@value #PARALLELISM_ENV}. */
    public static CheckerConfig fromEnv(IEnvGetter env) {
        CheckerConfig d = defaults();
        return new CheckerConfig(
                IEnvGetter.getBooleanOr(env, PARALLEL_ENV, d.parallel()),
                IEnvGetter.getIntOr(env, PARALLELISM_ENV, d.parallelism()));
    }
}
