package io.commuter.diagram;

import io.commuter.common.IEnvGetter;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckerConfigTest {

    private static IEnvGetter env(Map<String, String> kv) {
        return kv::get;
    }

    @Test
    void defaults_areSequential() {
        var c = CheckerConfig.defaults();
        assertFalse(c.parallel());
        assertTrue(c.parallelism() >= 1);
    }

    @Test
    void fromEnv_withNothingSet_isDefaults() {
        assertEquals(CheckerConfig.defaults(), CheckerConfig.fromEnv(env(Map.of())));
    }

    @Test
    void fromEnv_readsBothVariables() {
        var c = CheckerConfig.fromEnv(env(Map.of(CheckerConfig.PARALLEL_ENV, "true", CheckerConfig.PARALLELISM_ENV, "3")));
        assertEquals(new CheckerConfig(true, 3), c);
    }

    @Test
    void fromEnv_rejectsGarbageParallelism() {
        var ex = assertThrows(IllegalStateException.class,
                () -> CheckerConfig.fromEnv(env(Map.of(CheckerConfig.PARALLELISM_ENV, "lots"))));
        assertTrue(ex.getMessage().contains(CheckerConfig.PARALLELISM_ENV));
    }

    @Test
    void parallelismBelowOne_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> CheckerConfig.parallel(0));
    }

    @Test
    void checkerFromEnv_usesTheConfig() {
        var checker = CommutativityChecker.fromEnv(env(Map.of(CheckerConfig.PARALLEL_ENV, "true", CheckerConfig.PARALLELISM_ENV, "2")));
        assertEquals(CheckerConfig.parallel(2), checker.config());
    }
}
