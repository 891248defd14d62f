package io.commuter.diagram;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static io.commuter.diagram.DiagramFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DiagramMapTest {

    private final DiagramMap sum = DiagramMap.of(1, 3, Pair.class, SUM, "(+)");

    @Test
    void apply_runsTheFunctionOnMatchingInput() {
        assertEquals(Optional.of(Element.of(7)), sum.apply(Element.of(new Pair(3, 4))));
    }

    @Test
    void apply_isEmptyForMismatchedInput() {
        assertEquals(Optional.empty(), sum.apply(Element.of(new Triple(1, 2, 3))));
    }

    @Test
    void nullResult_isAContractViolation() {
        var nothing = DiagramMap.of(0, 1, Integer.class, x -> (String) null, "nothing");
        var ex = assertThrows(ContractViolationException.class, () -> nothing.apply(Element.of(1)));
        assertTrue(ex.getMessage().contains("nothing"), ex.getMessage());
    }

    @Test
    void exposesEndpointsAndName() {
        assertEquals(1, sum.from());
        assertEquals(3, sum.to());
        assertEquals("(+)", sum.name());
        assertEquals(Pair.class, sum.inputType());
    }

    @Test
    void primitiveInputType_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> DiagramMap.of(0, 1, int.class, x -> x, "id"));
    }
}
