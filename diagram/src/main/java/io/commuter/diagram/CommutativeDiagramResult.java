package io.commuter.diagram;

import java.util.Objects;

/** Verdict of a completed verification run. */
public sealed interface CommutativeDiagramResult {

    CommutativeDiagramResult COMMUTES = new Commutes();

    boolean commutes();

    record Commutes() implements CommutativeDiagramResult {
        @Override
        public boolean commutes() {
            return true;
        }
    }

    /**
     * The first disagreement found.
     *
     * @param reason    names both paths, the input and both results
     * @param leftPath  map names of the first path, joined with {@code " -> "}
     * @param rightPath map names of the second path
     */
    record DoesNotCommute(String reason, String leftPath, String rightPath,
                          Element input, Element leftResult, Element rightResult) implements CommutativeDiagramResult {
        public DoesNotCommute {
            Objects.requireNonNull(reason, "reason");
        }

        public static DoesNotCommute of(String leftPath, String rightPath, Element input, Element leftResult, Element rightResult) {
            String reason = leftPath + " and " + rightPath + " don't agree on " + input.name()
                    + ". Left gets " + leftResult.name() + " while right gets " + rightResult.name();
            return new DoesNotCommute(reason, leftPath, rightPath, input, leftResult, rightResult);
        }

        @Override
        public boolean commutes() {
            return false;
        }
    }
}
