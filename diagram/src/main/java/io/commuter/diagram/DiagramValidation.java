package io.commuter.diagram;

import io.commuter.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Validates diagram structure. Reports every problem, never throws. */
public interface DiagramValidation {

    static ErrorsOr<Boolean> validate(List<? extends ElementSet> sets, List<DiagramMap> maps) {
        Objects.requireNonNull(sets);
        Objects.requireNonNull(maps);

        List<String> errors = new ArrayList<>();
        for (int i = 0; i < sets.size(); i++) {
            if (sets.get(i) == null) errors.add("Set #" + i + " is null");
        }
        for (int i = 0; i < maps.size(); i++) {
            DiagramMap m = maps.get(i);
            if (m == null) {
                errors.add("Map #" + i + " is null");
                continue;
            }
            if (m.from() < 0 || m.from() >= sets.size())
                errors.add("Map #" + i + " " + m.name() + " starts at set " + m.from() + " but the diagram has " + sets.size() + " sets");
            if (m.to() < 0 || m.to() >= sets.size())
                errors.add("Map #" + i + " " + m.name() + " ends at set " + m.to() + " but the diagram has " + sets.size() + " sets");
        }
        return errors.isEmpty() ? ErrorsOr.lift(Boolean.TRUE) : ErrorsOr.errors(errors);
    }
}
