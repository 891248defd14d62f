package io.commuter.common.errorsor;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used where every problem should be reported at once (validation) rather than
 * failing on the first one.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    default ErrorsOr<T> mapError(Function<List<String>, List<String>> f) {
        return isError() ? ErrorsOr.errors(f.apply(getErrors())) : this;
    }
}
