package com.hcltech.graphs.common.errorsor;

import com.hcltech.graphs.common.function.ThrowingSupplier;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used at the boundaries where several independent things can go wrong at once
 * (parsing a graph description, running a batch of analyses) and the caller wants all of them,
 * not just the first.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    /**
     * Re-types an error. Throws if this is a value.
     */
    <T1> ErrorsOr<T1> errorCast();

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> error(String pattern, Exception e) {
        return new Error<>(List.of(MessageFormat.format(pattern, e.getClass().getSimpleName(), e.getMessage())));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** All values in order, or every error from every failed item. */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> items) {
        List<String> allErrors = new ArrayList<>();
        List<T> values = new ArrayList<>(items.size());
        for (ErrorsOr<T> item : items) {
            if (item.isError()) allErrors.addAll(item.getErrors());
            else values.add(item.valueOrThrow());
        }
        return allErrors.isEmpty() ? lift(List.copyOf(values)) : errors(allErrors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default T valueOrDefault(T defaultValue) {
        return getValue().orElse(defaultValue);
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(valueOrThrow()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(valueOrThrow());
    }

    default ErrorsOr<T> recover(Function<List<String>, T> f) {
        return isError() ? ErrorsOr.lift(f.apply(getErrors())) : this;
    }

    default void ifValue(Consumer<? super T> consumer) {
        if (isValue()) consumer.accept(valueOrThrow());
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }

    /** Wrap a throwing supplier -> ErrorsOr. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error("Evaluation error: {0}: {1}", e);
        }
    }

    /** Wrap a throwing supplier with a custom formatter (no alloc if happy path). */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
