package dev.neuronic.matrix;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a fallible matrix operation: either a value or a {@link MatrixError}.
 *
 * <p>Returned by the {@code try*} factories and {@link Matrix#tryAt(int, int)}
 * for callers that prefer branching over catching:
 * <pre>{@code
 * MatrixResult<Matrix<Integer>> result = Matrix.tryOf(Arithmetics.integers(), 2, 3, values);
 * if (!result.isOk())
 *     System.out.println(result.error().description());
 * }</pre>
 *
 * @param <V> the success value type
 */
public final class MatrixResult<V> {

    private final V value;
    private final MatrixError error;

    private MatrixResult(V value, MatrixError error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value the success value; {@code null} is allowed, as read from an uninitialized element
     */
    public static <V> MatrixResult<V> ok(V value) {
        return new MatrixResult<>(value, null);
    }

    public static <V> MatrixResult<V> failure(MatrixError error) {
        return new MatrixResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this result is a failure
     */
    public V value() {
        if (error != null)
            throw new IllegalStateException("No value present, result failed with " + error);
        return value;
    }

    /**
     * @return the failure kind, or {@code null} on success
     */
    public MatrixError error() {
        return error;
    }

    /**
     * @return the success value
     * @throws MatrixException the subclass matching {@link #error()} if this result is a failure
     */
    public V orElseThrow() {
        if (error != null)
            throw error.toException();
        return value;
    }

    public <R> MatrixResult<R> map(Function<? super V, ? extends R> mapper) {
        if (error != null)
            return failure(error);
        return ok(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MatrixResult)) return false;
        MatrixResult<?> other = (MatrixResult<?>) o;
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Ok[" + value + "]" : "Failure[" + error + "]";
    }
}
