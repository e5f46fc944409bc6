package dev.neuronic.matrix.math;

/**
 * Element operations a {@code Matrix<T>} needs from its element type.
 *
 * <p>Implementations must be stateless and must never return {@code null} from
 * the arithmetic methods. Stock implementations live in {@link Arithmetics}.
 *
 * <p><b>Usage Examples:</b>
 * <pre>{@code
 * Matrix<Double> m = Matrix.filled(Arithmetics.doubles(), 2, 3, 1.5);
 * Matrix<Integer> d = Matrix.diagonal(Arithmetics.integers(), 1, 2, 3);
 * }</pre>
 *
 * @param <T> the element type
 */
public interface Arithmetic<T> {

    /**
     * @return the runtime class of the elements, used to key per-type settings
     */
    Class<T> elementType();

    /**
     * @return the additive identity (the value of the literal 0 for numbers)
     */
    T zero();

    T add(T a, T b);

    T subtract(T a, T b);

    T negate(T a);

    T multiply(T a, T b);

    /**
     * Whether {@code multiply(a, b)} equals {@code multiply(b, a)} for every pair.
     * Right scalar multiplication reuses the left form only when this holds.
     */
    default boolean isMultiplicationCommutative() {
        return true;
    }

    /**
     * Text for a single element when a matrix is formatted for display.
     */
    default String toText(T value) {
        return String.valueOf(value);
    }
}
