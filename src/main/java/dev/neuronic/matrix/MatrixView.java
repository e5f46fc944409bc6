package dev.neuronic.matrix;

/**
 * Read-only access to a matrix.
 *
 * <p>{@link Matrix} implements this interface and {@link Matrix#view()} returns a
 * live view that cannot be used to modify the underlying matrix.
 *
 * @param <T> the element type
 */
public interface MatrixView<T> {

    int rows();

    int cols();

    /**
     * @return {@code true} only for a matrix whose contents were moved away
     */
    boolean isEmpty();

    /**
     * Element at {@code (row, col)} WITHOUT range checking.
     * See {@link Matrix#element(int, int)} for the caller contract.
     */
    T element(int row, int col);

    /**
     * Element at {@code (row, col)} with range checking.
     *
     * @throws MatrixException.IndexOutOfRange if either index is out of range
     */
    T at(int row, int col);

    /**
     * Text for one element, as used by {@link dev.neuronic.matrix.format.MatrixFormatter}.
     */
    String elementText(int row, int col);

    /**
     * @return the element class, used to look up the shared output width
     */
    Class<T> elementType();
}
