package dev.neuronic.matrix;

import dev.neuronic.matrix.format.MatrixFormatter;
import dev.neuronic.matrix.math.Arithmetic;
import dev.neuronic.matrix.math.ops.ElementwiseAdd;
import dev.neuronic.matrix.math.ops.ElementwiseNegate;
import dev.neuronic.matrix.math.ops.ElementwiseScale;
import dev.neuronic.matrix.math.ops.ElementwiseSubtract;
import dev.neuronic.matrix.math.ops.MatrixMultiply;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Dense, dynamically-sized matrix of arbitrary element type.
 *
 * <p>Elements are stored row-major in a single buffer owned exclusively by this
 * instance: element {@code (r, c)} lives at offset {@code r * cols + c}. Every
 * live matrix has at least one row and one column. Copying (the copy
 * constructor, {@link #copy()}, {@link #assign}) duplicates the buffer; moving
 * ({@link #moveFrom}, {@link #moveAssign}) hands the buffer over and leaves the
 * source empty ({@code 0x0}, no buffer) until it is assigned again.
 *
 * <p>The element operations come from an {@link Arithmetic}, see
 * {@link dev.neuronic.matrix.math.Arithmetics} for the stock ones.
 *
 * <p><b>Usage Examples:</b>
 * <pre>{@code
 * Arithmetic<Double> d = Arithmetics.doubles();
 * Matrix<Double> a = Matrix.of(d, 2, 2, 1.0, 2.0, 3.0, 4.0);
 * Matrix<Double> b = Matrix.diagonal(d, 5.0, 6.0);
 *
 * Matrix<Double> c = a.times(b).plus(Matrix.filled(d, 2, 2, 1.0));
 * c.setAt(0, 1, 7.0);
 * a.plusEquals(c);
 * System.out.print(Matrix.times(0.5, a));
 * }</pre>
 *
 * <p>Instances are not thread-safe.
 *
 * @param <T> the element type
 */
public final class Matrix<T> implements MatrixView<T> {

    private final Arithmetic<T> arithmetic;
    private int rows;
    private int cols;
    private Object[] elements;

    private Matrix(Arithmetic<T> arithmetic, int rows, int cols, Object[] elements) {
        this.arithmetic = arithmetic;
        this.rows = rows;
        this.cols = cols;
        this.elements = elements;
    }

    /**
     * Copy constructor: a new matrix with the same shape and elements and its own buffer.
     *
     * @throws IllegalStateException if {@code other} has been moved from
     */
    public Matrix(Matrix<T> other) {
        this(other.arithmetic, other.rows, other.cols, other.requireLive().elements.clone());
    }

    // ========== FACTORIES ==========

    /**
     * Create an UNINITIALIZED matrix. Every element is {@code null} until written;
     * reading one before writing it is a caller error.
     *
     * @throws MatrixException.ZeroSize if rows or cols is not positive
     */
    public static <T> Matrix<T> uninitialized(Arithmetic<T> arithmetic, int rows, int cols) {
        return tryUninitialized(arithmetic, rows, cols).orElseThrow();
    }

    public static <T> MatrixResult<Matrix<T>> tryUninitialized(Arithmetic<T> arithmetic, int rows, int cols) {
        Objects.requireNonNull(arithmetic, "arithmetic");
        if (rows <= 0 || cols <= 0)
            return MatrixResult.failure(MatrixError.ZERO_SIZE);
        return MatrixResult.ok(new Matrix<>(arithmetic, rows, cols, new Object[elementCount(rows, cols)]));
    }

    /**
     * Create a matrix with every element set to {@code value}.
     *
     * @throws MatrixException.ZeroSize if rows or cols is not positive
     */
    public static <T> Matrix<T> filled(Arithmetic<T> arithmetic, int rows, int cols, T value) {
        return tryFilled(arithmetic, rows, cols, value).orElseThrow();
    }

    public static <T> MatrixResult<Matrix<T>> tryFilled(Arithmetic<T> arithmetic, int rows, int cols, T value) {
        Objects.requireNonNull(value, "value");
        return tryUninitialized(arithmetic, rows, cols).map(m -> {
            Arrays.fill(m.elements, value);
            return m;
        });
    }

    /**
     * Create a square diagonal matrix. The size is the number of values; entries
     * off the diagonal are {@link Arithmetic#zero()}.
     *
     * @throws MatrixException.ZeroSize if no values are given
     */
    @SafeVarargs
    public static <T> Matrix<T> diagonal(Arithmetic<T> arithmetic, T... diagonal) {
        return tryDiagonal(arithmetic, Arrays.asList(diagonal)).orElseThrow();
    }

    public static <T> Matrix<T> diagonal(Arithmetic<T> arithmetic, List<? extends T> diagonal) {
        return tryDiagonal(arithmetic, diagonal).orElseThrow();
    }

    public static <T> MatrixResult<Matrix<T>> tryDiagonal(Arithmetic<T> arithmetic, List<? extends T> diagonal) {
        int n = diagonal.size();
        return tryUninitialized(arithmetic, n, n).map(m -> {
            T zero = arithmetic.zero();
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    m.elements[(n * i) + j] = (i == j) ? Objects.requireNonNull(diagonal.get(i), "diagonal element") : zero;
            return m;
        });
    }

    /**
     * Create a matrix from its elements in flattened row-major order: for a 2x2
     * matrix A the values are {@code A(0,0), A(0,1), A(1,0), A(1,1)}.
     *
     * @throws MatrixException.ZeroSize if rows or cols is not positive
     * @throws MatrixException.SizeMismatch if the number of values is not {@code rows * cols}
     */
    @SafeVarargs
    public static <T> Matrix<T> of(Arithmetic<T> arithmetic, int rows, int cols, T... elements) {
        return tryOf(arithmetic, rows, cols, Arrays.asList(elements)).orElseThrow();
    }

    public static <T> Matrix<T> of(Arithmetic<T> arithmetic, int rows, int cols, List<? extends T> elements) {
        return tryOf(arithmetic, rows, cols, elements).orElseThrow();
    }

    public static <T> MatrixResult<Matrix<T>> tryOf(Arithmetic<T> arithmetic, int rows, int cols,
                                                   List<? extends T> elements) {
        Objects.requireNonNull(arithmetic, "arithmetic");
        Objects.requireNonNull(elements, "elements");
        if (rows <= 0 || cols <= 0)
            return MatrixResult.failure(MatrixError.ZERO_SIZE);
        if (elements.size() != elementCount(rows, cols))
            return MatrixResult.failure(MatrixError.SIZE_MISMATCH);

        Object[] buffer = elements.toArray();
        for (Object e : buffer)
            Objects.requireNonNull(e, "element");
        return MatrixResult.ok(new Matrix<>(arithmetic, rows, cols, buffer));
    }

    /**
     * Move constructor: the new matrix takes over the source's buffer and the
     * source is left empty.
     */
    public static <T> Matrix<T> moveFrom(Matrix<T> source) {
        Matrix<T> target = new Matrix<>(source.arithmetic, source.rows, source.cols, source.elements);
        source.clear();
        return target;
    }

    // ========== ASSIGNMENT ==========

    /**
     * Copy assignment: replace this matrix's shape and contents with a copy of {@code source}.
     *
     * @return this matrix
     * @throws IllegalStateException if {@code source} has been moved from
     */
    public Matrix<T> assign(Matrix<T> source) {
        Object[] copy = source.requireLive().elements.clone();
        rows = source.rows;
        cols = source.cols;
        elements = copy;
        return this;
    }

    /**
     * Move assignment: take over {@code source}'s buffer, discarding this
     * matrix's previous contents, and leave {@code source} empty. Moving a matrix
     * into itself changes nothing.
     *
     * @return this matrix
     */
    public Matrix<T> moveAssign(Matrix<T> source) {
        if (source == this)
            return this;
        rows = source.rows;
        cols = source.cols;
        elements = source.elements;
        source.clear();
        return this;
    }

    /**
     * @return an independent deep copy
     */
    public Matrix<T> copy() {
        return new Matrix<>(this);
    }

    // ========== QUERIES ==========

    @Override
    public int rows() {
        return rows;
    }

    @Override
    public int cols() {
        return cols;
    }

    /**
     * @return total number of elements, {@code rows * cols}
     */
    public int size() {
        return rows * cols;
    }

    @Override
    public boolean isEmpty() {
        return elements == null;
    }

    public Arithmetic<T> arithmetic() {
        return arithmetic;
    }

    @Override
    public Class<T> elementType() {
        return arithmetic.elementType();
    }

    // ========== ELEMENT ACCESS ==========

    /**
     * Element at {@code (row, col)} WITHOUT range checking, for inner loops.
     *
     * <p><b>WARNING:</b> the caller must guarantee {@code 0 <= row < rows} and
     * {@code 0 <= col < cols}. Nothing is validated: a column past the end
     * silently reads the next row, and an offset outside the buffer (or any
     * access to a moved-from matrix) fails with whatever the JVM raises
     * ({@link ArrayIndexOutOfBoundsException}, {@link NullPointerException}).
     * Use {@link #at(int, int)} when the indices are not known to be valid.
     */
    @Override
    @SuppressWarnings("unchecked")
    public T element(int row, int col) {
        return (T) elements[(cols * row) + col];
    }

    /**
     * Overwrite the element at {@code (row, col)} WITHOUT range checking.
     * The same caller contract as {@link #element(int, int)} applies.
     */
    public void setElement(int row, int col, T value) {
        elements[(cols * row) + col] = value;
    }

    /**
     * Element at {@code (row, col)} with range checking.
     *
     * @throws MatrixException.IndexOutOfRange if either index is negative or not below its bound
     */
    @Override
    public T at(int row, int col) {
        checkIndex(row, col);
        return element(row, col);
    }

    /**
     * Overwrite the element at {@code (row, col)} with range checking.
     *
     * @throws MatrixException.IndexOutOfRange if either index is negative or not below its bound
     */
    public void setAt(int row, int col, T value) {
        checkIndex(row, col);
        setElement(row, col, value);
    }

    /**
     * Checked read that reports an out-of-range index as a failed result.
     * Like {@link #at(int, int)}, an uninitialized element reads as a successful {@code null}.
     */
    public MatrixResult<T> tryAt(int row, int col) {
        if (!inRange(row, col))
            return MatrixResult.failure(MatrixError.INDEX_OUT_OF_RANGE);
        return MatrixResult.ok(element(row, col));
    }

    @Override
    public String elementText(int row, int col) {
        T value = element(row, col);
        // uninitialized slots
        if (value == null)
            return "null";
        return arithmetic.toText(value);
    }

    /**
     * @return a live read-only view of this matrix
     */
    public MatrixView<T> view() {
        return new ReadOnlyView<>(this);
    }

    // ========== ARITHMETIC ==========

    /**
     * @return {@code this + other}, element by element
     * @throws MatrixException.IncompatibleSizesAdd if the shapes differ
     */
    public Matrix<T> plus(Matrix<T> other) {
        checkSameShape(other);
        Matrix<T> c = blank(rows, cols);
        ElementwiseAdd.compute(arithmetic, elements, other.elements, c.elements);
        return c;
    }

    /**
     * Replace this matrix with {@code this + other}.
     *
     * @return this matrix
     * @throws MatrixException.IncompatibleSizesAdd if the shapes differ
     */
    public Matrix<T> plusEquals(Matrix<T> other) {
        return moveAssign(plus(other));
    }

    /**
     * @return {@code -this}, element by element
     */
    public Matrix<T> negate() {
        requireLive();
        Matrix<T> c = blank(rows, cols);
        ElementwiseNegate.compute(arithmetic, elements, c.elements);
        return c;
    }

    /**
     * @return {@code this - other}, element by element
     * @throws MatrixException.IncompatibleSizesAdd if the shapes differ
     */
    public Matrix<T> minus(Matrix<T> other) {
        checkSameShape(other);
        Matrix<T> c = blank(rows, cols);
        ElementwiseSubtract.compute(arithmetic, elements, other.elements, c.elements);
        return c;
    }

    /**
     * Replace this matrix with {@code this - other}.
     *
     * @return this matrix
     * @throws MatrixException.IncompatibleSizesAdd if the shapes differ
     */
    public Matrix<T> minusEquals(Matrix<T> other) {
        return moveAssign(minus(other));
    }

    /**
     * Matrix product. The result has {@code this.rows()} rows and {@code other.cols()} columns.
     *
     * @throws MatrixException.IncompatibleSizesMultiply if {@code this.cols() != other.rows()}
     */
    public Matrix<T> times(Matrix<T> other) {
        requireLive();
        other.requireLive();
        if (cols != other.rows)
            throw new MatrixException.IncompatibleSizesMultiply();
        Matrix<T> c = blank(rows, other.cols);
        MatrixMultiply.compute(arithmetic, elements, other.elements, rows, cols, other.cols, c.elements);
        return c;
    }

    /**
     * Scalar product with the scalar on the left: {@code c(i, j) = scalar * m(i, j)}.
     */
    public static <T> Matrix<T> times(T scalar, Matrix<T> m) {
        m.requireLive();
        Matrix<T> c = m.blank(m.rows, m.cols);
        ElementwiseScale.computeLeft(m.arithmetic, scalar, m.elements, c.elements);
        return c;
    }

    /**
     * Scalar product with the scalar on the right: {@code c(i, j) = m(i, j) * scalar}.
     * For element types with commutative multiplication this is the same as
     * {@link #times(Object, Matrix)}.
     */
    public Matrix<T> times(T scalar) {
        if (arithmetic.isMultiplicationCommutative())
            return times(scalar, this);
        requireLive();
        Matrix<T> c = blank(rows, cols);
        ElementwiseScale.computeRight(arithmetic, elements, scalar, c.elements);
        return c;
    }

    // ========== DISPLAY ==========

    /**
     * Set the shared display width for every matrix with this element type.
     *
     * @throws IllegalArgumentException if width is negative
     */
    public static <T> void setOutputWidth(Arithmetic<T> arithmetic, int width) {
        MatrixFormatter.setOutputWidth(arithmetic.elementType(), width);
    }

    /**
     * Rows in parentheses, elements right-justified to the shared output width.
     */
    @Override
    public String toString() {
        return MatrixFormatter.format(this);
    }

    // ========== VALUE SEMANTICS ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Matrix)) return false;
        Matrix<?> other = (Matrix<?>) o;
        return rows == other.rows && cols == other.cols && Arrays.equals(elements, other.elements);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rows + cols) + Arrays.hashCode(elements);
    }

    // ========== INTERNALS ==========

    private Matrix<T> blank(int rows, int cols) {
        return new Matrix<>(arithmetic, rows, cols, new Object[elementCount(rows, cols)]);
    }

    private void clear() {
        rows = 0;
        cols = 0;
        elements = null;
    }

    private Matrix<T> requireLive() {
        if (elements == null)
            throw new IllegalStateException("Matrix has been moved from and holds no elements");
        return this;
    }

    private void checkSameShape(Matrix<T> other) {
        requireLive();
        other.requireLive();
        if (rows != other.rows || cols != other.cols)
            throw new MatrixException.IncompatibleSizesAdd();
    }

    private boolean inRange(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    private void checkIndex(int row, int col) {
        if (!inRange(row, col))
            throw new MatrixException.IndexOutOfRange();
    }

    private static int elementCount(int rows, int cols) {
        try {
            return Math.multiplyExact(rows, cols);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Matrix too large: " + rows + "x" + cols, e);
        }
    }

    private static final class ReadOnlyView<T> implements MatrixView<T> {

        private final Matrix<T> matrix;

        ReadOnlyView(Matrix<T> matrix) {
            this.matrix = matrix;
        }

        @Override public int rows() { return matrix.rows(); }
        @Override public int cols() { return matrix.cols(); }
        @Override public boolean isEmpty() { return matrix.isEmpty(); }
        @Override public T element(int row, int col) { return matrix.element(row, col); }
        @Override public T at(int row, int col) { return matrix.at(row, col); }
        @Override public String elementText(int row, int col) { return matrix.elementText(row, col); }
        @Override public Class<T> elementType() { return matrix.elementType(); }

        @Override
        public String toString() {
            return MatrixFormatter.format(this);
        }
    }
}
