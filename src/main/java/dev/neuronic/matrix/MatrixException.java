package dev.neuronic.matrix;

/**
 * Base class of the exceptions raised by {@link Matrix}.
 *
 * <p>Each {@link MatrixError} has its own subclass so callers can catch one kind
 * and let the others propagate:
 * <pre>{@code
 * try {
 *     Matrix<Double> c = a.times(b);
 * } catch (MatrixException.IncompatibleSizesMultiply e) {
 *     // shapes do not chain
 * }
 * }</pre>
 * The exceptions carry no payload beyond their kind.
 */
public class MatrixException extends RuntimeException {

    private final MatrixError kind;

    MatrixException(MatrixError kind) {
        super(kind.description());
        this.kind = kind;
    }

    public MatrixError kind() {
        return kind;
    }

    /** Requested row or column count is zero (or negative). */
    public static final class ZeroSize extends MatrixException {
        public ZeroSize() {
            super(MatrixError.ZERO_SIZE);
        }
    }

    /** Flattened element sequence length differs from {@code rows * cols}. */
    public static final class SizeMismatch extends MatrixException {
        public SizeMismatch() {
            super(MatrixError.SIZE_MISMATCH);
        }
    }

    /** Operands of an addition or subtraction differ in shape. */
    public static final class IncompatibleSizesAdd extends MatrixException {
        public IncompatibleSizesAdd() {
            super(MatrixError.INCOMPATIBLE_SIZES_ADD);
        }
    }

    /** Left column count differs from right row count in a product. */
    public static final class IncompatibleSizesMultiply extends MatrixException {
        public IncompatibleSizesMultiply() {
            super(MatrixError.INCOMPATIBLE_SIZES_MULTIPLY);
        }
    }

    /** Checked access outside {@code [0, rows) x [0, cols)}. */
    public static final class IndexOutOfRange extends MatrixException {
        public IndexOutOfRange() {
            super(MatrixError.INDEX_OUT_OF_RANGE);
        }
    }
}
