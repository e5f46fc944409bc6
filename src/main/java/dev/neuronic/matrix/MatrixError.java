package dev.neuronic.matrix;

/**
 * The failure kinds a {@link Matrix} operation can report.
 */
public enum MatrixError {
    ZERO_SIZE("Cannot create a matrix with zero rows or columns"),
    SIZE_MISMATCH("Initializer size does not match the expected number of elements"),
    INCOMPATIBLE_SIZES_ADD("Two matrices can only be added or subtracted if they are of the same size"),
    INCOMPATIBLE_SIZES_MULTIPLY("Two matrices can only be multiplied if the number of columns in the first matrix " +
                                "is equal to the number of rows in the second matrix"),
    INDEX_OUT_OF_RANGE("Requested matrix element is out of range");

    private final String description;

    MatrixError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * @return a new exception of the subclass matching this kind
     */
    public MatrixException toException() {
        switch (this) {
            case ZERO_SIZE:
                return new MatrixException.ZeroSize();
            case SIZE_MISMATCH:
                return new MatrixException.SizeMismatch();
            case INCOMPATIBLE_SIZES_ADD:
                return new MatrixException.IncompatibleSizesAdd();
            case INCOMPATIBLE_SIZES_MULTIPLY:
                return new MatrixException.IncompatibleSizesMultiply();
            case INDEX_OUT_OF_RANGE:
                return new MatrixException.IndexOutOfRange();
            default:
                throw new IllegalStateException("Unknown matrix error: " + this);
        }
    }
}
