package dev.neuronic.matrix.math.ops;

import dev.neuronic.matrix.math.Arithmetic;

/**
 * Dense matrix product on row-major flattened buffers.
 *
 * Computes: output[i][j] = sum(a[i][k] * b[k][j]) for k in [0, inner)
 *
 * where a is [rows x inner], b is [inner x cols] and output is [rows x cols].
 * Each accumulator starts from {@link Arithmetic#zero()} and products are added
 * in increasing k, so integer results are exact and floating results match the
 * naive triple loop bit for bit.
 */
public final class MatrixMultiply {

    /**
     * @param arithmetic element operations
     * @param a left operand, row-major [rows x inner]
     * @param b right operand, row-major [inner x cols]
     * @param rows rows of a and of the output
     * @param inner columns of a, rows of b
     * @param cols columns of b and of the output
     * @param output pre-allocated output, row-major [rows x cols]; must not be a or b
     * @throws IllegalArgumentException if any buffer length disagrees with the dimensions,
     *         or a dimension product overflows {@code int}
     */
    @SuppressWarnings("unchecked")
    public static <T> void compute(Arithmetic<T> arithmetic, Object[] a, Object[] b,
                                   int rows, int inner, int cols, Object[] output) {
        if (a.length != checkedProduct(rows, inner))
            throw new IllegalArgumentException("Left buffer length " + a.length +
                                             " does not match " + rows + "x" + inner);
        if (b.length != checkedProduct(inner, cols))
            throw new IllegalArgumentException("Right buffer length " + b.length +
                                             " does not match " + inner + "x" + cols);
        if (output.length != checkedProduct(rows, cols))
            throw new IllegalArgumentException("Output buffer length " + output.length +
                                             " does not match " + rows + "x" + cols);
        if (output == a || output == b)
            throw new IllegalArgumentException("Output buffer must not alias an input");

        for (int i = 0; i < rows; i++) {
            int aRow = i * inner;
            for (int j = 0; j < cols; j++) {
                T sum = arithmetic.zero();
                for (int k = 0; k < inner; k++) {
                    sum = arithmetic.add(sum, arithmetic.multiply((T) a[aRow + k], (T) b[k * cols + j]));
                }
                output[i * cols + j] = sum;
            }
        }
    }

    private static int checkedProduct(int m, int n) {
        try {
            return Math.multiplyExact(m, n);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Dimensions too large: " + m + "x" + n, e);
        }
    }

    private MatrixMultiply() {}
}
