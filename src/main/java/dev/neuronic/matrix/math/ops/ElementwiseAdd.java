package dev.neuronic.matrix.math.ops;

import dev.neuronic.matrix.math.Arithmetic;

/**
 * Element-wise addition: output[i] = a[i] + b[i]
 */
public final class ElementwiseAdd {

    /**
     * Compute element-wise addition of two buffers.
     *
     * @param arithmetic element operations
     * @param a first input buffer
     * @param b second input buffer
     * @param output pre-allocated output buffer, may be {@code a} or {@code b}
     * @throws IllegalArgumentException if buffers have different lengths
     */
    @SuppressWarnings("unchecked")
    public static <T> void compute(Arithmetic<T> arithmetic, Object[] a, Object[] b, Object[] output) {
        if (a.length != b.length || a.length != output.length)
            throw new IllegalArgumentException("All arrays must have same length: a=" + a.length +
                                             ", b=" + b.length + ", output=" + output.length);

        for (int i = 0; i < a.length; i++) {
            output[i] = arithmetic.add((T) a[i], (T) b[i]);
        }
    }

    private ElementwiseAdd() {}
}
