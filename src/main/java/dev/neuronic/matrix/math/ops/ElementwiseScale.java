package dev.neuronic.matrix.math.ops;

import dev.neuronic.matrix.math.Arithmetic;

/**
 * Element-wise scaling by a scalar, in either operand order:
 * <ul>
 *   <li>{@link #computeLeft}: output[i] = scale * input[i]</li>
 *   <li>{@link #computeRight}: output[i] = input[i] * scale</li>
 * </ul>
 * The two only differ for element types whose multiplication does not commute.
 */
public final class ElementwiseScale {

    /**
     * Scale with the scalar as the left factor.
     *
     * @param arithmetic element operations
     * @param scale scalar multiplier
     * @param input input buffer
     * @param output output buffer (must be same length as input)
     * @throws IllegalArgumentException if buffers have different lengths
     */
    @SuppressWarnings("unchecked")
    public static <T> void computeLeft(Arithmetic<T> arithmetic, T scale, Object[] input, Object[] output) {
        checkLengths(input, output);

        for (int i = 0; i < input.length; i++) {
            output[i] = arithmetic.multiply(scale, (T) input[i]);
        }
    }

    /**
     * Scale with the scalar as the right factor.
     *
     * @param arithmetic element operations
     * @param input input buffer
     * @param scale scalar multiplier
     * @param output output buffer (must be same length as input)
     * @throws IllegalArgumentException if buffers have different lengths
     */
    @SuppressWarnings("unchecked")
    public static <T> void computeRight(Arithmetic<T> arithmetic, Object[] input, T scale, Object[] output) {
        checkLengths(input, output);

        for (int i = 0; i < input.length; i++) {
            output[i] = arithmetic.multiply((T) input[i], scale);
        }
    }

    private static void checkLengths(Object[] input, Object[] output) {
        if (input.length != output.length)
            throw new IllegalArgumentException("Input and output arrays must have same length: " +
                                             "input.length=" + input.length + ", output.length=" + output.length);
    }

    private ElementwiseScale() {}
}
