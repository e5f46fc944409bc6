package dev.neuronic.matrix.math.ops;

import dev.neuronic.matrix.math.Arithmetic;

/**
 * Element-wise negation: output[i] = -input[i]
 */
public final class ElementwiseNegate {

    /**
     * @param arithmetic element operations
     * @param input input buffer
     * @param output output buffer (must be same length as input)
     * @throws IllegalArgumentException if buffers have different lengths
     */
    @SuppressWarnings("unchecked")
    public static <T> void compute(Arithmetic<T> arithmetic, Object[] input, Object[] output) {
        if (input.length != output.length)
            throw new IllegalArgumentException("Input and output arrays must have same length: " +
                                             "input.length=" + input.length + ", output.length=" + output.length);

        for (int i = 0; i < input.length; i++) {
            output[i] = arithmetic.negate((T) input[i]);
        }
    }

    private ElementwiseNegate() {}
}
