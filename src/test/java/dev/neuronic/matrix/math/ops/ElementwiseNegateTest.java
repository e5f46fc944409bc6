package dev.neuronic.matrix.math.ops;

import dev.neuronic.matrix.math.Arithmetics;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class ElementwiseNegateTest {

    @Test
    void testNegation() {
        Object[] input = {1, -2, 0};
        Object[] output = new Object[3];

        ElementwiseNegate.compute(Arithmetics.integers(), input, output);

        assertArrayEquals(new Object[]{-1, 2, 0}, output);
        assertArrayEquals(new Object[]{1, -2, 0}, input);
    }

    @Test
    void testBigIntegerNegation() {
        Object[] input = {BigInteger.TEN};
        Object[] output = new Object[1];

        ElementwiseNegate.compute(Arithmetics.bigIntegers(), input, output);

        assertEquals(BigInteger.valueOf(-10), output[0]);
    }

    @Test
    void testLengthMismatch() {
        assertThrows(IllegalArgumentException.class, () ->
            ElementwiseNegate.compute(Arithmetics.integers(), new Object[]{1, 2}, new Object[3]));
    }
}
