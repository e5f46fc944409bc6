package dev.neuronic.matrix.math;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Stock {@link Arithmetic} implementations for the JDK number types.
 *
 * <p>Primitive wrappers follow Java's own operator semantics: integer types
 * wrap on overflow, floating types follow IEEE 754.
 */
public final class Arithmetics {

    private static final Arithmetic<Integer> INTEGERS = new Arithmetic<>() {
        @Override public Class<Integer> elementType() { return Integer.class; }
        @Override public Integer zero() { return 0; }
        @Override public Integer add(Integer a, Integer b) { return a + b; }
        @Override public Integer subtract(Integer a, Integer b) { return a - b; }
        @Override public Integer negate(Integer a) { return -a; }
        @Override public Integer multiply(Integer a, Integer b) { return a * b; }
    };

    private static final Arithmetic<Long> LONGS = new Arithmetic<>() {
        @Override public Class<Long> elementType() { return Long.class; }
        @Override public Long zero() { return 0L; }
        @Override public Long add(Long a, Long b) { return a + b; }
        @Override public Long subtract(Long a, Long b) { return a - b; }
        @Override public Long negate(Long a) { return -a; }
        @Override public Long multiply(Long a, Long b) { return a * b; }
    };

    private static final Arithmetic<Float> FLOATS = new Arithmetic<>() {
        @Override public Class<Float> elementType() { return Float.class; }
        @Override public Float zero() { return 0.0f; }
        @Override public Float add(Float a, Float b) { return a + b; }
        @Override public Float subtract(Float a, Float b) { return a - b; }
        @Override public Float negate(Float a) { return -a; }
        @Override public Float multiply(Float a, Float b) { return a * b; }
        @Override public String toText(Float value) { return floatingText(value); }
    };

    private static final Arithmetic<Double> DOUBLES = new Arithmetic<>() {
        @Override public Class<Double> elementType() { return Double.class; }
        @Override public Double zero() { return 0.0; }
        @Override public Double add(Double a, Double b) { return a + b; }
        @Override public Double subtract(Double a, Double b) { return a - b; }
        @Override public Double negate(Double a) { return -a; }
        @Override public Double multiply(Double a, Double b) { return a * b; }
        @Override public String toText(Double value) { return floatingText(value); }
    };

    private static final Arithmetic<BigInteger> BIG_INTEGERS = new Arithmetic<>() {
        @Override public Class<BigInteger> elementType() { return BigInteger.class; }
        @Override public BigInteger zero() { return BigInteger.ZERO; }
        @Override public BigInteger add(BigInteger a, BigInteger b) { return a.add(b); }
        @Override public BigInteger subtract(BigInteger a, BigInteger b) { return a.subtract(b); }
        @Override public BigInteger negate(BigInteger a) { return a.negate(); }
        @Override public BigInteger multiply(BigInteger a, BigInteger b) { return a.multiply(b); }
    };

    private static final Arithmetic<BigDecimal> BIG_DECIMALS = new Arithmetic<>() {
        @Override public Class<BigDecimal> elementType() { return BigDecimal.class; }
        @Override public BigDecimal zero() { return BigDecimal.ZERO; }
        @Override public BigDecimal add(BigDecimal a, BigDecimal b) { return a.add(b); }
        @Override public BigDecimal subtract(BigDecimal a, BigDecimal b) { return a.subtract(b); }
        @Override public BigDecimal negate(BigDecimal a) { return a.negate(); }
        @Override public BigDecimal multiply(BigDecimal a, BigDecimal b) { return a.multiply(b); }
        @Override public String toText(BigDecimal value) { return value.toPlainString(); }
    };

    public static Arithmetic<Integer> integers() {
        return INTEGERS;
    }

    public static Arithmetic<Long> longs() {
        return LONGS;
    }

    public static Arithmetic<Float> floats() {
        return FLOATS;
    }

    public static Arithmetic<Double> doubles() {
        return DOUBLES;
    }

    public static Arithmetic<BigInteger> bigIntegers() {
        return BIG_INTEGERS;
    }

    /**
     * Exact decimal arithmetic. Note that {@link BigDecimal#equals} is scale
     * sensitive, so {@code 2.0} and {@code 2.00} elements compare unequal.
     */
    public static Arithmetic<BigDecimal> bigDecimals() {
        return BIG_DECIMALS;
    }

    /**
     * Integral values print without a fractional part ({@code 1.0} becomes {@code "1"}),
     * everything else uses {@link Double#toString(double)} or {@link Float#toString(float)}.
     */
    static String floatingText(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            // keep the sign of negative zero
            if (value == 0 && 1 / value < 0)
                return "-0";
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    static String floatingText(float value) {
        if (value == Math.rint(value) && !Float.isInfinite(value) && Math.abs(value) < 1e7f) {
            if (value == 0 && 1 / value < 0)
                return "-0";
            return Long.toString((long) value);
        }
        return Float.toString(value);
    }

    private Arithmetics() {}
}
