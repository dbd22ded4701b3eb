package org.cuelang.cue.internal;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Precision and rounding for arbitrary-precision decimal arithmetic.
 *
 * Numbers are {@link BigDecimal}s. The context is passed explicitly to every
 * operation; {@link #BASE} is the default used by the evaluator.
 */
public final class DecimalContext {

    public static final int BASE_PRECISION = 24;

    /** 24 significant digits, rounding half up. */
    public static final DecimalContext BASE =
            new DecimalContext(new MathContext(BASE_PRECISION, RoundingMode.HALF_UP));

    private final MathContext mathContext;

    private DecimalContext(MathContext mathContext) {
        this.mathContext = mathContext;
    }

    public static DecimalContext of(MathContext mathContext) {
        return new DecimalContext(Objects.requireNonNull(mathContext, "MathContext cannot be null"));
    }

    /**
     * Returns a context with the same rounding mode and the given precision.
     */
    public DecimalContext withPrecision(int precision) {
        if (precision <= 0) {
            throw new IllegalArgumentException("Precision must be positive: " + precision);
        }
        return new DecimalContext(new MathContext(precision, mathContext.getRoundingMode()));
    }

    public MathContext mathContext() {
        return mathContext;
    }

    public int precision() {
        return mathContext.getPrecision();
    }

    public BigDecimal round(BigDecimal x) {
        return x.round(mathContext);
    }

    public BigDecimal add(BigDecimal x, BigDecimal y) {
        return x.add(y, mathContext);
    }

    public BigDecimal subtract(BigDecimal x, BigDecimal y) {
        return x.subtract(y, mathContext);
    }

    public BigDecimal multiply(BigDecimal x, BigDecimal y) {
        return x.multiply(y, mathContext);
    }

    /**
     * @throws ArithmeticException if {@code y} is zero
     */
    public BigDecimal divide(BigDecimal x, BigDecimal y) {
        return x.divide(y, mathContext);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DecimalContext other && mathContext.equals(other.mathContext);
    }

    @Override
    public int hashCode() {
        return mathContext.hashCode();
    }

    @Override
    public String toString() {
        return "DecimalContext[" + mathContext + "]";
    }
}
