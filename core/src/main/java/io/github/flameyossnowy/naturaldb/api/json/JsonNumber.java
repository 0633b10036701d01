package io.github.flameyossnowy.naturaldb.api.json;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * A JSON number.
 *
 * <p>Integer literals are held as {@link Long}, or as {@link BigInteger} when they do not fit
 * in 64 bits. Literals with a fraction or an exponent are held as {@link Double}. Equality is
 * structural, so {@code 1} and {@code 1.0} are different values; use
 * {@link #numericallyEquals(JsonNumber)} to compare by magnitude.</p>
 */
public record JsonNumber(@NotNull Number value) implements JsonValue {
    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public JsonNumber {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof Long || value instanceof BigInteger || value instanceof Double)) {
            throw new IllegalArgumentException("Unsupported number representation: " + value.getClass().getName());
        }
    }

    public static @NotNull JsonNumber of(long value) {
        return new JsonNumber(value);
    }

    public static @NotNull JsonNumber of(double value) {
        return new JsonNumber(value);
    }

    public static @NotNull JsonNumber of(@NotNull BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return new JsonNumber(value.longValue());
        }
        return new JsonNumber(value);
    }

    public boolean isIntegral() {
        return !(value instanceof Double);
    }

    public long longValue() {
        return value.longValue();
    }

    public double doubleValue() {
        return value.doubleValue();
    }

    public @NotNull BigDecimal toBigDecimal() {
        if (value instanceof Long l) {
            return BigDecimal.valueOf(l);
        }
        if (value instanceof BigInteger big) {
            return new BigDecimal(big);
        }
        return BigDecimal.valueOf(value.doubleValue());
    }

    public boolean isFinite() {
        return !(value instanceof Double d) || Double.isFinite(d);
    }

    /**
     * Compares by magnitude regardless of representation. Non-finite doubles fall back to
     * {@link Double#compare(double, double)}.
     */
    public int compareNumeric(@NotNull JsonNumber other) {
        if (value instanceof Long a && other.value instanceof Long b) {
            return Long.compare(a, b);
        }
        if (!isFinite() || !other.isFinite()) {
            return Double.compare(doubleValue(), other.doubleValue());
        }
        return toBigDecimal().compareTo(other.toBigDecimal());
    }

    public boolean numericallyEquals(@NotNull JsonNumber other) {
        return compareNumeric(other) == 0;
    }

    /**
     * Returns the integral form of this number when it has no fractional part, so that values
     * equal by magnitude share one representation.
     */
    public @NotNull JsonNumber normalized() {
        if (isIntegral() || !isFinite()) {
            return this;
        }
        double d = doubleValue();
        if (d != Math.rint(d)) {
            return this;
        }
        return of(BigDecimal.valueOf(d).toBigIntegerExact());
    }

    @Override
    public @NotNull Kind kind() {
        return Kind.NUMBER;
    }

    @Override
    public Object toJava() {
        return value;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
