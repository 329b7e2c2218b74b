package org.neuralchilli.symdag.domain;

import javax.annotation.Nonnull;
import java.io.Serial;
import java.io.Serializable;
import java.util.Optional;

/**
 * Exact fraction over two longs.
 * Always normalized: the denominator is positive, numerator and denominator
 * are coprime, and zero is 0/1. Every operation returns a new value and
 * fails with {@link RationalArithmeticException} instead of wrapping on overflow.
 */
public final class Rational implements Comparable<Rational>, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_EPSILON = 1e-10;
    public static final long DEFAULT_MAX_DENOMINATOR = 1_000_000L;

    public static final Rational ZERO = new Rational(0, 1);
    public static final Rational ONE = new Rational(1, 1);

    private final long numerator;
    private final long denominator;

    private Rational(long numerator, long denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static Rational of(long value) {
        return new Rational(value, 1);
    }

    /**
     * Create a normalized rational from a numerator/denominator pair.
     *
     * @throws RationalArithmeticException if the denominator is zero, or the
     *                                     normalized value is not representable
     */
    public static Rational of(long numerator, long denominator) {
        if (denominator == 0) {
            throw RationalArithmeticException.divisionByZero();
        }
        if (numerator == 0) {
            return ZERO;
        }

        long g = gcd(numerator, denominator);
        if (g == Long.MIN_VALUE) {
            // Only when both are Long.MIN_VALUE
            return ONE;
        }
        g = Math.abs(g);

        long n = numerator / g;
        long d = denominator / g;

        if (d < 0) {
            n = negate(n, "normalization");
            d = negate(d, "normalization");
        }

        return new Rational(n, d);
    }

    /**
     * Parse "n" or "n/d", with an optional leading sign. Spaces are ignored.
     *
     * @throws NumberFormatException if the text is not a fraction
     */
    public static Rational parse(String text) {
        if (text == null) {
            throw new NumberFormatException("Rational text cannot be null");
        }

        String s = text.replace(" ", "");
        if (s.isEmpty()) {
            throw new NumberFormatException("Rational text cannot be empty");
        }

        int split = s.indexOf('/');
        String numeratorText = split < 0 ? s : s.substring(0, split);
        String denominatorText = split < 0 ? "1" : s.substring(split + 1);

        // Sign stays on the numerator so Long.MIN_VALUE parses
        boolean signed = numeratorText.startsWith("-") || numeratorText.startsWith("+");
        if (!isDigits(signed ? numeratorText.substring(1) : numeratorText) || !isDigits(denominatorText)) {
            throw new NumberFormatException("Not a rational: " + text);
        }

        long n = Long.parseLong(numeratorText);
        long d = Long.parseLong(denominatorText);

        return of(n, d);
    }

    /**
     * Best rational approximation of a double, using the default tolerance and
     * denominator bound.
     */
    public static Rational fromDouble(double value) {
        return fromDouble(value, DEFAULT_EPSILON, DEFAULT_MAX_DENOMINATOR);
    }

    /**
     * Best rational approximation of a double by Stern-Brocot search.
     * Stops at the first mediant within {@code epsilon} of the value, or returns
     * the last left bound once the mediant denominator exceeds {@code maxDenominator}.
     */
    public static Rational fromDouble(double value, double epsilon, long maxDenominator) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot approximate non-finite value: " + value);
        }
        if (!(epsilon > 0.0 && epsilon < 1.0)) {
            throw new IllegalArgumentException("Epsilon must be in (0, 1), got: " + epsilon);
        }
        if (maxDenominator < 1) {
            throw new IllegalArgumentException("Max denominator must be positive, got: " + maxDenominator);
        }

        if (value == 0.0) {
            return ZERO;
        }
        if (value < 0) {
            return fromDouble(-value, epsilon, maxDenominator).negate();
        }
        if (value >= 0x1p63) {
            throw RationalArithmeticException.overflow("approximation", null);
        }

        // The walk from 0/1 and 1/0 only visits integer mediants k/1 until it
        // brackets the value, so start directly from the bracketing integers.
        long whole = (long) Math.floor(value);
        if (Math.abs(value - whole) < epsilon && whole > 0) {
            return of(whole);
        }
        long next = add(whole, 1, "approximation");
        if (Math.abs(value - next) < epsilon) {
            return of(next);
        }

        long leftNum = whole;
        long leftDen = 1;
        long rightNum = next;
        long rightDen = 1;

        while (true) {
            long midNum = add(leftNum, rightNum, "approximation");
            long midDen = add(leftDen, rightDen, "approximation");

            long g = gcd(midNum, midDen);
            midNum /= g;
            midDen /= g;

            if (midDen > maxDenominator) {
                break;
            }

            double midValue = (double) midNum / midDen;

            if (Math.abs(value - midValue) < epsilon) {
                return of(midNum, midDen);
            }

            if (value < midValue) {
                rightNum = midNum;
                rightDen = midDen;
            } else {
                leftNum = midNum;
                leftDen = midDen;
            }
        }

        return of(leftNum, leftDen);
    }

    // a/b + c/d = (ad + bc)/bd
    public Rational add(Rational other) {
        long ad = multiply(numerator, other.denominator, "addition");
        long bc = multiply(denominator, other.numerator, "addition");
        long bd = multiply(denominator, other.denominator, "addition");
        return of(add(ad, bc, "addition"), bd);
    }

    // a/b - c/d = (ad - bc)/bd
    public Rational subtract(Rational other) {
        long ad = multiply(numerator, other.denominator, "subtraction");
        long bc = multiply(denominator, other.numerator, "subtraction");
        long bd = multiply(denominator, other.denominator, "subtraction");
        return of(subtract(ad, bc, "subtraction"), bd);
    }

    public Rational multiply(Rational other) {
        long ac = multiply(numerator, other.numerator, "multiplication");
        long bd = multiply(denominator, other.denominator, "multiplication");
        return of(ac, bd);
    }

    // a/b / c/d = ad/bc
    public Rational divide(Rational other) {
        if (other.isZero()) {
            throw RationalArithmeticException.divisionByZero();
        }
        long ad = multiply(numerator, other.denominator, "division");
        long bc = multiply(denominator, other.numerator, "division");
        return of(ad, bc);
    }

    public Rational negate() {
        return new Rational(negate(numerator, "negation"), denominator);
    }

    public Rational abs() {
        return numerator < 0 ? negate() : this;
    }

    /**
     * Exact integer power. A negative exponent inverts the base first.
     */
    public Rational pow(long exponent) {
        if (exponent < 0) {
            if (isZero()) {
                throw RationalArithmeticException.divisionByZero();
            }
            return ONE.divide(this).pow(negate(exponent, "power"));
        }

        long n = 1;
        long d = 1;
        long baseNum = numerator;
        long baseDen = denominator;
        long e = exponent;

        while (e > 0) {
            if ((e & 1) == 1) {
                n = multiply(n, baseNum, "power");
                d = multiply(d, baseDen, "power");
            }
            e >>= 1;
            if (e > 0) {
                baseNum = multiply(baseNum, baseNum, "power");
                baseDen = multiply(baseDen, baseDen, "power");
            }
        }

        return of(n, d);
    }

    /**
     * Square root, present only when both numerator and denominator are perfect squares.
     */
    public Optional<Rational> sqrtExact() {
        if (numerator < 0) {
            return Optional.empty();
        }
        long n = exactSquareRoot(numerator);
        long d = exactSquareRoot(denominator);
        if (n < 0 || d < 0) {
            return Optional.empty();
        }
        return Optional.of(of(n, d));
    }

    @Override
    public int compareTo(Rational other) {
        long ad = multiply(numerator, other.denominator, "comparison");
        long bc = multiply(denominator, other.numerator, "comparison");
        return Long.compare(ad, bc);
    }

    public boolean isLessThan(Rational other) {
        return compareTo(other) < 0;
    }

    public boolean isLessThanOrEqualTo(Rational other) {
        return compareTo(other) <= 0;
    }

    public boolean isGreaterThan(Rational other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqualTo(Rational other) {
        return compareTo(other) >= 0;
    }

    public long numerator() {
        return numerator;
    }

    public long denominator() {
        return denominator;
    }

    public double doubleValue() {
        return (double) numerator / denominator;
    }

    /**
     * Integer part, truncated toward zero.
     */
    public long longValue() {
        return numerator / denominator;
    }

    public boolean isInteger() {
        return denominator == 1;
    }

    public boolean isZero() {
        return numerator == 0;
    }

    public int signum() {
        return Long.signum(numerator);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        // Both sides are normalized, so component equality is value equality
        Rational that = (Rational) obj;
        return numerator == that.numerator && denominator == that.denominator;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(numerator) + Long.hashCode(denominator);
    }

    @Nonnull
    @Override
    public String toString() {
        if (denominator == 1) {
            return Long.toString(numerator);
        }
        return numerator + "/" + denominator;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // -1 when value is not a perfect square
    private static long exactSquareRoot(long value) {
        long root = (long) Math.sqrt((double) value);
        for (long candidate = Math.max(0, root - 1); candidate <= root + 1; candidate++) {
            if (candidate <= 3_037_000_499L && candidate * candidate == value) {
                return candidate;
            }
        }
        return -1;
    }

    private static long multiply(long a, long b, String operation) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw RationalArithmeticException.overflow(operation, e);
        }
    }

    private static long add(long a, long b, String operation) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw RationalArithmeticException.overflow(operation, e);
        }
    }

    private static long subtract(long a, long b, String operation) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw RationalArithmeticException.overflow(operation, e);
        }
    }

    private static long negate(long a, String operation) {
        try {
            return Math.negateExact(a);
        } catch (ArithmeticException e) {
            throw RationalArithmeticException.overflow(operation, e);
        }
    }
}
