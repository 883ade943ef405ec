package org.calista.bullscows.code;

import java.util.Arrays;

/**
 * Code: immutable 4-digit number with pairwise distinct digits (0..9).
 *
 * <p>Used both as the secret and as a guess/candidate. Besides the digits the instance keeps a
 * 10-bit digit mask, so digit-set intersections are a single {@code Integer.bitCount}.
 *
 * <p>Natural order is lexicographic by digit sequence (0123 &lt; 0124 &lt; ... &lt; 9876).
 */
public final class Code implements Comparable<Code> {

    public static final int LENGTH = 4;

    private final int[] digits;
    private final int mask;
    private final int value;

    private Code(int[] digits, int mask) {
        this.digits = digits;
        this.mask = mask;
        int v = 0;
        for (int d : digits) v = v * 10 + d;
        this.value = v;
    }

    /**
     * Builds a code from four digits.
     *
     * @throws InvalidNumberException if the digits are not 4 distinct values in [0,9]
     */
    public static Code of(int... digits) {
        if (digits == null) throw new InvalidNumberException("digits are null");
        if (digits.length != LENGTH) {
            throw new InvalidNumberException("expected " + LENGTH + " digits, got " + digits.length);
        }

        int mask = 0;
        for (int d : digits) {
            if (d < 0 || d > 9) throw new InvalidNumberException("digit out of range: " + d);
            int bit = 1 << d;
            if ((mask & bit) != 0) throw new InvalidNumberException("repeated digit: " + d);
            mask |= bit;
        }
        return new Code(digits.clone(), mask);
    }

    /**
     * Parses text like {@code "0123"}. Surrounding whitespace is ignored.
     *
     * @throws InvalidNumberException if the text is not 4 distinct decimal digits
     */
    public static Code parse(String text) {
        if (text == null) throw new InvalidNumberException("input is null");
        String s = text.trim();
        if (s.length() != LENGTH) {
            throw new InvalidNumberException("expected " + LENGTH + " digits: '" + s + "'");
        }

        int[] ds = new int[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') throw new InvalidNumberException("not a digit '" + c + "' in '" + s + "'");
            ds[i] = c - '0';
        }
        return of(ds);
    }

    public int digitAt(int position) {
        return digits[position];
    }

    public int[] digits() {
        return digits.clone();
    }

    /** Bit i is set iff digit i occurs in this code. */
    public int digitMask() {
        return mask;
    }

    public boolean containsDigit(int digit) {
        return digit >= 0 && digit <= 9 && (mask & (1 << digit)) != 0;
    }

    @Override
    public int compareTo(Code o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Code c)) return false;
        return value == c.value && Arrays.equals(digits, c.digits);
    }

    @Override
    public int hashCode() {
        return value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int d : digits) sb.append((char) ('0' + d));
        return sb.toString();
    }
}
