package org.calista.bullscows.engine;

import java.util.Objects;

/**
 * Small immutable scored wrapper.
 * Comparable uses descending score order; ties go to the lower ordinal (earlier pool position).
 */
public final class Scored<T> implements Comparable<Scored<T>> {
    public final T item;
    public final double score;
    public final int ordinal;

    public Scored(T item, double score, int ordinal) {
        this.item = item;
        this.score = score;
        this.ordinal = ordinal;
    }

    public static <T> Scored<T> of(T item, double score, int ordinal) {
        return new Scored<>(item, score, ordinal);
    }

    @Override
    public int compareTo(Scored<T> o) {
        int c = Double.compare(o.score, this.score);
        if (c != 0) return c;
        return Integer.compare(this.ordinal, o.ordinal);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?> s)) return false;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score)
                && ordinal == s.ordinal
                && Objects.equals(item, s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score), ordinal);
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", item=" + item + ", ordinal=" + ordinal + '}';
    }
}
