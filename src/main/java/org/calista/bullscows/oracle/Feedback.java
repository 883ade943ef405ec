package org.calista.bullscows.oracle;

import org.calista.bullscows.code.Code;

/**
 * Immutable (bulls, cows) pair.
 *
 * <p>All 25 (bulls, cows) combinations with bulls + cows &lt;= 4 are valid values, including
 * (3,1) which no real pair of codes can produce. Instances are interned, so {@link #of} never
 * allocates.
 */
public final class Feedback {

    /** Size of the dense index space, see {@link #index()}. */
    public static final int INDEX_SPACE = (Code.LENGTH + 1) * (Code.LENGTH + 1);

    private static final Feedback[] CACHE = new Feedback[INDEX_SPACE];

    static {
        for (int b = 0; b <= Code.LENGTH; b++) {
            for (int c = 0; b + c <= Code.LENGTH; c++) {
                CACHE[indexOf(b, c)] = new Feedback(b, c);
            }
        }
    }

    public final int bulls;
    public final int cows;

    private Feedback(int bulls, int cows) {
        this.bulls = bulls;
        this.cows = cows;
    }

    /**
     * @throws IllegalArgumentException if either count is negative or bulls + cows &gt; 4
     */
    public static Feedback of(int bulls, int cows) {
        if (bulls < 0 || cows < 0 || bulls + cows > Code.LENGTH) {
            throw new IllegalArgumentException("invalid feedback: bulls=" + bulls + " cows=" + cows);
        }
        return CACHE[indexOf(bulls, cows)];
    }

    public static Feedback fromIndex(int index) {
        Feedback f = (index >= 0 && index < INDEX_SPACE) ? CACHE[index] : null;
        if (f == null) throw new IllegalArgumentException("invalid feedback index: " + index);
        return f;
    }

    /** Dense index {@code bulls * 5 + cows}, used for outcome histograms. */
    public int index() {
        return indexOf(bulls, cows);
    }

    public boolean isSolved() {
        return bulls == Code.LENGTH;
    }

    static int indexOf(int bulls, int cows) {
        return bulls * (Code.LENGTH + 1) + cows;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Feedback f)) return false;
        return bulls == f.bulls && cows == f.cows;
    }

    @Override
    public int hashCode() {
        return index();
    }

    @Override
    public String toString() {
        return bulls + "B" + cows + "C";
    }
}
