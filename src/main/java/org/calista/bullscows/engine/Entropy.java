package org.calista.bullscows.engine;

/**
 * Shannon entropy helpers, in bits.
 */
public final class Entropy {

    private static final double LN2 = Math.log(2.0);

    private Entropy() {}

    public static double log2(double x) {
        return Math.log(x) / LN2;
    }

    /**
     * Entropy of a uniform distribution over {@code n} outcomes.
     *
     * @throws IllegalArgumentException if n &lt; 1
     */
    public static double uniformBits(int n) {
        if (n < 1) throw new IllegalArgumentException("n must be >= 1: " + n);
        return (n == 1) ? 0.0 : log2(n);
    }

    /**
     * {@code -sum(p * log2 p)} with {@code p = counts[i] / total}; zero buckets are skipped.
     * Buckets are summed in index order, so equal histograms give bit-identical results.
     */
    public static double ofHistogram(int[] counts, int total) {
        if (total <= 0) return 0.0;
        double h = 0.0;
        for (int c : counts) {
            if (c <= 0) continue;
            if (c == total) return 0.0;
            double p = (double) c / total;
            h -= p * log2(p);
        }
        return h;
    }
}
