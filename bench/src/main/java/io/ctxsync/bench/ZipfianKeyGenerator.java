// file: bench/src/main/java/io/ctxsync/bench/ZipfianKeyGenerator.java
package io.ctxsync.bench;

import java.util.Random;
import java.util.SplittableRandom;

/**
 * Zipf-distributed context ids in [0, n): id 0 is the hottest.
 *
 * The CDF is built once and shared; each caller passes its own random source,
 * so worker threads never contend on a shared generator.
 */
public final class ZipfianKeyGenerator {

    private final double[] cdf;

    public ZipfianKeyGenerator(int n, double skew) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        double total = 0.0;
        for (int rank = 1; rank <= n; rank++) total += Math.pow(rank, -skew);

        this.cdf = new double[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += Math.pow(i + 1, -skew) / total;
            cdf[i] = running;
        }
        cdf[n - 1] = 1.0;
    }

    public int size() {
        return cdf.length;
    }

    /** Probability mass of the {@code k} hottest ids. */
    public double headMass(int k) {
        if (k <= 0) return 0.0;
        return cdf[Math.min(k, cdf.length) - 1];
    }

    public int next(SplittableRandom rnd) {
        return search(rnd.nextDouble());
    }

    public int next(Random rnd) {
        return search(rnd.nextDouble());
    }

    private int search(double u) {
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }
}
