package io.droplite.bench;

import java.util.List;
import java.util.Random;

/**
 * Picks claimants with Zipfian skew so a few hot users hammer their claim
 * repeatedly while the tail claims once or never.
 * <p>
 * Precomputes the CDF once and samples with a binary search.
 */
public final class ZipfianUserPicker {

    private final List<String> users;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianUserPicker(List<String> users, double skew, long seed) {
        if (users.isEmpty()) throw new IllegalArgumentException("users must not be empty");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.users = List.copyOf(users);
        this.rnd = new Random(seed);

        int n = users.size();
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += 1.0 / Math.pow(i + 1, skew);
        }
        this.cdf = new double[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += (1.0 / Math.pow(i + 1, skew)) / sum;
            cdf[i] = running;
        }
    }

    /** Rank of the next claimant in [0, n); rank 0 is the hottest user. */
    public int nextRank() {
        double u = rnd.nextDouble();
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

    public String next() {
        return users.get(nextRank());
    }
}
