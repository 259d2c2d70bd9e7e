package io.droplite.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Finalized commitment for one slot.
 * <p>
 * Invariants:
 *  - Written at most once per slot and never modified afterwards.
 *  - totalReward is the sum of the amounts the root commits to.
 *  - createdAt is epoch seconds at admission time.
 */
public record DistributionRecord(
        SlotKey slot,
        Bytes32 root,
        int userCount,
        BigInteger totalReward,
        boolean finalized,
        long createdAt,
        String relayer
) {
    public DistributionRecord {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(totalReward, "totalReward");
        relayer = Addresses.normalize(relayer);
        if (userCount <= 0) throw new IllegalArgumentException("userCount must be > 0");
        if (totalReward.signum() < 0) throw new IllegalArgumentException("totalReward must be >= 0");
    }
}
