package io.droplite.server.claim;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A claimant's proof of one leaf: (caller, points, rewardAmount) at index in the
 * tree of (day, category, subBatch).
 */
public record ClaimRequest(
        long day,
        Category category,
        int subBatch,
        long points,
        BigInteger rewardAmount,
        long index,
        List<Bytes32> proof
) {
    public ClaimRequest {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(rewardAmount, "rewardAmount");
        proof = proof == null ? List.of() : List.copyOf(proof);
    }

    public SlotKey slot() {
        return new SlotKey(day, category, subBatch);
    }
}
