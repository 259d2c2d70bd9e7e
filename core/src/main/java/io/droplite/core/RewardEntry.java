package io.droplite.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * One user's entry in a batch.
 * <p>
 *  - user:   EVM address, normalized to lowercase 0x form.
 *  - points: interaction score supplied by the scorer (not validated here).
 *  - reward: token amount in wei (18-decimal fixed point).
 */
public record RewardEntry(String user, long points, BigInteger reward) {

    public RewardEntry {
        user = Addresses.normalize(user);
        Objects.requireNonNull(reward, "reward");
        if (points < 0) throw new IllegalArgumentException("points must be >= 0");
        if (reward.signum() < 0) throw new IllegalArgumentException("reward must be >= 0");
        if (reward.bitLength() > 256) throw new IllegalArgumentException("reward exceeds uint256");
    }
}
