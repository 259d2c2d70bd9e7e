package io.droplite.core;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Audit entry for a redeemed leaf. Keyed by (day, category, user); never removed.
 */
public record ClaimRecord(SlotKey slot, String user, BigInteger amount, long claimedAt) {

    public ClaimRecord {
        Objects.requireNonNull(slot, "slot");
        Objects.requireNonNull(amount, "amount");
        user = Addresses.normalize(user);
    }
}
