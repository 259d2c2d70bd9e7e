package io.droplite.storage;

import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of finalized distributions, consumed nonces and claims.
 * <p>
 * Every write re-checks its own guard atomically, so callers that validated
 * earlier can still lose a race and see the corresponding failure here.
 */
public interface DistributionLedger extends AutoCloseable {

    Optional<DistributionRecord> get(SlotKey slot);

    /** Record for sub-batch 0 of (day, category). */
    default Optional<DistributionRecord> get(long day, Category category) {
        return get(SlotKey.of(day, category));
    }

    /** All finalized sub-batches for (day, category), ordered by subBatch. */
    List<DistributionRecord> records(long day, Category category);

    /** Every finalized record, ordered by (day, category, subBatch). */
    List<DistributionRecord> records();

    /** Sum of totalReward over every finalized sub-batch of (day, category). */
    BigInteger finalizedTotal(long day, Category category);

    /** floor(now / 86400) in UTC epoch seconds. */
    long currentDay();

    boolean isNonceConsumed(String relayer, BigInteger nonce);

    Optional<ClaimRecord> claim(long day, Category category, String user);

    /** True if the user has a committed or an in-flight claim for (day, category). */
    boolean isClaimed(long day, Category category, String user);

    BigInteger claimedTotal(SlotKey slot);

    /**
     * Amount still held for the slot: totalReward minus committed claims.
     *
     * @throws io.droplite.core.DistributionException NO_DISTRIBUTION if the slot is not finalized
     */
    BigInteger unclaimed(SlotKey slot);

    /**
     * Persist a record and consume the relayer's nonce in one WAL record.
     *
     * @param dailyCap if non-null, the finalized total of (day, category) including
     *                 this record must not exceed it
     * @throws io.droplite.core.DistributionException ALREADY_SUBMITTED, NONCE_REPLAY or CAP_EXCEEDED
     */
    void finalizeDistribution(DistributionRecord record, BigInteger nonce, BigInteger dailyCap);

    default void finalizeDistribution(DistributionRecord record, BigInteger nonce) {
        finalizeDistribution(record, nonce, null);
    }

    /**
     * Flag (day, category, user) as claimed in memory only.
     *
     * @throws io.droplite.core.DistributionException NO_DISTRIBUTION or ALREADY_CLAIMED
     */
    ClaimReservation reserveClaim(SlotKey slot, String user, BigInteger amount);

    /** Make a reservation durable. */
    ClaimRecord commitClaim(ClaimReservation reservation);

    /** Drop a reservation that will not be committed. */
    void cancelClaim(ClaimReservation reservation);
}
