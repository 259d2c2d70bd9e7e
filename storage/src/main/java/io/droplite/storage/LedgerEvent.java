package io.droplite.storage;

import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;

import java.math.BigInteger;

/**
 * A single committed ledger mutation as it is written to the WAL.
 * Replaying the events in order rebuilds the ledger state.
 */
public sealed interface LedgerEvent permits LedgerEvent.Finalized, LedgerEvent.Claimed {

    /** A distribution became final; the relayer's nonce is consumed with it. */
    record Finalized(DistributionRecord record, BigInteger nonce) implements LedgerEvent {}

    /** A user's reward was released. */
    record Claimed(ClaimRecord claim) implements LedgerEvent {}
}
