package io.droplite.server.distribution;

import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;

/**
 * Observer for committed ledger changes. Called after the change is durable,
 * on the thread that made it; implementations must not throw.
 */
public interface DistributionEventListener {

    default void onFinalized(DistributionRecord record) {}

    default void onClaimed(ClaimRecord claim) {}
}
