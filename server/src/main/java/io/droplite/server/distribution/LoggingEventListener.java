package io.droplite.server.distribution;

import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;

import java.util.logging.Logger;

/**
 * Writes one log line per finalized distribution and per claim.
 */
public final class LoggingEventListener implements DistributionEventListener {
    private static final Logger log = Logger.getLogger(LoggingEventListener.class.getName());

    @Override
    public void onFinalized(DistributionRecord r) {
        log.info(String.format("DistributionFinalized slot=%s root=%s users=%d total=%s relayer=%s",
                r.slot(), r.root().toHex(), r.userCount(), r.totalReward(), r.relayer()));
    }

    @Override
    public void onClaimed(ClaimRecord c) {
        log.info(String.format("RewardClaimed slot=%s user=%s amount=%s", c.slot(), c.user(), c.amount()));
    }
}
