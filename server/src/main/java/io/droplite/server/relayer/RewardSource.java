package io.droplite.server.relayer;

import io.droplite.core.Category;
import io.droplite.core.RewardEntry;

import java.util.List;

/**
 * Supplies the scored rewards for one (day, category).
 * Order matters: it fixes leaf indices and therefore the root.
 */
public interface RewardSource {

    List<RewardEntry> rewards(long day, Category category);
}
