package io.droplite.server.relayer;

import io.droplite.core.Category;
import io.droplite.core.DistributionRecord;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.Batch;
import io.droplite.core.batch.BatchBuilder;
import io.droplite.storage.DistributionLedger;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finalized batches kept off-ledger so claimants can fetch their leaf index and
 * proof. The ledger only stores roots.
 */
public final class BatchArchive {
    private static final Logger log = Logger.getLogger(BatchArchive.class.getName());

    private final Map<SlotKey, Batch> batches = new ConcurrentHashMap<>();

    public void put(Batch batch) {
        batches.put(batch.slot(), batch);
    }

    public Optional<Batch> get(SlotKey slot) {
        return Optional.ofNullable(batches.get(slot));
    }

    /** The batch of (day, category) that contains the user, lowest subBatch first. */
    public Optional<Batch> batchFor(long day, Category category, String user) {
        return batches.values().stream()
                .filter(b -> b.slot().day() == day && b.slot().category() == category)
                .filter(b -> b.ticket(user).isPresent())
                .min(Comparator.comparingInt(b -> b.slot().subBatch()));
    }

    /**
     * Rebuild batches for every finalized slot from the scored rewards, as done on
     * startup. A rebuilt batch is archived only if its root equals the ledger's;
     * slots whose rewards are missing or have changed stay unarchived.
     *
     * @return number of slots archived
     */
    public int restore(DistributionLedger ledger, RewardSource source, int maxBatchSize) {
        List<DistributionRecord> finalized = ledger.records();
        // sub-batch 0 of each finalized (day, category)
        Set<SlotKey> groups = new LinkedHashSet<>();
        for (DistributionRecord r : finalized) groups.add(SlotKey.of(r.slot().day(), r.slot().category()));

        int restored = 0;
        int mismatched = 0;
        for (SlotKey group : groups) {
            long day = group.day();
            Category category = group.category();
            List<Batch> rebuilt;
            try {
                List<RewardEntry> entries = source.rewards(day, category);
                if (entries.isEmpty()) continue;
                rebuilt = BatchBuilder.split(day, category, entries, maxBatchSize);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Could not rebuild batches for " + day + "/" + category, e);
                continue;
            }
            for (Batch b : rebuilt) {
                Optional<DistributionRecord> record = ledger.get(b.slot());
                if (record.isEmpty()) continue;
                if (record.get().root().equals(b.root())) {
                    put(b);
                    restored++;
                } else {
                    mismatched++;
                }
            }
        }
        if (mismatched > 0) {
            log.warning(mismatched + " rebuilt batches did not match their finalized root; proofs unavailable for them");
        }
        log.info(String.format("Restored %d of %d finalized batches", restored, finalized.size()));
        return restored;
    }

    public int size() {
        return batches.size();
    }
}
