package io.droplite.storage;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Bounds worst-case recovery time by limiting WAL replay length.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /**
     * Call after each successful durable write. Snapshots when threshold is hit.
     * The state is only materialized when a snapshot is actually taken.
     */
    public boolean maybeSnapshot(Supplier<List<LedgerEvent>> state, long walPosition, Snapshotter snaps) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            snaps.writeSnapshot(state.get(), walPosition);
            sinceLast.set(0);
            return true;
        }
        return false;
    }
}
