package io.droplite.storage;

import java.util.List;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is the compacted ledger state (one event per finalized slot and per
 * claim) together with the number of WAL records it already covers. On restart:
 *  - we load the latest snapshot, then
 *  - replay only the WAL records written after that position.
 */
public interface Snapshotter {

    /**
     * Persist the compacted state.
     *
     * @param state       events that rebuild the current ledger when applied in order
     * @param walPosition number of WAL records reflected in {@code state}
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(List<LedgerEvent> state, long walPosition);

    /** Load the latest snapshot if present, otherwise null. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id and its data */
    record LoadedSnapshot(String id, List<LedgerEvent> events, long walPosition) {}
}
