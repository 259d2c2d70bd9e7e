package io.droplite.storage;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.DistributionRecord;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/** Shared builders for ledger tests. */
final class LedgerFixtures {
    static final String RELAYER = "0x" + "1".repeat(40);
    static final String ALICE = "0x" + "a".repeat(40);
    static final String BOB = "0x" + "b".repeat(40);
    static final Clock DAY_100 = Clock.fixed(Instant.ofEpochSecond(100 * SlotKey.SECONDS_PER_DAY + 42), ZoneOffset.UTC);

    private LedgerFixtures() {}

    static DistributionRecord record(SlotKey slot, long total) {
        byte[] root = new byte[32];
        root[0] = (byte) slot.category().code();
        root[1] = (byte) slot.subBatch();
        root[31] = (byte) slot.day();
        return new DistributionRecord(slot, Bytes32.wrap(root), 2, BigInteger.valueOf(total), true, 8_640_042L, RELAYER);
    }

    static DistributionRecord record(long day, Category category, long total) {
        return record(SlotKey.of(day, category), total);
    }

    static DurableLedger open(Path walDir, Path snapDir) {
        return new DurableLedger(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), DAY_100);
    }
}
