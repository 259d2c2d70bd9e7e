package io.droplite.storage;

import io.droplite.core.Category;
import io.droplite.core.SlotKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.droplite.storage.LedgerFixtures.*;
import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private void appendTornRecord(byte[] full) throws Exception {
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(full, 0, full.length - 5); // header says "len" but payload is short
            out.flush(); // simulate crash right here
        }
    }

    @Test
    void replay_ignores_truncated_tail_and_applies_all_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(RecordCodec.encode(new LedgerEvent.Finalized(record(100, Category.CREATE, 10), BigInteger.ONE)));
        wal.append(RecordCodec.encode(new LedgerEvent.Finalized(record(100, Category.LIKES, 20), BigInteger.TWO)));
        appendTornRecord(RecordCodec.encode(new LedgerEvent.Finalized(record(100, Category.TIPPING, 30), BigInteger.TEN)));
        wal.close();

        var ledger = open(walDir, snapDir);

        assertTrue(ledger.get(100, Category.CREATE).isPresent());
        assertTrue(ledger.get(100, Category.LIKES).isPresent());
        assertTrue(ledger.get(100, Category.TIPPING).isEmpty()); // truncated tail not applied
        assertFalse(ledger.isNonceConsumed(RELAYER, BigInteger.TEN));
    }

    @Test
    void writes_after_a_torn_tail_survive_the_next_restart() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(RecordCodec.encode(new LedgerEvent.Finalized(record(100, Category.CREATE, 10), BigInteger.ONE)));
        appendTornRecord(RecordCodec.encode(new LedgerEvent.Finalized(record(100, Category.LIKES, 20), BigInteger.TWO)));
        wal.close();

        var first = open(walDir, snapDir);
        first.finalizeDistribution(record(100, Category.CRYPTO, 40), BigInteger.valueOf(7));
        first.close();

        var second = open(walDir, snapDir);
        assertTrue(second.get(100, Category.CREATE).isPresent());
        assertTrue(second.get(100, Category.LIKES).isEmpty());
        assertTrue(second.get(100, Category.CRYPTO).isPresent(), "record appended after truncation is replayed");
    }

    @Test
    void reader_walks_every_segment_in_order() throws Exception {
        var wal = new FileWal(walDir, 1); // rotate after every record
        for (int sub = 0; sub < 4; sub++) {
            var event = new LedgerEvent.Finalized(record(new SlotKey(5, Category.COMMENTS, sub), 1), BigInteger.valueOf(sub));
            wal.append(RecordCodec.encode(event));
            wal.rotateIfNeeded();
        }
        wal.close();

        try (Wal.WalReader r = new FileWal(walDir, 1).openReader()) {
            for (int sub = 0; sub < 4; sub++) {
                var event = (LedgerEvent.Finalized) RecordCodec.decode(r.next());
                assertEquals(sub, event.record().slot().subBatch());
            }
            assertNull(r.next());
        }
    }
}
