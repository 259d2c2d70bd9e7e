package io.droplite.storage;

import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionRecord;
import io.droplite.core.SlotKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static io.droplite.storage.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Records, claims and consumed nonces must all come back after a restart,
 * whether they are recovered from the WAL alone or from a snapshot plus WAL tail.
 */
class DurableLedgerDurabilityTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    @Test
    void records_claims_and_nonces_survive_restart() throws Exception {
        var ledger1 = open(walDir, snapDir);
        DistributionRecord rec = record(100, Category.CREATE, 500);
        ledger1.finalizeDistribution(rec, BigInteger.valueOf(3));
        var reservation = ledger1.reserveClaim(rec.slot(), ALICE, BigInteger.valueOf(200));
        ClaimRecord claim = ledger1.commitClaim(reservation);
        ledger1.close();

        // "Crash": drop reference; new instance recovers from disk
        var ledger2 = open(walDir, snapDir);

        assertEquals(rec, ledger2.get(rec.slot()).orElseThrow());
        assertTrue(ledger2.isNonceConsumed(RELAYER, BigInteger.valueOf(3)));
        assertEquals(claim, ledger2.claim(100, Category.CREATE, ALICE).orElseThrow());
        assertEquals(BigInteger.valueOf(200), ledger2.claimedTotal(rec.slot()));
        assertEquals(BigInteger.valueOf(300), ledger2.unclaimed(rec.slot()));
    }

    @Test
    void snapshot_plus_wal_tail_rebuilds_the_same_state() throws Exception {
        var ledger1 = new DurableLedger(new FileWal(walDir, 256), new FileSnapshotter(snapDir), new SnapshotPolicy(3), DAY_100);
        for (int sub = 0; sub < 7; sub++) {
            ledger1.finalizeDistribution(record(new SlotKey(100, Category.REFERRALS, sub), 10), BigInteger.valueOf(sub));
        }
        var r = ledger1.reserveClaim(new SlotKey(100, Category.REFERRALS, 6), BOB, BigInteger.TEN);
        ledger1.commitClaim(r);
        ledger1.close();

        try (Stream<Path> snaps = Files.list(snapDir)) {
            assertTrue(snaps.anyMatch(p -> p.getFileName().toString().endsWith(".bin")), "policy should have snapshotted");
        }

        var ledger2 = new DurableLedger(new FileWal(walDir, 256), new FileSnapshotter(snapDir), new SnapshotPolicy(3), DAY_100);
        assertEquals(7, ledger2.records(100, Category.REFERRALS).size());
        assertEquals(BigInteger.valueOf(70), ledger2.finalizedTotal(100, Category.REFERRALS));
        assertTrue(ledger2.claim(100, Category.REFERRALS, BOB).isPresent());
        assertEquals(BigInteger.TEN, ledger2.claimedTotal(new SlotKey(100, Category.REFERRALS, 6)));
        for (int sub = 0; sub < 7; sub++) {
            assertTrue(ledger2.isNonceConsumed(RELAYER, BigInteger.valueOf(sub)));
        }
    }

    @Test
    void uncommitted_reservation_is_not_persisted() throws Exception {
        var ledger1 = open(walDir, snapDir);
        DistributionRecord rec = record(100, Category.LIKES, 50);
        ledger1.finalizeDistribution(rec, BigInteger.ONE);
        ledger1.reserveClaim(rec.slot(), ALICE, BigInteger.valueOf(50));
        ledger1.close();

        var ledger2 = open(walDir, snapDir);
        assertFalse(ledger2.isClaimed(100, Category.LIKES, ALICE));
        assertEquals(BigInteger.valueOf(50), ledger2.unclaimed(rec.slot()));
    }

    @Test
    void all_records_are_listed_in_slot_order_after_restart() throws Exception {
        var ledger1 = open(walDir, snapDir);
        DistributionRecord late = record(101, Category.CREATE, 1);
        DistributionRecord likes1 = record(new SlotKey(100, Category.LIKES, 1), 1);
        DistributionRecord likes0 = record(100, Category.LIKES, 1);
        DistributionRecord create = record(100, Category.CREATE, 1);
        ledger1.finalizeDistribution(late, BigInteger.ONE);
        ledger1.finalizeDistribution(likes1, BigInteger.TWO);
        ledger1.finalizeDistribution(likes0, BigInteger.valueOf(3));
        ledger1.finalizeDistribution(create, BigInteger.valueOf(4));
        ledger1.close();

        var ledger2 = open(walDir, snapDir);
        assertEquals(List.of(create, likes0, likes1, late), ledger2.records());
        ledger2.close();
    }
}
