package io.droplite.server.relayer;

import io.droplite.core.Category;
import io.droplite.core.DistributionRecord;
import io.droplite.core.Failure;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.Batch;
import io.droplite.server.DistributionFixture;
import io.droplite.server.distribution.DistributionEventListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.droplite.server.DistributionFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class BatchSubmitterTest {

    @TempDir Path dir;
    private DistributionFixture fx;

    @AfterEach
    void close() throws Exception {
        if (fx != null) fx.close();
    }

    private static List<RewardEntry> users(int n, BigInteger each) {
        List<RewardEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new RewardEntry("0x" + String.format("%040x", i + 1), i + 1, each));
        }
        return out;
    }

    private BatchSubmitter submitter(RewardSource source) {
        return new BatchSubmitter(source, fx.validator, fx.ledger, fx.signer, fx.archive, CLOCK, Duration.ofMinutes(10));
    }

    @Test
    void splits_signs_finalizes_and_archives_every_sub_batch() {
        fx = new DistributionFixture(dir, c -> c.withMaxBatchSize(3));
        List<RewardEntry> entries = users(7, BigInteger.TEN);
        var report = submitter((day, cat) -> entries).submitDay(100, Category.LIKES);

        assertFalse(report.inFlight());
        assertEquals(3, report.outcomes().size());
        assertEquals(3, report.finalizedCount());
        assertEquals(3, fx.ledger.records(100, Category.LIKES).size());
        assertEquals(BigInteger.valueOf(70), fx.ledger.finalizedTotal(100, Category.LIKES));
        assertEquals(3, fx.archive.size());

        // the seventh user lands alone in sub-batch 2
        Batch last = fx.archive.batchFor(100, Category.LIKES, entries.get(6).user()).orElseThrow();
        assertEquals(2, last.slot().subBatch());
        assertEquals(1, last.size());
        assertEquals(fx.ledger.get(last.slot()).orElseThrow().root(), last.root());
    }

    @Test
    void empty_source_submits_nothing() {
        fx = new DistributionFixture(dir);
        var report = submitter((day, cat) -> List.of()).submitDay(100, Category.CREATE);
        assertTrue(report.outcomes().isEmpty());
        assertTrue(fx.ledger.get(100, Category.CREATE).isEmpty());
    }

    @Test
    void cap_breach_stops_the_run_at_the_offending_sub_batch() {
        // CREATE cap is 1.49 tokens; two entries of 0.5 per sub-batch
        fx = new DistributionFixture(dir, c -> c.withMaxBatchSize(2));
        var report = submitter((day, cat) -> users(6, HALF_TOKEN)).submitDay(100, Category.CREATE);

        assertEquals(2, report.outcomes().size(), "third sub-batch is never attempted");
        assertTrue(report.outcomes().get(0).finalized());
        assertEquals(Failure.CAP_EXCEEDED, report.outcomes().get(1).failure());
        assertTrue(fx.ledger.get(new SlotKey(100, Category.CREATE, 1)).isEmpty());
        assertEquals(1, fx.archive.size());
    }

    @Test
    void rerun_reports_already_submitted_and_keeps_the_first_root() {
        fx = new DistributionFixture(dir);
        List<RewardEntry> first = users(2, BigInteger.ONE);
        assertEquals(1, submitter((day, cat) -> first).submitDay(100, Category.COMMENTS).finalizedCount());
        var root = fx.ledger.get(100, Category.COMMENTS).orElseThrow().root();

        var again = submitter((day, cat) -> users(3, BigInteger.TWO)).submitDay(100, Category.COMMENTS);
        assertEquals(0, again.finalizedCount());
        assertEquals(Failure.ALREADY_SUBMITTED, again.outcomes().get(0).failure());
        assertEquals(root, fx.ledger.get(100, Category.COMMENTS).orElseThrow().root());
    }

    @Test
    void racing_relayers_finalize_each_slot_once() throws Exception {
        fx = new DistributionFixture(dir);
        int racers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<BatchSubmitter.Report>> futures = new ArrayList<>();
            for (int i = 0; i < racers; i++) {
                // separate submitters model separate relayer processes
                BatchSubmitter s = submitter((day, cat) -> users(4, BigInteger.TEN));
                futures.add(pool.submit(() -> {
                    go.await();
                    return s.submitDay(100, Category.CRYPTO);
                }));
            }
            go.countDown();

            long finalized = 0;
            for (Future<BatchSubmitter.Report> f : futures) {
                BatchSubmitter.Report r = f.get(10, TimeUnit.SECONDS);
                finalized += r.finalizedCount();
                for (var o : r.outcomes()) {
                    assertTrue(o.finalized() || o.failure() == Failure.ALREADY_SUBMITTED, o.toString());
                }
            }
            assertEquals(1, finalized);
            assertEquals(1, fx.ledger.records(100, Category.CRYPTO).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void second_run_for_the_same_day_and_category_is_skipped_while_in_flight() throws Exception {
        fx = new DistributionFixture(dir);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RewardSource slow = (day, cat) -> {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return users(1, BigInteger.ONE);
        };
        BatchSubmitter s = submitter(slow);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<BatchSubmitter.Report> first = pool.submit(() -> s.submitDay(100, Category.REFERRALS));
            assertTrue(entered.await(10, TimeUnit.SECONDS));

            var skipped = s.submitDay(100, Category.REFERRALS);
            assertTrue(skipped.inFlight());
            assertTrue(skipped.outcomes().isEmpty());

            release.countDown();
            assertEquals(1, first.get(10, TimeUnit.SECONDS).finalizedCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void scheduler_reports_finalized_categories_without_resubmitting() {
        fx = new DistributionFixture(dir);
        Map<Category, List<RewardEntry>> rows = new EnumMap<>(Category.class);
        rows.put(Category.CREATE, users(2, BigInteger.ONE));
        rows.put(Category.TIPPING, users(3, BigInteger.ONE));
        BatchSubmitter s = submitter((day, cat) -> rows.getOrDefault(cat, List.of()));
        s.submitDay(100, Category.CREATE);
        var createRoot = fx.ledger.get(100, Category.CREATE).orElseThrow().root();

        var scheduler = new DailyDistributionScheduler(fx.ledger, s, Duration.ofHours(1));
        List<BatchSubmitter.Report> reports = scheduler.runOnce(100);

        assertEquals(Category.count(), reports.size());
        var create = reports.stream().filter(r -> r.category() == Category.CREATE).findFirst().orElseThrow();
        assertEquals(0, create.finalizedCount());
        assertEquals(Failure.ALREADY_SUBMITTED, create.outcomes().get(0).failure());
        assertEquals(createRoot, fx.ledger.get(100, Category.CREATE).orElseThrow().root());

        var tipping = reports.stream().filter(r -> r.category() == Category.TIPPING).findFirst().orElseThrow();
        assertEquals(1, tipping.finalizedCount());
        assertEquals(1, fx.ledger.records(100, Category.TIPPING).size());
    }

    @Test
    void scheduler_retries_a_sub_batch_that_failed_after_the_first_one_finalized() {
        fx = new DistributionFixture(dir, c -> c.withMaxBatchSize(1));
        String relayer = fx.signer.address();
        fx.validator.addListener(new DistributionEventListener() {
            @Override
            public void onFinalized(DistributionRecord record) {
                if (record.slot().subBatch() == 0) fx.auth.revoke(relayer);
            }
        });
        BatchSubmitter s = submitter((day, cat) -> cat == Category.CREATE ? users(2, BigInteger.ONE) : List.of());
        var scheduler = new DailyDistributionScheduler(fx.ledger, s, Duration.ofHours(1));

        var first = scheduler.runOnce(100).stream()
                .filter(r -> r.category() == Category.CREATE).findFirst().orElseThrow();
        assertTrue(first.outcomes().get(0).finalized());
        assertEquals(Failure.UNAUTHORIZED, first.outcomes().get(1).failure());
        assertTrue(fx.ledger.get(new SlotKey(100, Category.CREATE, 1)).isEmpty());

        fx.auth.grant(relayer);
        var second = scheduler.runOnce(100).stream()
                .filter(r -> r.category() == Category.CREATE).findFirst().orElseThrow();
        assertEquals(Failure.ALREADY_SUBMITTED, second.outcomes().get(0).failure());
        assertTrue(second.outcomes().get(1).finalized());
        assertEquals(2, fx.ledger.records(100, Category.CREATE).size());
        assertEquals(2, fx.archive.size());
    }

    @Test
    void archive_is_rebuilt_from_rewards_after_restart() throws Exception {
        fx = new DistributionFixture(dir, c -> c.withMaxBatchSize(2));
        List<RewardEntry> create = users(5, BigInteger.TEN);
        List<RewardEntry> likes = users(1, BigInteger.ONE);
        Map<Category, List<RewardEntry>> rows = new EnumMap<>(Category.class);
        rows.put(Category.CREATE, create);
        rows.put(Category.LIKES, likes);
        RewardSource source = (day, cat) -> rows.getOrDefault(cat, List.of());
        submitter(source).submitDay(100, Category.CREATE);
        submitter(source).submitDay(100, Category.LIKES);
        Batch before = fx.archive.batchFor(100, Category.CREATE, create.get(4).user()).orElseThrow();
        fx.close();

        fx = new DistributionFixture(dir, c -> c.withMaxBatchSize(2));
        assertEquals(0, fx.archive.size());

        // LIKES rewards changed after finalizing: its rebuilt root no longer matches
        rows.put(Category.LIKES, users(1, BigInteger.TWO));
        assertEquals(3, fx.archive.restore(fx.ledger, source, fx.config.maxBatchSize()));

        Batch after = fx.archive.batchFor(100, Category.CREATE, create.get(4).user()).orElseThrow();
        assertEquals(before.slot(), after.slot());
        assertEquals(before.root(), after.root());
        assertEquals(before.ticket(create.get(4).user()), after.ticket(create.get(4).user()));
        assertTrue(fx.archive.batchFor(100, Category.LIKES, likes.get(0).user()).isEmpty());
    }

    @Test
    void json_reward_source_reads_day_category_files() throws Exception {
        Path rewards = dir.resolve("rewards");
        Files.createDirectories(rewards.resolve("100"));
        Files.writeString(rewards.resolve("100").resolve("TIPPING.json"),
                "[{\"user\":\"0xAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA\",\"points\":10,\"reward\":\"500000000000000000\"},"
                        + "{\"user\":\"" + BOB + "\",\"points\":3,\"reward\":\"7\"}]");

        var source = new JsonFileRewardSource(rewards);
        List<RewardEntry> rows = source.rewards(100, Category.TIPPING);

        assertEquals(List.of(new RewardEntry(ALICE, 10, HALF_TOKEN), new RewardEntry(BOB, 3, BigInteger.valueOf(7))), rows);
        assertTrue(source.rewards(100, Category.LIKES).isEmpty());
        assertTrue(source.rewards(101, Category.TIPPING).isEmpty());
    }
}
