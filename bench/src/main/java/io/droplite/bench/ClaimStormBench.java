package io.droplite.bench;

import io.droplite.core.Category;
import io.droplite.core.DistributionException;
import io.droplite.core.Failure;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.Batch;
import io.droplite.core.batch.ClaimTicket;
import io.droplite.server.claim.ClaimProcessor;
import io.droplite.server.claim.ClaimRequest;
import io.droplite.server.claim.EscrowValueTransfer;
import io.droplite.server.distribution.DistributionConfig;
import io.droplite.server.distribution.StaticRelayerAuthorization;
import io.droplite.server.distribution.SubmissionValidator;
import io.droplite.server.relayer.BatchArchive;
import io.droplite.server.relayer.BatchSubmitter;
import io.droplite.server.signing.TypedDataSigner;
import io.droplite.storage.DurableLedger;
import io.droplite.storage.FileSnapshotter;
import io.droplite.storage.FileWal;
import io.droplite.storage.SnapshotPolicy;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

/**
 * In-process load driver for one day's distribution.
 * <p>
 * Builds rewards for many users, lets the relayer split and finalize them, then
 * has many threads claim concurrently with Zipfian skew, so hot users retry
 * claims they already redeemed. At the end every user's payout is compared
 * with their reward; any excess is a double spend.
 *
 * Usage:
 *   java -cp bench.jar io.droplite.bench.ClaimStormBench \
 *     --users 20000 \
 *     --batch-size 500 \
 *     --threads 8 \
 *     --attempts 5000 \
 *     --zipf-skew 0.99 \
 *     --dir ./bench-data
 *
 * Output:
 *   - Summary line to stderr.
 *   - CSV to stdout with per-claim latency samples:
 *       outcome,latency_ms
 */
public final class ClaimStormBench {

    /** Throwaway relayer key used only by this driver. */
    static final String BENCH_RELAYER_KEY = "0x8f2a55949038a9610f50fb23b5883af3b4ecb3c3bb792cbcefbd1542c692be63";
    static final Category CATEGORY = Category.CRYPTO;

    public record Options(int users, int batchSize, int threads, int attemptsPerThread, double zipfSkew, Path dir) {
        public Options {
            if (users <= 0) throw new IllegalArgumentException("users must be > 0");
            if (batchSize <= 0) throw new IllegalArgumentException("batch-size must be > 0");
            if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
            if (attemptsPerThread <= 0) throw new IllegalArgumentException("attempts must be > 0");
        }
    }

    public record Sample(String outcome, double latencyMs) {}

    /**
     * @param doubleSpends users paid more than their reward (must be 0)
     * @param overReleased released value beyond what the ledger recorded as claimed (must be 0)
     */
    public record Result(
            int batches,
            long claimed,
            long alreadyClaimed,
            long failed,
            long doubleSpends,
            BigInteger overReleased,
            double seconds,
            List<Sample> samples
    ) {}

    private ClaimStormBench() {}

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        Options opts = new Options(
                Integer.parseInt(cfg.getOrDefault("users", "20000")),
                Integer.parseInt(cfg.getOrDefault("batch-size", "500")),
                Integer.parseInt(cfg.getOrDefault("threads", "8")),
                Integer.parseInt(cfg.getOrDefault("attempts", "5000")),
                Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99")),
                cfg.containsKey("dir") ? Path.of(cfg.get("dir")) : Files.createTempDirectory("droplite-bench")
        );

        Result r = run(opts);
        summarizeAndPrint(r);
        if (r.doubleSpends() != 0 || r.overReleased().signum() != 0) {
            System.exit(2);
        }
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    public static Result run(Options opts) throws Exception {
        Clock clock = Clock.systemUTC();
        DistributionConfig base = DistributionConfig.defaults();
        TypedDataSigner signer = TypedDataSigner.fromPrivateKey(BENCH_RELAYER_KEY, base.domain());
        DistributionConfig policy = base
                .withMaxBatchSize(opts.batchSize())
                .withRelayers(List.of(signer.address()));

        // Spread the category's daily cap evenly; remainder stays unallocated.
        BigInteger each = policy.dailyCap(CATEGORY).divide(BigInteger.valueOf(opts.users()));
        if (each.signum() == 0) throw new IllegalArgumentException("too many users for the daily cap");

        List<RewardEntry> entries = new ArrayList<>(opts.users());
        for (int i = 0; i < opts.users(); i++) {
            entries.add(new RewardEntry(String.format("0x%040x", i + 1), i % 97, each));
        }
        BigInteger total = each.multiply(BigInteger.valueOf(opts.users()));

        try (var ledger = new DurableLedger(
                new FileWal(opts.dir().resolve("wal"), policy.walRotateBytes()),
                new FileSnapshotter(opts.dir().resolve("snap")),
                new SnapshotPolicy(policy.snapshotEveryOps()),
                clock)) {

            var validator = new SubmissionValidator(ledger, new StaticRelayerAuthorization(policy.relayers()), policy, clock);
            var escrow = new EscrowValueTransfer(total);
            var claims = new ClaimProcessor(ledger, escrow);
            var archive = new BatchArchive();
            var submitter = new BatchSubmitter((day, category) -> entries, validator, ledger, signer, archive,
                    clock, Duration.ofMinutes(10));

            long day = ledger.currentDay();
            BatchSubmitter.Report report = submitter.submitDay(day, CATEGORY);
            if (report.finalizedCount() == 0) {
                throw new IllegalStateException("no sub-batch finalized: " + report.outcomes());
            }

            List<String> users = entries.stream().map(RewardEntry::user).toList();
            ZipfianUserPicker picker = new ZipfianUserPicker(users, opts.zipfSkew(), 42L);

            ExecutorService exec = Executors.newFixedThreadPool(opts.threads());
            BlockingQueue<Sample> samples = new LinkedBlockingQueue<>();
            long start = System.nanoTime();

            Runnable worker = () -> {
                for (int i = 0; i < opts.attemptsPerThread(); i++) {
                    String user = picker.next();
                    Batch batch = archive.batchFor(day, CATEGORY, user).orElse(null);
                    if (batch == null) {
                        samples.add(new Sample("UNARCHIVED", 0.0));
                        continue;
                    }
                    ClaimTicket t = batch.ticket(user).orElseThrow();
                    SlotKey slot = batch.slot();
                    var req = new ClaimRequest(day, CATEGORY, slot.subBatch(), t.points(), t.reward(), t.index(), t.proof());

                    long s = System.nanoTime();
                    String outcome;
                    try {
                        claims.claim(req, user);
                        outcome = "OK";
                    } catch (DistributionException e) {
                        outcome = e.failure().name();
                    } catch (RuntimeException e) {
                        outcome = "ERROR";
                    }
                    samples.add(new Sample(outcome, (System.nanoTime() - s) / 1_000_000.0));
                }
            };

            for (int i = 0; i < opts.threads(); i++) {
                exec.submit(worker);
            }
            exec.shutdown();
            if (!exec.awaitTermination(10, TimeUnit.MINUTES)) {
                exec.shutdownNow();
                throw new IllegalStateException("claim workers did not finish");
            }
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;

            List<Sample> all = new ArrayList<>(samples.size());
            samples.drainTo(all);

            long doubleSpends = users.stream()
                    .filter(u -> escrow.releasedTo(u).compareTo(each) > 0)
                    .count();
            BigInteger claimedOnLedger = BigInteger.ZERO;
            for (var outcome : report.outcomes()) {
                if (outcome.finalized()) claimedOnLedger = claimedOnLedger.add(ledger.claimedTotal(outcome.slot()));
            }
            BigInteger released = total.subtract(escrow.pool());

            long ok = all.stream().filter(x -> x.outcome().equals("OK")).count();
            long dup = all.stream().filter(x -> x.outcome().equals(Failure.ALREADY_CLAIMED.name())).count();
            return new Result(
                    (int) report.finalizedCount(),
                    ok,
                    dup,
                    all.size() - ok - dup,
                    doubleSpends,
                    released.subtract(claimedOnLedger),
                    seconds,
                    all
            );
        }
    }

    private static void summarizeAndPrint(Result r) {
        List<Double> latencies = new ArrayList<>(r.samples().size());
        for (Sample s : r.samples()) {
            if (!s.outcome().equals("UNARCHIVED")) latencies.add(s.latencyMs());
        }
        Collections.sort(latencies);

        System.err.printf(
                "batches=%d, claims/s=%.2f, ok=%d, already_claimed=%d, failed=%d, double_spends=%d, "
                        + "over_released=%s, p50=%.2fms, p95=%.2fms, p99=%.2fms%n",
                r.batches(), r.samples().size() / r.seconds(), r.claimed(), r.alreadyClaimed(), r.failed(),
                r.doubleSpends(), r.overReleased(),
                percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99)
        );

        System.out.println("outcome,latency_ms");
        for (Sample s : r.samples()) {
            System.out.printf("%s,%.3f%n", s.outcome(), s.latencyMs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
