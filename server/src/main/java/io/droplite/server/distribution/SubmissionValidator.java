package io.droplite.server.distribution;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.DistributionException;
import io.droplite.core.DistributionRecord;
import io.droplite.core.Failure;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.BatchBuilder;
import io.droplite.server.signing.SignatureVerifier;
import io.droplite.server.signing.SubmissionDigest;
import io.droplite.storage.DistributionLedger;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Admits relayer submissions and finalizes slots.
 * <p>
 * Each slot moves Empty -> Finalized exactly once. Checks run in a fixed order and
 * the first failing check decides the error:
 * <ol start="0">
 *   <li>submitter holds the relayer role (UNAUTHORIZED)</li>
 *   <li>category code in range (INVALID_CATEGORY)</li>
 *   <li>slot not finalized (ALREADY_SUBMITTED)</li>
 *   <li>non-empty, equal-length arrays within maxBatchSize (BATCH_TOO_LARGE)</li>
 *   <li>day total stays within the category cap (CAP_EXCEEDED)</li>
 *   <li>now &lt;= deadline (DEADLINE_EXPIRED)</li>
 *   <li>signature recovers to a relayer (INVALID_SIGNATURE), unused nonce (NONCE_REPLAY)</li>
 *   <li>root matches the entries under REDERIVE (ROOT_MISMATCH)</li>
 * </ol>
 * The ledger repeats the slot, nonce and cap checks atomically on write, so a
 * submission that loses a race still fails with the matching error.
 */
public final class SubmissionValidator {
    private static final Logger log = Logger.getLogger(SubmissionValidator.class.getName());

    private final DistributionLedger ledger;
    private final RelayerAuthorization relayers;
    private final DistributionConfig config;
    private final Clock clock;
    private final List<DistributionEventListener> listeners = new CopyOnWriteArrayList<>();

    public SubmissionValidator(DistributionLedger ledger,
                               RelayerAuthorization relayers,
                               DistributionConfig config,
                               Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.relayers = Objects.requireNonNull(relayers, "relayers");
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(DistributionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public DistributionConfig config() {
        return config;
    }

    /**
     * Validate and finalize one slot.
     *
     * @return the record now stored in the ledger
     * @throws DistributionException with the first failing check
     * @throws IllegalArgumentException for malformed addresses, negative amounts or
     *                                  duplicate users
     */
    public DistributionRecord submit(Submission s) {
        Objects.requireNonNull(s, "submission");

        // 0) caller must be a relayer
        if (!relayers.isRelayer(s.submitter())) {
            throw new DistributionException(Failure.UNAUTHORIZED, "submitter " + s.submitter() + " is not a relayer");
        }

        // 1) category
        Category category = Category.fromCode(s.category());
        SlotKey slot = new SlotKey(s.day(), category, s.subBatch());

        // 2) one-shot slot
        if (ledger.get(slot).isPresent()) {
            throw new DistributionException(Failure.ALREADY_SUBMITTED, "slot " + slot + " already finalized");
        }

        // 3) shape
        int n = s.users().size();
        if (n == 0 || n != s.points().size() || n != s.amounts().size() || n > config.maxBatchSize()) {
            throw new DistributionException(Failure.BATCH_TOO_LARGE, String.format(
                    "batch shape users=%d points=%d amounts=%d (max %d)",
                    n, s.points().size(), s.amounts().size(), config.maxBatchSize()));
        }
        List<RewardEntry> entries = BatchBuilder.entries(s.users(), s.points(), s.amounts());

        // 4) cumulative daily cap
        BigInteger total = sum(s.amounts());
        BigInteger cap = config.dailyCap(category);
        BigInteger after = ledger.finalizedTotal(s.day(), category).add(total);
        if (after.compareTo(cap) > 0) {
            throw new DistributionException(Failure.CAP_EXCEEDED,
                    "day " + s.day() + " " + category + " would reach " + after + " > cap " + cap);
        }

        // 5) deadline
        long now = clock.instant().getEpochSecond();
        if (now > s.deadline()) {
            throw new DistributionException(Failure.DEADLINE_EXPIRED,
                    "deadline " + s.deadline() + " passed at " + now);
        }

        // 6) signer and nonce
        Bytes32 digest = SubmissionDigest.digest(config.domain(), s.payload());
        String signer = SignatureVerifier.recover(digest, s.signature())
                .filter(relayers::isRelayer)
                .orElseThrow(() -> new DistributionException(Failure.INVALID_SIGNATURE,
                        "signature does not recover to a relayer"));
        if (ledger.isNonceConsumed(signer, s.nonce())) {
            throw new DistributionException(Failure.NONCE_REPLAY, "nonce " + s.nonce() + " already used by " + signer);
        }

        // 7) root
        if (config.rootPolicy() == RootTrustPolicy.REDERIVE) {
            Bytes32 derived = BatchBuilder.rootOf(entries);
            if (!derived.equals(s.root())) {
                throw new DistributionException(Failure.ROOT_MISMATCH,
                        "submitted root " + s.root() + " != derived " + derived);
            }
        }

        // 8) commit
        var record = new DistributionRecord(slot, s.root(), n, total, true, now, signer);
        ledger.finalizeDistribution(record, s.nonce(), cap);
        notifyFinalized(record);
        return record;
    }

    private static BigInteger sum(List<BigInteger> amounts) {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger a : amounts) {
            if (a == null || a.signum() < 0) throw new IllegalArgumentException("amount must be >= 0: " + a);
            total = total.add(a);
        }
        return total;
    }

    private void notifyFinalized(DistributionRecord record) {
        for (DistributionEventListener l : listeners) {
            try {
                l.onFinalized(record);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "listener failed on finalize of " + record.slot(), e);
            }
        }
    }
}
