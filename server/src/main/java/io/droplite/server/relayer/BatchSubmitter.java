package io.droplite.server.relayer;

import io.droplite.core.Category;
import io.droplite.core.DistributionException;
import io.droplite.core.Failure;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.batch.Batch;
import io.droplite.core.batch.BatchBuilder;
import io.droplite.server.distribution.Submission;
import io.droplite.server.distribution.SubmissionValidator;
import io.droplite.server.signing.SubmissionDigest;
import io.droplite.server.signing.TypedDataSigner;
import io.droplite.storage.DistributionLedger;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Relayer side of a distribution: score -> split -> sign -> submit.
 * <p>
 * At most one run per (day, category) is active in this process. A sub-batch
 * that is already finalized (here or by another relayer) is reported as
 * ALREADY_SUBMITTED and its locally built batch is discarded, never retried.
 * Successful batches are archived so users can fetch proofs.
 */
public final class BatchSubmitter {
    private static final Logger log = Logger.getLogger(BatchSubmitter.class.getName());

    /** Result for one sub-batch; failure is null when the slot was finalized by this run. */
    public record SlotOutcome(SlotKey slot, Failure failure, String message) {
        public boolean finalized() {
            return failure == null;
        }
    }

    /** Result of one run; inFlight means another run held the (day, category). */
    public record Report(long day, Category category, boolean inFlight, List<SlotOutcome> outcomes) {
        public long finalizedCount() {
            return outcomes.stream().filter(SlotOutcome::finalized).count();
        }
    }

    private final RewardSource source;
    private final SubmissionValidator validator;
    private final DistributionLedger ledger;
    private final TypedDataSigner signer;
    private final BatchArchive archive;
    private final Clock clock;
    private final Duration deadlineWindow;
    private final SecureRandom random = new SecureRandom();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public BatchSubmitter(RewardSource source,
                          SubmissionValidator validator,
                          DistributionLedger ledger,
                          TypedDataSigner signer,
                          BatchArchive archive,
                          Clock clock,
                          Duration deadlineWindow) {
        this.source = Objects.requireNonNull(source, "source");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.archive = Objects.requireNonNull(archive, "archive");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.deadlineWindow = Objects.requireNonNull(deadlineWindow, "deadlineWindow");
    }

    public Report submitDay(long day, Category category) {
        String key = day + "/" + category;
        if (!inFlight.add(key)) {
            log.info("Distribution for " + key + " already in flight; skipping");
            return new Report(day, category, true, List.of());
        }
        try {
            List<RewardEntry> entries = source.rewards(day, category);
            if (entries.isEmpty()) {
                return new Report(day, category, false, List.of());
            }

            int maxBatchSize = validator.config().maxBatchSize();
            List<Batch> batches = BatchBuilder.split(day, category, entries, maxBatchSize);
            List<SlotOutcome> outcomes = new ArrayList<>(batches.size());

            for (Batch batch : batches) {
                SlotOutcome outcome = submitBatch(batch);
                outcomes.add(outcome);
                // later sub-batches only make sense once earlier ones are settled
                if (!outcome.finalized() && outcome.failure() != Failure.ALREADY_SUBMITTED) break;
            }
            return new Report(day, category, false, List.copyOf(outcomes));
        } finally {
            inFlight.remove(key);
        }
    }

    /** Sign and submit one prebuilt batch. */
    public SlotOutcome submitBatch(Batch batch) {
        SlotKey slot = batch.slot();
        if (ledger.get(slot).isPresent()) {
            return new SlotOutcome(slot, Failure.ALREADY_SUBMITTED, "slot already finalized");
        }

        Submission submission = sign(batch);
        try {
            validator.submit(submission);
            archive.put(batch);
            log.info(String.format("Submitted %s: %d users, total=%s, root=%s",
                    slot, batch.size(), batch.totalReward(), batch.root().toHex()));
            return new SlotOutcome(slot, null, "finalized");
        } catch (DistributionException e) {
            if (e.failure() == Failure.ALREADY_SUBMITTED) {
                log.info("Lost race for " + slot + "; discarding local batch");
            } else {
                log.warning("Submission for " + slot + " rejected: " + e.failure() + " " + e.getMessage());
            }
            return new SlotOutcome(slot, e.failure(), e.getMessage());
        }
    }

    private Submission sign(Batch batch) {
        SlotKey slot = batch.slot();
        BigInteger nonce = new BigInteger(128, random);
        long deadline = clock.instant().plus(deadlineWindow).getEpochSecond();

        var payload = new SubmissionDigest.Payload(slot.day(), slot.category().code(), slot.subBatch(),
                batch.root(), batch.users(), batch.points(), batch.amounts(), nonce, deadline);
        byte[] signature = signer.sign(payload);
        return new Submission(slot.day(), slot.category().code(), slot.subBatch(), batch.root(),
                batch.users(), batch.points(), batch.amounts(), nonce, deadline, signature, signer.address());
    }
}
