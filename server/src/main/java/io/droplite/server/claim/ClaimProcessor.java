package io.droplite.server.claim;

import io.droplite.core.Bytes32;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionException;
import io.droplite.core.DistributionRecord;
import io.droplite.core.Failure;
import io.droplite.core.SlotKey;
import io.droplite.core.merkle.MerkleAccumulator;
import io.droplite.core.merkle.MerkleHashing;
import io.droplite.server.distribution.DistributionEventListener;
import io.droplite.storage.ClaimReservation;
import io.droplite.storage.DistributionLedger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Redeems Merkle proofs against finalized roots.
 * <p>
 * Order of effects: the claim flag is reserved in the ledger before any value
 * moves, so a transfer that calls back into claim() sees ALREADY_CLAIMED.
 * A failed transfer cancels the reservation and leaves no trace on disk.
 */
public final class ClaimProcessor {
    private static final Logger log = Logger.getLogger(ClaimProcessor.class.getName());

    private final DistributionLedger ledger;
    private final ValueTransfer transfer;
    private final List<DistributionEventListener> listeners = new CopyOnWriteArrayList<>();

    public ClaimProcessor(DistributionLedger ledger, ValueTransfer transfer) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.transfer = Objects.requireNonNull(transfer, "transfer");
    }

    public void addListener(DistributionEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @param caller authenticated claimant; the leaf is rebuilt from this address
     * @throws DistributionException NO_DISTRIBUTION, ALREADY_CLAIMED or PROOF_INVALID
     * @throws TransferException     if the value release failed (nothing persisted)
     */
    public ClaimRecord claim(ClaimRequest req, String caller) {
        Objects.requireNonNull(req, "request");
        SlotKey slot = req.slot();

        DistributionRecord record = ledger.get(slot)
                .orElseThrow(() -> new DistributionException(Failure.NO_DISTRIBUTION, "no distribution for " + slot));

        if (ledger.isClaimed(req.day(), req.category(), caller)) {
            throw new DistributionException(Failure.ALREADY_CLAIMED,
                    caller + " already claimed " + req.day() + "/" + req.category());
        }

        Bytes32 leaf = MerkleHashing.leaf(caller, req.points(), req.rewardAmount());
        if (!MerkleAccumulator.verifyProof(record.root(), leaf, req.index(), req.proof())) {
            throw new DistributionException(Failure.PROOF_INVALID, "proof does not match root of " + slot);
        }

        ClaimReservation reservation = ledger.reserveClaim(slot, caller, req.rewardAmount());
        try {
            transfer.release(reservation.user(), req.rewardAmount());
        } catch (RuntimeException e) {
            ledger.cancelClaim(reservation);
            log.log(Level.WARNING, "release to " + reservation.user() + " failed; claim on " + slot + " rolled back", e);
            throw e;
        }

        ClaimRecord claim = ledger.commitClaim(reservation);
        for (DistributionEventListener l : listeners) {
            try {
                l.onClaimed(claim);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "listener failed on claim of " + claim.user(), e);
            }
        }
        return claim;
    }
}
