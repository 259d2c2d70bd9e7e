package io.droplite.storage;

import io.droplite.core.Addresses;
import io.droplite.core.Category;
import io.droplite.core.ClaimRecord;
import io.droplite.core.DistributionException;
import io.droplite.core.DistributionRecord;
import io.droplite.core.Failure;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable ledger implementation.
 * <p>
 * Responsibilities:
 *  - Maintain in-memory maps: slot -> record, (relayer, nonce) -> slot,
 *    (day, category, user) -> claim, plus per-slot claimed totals.
 *  - On write:
 *      1) Re-check the guard under the ledger lock.
 *      2) Serialize the event to a WAL record.
 *      3) Append+fsync to WAL.
 *      4) Apply it to memory.
 *      5) Rotate WAL segment if needed and possibly snapshot.
 * <p>
 *  - On startup:
 *      1) Load the latest snapshot (if any) into memory.
 *      2) Replay WAL records written after the snapshot position.
 * <p>
 * Claims are two-phase: reserveClaim() sets an in-memory flag that blocks any
 * other claim for the same user, commitClaim() writes it, cancelClaim() drops it.
 * Reservations are never persisted, so a crash between reserve and commit leaves
 * the user free to claim again.
 */
public class DurableLedger implements DistributionLedger {
    private static final Logger log = Logger.getLogger(DurableLedger.class.getName());

    private final Map<SlotKey, DistributionRecord> records = new ConcurrentHashMap<>();
    private final Map<SlotKey, BigInteger> nonceBySlot = new ConcurrentHashMap<>();
    private final Map<NonceKey, SlotKey> nonces = new ConcurrentHashMap<>();
    private final Map<ClaimKey, ClaimRecord> claims = new ConcurrentHashMap<>();
    private final Map<ClaimKey, ClaimReservation> pending = new ConcurrentHashMap<>();
    private final Map<SlotKey, BigInteger> claimedTotals = new ConcurrentHashMap<>();

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy snapPolicy;
    private final Clock clock;

    // Number of WAL records reflected in memory; guarded by this.
    private long walPosition;

    public DurableLedger(Wal wal, Snapshotter snaps, Clock clock) {
        this(wal, snaps, new SnapshotPolicy(50_000), clock);
    }

    public DurableLedger(Wal wal, Snapshotter snaps, SnapshotPolicy snapPolicy, Clock clock) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.snapPolicy = Objects.requireNonNull(snapPolicy, "snapPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        recover();
    }

    // ---------------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------------

    @Override
    public Optional<DistributionRecord> get(SlotKey slot) {
        return Optional.ofNullable(records.get(slot));
    }

    @Override
    public List<DistributionRecord> records(long day, Category category) {
        List<DistributionRecord> out = new ArrayList<>();
        for (DistributionRecord r : records.values()) {
            if (r.slot().day() == day && r.slot().category() == category) out.add(r);
        }
        out.sort(Comparator.comparingInt(r -> r.slot().subBatch()));
        return out;
    }

    @Override
    public List<DistributionRecord> records() {
        List<DistributionRecord> out = new ArrayList<>(records.values());
        out.sort(Comparator.comparingLong((DistributionRecord r) -> r.slot().day())
                .thenComparing(r -> r.slot().category())
                .thenComparingInt(r -> r.slot().subBatch()));
        return out;
    }

    @Override
    public BigInteger finalizedTotal(long day, Category category) {
        BigInteger sum = BigInteger.ZERO;
        for (DistributionRecord r : records(day, category)) sum = sum.add(r.totalReward());
        return sum;
    }

    @Override
    public long currentDay() {
        return SlotKey.dayOf(clock.instant().getEpochSecond());
    }

    @Override
    public boolean isNonceConsumed(String relayer, BigInteger nonce) {
        return nonces.containsKey(new NonceKey(Addresses.normalize(relayer), nonce));
    }

    @Override
    public Optional<ClaimRecord> claim(long day, Category category, String user) {
        return Optional.ofNullable(claims.get(ClaimKey.of(day, category, user)));
    }

    @Override
    public boolean isClaimed(long day, Category category, String user) {
        ClaimKey key = ClaimKey.of(day, category, user);
        return claims.containsKey(key) || pending.containsKey(key);
    }

    @Override
    public BigInteger claimedTotal(SlotKey slot) {
        return claimedTotals.getOrDefault(slot, BigInteger.ZERO);
    }

    @Override
    public BigInteger unclaimed(SlotKey slot) {
        DistributionRecord r = records.get(slot);
        if (r == null) throw new DistributionException(Failure.NO_DISTRIBUTION, "no distribution for " + slot);
        return r.totalReward().subtract(claimedTotal(slot));
    }

    // ---------------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------------

    @Override
    public synchronized void finalizeDistribution(DistributionRecord record, BigInteger nonce, BigInteger dailyCap) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(nonce, "nonce");
        if (!record.finalized()) throw new IllegalArgumentException("record must be finalized");

        SlotKey slot = record.slot();
        if (records.containsKey(slot)) {
            throw new DistributionException(Failure.ALREADY_SUBMITTED, "slot " + slot + " already finalized");
        }
        if (nonces.containsKey(new NonceKey(record.relayer(), nonce))) {
            throw new DistributionException(Failure.NONCE_REPLAY, "nonce " + nonce + " already used by " + record.relayer());
        }
        if (dailyCap != null) {
            BigInteger after = finalizedTotal(slot.day(), slot.category()).add(record.totalReward());
            if (after.compareTo(dailyCap) > 0) {
                throw new DistributionException(Failure.CAP_EXCEEDED,
                        "day " + slot.day() + " " + slot.category() + " would reach " + after + " > cap " + dailyCap);
            }
        }

        persist(new LedgerEvent.Finalized(record, nonce));
    }

    @Override
    public synchronized ClaimReservation reserveClaim(SlotKey slot, String user, BigInteger amount) {
        Objects.requireNonNull(amount, "amount");
        DistributionRecord record = records.get(slot);
        if (record == null) {
            throw new DistributionException(Failure.NO_DISTRIBUTION, "no distribution for " + slot);
        }
        ClaimKey key = ClaimKey.of(slot.day(), slot.category(), user);
        if (claims.containsKey(key) || pending.containsKey(key)) {
            throw new DistributionException(Failure.ALREADY_CLAIMED, key.user() + " already claimed " + slot.day() + "/" + slot.category());
        }

        // Escrow bound: a root that disagrees with the signed totals cannot drain other slots.
        BigInteger outstanding = claimedTotal(slot).add(amount);
        for (ClaimReservation r : pending.values()) {
            if (r.slot().equals(slot)) outstanding = outstanding.add(r.amount());
        }
        if (outstanding.compareTo(record.totalReward()) > 0) {
            throw new DistributionException(Failure.PROOF_INVALID,
                    "claim of " + amount + " exceeds remaining funds of " + slot);
        }

        ClaimReservation reservation = new ClaimReservation(slot, key.user(), amount);
        pending.put(key, reservation);
        return reservation;
    }

    @Override
    public synchronized ClaimRecord commitClaim(ClaimReservation reservation) {
        ClaimKey key = ClaimKey.of(reservation.slot().day(), reservation.slot().category(), reservation.user());
        if (pending.get(key) != reservation) {
            throw new IllegalStateException("no outstanding reservation for " + key);
        }
        var claim = new ClaimRecord(reservation.slot(), reservation.user(), reservation.amount(),
                clock.instant().getEpochSecond());
        // The reservation stays in place if the append fails: value already moved,
        // so the user must not be able to claim again in this process.
        persist(new LedgerEvent.Claimed(claim));
        pending.remove(key);
        return claim;
    }

    @Override
    public synchronized void cancelClaim(ClaimReservation reservation) {
        ClaimKey key = ClaimKey.of(reservation.slot().day(), reservation.slot().category(), reservation.user());
        pending.remove(key, reservation);
    }

    @Override
    public void close() throws Exception {
        wal.close();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void persist(LedgerEvent event) {
        // If process crashes after append returns, recovery will still see this.
        wal.append(RecordCodec.encode(event));
        walPosition++;
        apply(event);

        wal.rotateIfNeeded();
        try {
            snapPolicy.maybeSnapshot(this::compactState, walPosition, snaps);
        } catch (RuntimeException e) {
            // The event is already durable in the WAL; a failed snapshot only costs replay time.
            log.log(Level.WARNING, "Snapshot at WAL position " + walPosition + " failed", e);
        }
    }

    /**
     * Recovery procedure called from constructor:
     *  1) Seed memory from the latest snapshot (if present).
     *  2) Replay WAL records after the snapshot position, in order.
     */
    private void recover() {
        long skip = 0;
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            loaded.events().forEach(this::apply);
            skip = loaded.walPosition();
        }

        long seen = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                if (seen++ < skip) continue;
                apply(RecordCodec.decode(payload));
            }
        } catch (Exception e) {
            throw new RuntimeException("Recovery Failed", e);
        }
        walPosition = Math.max(seen, skip);

        log.info(String.format("Recovered ledger: %d distributions, %d claims (snapshot=%s, wal records=%d)",
                records.size(), claims.size(), loaded == null ? "none" : loaded.id(), seen));
    }

    /** Apply one event to memory. Replays of an already applied event are no-ops. */
    private void apply(LedgerEvent event) {
        if (event instanceof LedgerEvent.Finalized f) {
            DistributionRecord r = f.record();
            if (records.putIfAbsent(r.slot(), r) == null) {
                nonceBySlot.put(r.slot(), f.nonce());
                nonces.put(new NonceKey(r.relayer(), f.nonce()), r.slot());
            }
        } else if (event instanceof LedgerEvent.Claimed c) {
            ClaimRecord claim = c.claim();
            ClaimKey key = ClaimKey.of(claim.slot().day(), claim.slot().category(), claim.user());
            if (claims.putIfAbsent(key, claim) == null) {
                claimedTotals.merge(claim.slot(), claim.amount(), BigInteger::add);
            }
        }
    }

    /** One event per finalized slot followed by one per claim. */
    private List<LedgerEvent> compactState() {
        List<LedgerEvent> out = new ArrayList<>(records.size() + claims.size());
        for (DistributionRecord r : records.values()) {
            out.add(new LedgerEvent.Finalized(r, nonceBySlot.get(r.slot())));
        }
        for (ClaimRecord c : claims.values()) {
            out.add(new LedgerEvent.Claimed(c));
        }
        return out;
    }

    private record NonceKey(String relayer, BigInteger nonce) {}

    private record ClaimKey(long day, Category category, String user) {
        static ClaimKey of(long day, Category category, String user) {
            return new ClaimKey(day, category, Addresses.normalize(user));
        }
    }
}
