package io.droplite.core.batch;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.merkle.MerkleHashing;
import io.droplite.core.merkle.StaticMerkleTree;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic, side-effect free batch construction.
 * <p>
 * Same ordered input always yields the same root, which is what lets the relayer,
 * the submission validator and claimants recompute roots independently.
 * <p>
 * Shape: the static tree is padded to the next power of two with the empty-leaf
 * constant; a single entry has depth 0 and root == leaf.
 */
public final class BatchBuilder {

    private BatchBuilder() {}

    /** Build one batch for a slot. O(n) hashing, O(n log n) proofs. */
    public static Batch build(SlotKey slot, List<RewardEntry> entries) {
        Objects.requireNonNull(slot, "slot");
        List<Bytes32> leaves = leaves(entries);
        StaticMerkleTree tree = StaticMerkleTree.build(leaves);

        List<ClaimTicket> tickets = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            RewardEntry e = entries.get(i);
            tickets.add(new ClaimTicket(e.user(), e.points(), e.reward(), i, tree.proof(i)));
        }
        return new Batch(slot, tree.root(), tree.depth(), entries, tickets);
    }

    /** Root only; used to re-derive a submitted root. */
    public static Bytes32 rootOf(List<RewardEntry> entries) {
        return StaticMerkleTree.build(leaves(entries)).root();
    }

    /** Root from parallel arrays as they arrive in a submission. */
    public static Bytes32 rootOf(List<String> users, List<Long> points, List<BigInteger> amounts) {
        return rootOf(zip(users, points, amounts));
    }

    /**
     * Split a day's entries for one category into consecutive sub-batches of at most
     * maxBatchSize entries. Nothing is dropped; order is preserved.
     */
    public static List<Batch> split(long day, Category category, List<RewardEntry> entries, int maxBatchSize) {
        if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
        checkEntries(entries);

        List<Batch> out = new ArrayList<>();
        int subBatch = 0;
        for (int from = 0; from < entries.size(); from += maxBatchSize) {
            int to = Math.min(entries.size(), from + maxBatchSize);
            out.add(build(new SlotKey(day, category, subBatch++), entries.subList(from, to)));
        }
        return out;
    }

    /**
     * Zip submission arrays into entries and reject anything no batch could hold:
     * malformed addresses, negative values or duplicate users.
     */
    public static List<RewardEntry> entries(List<String> users, List<Long> points, List<BigInteger> amounts) {
        List<RewardEntry> out = zip(users, points, amounts);
        checkEntries(out);
        return out;
    }

    public static List<RewardEntry> zip(List<String> users, List<Long> points, List<BigInteger> amounts) {
        Objects.requireNonNull(users, "users");
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(amounts, "amounts");
        if (users.size() != points.size() || users.size() != amounts.size()) {
            throw new IllegalArgumentException("users, points and amounts must have equal length");
        }
        List<RewardEntry> out = new ArrayList<>(users.size());
        for (int i = 0; i < users.size(); i++) {
            out.add(new RewardEntry(users.get(i), points.get(i), amounts.get(i)));
        }
        return out;
    }

    // ---------------- helpers ----------------

    private static List<Bytes32> leaves(List<RewardEntry> entries) {
        checkEntries(entries);
        List<Bytes32> leaves = new ArrayList<>(entries.size());
        for (RewardEntry e : entries) {
            leaves.add(MerkleHashing.leaf(e.user(), e.points(), e.reward()));
        }
        return leaves;
    }

    private static void checkEntries(List<RewardEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("no entries provided");
        }
        Set<String> seen = new HashSet<>(entries.size() * 2);
        for (RewardEntry e : entries) {
            Objects.requireNonNull(e, "entry");
            if (!seen.add(e.user())) {
                throw new IllegalArgumentException("duplicate user in batch: " + e.user());
            }
        }
    }
}
