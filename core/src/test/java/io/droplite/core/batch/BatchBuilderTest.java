package io.droplite.core.batch;

import io.droplite.core.Bytes32;
import io.droplite.core.Category;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;
import io.droplite.core.merkle.MerkleAccumulator;
import io.droplite.core.merkle.MerkleHashing;
import io.droplite.core.merkle.MerkleTree;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Spec tests for deterministic batch construction.
 */
class BatchBuilderTest {

    private static final SlotKey SLOT = SlotKey.of(100, Category.CREATE);

    private static List<RewardEntry> entries(int n) {
        List<RewardEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new RewardEntry(String.format("0x%040x", 0x1000 + i), 20 + i % 80,
                    BigInteger.TEN.pow(15).multiply(BigInteger.valueOf(i + 1))));
        }
        return out;
    }

    @Test
    void identical_input_yields_identical_root() {
        var a = BatchBuilder.build(SLOT, entries(37));
        var b = BatchBuilder.build(SLOT, entries(37));
        assertEquals(a.root(), b.root());
        assertEquals(a.root(), BatchBuilder.rootOf(entries(37)));
    }

    @Test
    void order_matters() {
        List<RewardEntry> forward = entries(4);
        List<RewardEntry> reversed = new ArrayList<>(forward);
        Collections.reverse(reversed);
        assertNotEquals(BatchBuilder.rootOf(forward), BatchBuilder.rootOf(reversed));
    }

    @Test
    void every_ticket_verifies_against_root() {
        Batch batch = BatchBuilder.build(SLOT, entries(100));
        assertEquals(7, batch.depth());
        for (ClaimTicket t : batch.tickets()) {
            Bytes32 leaf = MerkleHashing.leaf(t.user(), t.points(), t.reward());
            assertTrue(MerkleTree.verify(batch.root(), leaf, t.index(), t.proof()), "ticket " + t.index());
        }
    }

    @Test
    void static_root_matches_accumulator_of_same_depth() {
        List<RewardEntry> list = entries(21);
        Batch batch = BatchBuilder.build(SLOT, list);

        var acc = new MerkleAccumulator(batch.depth());
        for (RewardEntry e : list) acc.insert(MerkleHashing.leaf(e.user(), e.points(), e.reward()));
        assertEquals(batch.root(), acc.root());
    }

    @Test
    void single_entry_root_is_its_leaf_with_empty_proof() {
        var e = new RewardEntry("0x000000000000000000000000000000000000000a", 50, new BigInteger("500000000000000000"));
        Batch batch = BatchBuilder.build(SLOT, List.of(e));

        assertEquals(MerkleHashing.leaf(e.user(), e.points(), e.reward()), batch.root());
        ClaimTicket t = batch.ticket(e.user()).orElseThrow();
        assertEquals(0, t.index());
        assertTrue(t.proof().isEmpty());
        assertEquals(new BigInteger("500000000000000000"), batch.totalReward());
    }

    @Test
    void ticket_lookup_ignores_address_case() {
        Batch batch = BatchBuilder.build(SLOT, entries(3));
        String upper = "0x" + batch.users().get(1).substring(2).toUpperCase();
        assertTrue(batch.ticket(upper).isPresent());
    }

    @Test
    void split_keeps_every_entry_in_order_across_sub_batches() {
        List<RewardEntry> list = entries(1201);
        List<Batch> parts = BatchBuilder.split(7, Category.TIPPING, list, 500);

        assertEquals(3, parts.size());
        assertEquals(List.of(500, 500, 201), parts.stream().map(Batch::size).toList());
        for (int i = 0; i < parts.size(); i++) {
            assertEquals(new SlotKey(7, Category.TIPPING, i), parts.get(i).slot());
        }
        List<RewardEntry> rejoined = new ArrayList<>();
        parts.forEach(p -> rejoined.addAll(p.entries()));
        assertEquals(list, rejoined);
    }

    @Test
    void duplicate_users_and_empty_input_are_rejected() {
        var e = entries(1).get(0);
        assertThrows(IllegalArgumentException.class, () -> BatchBuilder.build(SLOT, List.of(e, e)));
        assertThrows(IllegalArgumentException.class, () -> BatchBuilder.build(SLOT, List.of()));
        assertThrows(IllegalArgumentException.class, () -> BatchBuilder.split(1, Category.LIKES, entries(4), 0));
    }

    @Test
    void zip_requires_equal_lengths() {
        assertThrows(IllegalArgumentException.class, () -> BatchBuilder.zip(
                List.of("0x000000000000000000000000000000000000000a"),
                List.of(1L, 2L),
                List.of(BigInteger.ONE)));
    }
}
