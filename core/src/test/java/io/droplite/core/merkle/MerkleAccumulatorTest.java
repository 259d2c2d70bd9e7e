package io.droplite.core.merkle;

import io.droplite.core.Bytes32;
import io.droplite.core.DistributionException;
import io.droplite.core.Failure;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Spec tests for the incremental accumulator.
 *
 * Goal is to validate:
 *  - the incremental root always matches a full static rebuild,
 *  - every proof from a filled tree verifies,
 *  - capacity is enforced with TREE_FULL.
 */
class MerkleAccumulatorTest {

    private static Bytes32 leaf(int i) {
        return MerkleHashing.leaf(String.format("0x%040x", i + 1), i, BigInteger.valueOf(1_000L * i));
    }

    @Test
    void empty_tree_root_is_zero_subtree_of_full_depth() {
        var acc = new MerkleAccumulator(4);
        assertEquals(MerkleHashing.zero(4), acc.root());
        assertEquals(0, acc.size());
        assertEquals(16, acc.capacity());
    }

    @Test
    void incremental_root_matches_static_rebuild_after_every_insert() {
        int depth = 5;
        var acc = new MerkleAccumulator(depth);
        List<Bytes32> leaves = new ArrayList<>();

        for (int i = 0; i < 32; i++) {
            Bytes32 l = leaf(i);
            leaves.add(l);
            assertEquals(i, acc.insert(l), "indexes are sequential and zero-based");
            assertEquals(StaticMerkleTree.build(leaves, depth).root(), acc.root(),
                    "incremental root must match rebuild after " + (i + 1) + " leaves");
        }
    }

    @Test
    void every_proof_verifies_once_batch_is_inserted() {
        var acc = new MerkleAccumulator(6);
        int n = 45;
        for (int i = 0; i < n; i++) acc.insert(leaf(i));
        acc.close();

        for (int i = 0; i < n; i++) {
            List<Bytes32> proof = acc.generateProof(i);
            assertEquals(6, proof.size());
            assertTrue(MerkleAccumulator.verifyProof(acc.root(), leaf(i), i, proof), "proof " + i);
        }
    }

    @Test
    void proofs_match_static_tree_proofs() {
        int depth = 3;
        var acc = new MerkleAccumulator(depth);
        List<Bytes32> leaves = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            leaves.add(leaf(i));
            acc.insert(leaf(i));
        }
        var tree = StaticMerkleTree.build(leaves, depth);
        for (int i = 0; i < 6; i++) {
            assertEquals(tree.proof(i), acc.proof(i));
        }
    }

    @Test
    void wrong_index_other_leaf_and_damaged_proofs_fail() {
        var acc = new MerkleAccumulator(3);
        for (int i = 0; i < 8; i++) acc.insert(leaf(i));
        Bytes32 root = acc.root();
        List<Bytes32> proof = acc.proof(2);

        assertTrue(MerkleTree.verify(root, leaf(2), 2, proof));
        assertFalse(MerkleTree.verify(root, leaf(2), 3, proof), "wrong index");
        assertFalse(MerkleTree.verify(root, leaf(3), 2, proof), "leaf from another index");
        assertFalse(MerkleTree.verify(root, leaf(2), 2, proof.subList(0, 2)), "truncated");
        assertFalse(MerkleTree.verify(root, leaf(2), 2 + 8, proof), "index beyond proof width");

        List<Bytes32> corrupted = new ArrayList<>(proof);
        corrupted.set(1, MerkleHashing.zero(1));
        assertFalse(MerkleTree.verify(root, leaf(2), 2, corrupted), "corrupted element");
    }

    @Test
    void insert_past_capacity_fails_with_tree_full() {
        var acc = new MerkleAccumulator(2);
        for (int i = 0; i < 4; i++) acc.insert(leaf(i));
        Bytes32 before = acc.root();

        var ex = assertThrows(DistributionException.class, () -> acc.insert(leaf(9)));
        assertEquals(Failure.TREE_FULL, ex.failure());
        assertTrue(ex.terminal());
        assertEquals(before, acc.root(), "failed insert must not touch the root");
        assertEquals(4, acc.size());
    }

    @Test
    void closed_tree_rejects_inserts() {
        var acc = new MerkleAccumulator(4);
        acc.insert(leaf(0));
        acc.close();
        var ex = assertThrows(DistributionException.class, () -> acc.insert(leaf(1)));
        assertEquals(Failure.TREE_FULL, ex.failure());
    }

    @Test
    void depth_zero_holds_one_leaf_and_root_is_the_leaf() {
        var acc = new MerkleAccumulator(0);
        acc.insert(leaf(7));
        assertEquals(leaf(7), acc.root());
        assertTrue(acc.proof(0).isEmpty());
        assertTrue(MerkleTree.verify(acc.root(), leaf(7), 0, List.of()));
    }

    @Test
    void proof_for_unwritten_index_is_rejected() {
        var acc = new MerkleAccumulator(3);
        acc.insert(leaf(0));
        assertThrows(IllegalArgumentException.class, () -> acc.proof(1));
        assertThrows(IllegalArgumentException.class, () -> acc.proof(-1));
    }

    @Test
    void full_depth_range_up_to_32_is_accepted() {
        var acc = new MerkleAccumulator(MerkleHashing.MAX_DEPTH);
        assertEquals(32, acc.depth());
        assertEquals(1L << 32, acc.capacity());
        assertEquals(MerkleHashing.zero(32), acc.root());

        acc.insert(leaf(0));
        acc.insert(leaf(1));
        Bytes32 expected = MerkleHashing.node(leaf(0), leaf(1));
        for (int level = 1; level < 32; level++) {
            expected = MerkleHashing.node(expected, MerkleHashing.zero(level));
        }
        assertEquals(expected, acc.root());

        List<Bytes32> proof = acc.generateProof(1);
        assertEquals(32, proof.size());
        assertTrue(MerkleAccumulator.verifyProof(acc.root(), leaf(1), 1, proof));

        assertThrows(IllegalArgumentException.class, () -> new MerkleAccumulator(33));
        assertThrows(IllegalArgumentException.class, () -> new MerkleAccumulator(-1));
    }
}
