package io.droplite.core.merkle;

import io.droplite.core.Bytes32;

import java.util.List;

/**
 * Read side of a positional binary Merkle tree with fixed depth.
 * <p>
 * Node indexing is per level: the leaf at index i has sibling i ^ 1, its parent is i >> 1.
 * Unset leaves hash as {@link MerkleHashing#zero(int)} constants, so partially filled
 * trees still have a well-defined root.
 */
public interface MerkleTree {

    /** Current root. O(1). */
    Bytes32 root();

    /** Number of levels above the leaves; capacity is 2^depth. */
    int depth();

    /** Number of leaves written so far. */
    int size();

    /**
     * Sibling hashes from leaf to root for the given leaf index.
     * Time: O(depth)
     */
    List<Bytes32> proof(int index);

    /**
     * Recompute a candidate root from leaf + proof and compare.
     * The bit i of index decides whether the running hash is the left (0) or right (1) input.
     * Indexes that do not fit in proof.size() bits never verify.
     */
    static boolean verify(Bytes32 root, Bytes32 leaf, long index, List<Bytes32> proof) {
        if (root == null || leaf == null || proof == null) return false;
        if (index < 0 || proof.size() > MerkleHashing.MAX_DEPTH) return false;
        if ((index >>> proof.size()) != 0) return false;

        Bytes32 h = leaf;
        for (int level = 0; level < proof.size(); level++) {
            Bytes32 sibling = proof.get(level);
            if (sibling == null) return false;
            h = ((index >>> level) & 1L) == 0
                    ? MerkleHashing.node(h, sibling)
                    : MerkleHashing.node(sibling, h);
        }
        return h.equals(root);
    }
}
