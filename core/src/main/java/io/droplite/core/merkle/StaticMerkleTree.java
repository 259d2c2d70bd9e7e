package io.droplite.core.merkle;

import io.droplite.core.Bytes32;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Closed binary Merkle tree built once from an ordered leaf list.
 * <p>
 * Tree layout (implicit array):
 *  - leafCount = 2^depth leaves, padded with zero[0] past the supplied leaves
 *  - totalNodes = 2 * leafCount - 1
 *  - node 0 is root, leaves start at baseLeafId = leafCount - 1
 *  - for node n: left child = 2n + 1, right child = 2n + 2
 * <p>
 * Internal nodes: hash = H(leftChildHash || rightChildHash).
 * The root equals the root a {@link MerkleAccumulator} of the same depth reaches after
 * inserting the same leaves in order.
 */
public final class StaticMerkleTree implements MerkleTree {
    private final int depth;
    private final int size;
    private final int leafCount;
    private final int baseLeafId;
    private final Bytes32[] nodeHash;

    private StaticMerkleTree(List<Bytes32> leaves, int depth) {
        Objects.requireNonNull(leaves, "leaves");
        if (depth < 0 || depth > MerkleAccumulator.MAX_DEPTH) {
            throw new IllegalArgumentException("depth out of range: " + depth);
        }
        if (leaves.size() > (1L << depth)) {
            throw new IllegalArgumentException(leaves.size() + " leaves do not fit depth " + depth);
        }
        this.depth = depth;
        this.size = leaves.size();
        this.leafCount = 1 << depth;
        this.baseLeafId = leafCount - 1;
        this.nodeHash = new Bytes32[(leafCount << 1) - 1];

        // 1) leaves, padded with the empty-leaf constant
        for (int i = 0; i < leafCount; i++) {
            Bytes32 leaf = i < size ? Objects.requireNonNull(leaves.get(i), "leaf") : MerkleHashing.zero(0);
            nodeHash[baseLeafId + i] = leaf;
        }

        // 2) parents upward
        for (int n = baseLeafId - 1; n >= 0; n--) {
            nodeHash[n] = MerkleHashing.node(nodeHash[leftChild(n)], nodeHash[rightChild(n)]);
        }
    }

    /** Build with the smallest depth that fits all leaves. */
    public static StaticMerkleTree build(List<Bytes32> leaves) {
        if (leaves == null || leaves.isEmpty()) throw new IllegalArgumentException("no leaves");
        return new StaticMerkleTree(leaves, MerkleHashing.depthFor(leaves.size()));
    }

    /** Build padded to a fixed depth. */
    public static StaticMerkleTree build(List<Bytes32> leaves, int depth) {
        return new StaticMerkleTree(leaves, depth);
    }

    @Override public Bytes32 root() { return nodeHash[0]; }

    @Override public int depth() { return depth; }

    @Override public int size() { return size; }

    public Bytes32 leaf(int index) {
        checkIndex(index);
        return nodeHash[baseLeafId + index];
    }

    @Override
    public List<Bytes32> proof(int index) {
        checkIndex(index);
        List<Bytes32> out = new ArrayList<>(depth);
        int n = baseLeafId + index;
        while (n > 0) {
            // left children have odd ids, right children even ids
            int sibling = (n & 1) == 1 ? n + 1 : n - 1;
            out.add(nodeHash[sibling]);
            n = (n - 1) >>> 1;
        }
        return List.copyOf(out);
    }

    // ---------------- helpers ----------------

    private void checkIndex(int index) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("index " + index + " not in [0, " + size + ")");
        }
    }

    private static int leftChild(int n) { return (n << 1) + 1; }
    private static int rightChild(int n) { return (n << 1) + 2; }
}
