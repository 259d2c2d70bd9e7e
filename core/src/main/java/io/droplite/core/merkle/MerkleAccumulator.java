package io.droplite.core.merkle;

import io.droplite.core.Bytes32;
import io.droplite.core.DistributionException;
import io.droplite.core.Failure;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only Merkle tree with fixed depth and O(depth) insertion.
 * <p>
 * State:
 *  - nextIndex: number of leaves inserted; always <= capacity.
 *  - filled[level]: hash of the most recent left child written at that level.
 *    A left child is the only one still waiting for a right sibling, so combining
 *    it with the new right child never needs the leaves below it again.
 *  - nodes[level]: last known hash of every touched node at that level, used to
 *    serve proofs without rebuilding.
 *  - root: cached; always equals the static root of leaves [0, nextIndex).
 * <p>
 * Proofs only stay valid against the current root while no leaf sharing an ancestor
 * is appended afterwards. Issue them after {@link #close()}.
 */
public final class MerkleAccumulator implements MerkleTree {

    public static final int MAX_DEPTH = MerkleHashing.MAX_DEPTH;

    /** Leaf indices are ints, so depths above 30 hold at most this many leaves. */
    static final int MAX_LEAVES = Integer.MAX_VALUE;

    private final int depth;
    private final long capacity;
    private final Bytes32[] filled;
    private final List<List<Bytes32>> nodes;
    private int nextIndex;
    private Bytes32 root;
    private boolean closed;

    public MerkleAccumulator(int depth) {
        if (depth < 0 || depth > MAX_DEPTH) {
            throw new IllegalArgumentException("depth must be in [0, " + MAX_DEPTH + "], got " + depth);
        }
        this.depth = depth;
        this.capacity = 1L << depth;
        this.filled = new Bytes32[depth];
        this.nodes = new ArrayList<>(depth + 1);
        for (int level = 0; level <= depth; level++) {
            nodes.add(new ArrayList<>());
            if (level < depth) filled[level] = MerkleHashing.zero(level);
        }
        this.root = MerkleHashing.zero(depth);
    }

    /**
     * Append a leaf and refresh the path to the root.
     *
     * @return zero-based index assigned to the leaf
     * @throws DistributionException TREE_FULL when the tree is at capacity or closed
     */
    public synchronized int insert(Bytes32 leaf) {
        if (leaf == null) throw new IllegalArgumentException("leaf is null");
        if (closed || nextIndex == capacity || nextIndex == MAX_LEAVES) {
            throw new DistributionException(Failure.TREE_FULL,
                    "tree full: capacity=" + capacity + (closed ? " (closed)" : ""));
        }

        int index = nextIndex;
        int pos = index;
        Bytes32 current = leaf;
        for (int level = 0; level < depth; level++) {
            setNode(level, pos, current);
            Bytes32 left;
            Bytes32 right;
            if ((pos & 1) == 0) {
                // Right sibling not written yet: pair with the empty subtree.
                filled[level] = current;
                left = current;
                right = MerkleHashing.zero(level);
            } else {
                left = filled[level];
                right = current;
            }
            current = MerkleHashing.node(left, right);
            pos >>>= 1;
        }
        setNode(depth, 0, current);

        root = current;
        nextIndex = index + 1;
        return index;
    }

    @Override
    public synchronized Bytes32 root() {
        return root;
    }

    @Override
    public int depth() {
        return depth;
    }

    public long capacity() {
        return capacity;
    }

    @Override
    public synchronized int size() {
        return nextIndex;
    }

    /** Freeze the tree. Subsequent inserts fail with TREE_FULL. */
    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean closed() {
        return closed;
    }

    /** Alias kept close to the protocol vocabulary. */
    public List<Bytes32> generateProof(int index) {
        return proof(index);
    }

    @Override
    public synchronized List<Bytes32> proof(int index) {
        if (index < 0 || index >= nextIndex) {
            throw new IllegalArgumentException("index " + index + " not in [0, " + nextIndex + ")");
        }
        List<Bytes32> out = new ArrayList<>(depth);
        int pos = index;
        for (int level = 0; level < depth; level++) {
            int sibling = pos ^ 1;
            List<Bytes32> row = nodes.get(level);
            out.add(sibling < row.size() ? row.get(sibling) : MerkleHashing.zero(level));
            pos >>>= 1;
        }
        return List.copyOf(out);
    }

    public static boolean verifyProof(Bytes32 root, Bytes32 leaf, long index, List<Bytes32> proof) {
        return MerkleTree.verify(root, leaf, index, proof);
    }

    // ---------------- helpers ----------------

    private void setNode(int level, int pos, Bytes32 value) {
        List<Bytes32> row = nodes.get(level);
        if (pos == row.size()) {
            row.add(value);
        } else {
            row.set(pos, value);
        }
    }
}
