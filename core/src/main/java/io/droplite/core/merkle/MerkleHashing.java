package io.droplite.core.merkle;

import io.droplite.core.Addresses;
import io.droplite.core.Bytes32;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Hash primitives shared by every tree in the system.
 * <p>
 *  - H = Keccak-256.
 *  - leaf = H(address(20B) || uint256(points) || uint256(reward)), i.e. Solidity abi.encodePacked.
 *  - node = H(left || right), positional (never sorted).
 *  - zero[0] = 32 zero bytes, zero[i+1] = H(zero[i] || zero[i]).
 */
public final class MerkleHashing {

    /** Deepest tree supported (capacity 2^32 leaves). */
    public static final int MAX_DEPTH = 32;

    private static final Bytes32[] ZEROS = new Bytes32[MAX_DEPTH + 1];

    static {
        ZEROS[0] = Bytes32.ZERO;
        for (int i = 1; i <= MAX_DEPTH; i++) {
            ZEROS[i] = node(ZEROS[i - 1], ZEROS[i - 1]);
        }
    }

    private MerkleHashing() {}

    /** Root of an all-empty subtree of the given height. */
    public static Bytes32 zero(int level) {
        if (level < 0 || level > MAX_DEPTH) throw new IllegalArgumentException("level out of range: " + level);
        return ZEROS[level];
    }

    public static Bytes32 node(Bytes32 left, Bytes32 right) {
        byte[] buf = new byte[Bytes32.LENGTH * 2];
        System.arraycopy(left.toArray(), 0, buf, 0, Bytes32.LENGTH);
        System.arraycopy(right.toArray(), 0, buf, Bytes32.LENGTH, Bytes32.LENGTH);
        return Bytes32.wrap(Hash.sha3(buf));
    }

    public static Bytes32 leaf(String user, long points, BigInteger reward) {
        return leaf(user, BigInteger.valueOf(points), reward);
    }

    public static Bytes32 leaf(String user, BigInteger points, BigInteger reward) {
        byte[] addr = Addresses.toBytes(user);
        byte[] buf = new byte[20 + 32 + 32];
        System.arraycopy(addr, 0, buf, 0, 20);
        System.arraycopy(uint256(points), 0, buf, 20, 32);
        System.arraycopy(uint256(reward), 0, buf, 52, 32);
        return Bytes32.wrap(Hash.sha3(buf));
    }

    /** Encode a non-negative integer as a 32-byte big-endian word. */
    public static byte[] uint256(BigInteger v) {
        if (v == null || v.signum() < 0 || v.bitLength() > 256) {
            throw new IllegalArgumentException("value is not a uint256: " + v);
        }
        return Numeric.toBytesPadded(v, 32);
    }

    /** Smallest depth whose capacity holds n leaves (depth 0 for a single leaf). */
    public static int depthFor(int n) {
        if (n <= 0) throw new IllegalArgumentException("n must be > 0");
        return 32 - Integer.numberOfLeadingZeros(n - 1);
    }
}
