package io.droplite.core;

import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Immutable 32-byte value: Merkle roots, leaves, proof elements.
 * <p>
 * Invariants:
 *  - Always exactly 32 bytes.
 *  - Defensive copies of the bytes are taken on input and output.
 */
public final class Bytes32 {
    public static final int LENGTH = 32;
    public static final Bytes32 ZERO = new Bytes32(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 wrap(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("expected 32 bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Bytes32(Arrays.copyOf(bytes, LENGTH));
    }

    /** Parse a 0x-prefixed (or bare) 64 hex char string. */
    public static Bytes32 fromHex(String hex) {
        if (hex == null) throw new IllegalArgumentException("hex is null");
        String clean = Numeric.cleanHexPrefix(hex);
        if (clean.length() != LENGTH * 2) {
            throw new IllegalArgumentException("bytes32 must be 64 hex chars: " + hex);
        }
        try {
            return new Bytes32(Numeric.hexStringToByteArray(clean));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("invalid hex: " + hex, e);
        }
    }

    public byte[] toArray() {
        return Arrays.copyOf(bytes, LENGTH);
    }

    public String toHex() {
        return Numeric.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes32 other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
