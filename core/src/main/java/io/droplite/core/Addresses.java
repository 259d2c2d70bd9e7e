package io.droplite.core;

import org.web3j.utils.Numeric;

/**
 * Validators/normalizers for EVM addresses.
 * Canonical form is "0x" + 40 lowercase hex chars.
 */
public final class Addresses {
    private Addresses() {}

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        if (!addr.startsWith("0x") && !addr.startsWith("0X")) {
            throw new IllegalArgumentException("address must start with 0x: " + addr);
        }
        String hex = addr.substring(2);
        if (hex.length() != 40) {
            throw new IllegalArgumentException("invalid address length (need 40 hex chars): " + addr);
        }
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("address must be hex: " + addr);
            }
        }
        return "0x" + hex.toLowerCase();
    }

    /** 20 raw address bytes, as packed into a leaf. */
    public static byte[] toBytes(String addr) {
        return Numeric.hexStringToByteArray(normalize(addr));
    }
}
