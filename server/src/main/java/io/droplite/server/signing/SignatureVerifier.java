package io.droplite.server.signing;

import io.droplite.core.Bytes32;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recovers the secp256k1 signer address from a 65-byte {@code r || s || v} signature.
 * {@code v} may be given as 0/1 or 27/28.
 */
public final class SignatureVerifier {
    private static final Logger log = Logger.getLogger(SignatureVerifier.class.getName());

    // secp256k1 n / 2; signatures with a higher s are malleable duplicates
    private static final BigInteger HALF_CURVE_ORDER =
            new BigInteger("7FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFF5D576E7357A4501DDFE92F46681B20A0", 16);

    private SignatureVerifier() {}

    /**
     * @return lowercase 0x-prefixed signer address, or empty if the signature is
     *         malformed or does not recover to a key
     */
    public static Optional<String> recover(Bytes32 digest, byte[] signature) {
        if (signature == null || signature.length != 65) return Optional.empty();

        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        int v = signature[64] & 0xFF;
        if (v < 27) v += 27;
        if (v != 27 && v != 28) return Optional.empty();

        BigInteger sValue = new BigInteger(1, s);
        if (sValue.signum() == 0 || sValue.compareTo(HALF_CURVE_ORDER) > 0) return Optional.empty();
        if (new BigInteger(1, r).signum() == 0) return Optional.empty();

        try {
            var data = new Sign.SignatureData((byte) v, r, s);
            BigInteger publicKey = Sign.signedMessageHashToKey(digest.toArray(), data);
            return Optional.of("0x" + Keys.getAddress(publicKey).toLowerCase());
        } catch (SignatureException | IllegalArgumentException e) {
            log.log(Level.FINE, "signature recovery failed", e);
            return Optional.empty();
        }
    }
}
