package io.droplite.server.signing;

import io.droplite.core.Bytes32;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Sign;

/**
 * Relayer-side signer producing 65-byte {@code r || s || v} signatures (v = 27/28)
 * over EIP-712 submission digests.
 */
public final class TypedDataSigner {

    private final Credentials credentials;
    private final TypedDataDomain domain;

    public TypedDataSigner(Credentials credentials, TypedDataDomain domain) {
        this.credentials = credentials;
        this.domain = domain;
    }

    public static TypedDataSigner fromPrivateKey(String privateKeyHex, TypedDataDomain domain) {
        return new TypedDataSigner(Credentials.create(privateKeyHex), domain);
    }

    /** Lowercase 0x-prefixed address of the signing key. */
    public String address() {
        return credentials.getAddress().toLowerCase();
    }

    public TypedDataDomain domain() {
        return domain;
    }

    public byte[] sign(SubmissionDigest.Payload payload) {
        return sign(SubmissionDigest.digest(domain, payload));
    }

    public byte[] sign(Bytes32 digest) {
        ECKeyPair keyPair = credentials.getEcKeyPair();
        // false: the digest is already the final hash, do not prefix and re-hash
        Sign.SignatureData sig = Sign.signMessage(digest.toArray(), keyPair, false);
        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }
}
