package io.droplite.server.signing;

import io.droplite.core.Bytes32;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static io.droplite.server.DistributionFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Sign/recover behavior of EIP-712 submission digests.
 */
class TypedDataSignerTest {

    private static final TypedDataDomain DOMAIN =
            new TypedDataDomain("TreeProcessor", "1", 31337, "0x5fbdb2315678afecb367f032d93f642f64180aa3");

    private static SubmissionDigest.Payload payload(BigInteger nonce) {
        return new SubmissionDigest.Payload(100, 0, 0, Bytes32.fromHex("0x" + "12".repeat(32)),
                List.of(ALICE, BOB), List.of(10L, 20L), List.of(HALF_TOKEN, BigInteger.ONE), nonce, NOW + 600);
    }

    @Test
    void signature_recovers_to_signer_address() {
        var signer = TypedDataSigner.fromPrivateKey(RELAYER_KEY, DOMAIN);
        var p = payload(BigInteger.ONE);
        byte[] sig = signer.sign(p);

        assertEquals(65, sig.length);
        assertTrue(sig[64] == 27 || sig[64] == 28);
        assertEquals(signer.address(), SignatureVerifier.recover(SubmissionDigest.digest(DOMAIN, p), sig).orElseThrow());
    }

    @Test
    void v_as_zero_or_one_is_accepted() {
        var signer = TypedDataSigner.fromPrivateKey(RELAYER_KEY, DOMAIN);
        Bytes32 digest = SubmissionDigest.digest(DOMAIN, payload(BigInteger.ONE));
        byte[] sig = signer.sign(digest);
        sig[64] = (byte) (sig[64] - 27);

        assertEquals(signer.address(), SignatureVerifier.recover(digest, sig).orElseThrow());
    }

    @Test
    void any_field_change_moves_the_digest() {
        Bytes32 base = SubmissionDigest.digest(DOMAIN, payload(BigInteger.ONE));
        assertNotEquals(base, SubmissionDigest.digest(DOMAIN, payload(BigInteger.TWO)));

        var otherChain = new TypedDataDomain("TreeProcessor", "1", 1, DOMAIN.verifyingContract());
        assertNotEquals(base, SubmissionDigest.digest(otherChain, payload(BigInteger.ONE)));

        var p = payload(BigInteger.ONE);
        var swappedPoints = new SubmissionDigest.Payload(p.day(), p.category(), p.subBatch(), p.merkleRoot(),
                p.users(), List.of(20L, 10L), p.amounts(), p.nonce(), p.deadline());
        assertNotEquals(base, SubmissionDigest.digest(DOMAIN, swappedPoints));
    }

    @Test
    void signature_over_other_payload_recovers_someone_else() {
        var signer = TypedDataSigner.fromPrivateKey(RELAYER_KEY, DOMAIN);
        byte[] sig = signer.sign(payload(BigInteger.ONE));

        var recovered = SignatureVerifier.recover(SubmissionDigest.digest(DOMAIN, payload(BigInteger.TWO)), sig);
        assertNotEquals(signer.address(), recovered.orElse(null));
    }

    @Test
    void malformed_signatures_do_not_recover() {
        Bytes32 digest = SubmissionDigest.digest(DOMAIN, payload(BigInteger.ONE));
        assertTrue(SignatureVerifier.recover(digest, new byte[64]).isEmpty());
        assertTrue(SignatureVerifier.recover(digest, new byte[65]).isEmpty()); // r = s = 0
        assertTrue(SignatureVerifier.recover(digest, null).isEmpty());

        byte[] sig = TypedDataSigner.fromPrivateKey(RELAYER_KEY, DOMAIN).sign(digest);
        sig[64] = 30;
        assertTrue(SignatureVerifier.recover(digest, sig).isEmpty());
    }

    @Test
    void domain_rejects_bad_contract_address() {
        assertThrows(IllegalArgumentException.class, () -> new TypedDataDomain("x", "1", 1, "0x1234"));
    }
}
