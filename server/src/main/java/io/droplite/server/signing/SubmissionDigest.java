package io.droplite.server.signing;

import io.droplite.core.Addresses;
import io.droplite.core.Bytes32;
import org.web3j.crypto.Hash;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static io.droplite.core.merkle.MerkleHashing.uint256;

/**
 * EIP-712 hashing of a tree submission.
 * <p>
 * Struct hash layout follows the typed-data encoding rules: each member is one
 * 32-byte word; dynamic arrays are replaced by keccak256 of their concatenated
 * words. The final digest is {@code keccak256(0x19 0x01 || domainSeparator || structHash)}.
 */
public final class SubmissionDigest {

    public static final String TYPE =
            "TreeSubmission(uint256 day,uint8 category,uint16 subBatch,bytes32 merkleRoot,"
                    + "address[] users,uint256[] points,uint256[] amounts,uint256 nonce,uint256 deadline)";

    private static final byte[] TYPE_HASH = Hash.sha3(TYPE.getBytes(StandardCharsets.UTF_8));

    private SubmissionDigest() {}

    /** Fields covered by the relayer's signature. */
    public record Payload(
            long day,
            int category,
            int subBatch,
            Bytes32 merkleRoot,
            List<String> users,
            List<Long> points,
            List<BigInteger> amounts,
            BigInteger nonce,
            long deadline
    ) {}

    public static Bytes32 structHash(Payload p) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(10 * 32);
        buf.writeBytes(TYPE_HASH);
        buf.writeBytes(uint256(BigInteger.valueOf(p.day())));
        buf.writeBytes(uint256(BigInteger.valueOf(p.category() & 0xFF)));
        buf.writeBytes(uint256(BigInteger.valueOf(p.subBatch() & 0xFFFF)));
        buf.writeBytes(p.merkleRoot().toArray());
        buf.writeBytes(addressArrayHash(p.users()));
        buf.writeBytes(uintArrayHash(p.points().stream().map(BigInteger::valueOf).toList()));
        buf.writeBytes(uintArrayHash(p.amounts()));
        buf.writeBytes(uint256(p.nonce()));
        buf.writeBytes(uint256(BigInteger.valueOf(p.deadline())));
        return Bytes32.wrap(Hash.sha3(buf.toByteArray()));
    }

    public static Bytes32 digest(TypedDataDomain domain, Payload p) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(2 + 64);
        buf.write(0x19);
        buf.write(0x01);
        buf.writeBytes(domain.separator().toArray());
        buf.writeBytes(structHash(p).toArray());
        return Bytes32.wrap(Hash.sha3(buf.toByteArray()));
    }

    /** Address left-padded to a 32-byte word. */
    static byte[] addressWord(String address) {
        byte[] word = new byte[32];
        System.arraycopy(Addresses.toBytes(address), 0, word, 12, 20);
        return word;
    }

    private static byte[] addressArrayHash(List<String> users) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(users.size() * 32);
        for (String u : users) buf.writeBytes(addressWord(u));
        return Hash.sha3(buf.toByteArray());
    }

    private static byte[] uintArrayHash(List<BigInteger> values) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(values.size() * 32);
        for (BigInteger v : values) buf.writeBytes(uint256(v));
        return Hash.sha3(buf.toByteArray());
    }
}
