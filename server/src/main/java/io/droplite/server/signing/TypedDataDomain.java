package io.droplite.server.signing;

import io.droplite.core.Addresses;
import io.droplite.core.Bytes32;
import org.web3j.crypto.Hash;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.droplite.core.merkle.MerkleHashing.uint256;

/**
 * EIP-712 domain binding signatures to one deployment:
 * {@code EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)}.
 */
public record TypedDataDomain(String name, String version, long chainId, String verifyingContract) {

    static final String TYPE = "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    public TypedDataDomain {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        verifyingContract = Addresses.normalize(verifyingContract);
        if (chainId <= 0) throw new IllegalArgumentException("chainId must be > 0");
    }

    public Bytes32 separator() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(5 * 32);
        buf.writeBytes(Hash.sha3(TYPE.getBytes(StandardCharsets.UTF_8)));
        buf.writeBytes(Hash.sha3(name.getBytes(StandardCharsets.UTF_8)));
        buf.writeBytes(Hash.sha3(version.getBytes(StandardCharsets.UTF_8)));
        buf.writeBytes(uint256(BigInteger.valueOf(chainId)));
        buf.writeBytes(SubmissionDigest.addressWord(verifyingContract));
        return Bytes32.wrap(Hash.sha3(buf.toByteArray()));
    }
}
