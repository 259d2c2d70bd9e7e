package io.droplite.server.distribution;

import io.droplite.core.Bytes32;
import io.droplite.server.signing.SubmissionDigest;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A relayer's request to finalize one slot.
 * <p>
 * category is the raw uint8 code so that out-of-range values reach the validator.
 * submitter is the authenticated caller; the signer is recovered from signature.
 */
public record Submission(
        long day,
        int category,
        int subBatch,
        Bytes32 root,
        List<String> users,
        List<Long> points,
        List<BigInteger> amounts,
        BigInteger nonce,
        long deadline,
        byte[] signature,
        String submitter
) {
    public Submission {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(nonce, "nonce");
        users = users == null ? List.of() : List.copyOf(users);
        points = points == null ? List.of() : List.copyOf(points);
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
        signature = signature == null ? new byte[0] : signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    /** The fields covered by the signature. */
    public SubmissionDigest.Payload payload() {
        return new SubmissionDigest.Payload(day, category, subBatch, root, users, points, amounts, nonce, deadline);
    }
}
