package io.droplite.core.batch;

import io.droplite.core.Bytes32;

import java.math.BigInteger;
import java.util.List;

/**
 * Everything a user needs to redeem their entry: the leaf preimage, its index and proof.
 */
public record ClaimTicket(String user, long points, BigInteger reward, int index, List<Bytes32> proof) {

    public ClaimTicket {
        proof = List.copyOf(proof);
    }
}
