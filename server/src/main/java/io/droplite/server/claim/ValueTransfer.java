package io.droplite.server.claim;

import java.math.BigInteger;

/**
 * Moves reward value out of custody to a claimant.
 * Implementations signal failure by throwing {@link TransferException}.
 */
public interface ValueTransfer {

    void release(String to, BigInteger amount);
}
