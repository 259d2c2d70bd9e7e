package io.droplite.server.distribution;

/**
 * How a submitted Merkle root is checked against the submitted entries.
 */
public enum RootTrustPolicy {
    /** Rebuild the root from users/points/amounts and require an exact match. */
    REDERIVE,
    /** Accept the root covered by a valid relayer signature as-is. */
    TRUST_SIGNED
}
