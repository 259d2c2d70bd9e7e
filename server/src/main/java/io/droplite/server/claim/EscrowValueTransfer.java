package io.droplite.server.claim;

import io.droplite.core.Addresses;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custodian holding the reward pool. Released funds are credited to per-user
 * balances; there is no withdrawal back to the operator, so anything never
 * claimed stays in the pool.
 */
public final class EscrowValueTransfer implements ValueTransfer {

    private BigInteger pool;
    private final Map<String, BigInteger> released = new ConcurrentHashMap<>();

    public EscrowValueTransfer(BigInteger initialPool) {
        if (initialPool.signum() < 0) throw new IllegalArgumentException("initialPool must be >= 0");
        this.pool = initialPool;
    }

    @Override
    public synchronized void release(String to, BigInteger amount) {
        if (amount.signum() < 0) throw new IllegalArgumentException("amount must be >= 0");
        if (pool.compareTo(amount) < 0) {
            throw new TransferException("escrow holds " + pool + ", cannot release " + amount);
        }
        pool = pool.subtract(amount);
        released.merge(Addresses.normalize(to), amount, BigInteger::add);
    }

    public synchronized void fund(BigInteger amount) {
        if (amount.signum() <= 0) throw new IllegalArgumentException("amount must be > 0");
        pool = pool.add(amount);
    }

    public synchronized BigInteger pool() {
        return pool;
    }

    public BigInteger releasedTo(String user) {
        return released.getOrDefault(Addresses.normalize(user), BigInteger.ZERO);
    }
}
