package io.droplite.server.distribution;

import io.droplite.core.Addresses;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * In-memory relayer allow-list, seeded from configuration and adjustable at runtime.
 */
public final class StaticRelayerAuthorization implements RelayerAuthorization {
    private static final Logger log = Logger.getLogger(StaticRelayerAuthorization.class.getName());

    private final Set<String> relayers = ConcurrentHashMap.newKeySet();

    public StaticRelayerAuthorization(Collection<String> initial) {
        initial.forEach(this::grant);
    }

    @Override
    public boolean isRelayer(String address) {
        if (address == null) return false;
        try {
            return relayers.contains(Addresses.normalize(address));
        } catch (IllegalArgumentException malformed) {
            return false;
        }
    }

    public void grant(String address) {
        if (relayers.add(Addresses.normalize(address))) {
            log.info("Relayer role granted to " + Addresses.normalize(address));
        }
    }

    public void revoke(String address) {
        if (relayers.remove(Addresses.normalize(address))) {
            log.info("Relayer role revoked from " + Addresses.normalize(address));
        }
    }

    public Set<String> relayers() {
        return Set.copyOf(relayers);
    }
}
