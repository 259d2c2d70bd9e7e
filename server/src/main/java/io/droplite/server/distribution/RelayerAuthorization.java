package io.droplite.server.distribution;

/**
 * Role check for relayer addresses.
 */
public interface RelayerAuthorization {

    /** @param address 0x-prefixed address, any case */
    boolean isRelayer(String address);
}
