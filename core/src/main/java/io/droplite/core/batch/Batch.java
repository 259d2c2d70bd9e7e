package io.droplite.core.batch;

import io.droplite.core.Addresses;
import io.droplite.core.Bytes32;
import io.droplite.core.RewardEntry;
import io.droplite.core.SlotKey;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed batch for one slot: its root plus a claim ticket for every included user.
 * Instances are immutable.
 */
public final class Batch {
    private final SlotKey slot;
    private final Bytes32 root;
    private final int depth;
    private final List<RewardEntry> entries;
    private final Map<String, ClaimTicket> tickets;
    private final BigInteger totalReward;

    Batch(SlotKey slot, Bytes32 root, int depth, List<RewardEntry> entries, List<ClaimTicket> tickets) {
        this.slot = slot;
        this.root = root;
        this.depth = depth;
        this.entries = List.copyOf(entries);
        Map<String, ClaimTicket> byUser = new LinkedHashMap<>();
        for (ClaimTicket t : tickets) byUser.put(t.user(), t);
        this.tickets = Collections.unmodifiableMap(byUser);
        this.totalReward = entries.stream().map(RewardEntry::reward).reduce(BigInteger.ZERO, BigInteger::add);
    }

    public SlotKey slot() { return slot; }

    public Bytes32 root() { return root; }

    public int depth() { return depth; }

    public int size() { return entries.size(); }

    public List<RewardEntry> entries() { return entries; }

    public BigInteger totalReward() { return totalReward; }

    /** Ticket for a user, looked up by normalized address. */
    public Optional<ClaimTicket> ticket(String user) {
        return Optional.ofNullable(tickets.get(Addresses.normalize(user)));
    }

    public List<ClaimTicket> tickets() {
        return new ArrayList<>(tickets.values());
    }

    public List<String> users() {
        return entries.stream().map(RewardEntry::user).toList();
    }

    public List<Long> points() {
        return entries.stream().map(RewardEntry::points).toList();
    }

    public List<BigInteger> amounts() {
        return entries.stream().map(RewardEntry::reward).toList();
    }
}
