package io.droplite.storage;

import io.droplite.core.SlotKey;

import java.math.BigInteger;

/**
 * Handle for a claim that has been flagged but not yet committed.
 * While it is outstanding, any further claim for the same (day, category, user)
 * is rejected with ALREADY_CLAIMED.
 */
public record ClaimReservation(SlotKey slot, String user, BigInteger amount) {}
