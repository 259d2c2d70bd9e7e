package io.droplite.server.dto;

import io.droplite.core.DistributionRecord;

import java.math.BigInteger;

/**
 * JSON view of a finalized distribution record.
 */
public class DistributionResponse {
    public long day;
    public String category;
    public int subBatch;
    public String merkleRoot;
    public int userCount;
    public String totalReward;
    public String claimedTotal;
    public boolean finalized;
    public long createdAt;
    public String relayer;

    public static DistributionResponse of(DistributionRecord r, BigInteger claimed) {
        var dto = new DistributionResponse();
        dto.day = r.slot().day();
        dto.category = r.slot().category().name();
        dto.subBatch = r.slot().subBatch();
        dto.merkleRoot = r.root().toHex();
        dto.userCount = r.userCount();
        dto.totalReward = r.totalReward().toString();
        dto.claimedTotal = claimed.toString();
        dto.finalized = r.finalized();
        dto.createdAt = r.createdAt();
        dto.relayer = r.relayer();
        return dto;
    }
}
