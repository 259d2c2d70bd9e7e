package io.droplite.server.dto;

import com.fasterxml.jackson.annotation.JsonMerge;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of the distribution policy file.
 * Caps and escrow funding are decimal token amounts (18 decimals), e.g. "1.49".
 */
public class JsonDistributionConfig {
    @JsonMerge
    public Domain domain;
    public int maxBatchSize;
    @JsonMerge
    public Map<String, String> dailyCaps;
    public List<String> relayers;
    public String rootPolicy;
    public String escrowFunding;
    public long schedulerIntervalSeconds;
    public long walRotateBytes;
    public int snapshotEveryOps;

    public static class Domain {
        public String name;
        public String version;
        public long chainId;
        public String verifyingContract;
    }
}
