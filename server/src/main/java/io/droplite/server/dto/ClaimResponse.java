package io.droplite.server.dto;

/**
 * JSON response for a successful POST /claims.
 */
public class ClaimResponse {
    public boolean ok;
    public long day;
    public String category;
    public int subBatch;
    public String user;
    public String amount;
    public long claimedAt;
}
