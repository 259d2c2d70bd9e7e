package io.droplite.server.dto;

import java.util.List;

/**
 * JSON body for POST /claims.
 * Example:
 *   {
 *     "day": 100, "category": "CREATE", "subBatch": 0,
 *     "points": 10, "rewardAmount": "500000000000000000",
 *     "index": 0, "proof": [], "caller": "0x..."
 *   }
 */
public class ClaimBody {
    public long day;
    public String category;
    public int subBatch;
    public long points;
    public String rewardAmount;
    public long index;
    public List<String> proof;
    public String caller;
}
