package io.droplite.server.dto;

import java.util.List;

/**
 * JSON body for POST /distributions.
 * Example:
 *   {
 *     "day": 100, "category": "CREATE", "subBatch": 0,
 *     "merkleRoot": "0x...", "users": ["0x..."], "points": [10],
 *     "amounts": ["500000000000000000"], "nonce": "1", "deadline": 8640600,
 *     "signature": "0x...65 bytes", "submitter": "0x..."
 *   }
 * category accepts the name or the numeric code; amounts and nonce are base-10 strings.
 */
public class SubmitRequest {
    public long day;
    public String category;
    public int subBatch;
    public String merkleRoot;
    public List<String> users;
    public List<Long> points;
    public List<String> amounts;
    public String nonce;
    public long deadline;
    public String signature;
    public String submitter;
}
