package io.droplite.server.dto;

import java.util.List;

/**
 * JSON response for GET /proofs/{day}/{category}/{user}: everything needed to
 * build a POST /claims body.
 */
public class ProofResponse {
    public long day;
    public String category;
    public int subBatch;
    public String merkleRoot;
    public String user;
    public long points;
    public String reward;
    public int index;
    public List<String> proof;
}
