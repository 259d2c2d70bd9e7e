package io.droplite.server.dto;

/**
 * One scored reward row in a rewards file.
 * reward is a base-10 integer string in wei.
 */
public class RewardEntryJson {
    public String user;
    public long points;
    public String reward;
}
