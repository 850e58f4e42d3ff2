package io.stashlite.server.dto;

/** JSON response for GET /admin/usage. */
public class UsageResponse {
    public long liveBytes;
    public int liveCount;
    public long expiredBytes;
    public int expiredCount;
    public long limitBytes;
    public String formatted;
}
