package io.stashlite.server.dto;

import java.util.Map;

/**
 * JSON body for POST /queue.
 *   {
 *     "type": "profile-update",
 *     "target": "https://api.example.org/profile",
 *     "method": "PUT",
 *     "headers": { "Content-Type": "application/json" },
 *     "body": "{\"name\":\"x\"}",
 *     "priority": 2,
 *     "maxRetries": 3
 *   }
 * method defaults to POST, priority to 0, maxRetries to 3.
 */
public class QueueRequest {
    public String type;
    public String target;
    public String method;
    public Map<String, String> headers;
    public String body;
    public int priority;
    public Integer maxRetries;
}
