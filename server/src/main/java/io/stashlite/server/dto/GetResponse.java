// file: src/main/java/io/stashlite/server/dto/GetResponse.java
package io.stashlite.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON response for GET /cache/{key}.
 * When the key is live:
 *   {
 *     "found": true,
 *     "key": "city:42",
 *     "value": { "aqi": 35 }
 *   }
 * On a miss (absent, expired or unreadable):
 *   {
 *     "found": false
 *   }
 */
public class GetResponse {
    public boolean found;
    public String key;
    public JsonNode value;
}
