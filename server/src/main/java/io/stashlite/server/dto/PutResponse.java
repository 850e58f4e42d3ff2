// file: src/main/java/io/stashlite/server/dto/PutResponse.java
package io.stashlite.server.dto;

/**
 * JSON response for PUT /cache/{key}.
 * Example:
 *   {
 *     "ok": true,
 *     "key": "city:42",
 *     "ttlMillis": 60000,
 *     "typeTag": "aqi"
 *   }
 */
public class PutResponse {
    public boolean ok;
    public String key;
    public long ttlMillis;
    public String typeTag;
}
