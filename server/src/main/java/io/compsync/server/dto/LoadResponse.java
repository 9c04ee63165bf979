// file: server/src/main/java/io/compsync/server/dto/LoadResponse.java
package io.compsync.server.dto;

/**
 * JSON response for PUT /documents/{id}.
 *   {
 *     "documentId": "screen",
 *     "nodes": 42,
 *     "instances": 3
 *   }
 */
public class LoadResponse {
    public String documentId;
    public int nodes;
    public int instances;
}
