// file: server/src/main/java/io/compsync/server/dto/DocumentOverridesResponse.java
package io.compsync.server.dto;

import java.util.List;

/** JSON response for GET /documents/{id}/overrides: one element per top-level instance. */
public class DocumentOverridesResponse {
    public String documentId;
    public List<OverridesResponse> instances;
}
