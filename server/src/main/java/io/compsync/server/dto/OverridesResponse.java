// file: server/src/main/java/io/compsync/server/dto/OverridesResponse.java
package io.compsync.server.dto;

import java.util.Map;

/**
 * JSON response for GET /documents/{id}/instances/{nodeId}/overrides.
 *   {
 *     "documentId": "screen",
 *     "nodeId": "screen:buy",
 *     "componentId": "lib:button",
 *     "componentName": "MyButton",
 *     "componentSetName": null,
 *     "rootKey": "MyButton",
 *     "syncMode": "LIBRARY_WITH_OVERRIDES",
 *     "overrides": { "MyButton": { ... }, "Label": { ... } }
 *   }
 */
public class OverridesResponse {
    public String documentId;
    public String nodeId;
    public String nodeName;
    public String componentId;
    public String componentName;
    public String componentSetName;
    public String rootKey;
    public String syncMode;
    public Map<String, OverrideEntryDto> overrides;
}
