// file: server/src/main/java/io/compsync/server/dto/OverrideEntryDto.java
package io.compsync.server.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * One override entry.
 *   {
 *     "style":   { "FILLS": [ ... ], "OPACITY": 0.5 },
 *     "content": { "kind": "TEXT", "replaced": false, "changes": { "TEXT": "Buy now" } }
 *   }
 * Either side is omitted when it carries no change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OverrideEntryDto {
    public Map<String, Object> style;
    public Content content;

    public static class Content {
        public String kind;
        public boolean replaced;
        public Map<String, Object> changes;
    }
}
