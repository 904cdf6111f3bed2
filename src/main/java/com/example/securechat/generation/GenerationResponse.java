package com.example.securechat.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Raw backend response: {@code {answer, sources: [{metadata: {source}}]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record GenerationResponse(String answer, List<SourceDocument> sources) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SourceDocument(Map<String, Object> metadata) {

        String source() {
            Object value = metadata == null ? null : metadata.get("source");
            return value == null ? null : value.toString();
        }
    }
}
