package com.example.securechat.generation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire body sent to the generation backend. Contains plaintext; never log it.
 */
public record GenerationRequest(
        @JsonProperty("query") String query,
        @JsonProperty("history") List<HistoryTurn> history,
        @JsonProperty("max_tokens") int maxTokens) {

    public record HistoryTurn(
            @JsonProperty("role") String role,
            @JsonProperty("content") String content) {
    }

    @Override
    public String toString() {
        return "GenerationRequest[queryLength=" + (query == null ? 0 : query.length())
                + ", historyTurns=" + (history == null ? 0 : history.size())
                + ", maxTokens=" + maxTokens + "]";
    }
}
