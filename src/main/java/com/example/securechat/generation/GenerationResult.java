package com.example.securechat.generation;

import java.util.List;

/**
 * Plaintext answer plus the source citations the backend reported.
 */
public record GenerationResult(String answer, List<String> sources) {

    public GenerationResult {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
