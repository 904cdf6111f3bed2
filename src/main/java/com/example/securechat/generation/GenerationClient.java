package com.example.securechat.generation;

import com.example.securechat.error.GenerationUnavailableException;

/**
 * The backend that turns a plaintext transcript into the assistant's reply.
 */
public interface GenerationClient {

    /**
     * @throws GenerationUnavailableException on a non-success status, timeout or
     *                                        connectivity failure
     */
    GenerationResult generate(GenerationRequest request);
}
