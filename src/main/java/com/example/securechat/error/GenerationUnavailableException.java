package com.example.securechat.error;

/**
 * The generation backend answered with a non-success status, timed out, or
 * could not be reached. Callers of the chat pipeline never see this exception;
 * the pipeline replaces the reply with the configured fallback text.
 */
public class GenerationUnavailableException extends SecureChatException {

    private final int status;

    public GenerationUnavailableException(String message, int status) {
        super(message);
        this.status = status;
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /**
     * @return the HTTP status returned by the backend, or {@code -1} for
     *         transport failures and timeouts
     */
    public int getStatus() {
        return status;
    }

    @Override
    public String getCode() {
        return "upstream_unavailable";
    }
}
