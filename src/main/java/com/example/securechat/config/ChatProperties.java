package com.example.securechat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings for the encrypted chat store, bound from the {@code chat.*} namespace.
 */
@ConfigurationProperties(prefix = "chat")
public class ChatProperties {

    /** Plaintext substituted when the generation backend cannot answer. */
    private String fallbackMessage =
            "I'm sorry, I'm having trouble connecting right now. Please try again in a moment.";

    private Title title = new Title();
    private Generation generation = new Generation();
    private Crypto crypto = new Crypto();
    private Store store = new Store();

    public String getFallbackMessage() { return fallbackMessage; }
    public void setFallbackMessage(String fallbackMessage) { this.fallbackMessage = fallbackMessage; }

    public Title getTitle() { return title; }
    public void setTitle(Title title) { this.title = title; }

    public Generation getGeneration() { return generation; }
    public void setGeneration(Generation generation) { this.generation = generation; }

    public Crypto getCrypto() { return crypto; }
    public void setCrypto(Crypto crypto) { this.crypto = crypto; }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }

    public static class Title {
        /** Placeholder title of a session nobody has named yet. */
        private String defaultTitle = "New Chat Session";
        /** Longest auto-derived title before the ellipsis is appended. */
        private int maxLength = 50;

        public String getDefaultTitle() { return defaultTitle; }
        public void setDefaultTitle(String defaultTitle) { this.defaultTitle = defaultTitle; }

        public int getMaxLength() { return maxLength; }
        public void setMaxLength(int maxLength) { this.maxLength = maxLength; }
    }

    public static class Generation {
        private String baseUrl = "http://localhost:8001";
        private String path = "/generate";
        private int maxTokens = 512;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
    }

    public static class Crypto {
        /** key id -> base64 encoded 32 byte key. */
        private Map<String, String> keys = new LinkedHashMap<>(Map.of(
                "flutter_app_key", "cGxhY2Vob2xkZXJfa2V5XzMyX2J5dGVzX2xvbmdfZm8="));
        /** Raw UTF-8 key used for any key id not listed in {@link #keys}. */
        private String fallbackKey = "placeholder_key_32_bytes_long_fo";

        public Map<String, String> getKeys() { return keys; }
        public void setKeys(Map<String, String> keys) { this.keys = keys; }

        public String getFallbackKey() { return fallbackKey; }
        public void setFallbackKey(String fallbackKey) { this.fallbackKey = fallbackKey; }
    }

    public static class Store {
        /** {@code jpa} (default) or {@code memory}. */
        private String type = "jpa";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }
}
