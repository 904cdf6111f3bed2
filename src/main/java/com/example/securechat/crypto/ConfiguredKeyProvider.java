package com.example.securechat.crypto;

import com.example.securechat.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static key table read from {@code chat.crypto.*}. Known key ids map to their
 * configured key; every other id gets the fallback key.
 *
 * <p>This is a stand-in for a key-management integration, not a secret store.</p>
 */
@Slf4j
@Component
public class ConfiguredKeyProvider implements KeyProvider {

    static final int KEY_LENGTH = 32;
    private static final String AES = "AES";

    private final Map<String, SecretKey> keys;
    private final SecretKey fallbackKey;

    public ConfiguredKeyProvider(ChatProperties properties) {
        ChatProperties.Crypto crypto = properties.getCrypto();
        Map<String, SecretKey> table = new LinkedHashMap<>();
        crypto.getKeys().forEach((id, b64) -> table.put(id, toKey(id, decode(id, b64))));
        this.keys = Map.copyOf(table);
        String fallback = crypto.getFallbackKey();
        if (fallback == null) {
            throw new IllegalStateException("chat.crypto.fallback-key must be set");
        }
        this.fallbackKey = toKey("<fallback>", fallback.getBytes(StandardCharsets.UTF_8));
        log.info("Key provider ready: {} configured key id(s) {}", keys.size(), keys.keySet());
    }

    @Override
    public SecretKey resolve(String keyId) {
        SecretKey key = keyId == null ? null : keys.get(keyId);
        if (key == null) {
            log.warn("Using placeholder key for key_id: {}", keyId);
            return fallbackKey;
        }
        return key;
    }

    private static byte[] decode(String id, String b64) {
        try {
            return Base64.getDecoder().decode(b64 == null ? "" : b64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Key '" + id + "' is not valid base64", e);
        }
    }

    private static SecretKey toKey(String id, byte[] raw) {
        if (raw.length != KEY_LENGTH) {
            throw new IllegalStateException(
                    "Key '" + id + "' must be " + KEY_LENGTH + " bytes but was " + raw.length);
        }
        return new SecretKeySpec(raw, AES);
    }
}
