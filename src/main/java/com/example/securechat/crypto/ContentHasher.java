package com.example.securechat.crypto;

import com.example.securechat.error.IntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * SHA-256 content hash over ciphertext bytes exactly as stored.
 * Checked independently of the AEAD tag so corruption is caught before decrypting.
 */
@Slf4j
@Component
public class ContentHasher {

    private static final MessageDigest SHA256_DIGEST;

    static {
        try {
            SHA256_DIGEST = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * @return 64 lower-case hex characters
     */
    public String computeHash(byte[] ciphertext) {
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext must not be null");
        }
        // MessageDigest is not thread-safe; work on a clone of the prototype
        try {
            MessageDigest digest = (MessageDigest) SHA256_DIGEST.clone();
            return HexFormat.of().formatHex(digest.digest(ciphertext));
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("SHA-256 MessageDigest cannot be cloned", e);
        }
    }

    public boolean verifyHash(byte[] ciphertext, String claimedHash) {
        if (ciphertext == null || claimedHash == null || claimedHash.isBlank()) {
            return false;
        }
        byte[] expected = computeHash(ciphertext).getBytes(StandardCharsets.US_ASCII);
        byte[] claimed = claimedHash.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, claimed);
    }

    /**
     * @throws IntegrityException when the hash does not match
     */
    public void requireValid(byte[] ciphertext, String claimedHash, String what) {
        if (!verifyHash(ciphertext, claimedHash)) {
            log.warn("Content hash mismatch for {} ({} bytes)", what, ciphertext == null ? 0 : ciphertext.length);
            throw new IntegrityException("Content hash verification failed for " + what);
        }
    }
}
