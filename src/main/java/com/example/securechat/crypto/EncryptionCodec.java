package com.example.securechat.crypto;

import com.example.securechat.domain.EncryptionAlgorithm;
import com.example.securechat.domain.EncryptionMetadata;
import com.example.securechat.error.DecryptionException;
import com.example.securechat.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * AES-256-GCM encryption of single UTF-8 strings. Every call to
 * {@link #encrypt} draws a fresh 96-bit nonce; no associated data is bound.
 */
@Slf4j
@Component
public class EncryptionCodec {

    private final KeyProvider keyProvider;
    private final SecureRandom random;
    private final Clock clock;

    @Autowired
    public EncryptionCodec(KeyProvider keyProvider, Clock clock) {
        this(keyProvider, new SecureRandom(), clock);
    }

    EncryptionCodec(KeyProvider keyProvider, SecureRandom random, Clock clock) {
        this.keyProvider = keyProvider;
        this.random = random;
        this.clock = clock;
    }

    public SecretKey deriveKey(EncryptionMetadata metadata) {
        SecretKey key = keyProvider.resolve(metadata == null ? null : metadata.keyId());
        EncryptionAlgorithm algorithm = requireAlgorithm(metadata);
        if (key.getEncoded() != null && key.getEncoded().length != algorithm.keyLength()) {
            throw new IllegalStateException("Key for key_id '" + metadata.keyId() + "' has the wrong length");
        }
        return key;
    }

    /**
     * Encrypts {@code plaintext} under the key selected by {@code inbound}.
     * The returned metadata keeps the algorithm and key id of {@code inbound}
     * but carries the new nonce and a fresh timestamp.
     */
    public EncryptedPayload encrypt(String plaintext, EncryptionMetadata inbound) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        EncryptionAlgorithm algorithm = requireAlgorithm(inbound);
        SecretKey key = deriveKey(inbound);

        byte[] nonce = new byte[algorithm.nonceLength()];
        random.nextBytes(nonce);

        byte[] ciphertext;
        try {
            Cipher cipher = Cipher.getInstance(algorithm.transformation());
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(algorithm.tagBits(), nonce));
            ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption with " + algorithm.tag() + " failed", e);
        }

        EncryptionMetadata outbound = new EncryptionMetadata(
                algorithm,
                inbound.keyId(),
                Base64.getEncoder().encodeToString(nonce),
                clock.instant().toString());
        log.debug("Encrypted {} plaintext bytes with {} (key_id={})",
                plaintext.length(), algorithm.tag(), inbound.keyId());
        return new EncryptedPayload(ciphertext, outbound);
    }

    /**
     * @throws DecryptionException if the nonce is missing or malformed, or the
     *                             authentication tag does not verify
     */
    public String decrypt(byte[] ciphertext, EncryptionMetadata metadata) {
        EncryptionAlgorithm algorithm = requireAlgorithm(metadata);
        if (!metadata.hasIv()) {
            throw new DecryptionException("No IV found in metadata");
        }
        byte[] nonce;
        try {
            nonce = Base64.getDecoder().decode(metadata.iv().trim());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("IV is not valid base64", e);
        }
        if (nonce.length != algorithm.nonceLength()) {
            throw new DecryptionException(
                    "IV must be " + algorithm.nonceLength() + " bytes but was " + nonce.length);
        }
        if (ciphertext == null || ciphertext.length < algorithm.tagBits() / 8) {
            throw new DecryptionException("Ciphertext is shorter than the authentication tag");
        }

        SecretKey key = deriveKey(metadata);
        try {
            Cipher cipher = Cipher.getInstance(algorithm.transformation());
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(algorithm.tagBits(), nonce));
            return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            log.warn("Authentication tag check failed (key_id={}, {} bytes)", metadata.keyId(), ciphertext.length);
            throw new DecryptionException("Authentication tag verification failed", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption with " + algorithm.tag() + " failed", e);
        }
    }

    private static EncryptionAlgorithm requireAlgorithm(EncryptionMetadata metadata) {
        if (metadata == null) {
            throw new ValidationException("encryption_metadata", "Encryption metadata is required");
        }
        if (metadata.algorithm() == null) {
            throw new ValidationException("algorithm", "Encryption algorithm is required");
        }
        return metadata.algorithm();
    }
}
