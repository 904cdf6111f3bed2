package com.example.securechat.crypto;

import com.example.securechat.config.ChatProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredKeyProviderTest {

    @Test
    void knownKeyIdResolvesToConfiguredKey() {
        ChatProperties props = new ChatProperties();
        byte[] custom = "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);
        props.getCrypto().setKeys(Map.of("device-1", Base64.getEncoder().encodeToString(custom)));

        ConfiguredKeyProvider provider = new ConfiguredKeyProvider(props);

        assertThat(provider.resolve("device-1").getEncoded()).isEqualTo(custom);
        assertThat(provider.resolve("device-1").getAlgorithm()).isEqualTo("AES");
    }

    @Test
    void unknownAndMissingKeyIdsFallBackToPlaceholder() {
        ConfiguredKeyProvider provider = new ConfiguredKeyProvider(new ChatProperties());
        byte[] placeholder = "placeholder_key_32_bytes_long_fo".getBytes(StandardCharsets.UTF_8);

        assertThat(provider.resolve("someone-else").getEncoded()).isEqualTo(placeholder);
        assertThat(provider.resolve(null).getEncoded()).isEqualTo(placeholder);
    }

    @Test
    void defaultClientKeyIsThirtyTwoBytes() {
        ConfiguredKeyProvider provider = new ConfiguredKeyProvider(new ChatProperties());
        assertThat(provider.resolve("flutter_app_key").getEncoded()).hasSize(32);
    }

    @Test
    void wrongLengthKeyFailsAtStartup() {
        ChatProperties props = new ChatProperties();
        props.getCrypto().setKeys(Map.of("short", Base64.getEncoder().encodeToString(new byte[16])));

        assertThatThrownBy(() -> new ConfiguredKeyProvider(props))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    @Test
    void nonBase64KeyFailsAtStartup() {
        ChatProperties props = new ChatProperties();
        props.getCrypto().setKeys(Map.of("bad", "not base64 at all!"));

        assertThatThrownBy(() -> new ConfiguredKeyProvider(props))
                .isInstanceOf(IllegalStateException.class);
    }
}
