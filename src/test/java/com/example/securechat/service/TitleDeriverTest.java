package com.example.securechat.service;

import com.example.securechat.config.ChatProperties;
import com.example.securechat.domain.ChatSession;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleDeriverTest {

    private final TitleDeriver deriver = new TitleDeriver(new ChatProperties());

    @Test
    void shortTextIsUsedAsIs() {
        assertThat(deriver.derive("Hi")).isEqualTo("Hi");
    }

    @Test
    void longTextIsCutWithEllipsis() {
        String text = "x".repeat(80);
        assertThat(deriver.derive(text)).isEqualTo("x".repeat(50) + "...");
    }

    @Test
    void textOfExactlyMaxLengthHasNoEllipsis() {
        String text = "y".repeat(50);
        assertThat(deriver.derive(text)).isEqualTo(text);
    }

    @Test
    void whitespaceIsCollapsed() {
        assertThat(deriver.derive("  hello \n\n  world\t ")).isEqualTo("hello world");
    }

    @Test
    void blankTextYieldsNoTitle() {
        assertThat(deriver.derive("   ")).isNull();
        assertThat(deriver.derive(null)).isNull();
    }

    @Test
    void maxLengthIsConfigurable() {
        ChatProperties props = new ChatProperties();
        props.getTitle().setMaxLength(5);
        assertThat(new TitleDeriver(props).derive("abcdefgh")).isEqualTo("abcde...");
    }

    @Test
    void configuredLengthIsCappedToTheTitleColumn() {
        ChatProperties properties = new ChatProperties();
        properties.getTitle().setMaxLength(10_000);

        String title = new TitleDeriver(properties).derive("z".repeat(1_000));

        assertThat(title).hasSize(ChatSession.MAX_TITLE_LENGTH).endsWith("...");
    }
}
