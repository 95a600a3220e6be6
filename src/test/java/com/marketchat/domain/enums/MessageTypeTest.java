package com.marketchat.domain.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageTypeTest {

    @Test
    void fromString_ShouldAcceptNameOrDescIgnoringCase() {
        assertThat(MessageType.fromString("IMAGE")).isEqualTo(MessageType.IMAGE);
        assertThat(MessageType.fromString("voice")).isEqualTo(MessageType.VOICE);
        assertThat(MessageType.fromString("sticker")).isNull();
        assertThat(MessageType.fromString(null)).isNull();
    }

    @Test
    void preview_ShouldUseLabelForMedia() {
        assertThat(MessageType.VIDEO.preview("https://cdn/v.mp4")).isEqualTo("🎥 Video");
        assertThat(MessageType.DOCUMENT.preview("x.pdf")).isEqualTo("📄 Document");
    }

    @Test
    void preview_ShouldTruncateLongText() {
        String text = "a".repeat(150);
        assertThat(MessageType.TEXT.preview(text)).hasSize(100);
        assertThat(MessageType.TEXT.preview("hello")).isEqualTo("hello");
    }
}
