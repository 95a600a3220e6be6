package com.marketchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息内容类型（t_message.msg_type）。content 对核心来说是不透明的（文本或媒体 URL）。
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text", null),
    IMAGE(2, "image", "📷 Photo"),
    VIDEO(3, "video", "🎥 Video"),
    VOICE(4, "voice", "🎵 Voice message"),
    DOCUMENT(5, "document", "📄 Document");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    /** 会话列表/推送里显示的预览；文本消息用正文本身。 */
    private final String previewLabel;

    /**
     * 协议层字符串（"TEXT" / "text"）转枚举，无法识别返回 null。
     */
    public static MessageType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MessageType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }

    public String preview(String content) {
        if (previewLabel != null) {
            return previewLabel;
        }
        if (content == null || content.isBlank()) {
            return "Message";
        }
        return content.length() <= 100 ? content : content.substring(0, 100);
    }
}
