package com.marketchat.domain.dto;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.marketchat.domain.enums.MessageType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * @param messageType 缺省为 text
 * @param content     也接受 text 字段名
 */
public record SendMessageRequest(
        @NotNull(message = "conversationId is required") @Positive Long conversationId,
        @NotNull(message = "senderId is required") @Positive Long senderId,
        String messageType,
        @NotBlank(message = "content is required") @JsonAlias("text") String content,
        String clientMsgId
) {

    public MessageType type() {
        if (StrUtil.isBlank(messageType)) {
            return MessageType.TEXT;
        }
        return MessageType.fromString(messageType);
    }
}
