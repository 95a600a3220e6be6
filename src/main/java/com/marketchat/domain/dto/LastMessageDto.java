package com.marketchat.domain.dto;

import com.marketchat.domain.entity.ConversationEntity;
import com.marketchat.domain.enums.MessageType;

import java.time.LocalDateTime;

public record LastMessageDto(
        String text,
        MessageType messageType,
        Long senderId,
        LocalDateTime timestamp
) {

    public static LastMessageDto from(ConversationEntity c) {
        if (c == null || c.getLastMessageAt() == null) {
            return null;
        }
        return new LastMessageDto(c.getLastMessageText(), c.getLastMessageType(), c.getLastMessageSenderId(),
                c.getLastMessageAt());
    }
}
