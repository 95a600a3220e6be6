package com.marketchat.domain.dto;

import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.enums.MessageType;

import java.time.LocalDateTime;

public record MessageDto(
        Long messageId,
        Long conversationId,
        Long msgSeq,
        Long senderId,
        MessageType messageType,
        String content,
        MessageStatus status,
        String clientMsgId,
        LocalDateTime createdAt
) {

    public static MessageDto from(MessageEntity e) {
        return new MessageDto(e.getId(), e.getConversationId(), e.getMsgSeq(), e.getSenderId(), e.getMsgType(),
                e.getContent(), e.getStatus(), e.getClientMsgId(), e.getCreatedAt());
    }
}
