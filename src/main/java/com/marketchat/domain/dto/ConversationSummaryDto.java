package com.marketchat.domain.dto;

import java.time.LocalDateTime;

/**
 * 会话列表项（以请求用户为视角）：对方、商品、最后一条消息、我的未读数。
 */
public record ConversationSummaryDto(
        Long conversationId,
        Long productId,
        Long participantId,
        String participantName,
        LastMessageDto lastMessage,
        int unreadCount,
        LocalDateTime updatedAt
) {
}
