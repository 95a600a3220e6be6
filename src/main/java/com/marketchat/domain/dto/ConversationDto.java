package com.marketchat.domain.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 会话详情：成员 + 每个成员的未读数。
 */
public record ConversationDto(
        Long id,
        Long productId,
        List<Long> participants,
        Map<Long, Integer> unreadCounts,
        LastMessageDto lastMessage,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
}
