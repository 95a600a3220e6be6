package com.marketchat.domain.dto;

/**
 * 一条 sent -> delivered 的迁移，用于给发送方回 message_delivered。
 */
public record DeliveryReceipt(
        long messageId,
        long conversationId,
        long senderId,
        long recipientId,
        boolean changed
) {
}
