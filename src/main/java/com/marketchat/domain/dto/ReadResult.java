package com.marketchat.domain.dto;

import java.util.List;

/**
 * markRead 的结果。
 *
 * @param readMessageIds 本次从未读变为 read 的消息
 * @param previousUnread 重置前的未读数
 */
public record ReadResult(
        long conversationId,
        long userId,
        List<Long> participants,
        List<Long> readMessageIds,
        int previousUnread
) {

    /** 有回执被置为 read 或未读数被清零，才需要广播 messages_read。 */
    public boolean changed() {
        return !readMessageIds.isEmpty() || previousUnread > 0;
    }
}
