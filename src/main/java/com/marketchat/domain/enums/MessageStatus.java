package com.marketchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Collection;

/**
 * 消息状态（t_message.status / t_message_receipt.status）。
 *
 * <p>数字严格递增：sent(0) &lt; delivered(1) &lt; read(2)。落库统一用 {@code greatest(status, ?)}，
 * 所以迟到的 delivered 不会把 read 覆盖回去。</p>
 */
@Getter
@RequiredArgsConstructor
public enum MessageStatus {

    SENT(0, "sent"),
    DELIVERED(1, "delivered"),
    READ(2, "read");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    public boolean isAtLeast(MessageStatus other) {
        return other == null || code >= other.code;
    }

    public static MessageStatus max(MessageStatus a, MessageStatus b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.code >= b.code ? a : b;
    }

    /**
     * 消息汇总状态：所有接收方回执里最低的那个；没有接收方时为 sent。
     */
    public static MessageStatus lowest(Collection<MessageStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return SENT;
        }
        MessageStatus min = READ;
        for (MessageStatus s : statuses) {
            if (s != null && s.code < min.code) {
                min = s;
            }
        }
        return min;
    }
}
