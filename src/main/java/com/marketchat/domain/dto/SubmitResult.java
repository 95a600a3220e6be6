package com.marketchat.domain.dto;

import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.enums.MessageStatus;

import java.util.List;
import java.util.Map;

/**
 * submit 的结果：已落库的消息、会话成员、每个接收方落库后的回执状态。
 *
 * @param duplicate true 表示同一 sender 的 clientMsgId 重复提交，返回的是已存在的消息，没有新的副作用
 */
public record SubmitResult(
        MessageEntity message,
        List<Long> participants,
        Map<Long, MessageStatus> recipientStatuses,
        boolean duplicate
) {

    public List<Long> recipientsWith(MessageStatus status) {
        return recipientStatuses.entrySet().stream()
                .filter(e -> e.getValue() == status)
                .map(Map.Entry::getKey)
                .toList();
    }
}
