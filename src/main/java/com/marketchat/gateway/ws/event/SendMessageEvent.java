package com.marketchat.gateway.ws.event;

import cn.hutool.core.util.StrUtil;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.enums.MessageType;

/**
 * @param messageType 缺省为 text
 * @param senderId    可选；带了就必须与握手身份一致
 */
public record SendMessageEvent(
        Long conversationId,
        String messageType,
        String content,
        String clientMsgId,
        Long senderId
) implements WsInboundEvent {

    @Override
    public void validate() {
        WsInboundEvent.requirePositive(conversationId, "missing_conversation_id");
        if (StrUtil.isBlank(content)) {
            throw ChatException.invalidPayload("missing_content");
        }
        if (type() == null) {
            throw ChatException.invalidPayload("invalid_message_type");
        }
    }

    public MessageType type() {
        if (StrUtil.isBlank(messageType)) {
            return MessageType.TEXT;
        }
        return MessageType.fromString(messageType);
    }
}
