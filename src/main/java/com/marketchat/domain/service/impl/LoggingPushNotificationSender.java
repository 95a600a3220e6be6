package com.marketchat.domain.service.impl;

import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.enums.MessageType;
import com.marketchat.domain.service.PushNotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * 默认实现：只打日志。接入真实推送通道时替换这个 Bean。
 */
@Slf4j
@Component
public class LoggingPushNotificationSender implements PushNotificationSender {

    static final String TITLE = "New message";

    @Override
    public void sendNewMessage(Collection<Long> recipientIds, MessageEntity message) {
        if (recipientIds == null || recipientIds.isEmpty() || message == null) {
            return;
        }
        String body = preview(message);
        for (Long userId : recipientIds) {
            log.info("push notification: userId={}, title={}, body={}, conversationId={}, messageId={}",
                    userId, TITLE, body, message.getConversationId(), message.getId());
        }
    }

    static String preview(MessageEntity message) {
        MessageType type = message.getMsgType() == null ? MessageType.TEXT : message.getMsgType();
        return type.preview(message.getContent());
    }
}
