package com.marketchat.domain.service;

import com.marketchat.domain.entity.MessageEntity;

import java.util.Collection;

/**
 * 离线推送（FCM/APNs 等）的出口。投递引擎提交后，对回执仍为 sent 的接收方调用。
 *
 * <p>实现必须自己吞掉并记录推送失败：推送是尽力而为，不影响消息本身。</p>
 */
public interface PushNotificationSender {

    void sendNewMessage(Collection<Long> recipientIds, MessageEntity message);
}
