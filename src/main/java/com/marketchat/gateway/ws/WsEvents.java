package com.marketchat.gateway.ws;

import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.enums.MessageStatus;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 下行事件名与构造方法。
 */
public final class WsEvents {

    public static final String USER_STATUS = "user_status";
    public static final String PRESENCE_SNAPSHOT = "presence_snapshot";
    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_SENT = "message_sent";
    public static final String MESSAGE_DELIVERED = "message_delivered";
    public static final String MESSAGE_READ = "message_read";
    public static final String MESSAGES_READ = "messages_read";
    public static final String USER_TYPING = "user_typing";
    public static final String RECORDING_INDICATOR = "recording_indicator";
    public static final String ENTER_CHAT_SUCCESS = "enter_chat_success";
    public static final String LEAVE_CHAT_SUCCESS = "leave_chat_success";
    public static final String MARK_READ_SUCCESS = "mark_read_success";
    public static final String MESSAGE_ERROR = "message_error";
    public static final String ERROR = "error";

    private WsEvents() {
    }

    public static WsEnvelope userStatus(UserPresenceDto presence) {
        WsEnvelope env = new WsEnvelope();
        env.type = USER_STATUS;
        env.userId = presence.userId();
        env.isOnline = presence.online();
        env.lastSeen = iso(presence.lastSeen());
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope presenceSnapshot(Collection<UserPresenceDto> peers) {
        List<WsEnvelope> users = new ArrayList<>(peers.size());
        for (UserPresenceDto p : peers) {
            users.add(userStatus(p));
        }
        WsEnvelope env = new WsEnvelope();
        env.type = PRESENCE_SNAPSHOT;
        env.users = users;
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope newMessage(MessageEntity msg, MessageStatus status) {
        WsEnvelope env = new WsEnvelope();
        env.type = NEW_MESSAGE;
        env.messageId = msg.getId();
        env.conversationId = msg.getConversationId();
        env.senderId = msg.getSenderId();
        env.messageType = msg.getMsgType() == null ? null : msg.getMsgType().getDesc();
        env.content = msg.getContent();
        env.status = status == null ? null : status.getDesc();
        env.timestamp = iso(msg.getCreatedAt());
        return env;
    }

    public static WsEnvelope messageSent(MessageEntity msg) {
        WsEnvelope env = new WsEnvelope();
        env.type = MESSAGE_SENT;
        env.messageId = msg.getId();
        env.clientMsgId = msg.getClientMsgId();
        env.conversationId = msg.getConversationId();
        env.status = MessageStatus.SENT.getDesc();
        env.timestamp = iso(msg.getCreatedAt());
        return env;
    }

    /**
     * message_delivered / message_read（发给发送方）。
     */
    public static WsEnvelope messageStatus(long messageId, long conversationId, MessageStatus status) {
        WsEnvelope env = new WsEnvelope();
        env.type = status == MessageStatus.READ ? MESSAGE_READ : MESSAGE_DELIVERED;
        env.messageId = messageId;
        env.conversationId = conversationId;
        env.status = status.getDesc();
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope messagesRead(long conversationId, long userId) {
        WsEnvelope env = new WsEnvelope();
        env.type = MESSAGES_READ;
        env.conversationId = conversationId;
        env.userId = userId;
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope userTyping(long conversationId, long userId, boolean typing) {
        WsEnvelope env = new WsEnvelope();
        env.type = USER_TYPING;
        env.conversationId = conversationId;
        env.userId = userId;
        env.isTyping = typing;
        return env;
    }

    public static WsEnvelope recordingIndicator(long conversationId, long userId, boolean recording) {
        WsEnvelope env = new WsEnvelope();
        env.type = RECORDING_INDICATOR;
        env.conversationId = conversationId;
        env.userId = userId;
        env.isRecording = recording;
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope ack(String type, Long conversationId) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.conversationId = conversationId;
        env.timestamp = now();
        return env;
    }

    public static WsEnvelope error(String type, ChatException e, Long messageId, String clientMsgId) {
        WsEnvelope env = new WsEnvelope();
        env.type = type;
        env.error = e.getMessage() == null || e.getMessage().isBlank() ? e.getErrorCode().getCode() : e.getMessage();
        env.code = e.getErrorCode().getCode();
        env.messageId = messageId;
        env.clientMsgId = clientMsgId;
        env.timestamp = now();
        return env;
    }

    static String now() {
        return Instant.now().toString();
    }

    static String iso(LocalDateTime t) {
        if (t == null) {
            return null;
        }
        return t.atZone(ZoneId.systemDefault()).toInstant().toString();
    }
}
