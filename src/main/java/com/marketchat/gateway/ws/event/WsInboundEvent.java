package com.marketchat.gateway.ws.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 上行事件：按 JSON 里的 type 反序列化成具体的 record，分发前先 {@link #validate()}。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = JoinEvent.class, name = "join"),
        @JsonSubTypes.Type(value = EnterChatEvent.class, name = "enter_chat"),
        @JsonSubTypes.Type(value = LeaveChatEvent.class, name = "leave_chat"),
        @JsonSubTypes.Type(value = SendMessageEvent.class, name = "send_message"),
        @JsonSubTypes.Type(value = TypingEvent.class, name = "typing"),
        @JsonSubTypes.Type(value = RecordingIndicatorEvent.class, name = "recording_indicator"),
        @JsonSubTypes.Type(value = MarkReadEvent.class, name = "mark_read"),
        @JsonSubTypes.Type(value = MarkDeliveredEvent.class, name = "mark_delivered"),
        @JsonSubTypes.Type(value = HeartbeatEvent.class, name = "heartbeat"),
        @JsonSubTypes.Type(value = DisconnectEvent.class, name = "disconnect")
})
public interface WsInboundEvent {

    /**
     * @throws com.marketchat.common.error.ChatException INVALID_PAYLOAD
     */
    default void validate() {
    }

    static long requirePositive(Long id, String reason) {
        if (id == null || id <= 0) {
            throw com.marketchat.common.error.ChatException.invalidPayload(reason);
        }
        return id;
    }
}
