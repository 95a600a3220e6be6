package com.marketchat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.List;

/**
 * 下行 JSON 帧。type 即事件名（user_status / new_message / ...），其余字段按事件选填。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WsEnvelope {

    /** 事件名，见 {@link WsEvents}。 */
    public String type;

    public Long userId;

    public Long conversationId;

    /** 服务端消息 id。 */
    public Long messageId;

    /** 客户端幂等 key，只在 message_sent / message_error 回给发送方。 */
    public String clientMsgId;

    public Long senderId;

    /** text / image / video / voice / document */
    public String messageType;

    public String content;

    /** sent / delivered / read */
    public String status;

    public Boolean isOnline;

    /** ISO-8601，离线用户从未上线时为空。 */
    public String lastSeen;

    public Boolean isTyping;

    public Boolean isRecording;

    /** presence_snapshot：每个对端一条 user_status。 */
    public List<WsEnvelope> users;

    /** 错误原因（message_error / error）。 */
    public String error;

    /** 错误分类：unauthorized / not_found / invalid_payload / persistence_failure / transport_failure */
    public String code;

    /** ISO-8601。 */
    public String timestamp;
}
