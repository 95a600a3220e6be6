package com.marketchat.gateway.ws;

import com.marketchat.gateway.ws.event.DisconnectEvent;
import com.marketchat.gateway.ws.event.EnterChatEvent;
import com.marketchat.gateway.ws.event.HeartbeatEvent;
import com.marketchat.gateway.ws.event.JoinEvent;
import com.marketchat.gateway.ws.event.LeaveChatEvent;
import com.marketchat.gateway.ws.event.MarkDeliveredEvent;
import com.marketchat.gateway.ws.event.MarkReadEvent;
import com.marketchat.gateway.ws.event.RecordingIndicatorEvent;
import com.marketchat.gateway.ws.event.SendMessageEvent;
import com.marketchat.gateway.ws.event.TypingEvent;
import com.marketchat.gateway.ws.event.WsInboundEvent;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 已校验的上行事件 -> 对应处理器。调用方保证 userId 来自握手身份。
 */
@Component
@RequiredArgsConstructor
public class WsEventDispatcher {

    private final WsPresenceService presenceService;
    private final WsChatViewHandler chatViewHandler;
    private final WsSendMessageHandler sendMessageHandler;
    private final WsReceiptHandler receiptHandler;
    private final WsIndicatorHandler indicatorHandler;

    public CompletableFuture<Void> dispatch(Channel ch, long userId, WsInboundEvent event) {
        if (event instanceof JoinEvent e) {
            return presenceService.join(ch, userId, e.userId());
        }
        if (event instanceof HeartbeatEvent e) {
            return presenceService.heartbeat(ch, userId, e.userId());
        }
        if (event instanceof EnterChatEvent e) {
            return chatViewHandler.enterChat(ch, userId, e.conversationId());
        }
        if (event instanceof LeaveChatEvent e) {
            return chatViewHandler.leaveChat(ch, userId, e.conversationId());
        }
        if (event instanceof SendMessageEvent e) {
            return sendMessageHandler.handle(ch, userId, e);
        }
        if (event instanceof MarkReadEvent e) {
            return receiptHandler.markRead(ch, userId, e.conversationId());
        }
        if (event instanceof MarkDeliveredEvent e) {
            return receiptHandler.markDelivered(ch, userId, e.messageId());
        }
        if (event instanceof TypingEvent e) {
            return indicatorHandler.typing(ch, userId, e.conversationId(), e.typing());
        }
        if (event instanceof RecordingIndicatorEvent e) {
            return indicatorHandler.recording(ch, userId, e.conversationId(), e.recording());
        }
        if (event instanceof DisconnectEvent) {
            // 主动断开与网络断开走同一条路径：channelInactive -> 解绑 -> 离线判定
            ch.close();
            return CompletableFuture.completedFuture(null);
        }
        throw new IllegalArgumentException("unsupported event: " + event.getClass().getSimpleName());
    }
}
