package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.service.ActiveViewTracker;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * enter_chat / leave_chat。
 *
 * <p>两者都进会话串行队列：与同一会话的 send_message 严格排序，
 * 所以 “enter 之后发来的消息立即 read、leave 之后发来的消息是 delivered” 在本进程内成立。</p>
 */
@Slf4j
@Component
public class WsChatViewHandler {

    private final MessageDeliveryService deliveryService;
    private final ActiveViewTracker activeViewTracker;
    private final SessionRegistry sessionRegistry;
    private final WsPushService pushService;
    private final WsWriter wsWriter;
    private final KeyedSerialExecutor<Long> conversationSerialExecutor;

    public WsChatViewHandler(MessageDeliveryService deliveryService,
                             ActiveViewTracker activeViewTracker,
                             SessionRegistry sessionRegistry,
                             WsPushService pushService,
                             WsWriter wsWriter,
                             @Qualifier("conversationSerialExecutor") KeyedSerialExecutor<Long> conversationSerialExecutor) {
        this.deliveryService = deliveryService;
        this.activeViewTracker = activeViewTracker;
        this.sessionRegistry = sessionRegistry;
        this.pushService = pushService;
        this.wsWriter = wsWriter;
        this.conversationSerialExecutor = conversationSerialExecutor;
    }

    /**
     * 先 markRead（同时校验成员），成功后才登记活跃视图。
     */
    public CompletableFuture<Void> enterChat(Channel ch, long userId, long conversationId) {
        String connId = sessionRegistry.connIdOf(ch);
        return conversationSerialExecutor.run(conversationId, () -> {
            ReadResult result = deliveryService.markRead(conversationId, userId);
            activeViewTracker.enter(userId, conversationId, connId);
            wsWriter.write(ch, WsEvents.ack(WsEvents.ENTER_CHAT_SUCCESS, conversationId));
            if (result.changed()) {
                pushService.pushToUsers(result.participants(), WsEvents.messagesRead(conversationId, userId));
            }
        }).whenComplete((v, err) -> {
            if (err != null) {
                wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
            }
        });
    }

    public CompletableFuture<Void> leaveChat(Channel ch, long userId, long conversationId) {
        return conversationSerialExecutor.run(conversationId, () -> {
            activeViewTracker.leave(userId, conversationId);
            wsWriter.write(ch, WsEvents.ack(WsEvents.LEAVE_CHAT_SUCCESS, conversationId));
        }).whenComplete((v, err) -> {
            if (err != null) {
                wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
            }
        });
    }
}
