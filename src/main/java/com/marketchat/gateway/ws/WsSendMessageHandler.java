package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.SubmitResult;
import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.enums.MessageType;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.domain.service.PushNotificationSender;
import com.marketchat.gateway.ws.event.SendMessageEvent;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * send_message：落库 -> 回 message_sent -> 扇出 new_message -> 回 message_delivered / message_read。
 *
 * <p>落库与扇出在同一个会话串行任务里：同一会话的 new_message 按 msgSeq 顺序到达接收方。
 * HTTP 发消息（POST /messages）也走 {@link #send}。</p>
 */
@Slf4j
@Component
public class WsSendMessageHandler {

    private final MessageDeliveryService deliveryService;
    private final PushNotificationSender pushNotificationSender;
    private final WsPushService pushService;
    private final WsWriter wsWriter;
    private final KeyedSerialExecutor<Long> conversationSerialExecutor;
    private final Executor pushExecutor;

    public WsSendMessageHandler(MessageDeliveryService deliveryService,
                                PushNotificationSender pushNotificationSender,
                                WsPushService pushService,
                                WsWriter wsWriter,
                                @Qualifier("conversationSerialExecutor") KeyedSerialExecutor<Long> conversationSerialExecutor,
                                @Qualifier("imPushExecutor") Executor pushExecutor) {
        this.deliveryService = deliveryService;
        this.pushNotificationSender = pushNotificationSender;
        this.pushService = pushService;
        this.wsWriter = wsWriter;
        this.conversationSerialExecutor = conversationSerialExecutor;
        this.pushExecutor = pushExecutor;
    }

    public CompletableFuture<Void> handle(Channel ch, long userId, SendMessageEvent event) {
        if (event.senderId() != null && event.senderId() != userId) {
            wsWriter.writeError(ch, WsEvents.MESSAGE_ERROR, ChatException.unauthorized("sender_mismatch"),
                    null, event.clientMsgId());
            return CompletableFuture.completedFuture(null);
        }
        return send(event.conversationId(), userId, event.type(), event.content(), event.clientMsgId(), ch)
                .<Void>thenApply(r -> null)
                .whenComplete((v, err) -> {
                    if (err != null) {
                        wsWriter.writeFailure(ch, WsEvents.MESSAGE_ERROR, err, null, event.clientMsgId());
                    }
                });
    }

    /**
     * @param origin 发起的 WS 连接；为 null（HTTP 入口）时发送方的回执推给他的所有连接
     */
    public CompletableFuture<SubmitResult> send(long conversationId, long senderId, MessageType type, String content,
                                                String clientMsgId, Channel origin) {
        return conversationSerialExecutor.submit(conversationId, () -> {
            SubmitResult result = deliveryService.submit(conversationId, senderId, type, content, clientMsgId);
            if (!result.duplicate()) {
                result = promoteConnected(result);
            }
            fanOut(origin, senderId, result);
            return result;
        });
    }

    /**
     * 落库时按 online 标记判成 sent、但实际上有活连接的接收方（已握手、join 还没处理完），
     * 这里补成 delivered，否则要等他下次 join 才会推进。
     */
    private SubmitResult promoteConnected(SubmitResult result) {
        List<Long> sent = result.recipientsWith(MessageStatus.SENT);
        if (sent.isEmpty()) {
            return result;
        }
        MessageEntity msg = result.message();
        Map<Long, MessageStatus> statuses = new LinkedHashMap<>(result.recipientStatuses());
        boolean changed = false;
        for (Long recipientId : sent) {
            if (!pushService.isConnected(recipientId)) {
                continue;
            }
            DeliveryReceipt r = deliveryService.markDelivered(msg.getId(), recipientId);
            if (r.changed()) {
                statuses.put(recipientId, MessageStatus.DELIVERED);
                changed = true;
            }
        }
        if (!changed) {
            return result;
        }
        msg.setStatus(MessageStatus.lowest(statuses.values()));
        return new SubmitResult(msg, result.participants(), statuses, false);
    }

    private void fanOut(Channel origin, long senderId, SubmitResult result) {
        MessageEntity msg = result.message();
        toSender(origin, senderId, WsEvents.messageSent(msg));

        if (!result.duplicate()) {
            for (Map.Entry<Long, MessageStatus> e : result.recipientStatuses().entrySet()) {
                pushService.pushToUser(e.getKey(), WsEvents.newMessage(msg, e.getValue()));
            }
        }

        // 发给发送方的状态以汇总状态为准：任一接收方还是 sent 就不回 delivered
        MessageStatus aggregate = msg.getStatus();
        if (aggregate != null && aggregate != MessageStatus.SENT) {
            toSender(origin, senderId, WsEvents.messageStatus(msg.getId(), msg.getConversationId(), aggregate));
        }

        if (!result.duplicate()) {
            List<Long> offline = result.recipientsWith(MessageStatus.SENT);
            if (!offline.isEmpty()) {
                notifyOffline(offline, msg);
            }
        }
    }

    private void toSender(Channel origin, long senderId, WsEnvelope envelope) {
        if (origin != null) {
            wsWriter.write(origin, envelope);
        } else {
            pushService.pushToUser(senderId, envelope);
        }
    }

    private void notifyOffline(List<Long> recipients, MessageEntity msg) {
        try {
            pushExecutor.execute(() -> {
                try {
                    pushNotificationSender.sendNewMessage(recipients, msg);
                } catch (Exception e) {
                    log.warn("push notification failed: messageId={}, err={}", msg.getId(), e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("push notification rejected: messageId={}, recipients={}", msg.getId(), recipients.size());
        }
    }
}
