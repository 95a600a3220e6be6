package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.service.MessageDeliveryService;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * mark_read / mark_delivered。
 */
@Slf4j
@Component
public class WsReceiptHandler {

    private final MessageDeliveryService deliveryService;
    private final WsPushService pushService;
    private final WsWriter wsWriter;
    private final KeyedSerialExecutor<Long> conversationSerialExecutor;
    private final Executor dbExecutor;

    public WsReceiptHandler(MessageDeliveryService deliveryService,
                            WsPushService pushService,
                            WsWriter wsWriter,
                            @Qualifier("conversationSerialExecutor") KeyedSerialExecutor<Long> conversationSerialExecutor,
                            @Qualifier("imDbExecutor") Executor dbExecutor) {
        this.deliveryService = deliveryService;
        this.pushService = pushService;
        this.wsWriter = wsWriter;
        this.conversationSerialExecutor = conversationSerialExecutor;
        this.dbExecutor = dbExecutor;
    }

    /**
     * 总是回 mark_read_success；只有确实有变化时才广播一次 messages_read。
     */
    public CompletableFuture<Void> markRead(Channel ch, long userId, long conversationId) {
        return readAndBroadcast(conversationId, userId)
                .thenAccept(r -> wsWriter.write(ch, WsEvents.ack(WsEvents.MARK_READ_SUCCESS, conversationId)))
                .whenComplete((v, err) -> {
                    if (err != null) {
                        wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
                    }
                });
    }

    /**
     * 会话串行队列里执行 markRead 并广播，HTTP 入口也走这里。
     */
    public CompletableFuture<ReadResult> readAndBroadcast(long conversationId, long userId) {
        return conversationSerialExecutor.submit(conversationId, () -> {
            ReadResult result = deliveryService.markRead(conversationId, userId);
            if (result.changed()) {
                pushService.pushToUsers(result.participants(), WsEvents.messagesRead(conversationId, userId));
            }
            return result;
        });
    }

    /**
     * 先查消息所属会话，再进该会话的串行队列写回执，和同会话的 messages_read 保持先后。
     */
    public CompletableFuture<Void> markDelivered(Channel ch, long userId, long messageId) {
        CompletableFuture<Long> conv;
        try {
            conv = CompletableFuture.supplyAsync(() -> deliveryService.conversationOf(messageId), dbExecutor);
        } catch (RejectedExecutionException e) {
            conv = CompletableFuture.failedFuture(e);
        }
        return conv.thenCompose(conversationId -> conversationSerialExecutor.run(conversationId, () -> {
            DeliveryReceipt r = deliveryService.markDelivered(messageId, userId);
            if (r.changed() && r.senderId() > 0) {
                pushService.pushToUser(r.senderId(),
                        WsEvents.messageStatus(r.messageId(), r.conversationId(), MessageStatus.DELIVERED));
            }
        })).whenComplete((v, err) -> {
            if (err != null) {
                wsWriter.writeFailure(ch, WsEvents.ERROR, err, messageId, null);
            }
        });
    }
}
