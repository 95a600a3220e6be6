package com.marketchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.common.error.ChatException;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化/错误回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行（同一线程提交的写按提交顺序到达）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsWriter {

    private final ObjectMapper objectMapper;

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(env);
        } catch (Exception e) {
            log.warn("ws serialize failed: type={}, err={}", env == null ? null : env.type, e.toString());
            return ch.newFailedFuture(e);
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("channel inactive"));
        }
        if (ch.eventLoop().inEventLoop()) {
            return ch.writeAndFlush(new TextWebSocketFrame(json));
        }
        ChannelPromise promise = ch.newPromise();
        try {
            ch.eventLoop().execute(() -> ch.writeAndFlush(new TextWebSocketFrame(json)).addListener(f -> {
                if (f.isSuccess()) {
                    promise.setSuccess();
                } else {
                    promise.setFailure(f.cause());
                }
            }));
        } catch (Exception e) {
            promise.setFailure(e);
        }
        return promise;
    }

    /**
     * 错误回包：send_message 的失败用 message_error，其它事件用 error。
     */
    public ChannelFuture writeError(Channel ch, String type, ChatException e, Long messageId, String clientMsgId) {
        return write(ch, WsEvents.error(type, e, messageId, clientMsgId));
    }

    public ChannelFuture writeError(Channel ch, ChatException e) {
        return writeError(ch, WsEvents.ERROR, e, null, null);
    }

    /**
     * 异步链路的失败回包：异常先还原成 ChatException（未知异常按 persistence_failure 处理）。
     */
    public void writeFailure(Channel ch, String type, Throwable error, Long messageId, String clientMsgId) {
        ChatException ce = ChatException.unwrap(error);
        switch (ce.getErrorCode()) {
            case PERSISTENCE_FAILURE, TRANSPORT_FAILURE ->
                    log.error("ws event failed: type={}, code={}, err={}", type, ce.getErrorCode(), ce.getMessage(), ce);
            default -> log.debug("ws event rejected: type={}, code={}, err={}", type, ce.getErrorCode(), ce.getMessage());
        }
        if (ch == null || !ch.isActive()) {
            return;
        }
        writeError(ch, type, ce, messageId, clientMsgId);
    }
}
