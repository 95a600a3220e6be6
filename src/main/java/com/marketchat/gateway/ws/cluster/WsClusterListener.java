package com.marketchat.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.ws.WsEnvelope;
import com.marketchat.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 接收其它实例转发的 PUSH，只写本机连接（不再二次转发）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsClusterListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final WsWriter wsWriter;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        if (message == null || message.getBody() == null) {
            return;
        }
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        WsClusterMessage msg;
        try {
            msg = objectMapper.readValue(raw, WsClusterMessage.class);
        } catch (Exception e) {
            log.debug("ws cluster message parse failed: {}", e.toString());
            return;
        }
        if (msg == null || !WsClusterMessage.TYPE_PUSH.equalsIgnoreCase(msg.type())) {
            return;
        }
        handlePush(msg);
    }

    private void handlePush(WsClusterMessage msg) {
        WsEnvelope env = msg.envelope();
        if (env == null || msg.userIds() == null || msg.userIds().isEmpty()) {
            return;
        }
        for (Long userId : msg.userIds()) {
            if (userId == null || userId <= 0) {
                continue;
            }
            for (Channel ch : sessionRegistry.getChannels(userId)) {
                if (ch == null || !ch.isActive()) {
                    continue;
                }
                wsWriter.write(ch, env).addListener(f -> {
                    if (!f.isSuccess()) {
                        log.warn("transport_failure: cluster push write failed, userId={}, type={}, err={}",
                                userId, env.type, String.valueOf(f.cause()));
                    }
                });
            }
        }
    }
}
