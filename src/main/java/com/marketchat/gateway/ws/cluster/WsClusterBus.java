package com.marketchat.gateway.ws.cluster;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.gateway.ws.WsEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
@RequiredArgsConstructor
public class WsClusterBus {

    private static final String TOPIC_PREFIX = "im:chat:ctrl:";

    /**
     * Redis Pub/Sub 故障时做 fail-fast：避免每次 publish 都阻塞在 Redis 超时上。
     *
     * <p>Redis 宕机时跨实例推送本就无法保证，这里只保证尽快失败、不拖住业务线程。</p>
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private static final AtomicLong REDIS_UNAVAILABLE_UNTIL_MS = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    /**
     * @return false 表示没有发出去（Redis 不可用 / 序列化失败）
     */
    public boolean publish(String serverId, WsClusterMessage msg) {
        if (serverId == null || serverId.isBlank() || msg == null) {
            return false;
        }
        if (shouldFailFast()) {
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(msg);
            redis.convertAndSend(topic(serverId), json);
            return true;
        } catch (Exception e) {
            log.warn("ws cluster publish failed: serverId={}, type={}, err={}", serverId, msg.type(), e.toString());
            markRedisDown();
            return false;
        }
    }

    public boolean publishPush(String serverId, List<Long> userIds, WsEnvelope envelope, String fromServerId) {
        if (userIds == null || userIds.isEmpty() || envelope == null) {
            return false;
        }
        return publish(serverId, WsClusterMessage.push(List.copyOf(userIds), envelope, fromServerId));
    }

    public static String topic(String serverId) {
        return TOPIC_PREFIX + serverId;
    }

    private static boolean shouldFailFast() {
        return System.currentTimeMillis() < REDIS_UNAVAILABLE_UNTIL_MS.get();
    }

    private static void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        while (true) {
            long prev = REDIS_UNAVAILABLE_UNTIL_MS.get();
            if (prev >= until) {
                return;
            }
            if (REDIS_UNAVAILABLE_UNTIL_MS.compareAndSet(prev, until)) {
                return;
            }
        }
    }
}
