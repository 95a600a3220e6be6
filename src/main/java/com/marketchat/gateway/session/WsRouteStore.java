package com.marketchat.gateway.session;

import com.marketchat.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WS 多实例路由存储（Redis hash）：
 * <ul>
 *   <li>key: im:chat:route:{userId}，field: connId，value: serverId</li>
 *   <li>一个用户可以同时有多条连接（多设备），分布在不同网关实例上</li>
 *   <li>hash 为空 = 该用户在整个集群没有活跃连接</li>
 * </ul>
 */
@Slf4j
@Component
public class WsRouteStore {

    private static final String ROUTE_KEY_PREFIX = "im:chat:route:";

    static final Duration ROUTE_TTL = Duration.ofSeconds(120);

    /**
     * Redis 故障时做 fail-fast：避免每次路由读写都阻塞在 Redis 超时上。
     *
     * <p>期间跨实例路由不可用，调用方退化为本机视角。</p>
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private static final AtomicLong REDIS_UNAVAILABLE_UNTIL_MS = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final String serverId;

    private final DefaultRedisScript<Long> addConnScript;
    private final DefaultRedisScript<Long> removeConnScript;

    public WsRouteStore(StringRedisTemplate redis, GatewayProperties wsProps) {
        this.redis = redis;
        this.serverId = wsProps.effectiveInstanceId();

        this.addConnScript = new DefaultRedisScript<>();
        this.addConnScript.setResultType(Long.class);
        this.addConnScript.setScriptText("""
                redis.call('HSET', KEYS[1], ARGV[1], ARGV[2])
                redis.call('EXPIRE', KEYS[1], ARGV[3])
                return redis.call('HLEN', KEYS[1])
                """);

        this.removeConnScript = new DefaultRedisScript<>();
        this.removeConnScript.setResultType(Long.class);
        this.removeConnScript.setScriptText("""
                redis.call('HDEL', KEYS[1], ARGV[1])
                return redis.call('HLEN', KEYS[1])
                """);
    }

    public String serverId() {
        return serverId;
    }

    /**
     * @return 该用户在集群内的连接数；Redis 不可用返回 null
     */
    public Long addConn(long userId, String connId) {
        if (connId == null || connId.isBlank() || shouldFailFast()) {
            return null;
        }
        try {
            return redis.execute(addConnScript, List.of(routeKeyOf(userId)), connId, serverId,
                    String.valueOf(ROUTE_TTL.toSeconds()));
        } catch (Exception e) {
            log.warn("ws route add failed, redis unavailable? userId={}, serverId={}, err={}", userId, serverId, e.toString());
            markRedisDown();
            return null;
        }
    }

    /**
     * @return 移除后该用户在集群内剩余的连接数；Redis 不可用返回 null
     */
    public Long removeConn(long userId, String connId) {
        if (connId == null || connId.isBlank() || shouldFailFast()) {
            return null;
        }
        try {
            return redis.execute(removeConnScript, List.of(routeKeyOf(userId)), connId);
        } catch (Exception e) {
            log.warn("ws route remove failed, redis unavailable? userId={}, serverId={}, err={}", userId, serverId, e.toString());
            markRedisDown();
            return null;
        }
    }

    /**
     * 刷新路由 TTL（心跳 / 写空闲时调用）。
     */
    public boolean touch(long userId) {
        if (shouldFailFast()) {
            return false;
        }
        try {
            Boolean ok = redis.expire(routeKeyOf(userId), ROUTE_TTL);
            return Boolean.TRUE.equals(ok);
        } catch (Exception e) {
            log.debug("ws route touch failed: userId={}, err={}", userId, e.toString());
            markRedisDown();
            return false;
        }
    }

    /**
     * @return 该用户有连接的实例集合；Redis 不可用返回 null 以便调用方 fail-open
     */
    public Set<String> serversOf(long userId) {
        if (shouldFailFast()) {
            return null;
        }
        try {
            List<Object> values = redis.opsForHash().values(routeKeyOf(userId));
            Set<String> out = new LinkedHashSet<>();
            if (values != null) {
                for (Object v : values) {
                    if (v != null && !v.toString().isBlank()) {
                        out.add(v.toString());
                    }
                }
            }
            return out;
        } catch (Exception e) {
            log.debug("ws route get failed: userId={}, err={}", userId, e.toString());
            markRedisDown();
            return null;
        }
    }

    /**
     * 批量查询路由：userId -> serverIds（没有连接的用户不在结果里）。
     *
     * @return Redis 不可用返回 null
     */
    public Map<Long, Set<String>> batchServers(Iterable<Long> userIds) {
        if (userIds == null) {
            return Map.of();
        }
        Map<Long, Set<String>> out = new HashMap<>();
        for (Long uid : userIds) {
            if (uid == null || uid <= 0) {
                continue;
            }
            Set<String> servers = serversOf(uid);
            if (servers == null) {
                return null;
            }
            if (!servers.isEmpty()) {
                out.put(uid, servers);
            }
        }
        return out;
    }

    public static String routeKeyOf(long userId) {
        return ROUTE_KEY_PREFIX + userId;
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

    /** 测试用：清除 fail-fast 窗口。 */
    static void resetFailFastForTest() {
        REDIS_UNAVAILABLE_UNTIL_MS.set(0);
    }
}
