package com.marketchat.gateway.ws;

import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.session.WsRouteStore;
import com.marketchat.gateway.ws.cluster.WsClusterBus;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 扇出：把一个事件推给一组用户的所有连接（本机直接写，其它实例走 Redis Pub/Sub）。
 *
 * <p>每个接收方独立处理，单个连接写失败只记 transport_failure，不影响其他接收方。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPushService {

    private final SessionRegistry sessionRegistry;
    private final WsRouteStore routeStore;
    private final WsClusterBus clusterBus;
    private final WsWriter wsWriter;

    public void pushToUser(long userId, WsEnvelope envelope) {
        pushToUsers(List.of(userId), envelope);
    }

    public void pushToUsers(Collection<Long> userIds, WsEnvelope envelope) {
        if (userIds == null || userIds.isEmpty() || envelope == null) {
            return;
        }
        Set<Long> targets = new LinkedHashSet<>();
        for (Long uid : userIds) {
            if (uid != null && uid > 0) {
                targets.add(uid);
            }
        }
        if (targets.isEmpty()) {
            return;
        }

        for (Long uid : targets) {
            pushLocal(uid, envelope);
        }

        Map<Long, Set<String>> routes = routeStore.batchServers(targets);
        if (routes == null || routes.isEmpty()) {
            // Redis 不可用：只能本机扇出
            return;
        }
        String self = routeStore.serverId();
        Map<String, List<Long>> byServer = new HashMap<>();
        for (Map.Entry<Long, Set<String>> e : routes.entrySet()) {
            for (String serverId : e.getValue()) {
                if (serverId == null || serverId.equals(self)) {
                    continue;
                }
                byServer.computeIfAbsent(serverId, k -> new ArrayList<>()).add(e.getKey());
            }
        }
        for (Map.Entry<String, List<Long>> e : byServer.entrySet()) {
            if (!clusterBus.publishPush(e.getKey(), e.getValue(), envelope, self)) {
                log.warn("transport_failure: cluster push not published, serverId={}, users={}, type={}",
                        e.getKey(), e.getValue().size(), envelope.type);
            }
        }
    }

    /**
     * 用户当前是否有活着的连接（本机，或 Redis 路由表里任一实例）。与落库的 online 标记无关：
     * 刚握手还没 join 的连接也算。
     */
    public boolean isConnected(long userId) {
        if (sessionRegistry.hasLocalConnection(userId)) {
            return true;
        }
        Set<String> servers = routeStore.serversOf(userId);
        return servers != null && !servers.isEmpty();
    }

    /**
     * 只写本机连接。
     *
     * @return 写出的连接数
     */
    public int pushLocal(long userId, WsEnvelope envelope) {
        int n = 0;
        for (Channel ch : sessionRegistry.getChannels(userId)) {
            if (ch == null || !ch.isActive()) {
                continue;
            }
            try {
                wsWriter.write(ch, envelope).addListener(f -> {
                    if (!f.isSuccess()) {
                        log.warn("transport_failure: push write failed, userId={}, type={}, err={}",
                                userId, envelope.type, String.valueOf(f.cause()));
                    }
                });
                n++;
            } catch (Exception e) {
                log.warn("transport_failure: push failed, userId={}, type={}, err={}", userId, envelope.type, e.toString());
            }
        }
        return n;
    }
}
