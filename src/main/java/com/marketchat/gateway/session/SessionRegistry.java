package com.marketchat.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机连接表：userId -> (connId -> Channel)。
 *
 * <p>Channel 不能放 Redis，多实例路由只在 {@link WsRouteStore} 里存 connId -> serverId。
 * 一个用户可以有多条连接，全部断开后才算离线。</p>
 */
@Slf4j
@Component
public class SessionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("uid");
    public static final AttributeKey<String> ATTR_CONN_ID = AttributeKey.valueOf("cid");
    /** 非空表示服务端主动关闭（例如心跳超时），断线流程不再重复写离线。 */
    public static final AttributeKey<String> ATTR_CLOSE_REASON = AttributeKey.valueOf("close_reason");

    private final ConcurrentHashMap<Long, ConcurrentHashMap<String, Channel>> userChannels = new ConcurrentHashMap<>();

    private final WsRouteStore routeStore;

    public SessionRegistry(WsRouteStore routeStore) {
        this.routeStore = routeStore;
    }

    /**
     * 握手通过后绑定身份；connId 在实例内唯一。
     */
    public String bind(Channel ch, long userId) {
        String connId = ch.id().asLongText();
        ch.attr(ATTR_USER_ID).set(userId);
        ch.attr(ATTR_CONN_ID).set(connId);
        userChannels.compute(userId, (k, v) -> {
            ConcurrentHashMap<String, Channel> map = v == null ? new ConcurrentHashMap<>() : v;
            map.put(connId, ch);
            return map;
        });
        routeStore.addConn(userId, connId);
        return connId;
    }

    /**
     * 解绑连接。
     *
     * @return 该用户剩余的活跃连接数（优先取集群视角；Redis 不可用时取本机视角）；未绑定的连接返回 -1
     */
    public long unbind(Channel ch) {
        Long userId = ch.attr(ATTR_USER_ID).get();
        String connId = ch.attr(ATTR_CONN_ID).get();
        if (userId == null || connId == null) {
            return -1;
        }
        long[] localRemaining = {0};
        boolean[] removed = {false};
        userChannels.computeIfPresent(userId, (k, v) -> {
            removed[0] = v.remove(connId, ch);
            localRemaining[0] = v.size();
            return v.isEmpty() ? null : v;
        });
        if (!removed[0]) {
            // 重复 unbind（exceptionCaught + channelInactive）
            return -1;
        }
        Long clusterRemaining = routeStore.removeConn(userId, connId);
        return clusterRemaining == null ? localRemaining[0] : clusterRemaining;
    }

    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_USER_ID).get() != null;
    }

    public Long userIdOf(Channel ch) {
        return ch.attr(ATTR_USER_ID).get();
    }

    public String connIdOf(Channel ch) {
        return ch.attr(ATTR_CONN_ID).get();
    }

    public List<Channel> getChannels(long userId) {
        ConcurrentHashMap<String, Channel> map = userChannels.get(userId);
        if (map == null || map.isEmpty()) {
            return Collections.emptyList();
        }
        return new ArrayList<>(map.values());
    }

    public boolean hasLocalConnection(long userId) {
        for (Channel ch : getChannels(userId)) {
            if (ch != null && ch.isActive()) {
                return true;
            }
        }
        return false;
    }

    public List<Long> getOnlineUserIds() {
        List<Long> out = new ArrayList<>();
        for (Long userId : userChannels.keySet()) {
            if (hasLocalConnection(userId)) {
                out.add(userId);
            }
        }
        return out;
    }

    public void touch(Channel ch) {
        Long userId = ch.attr(ATTR_USER_ID).get();
        String connId = ch.attr(ATTR_CONN_ID).get();
        if (userId == null || connId == null) {
            return;
        }
        // TTL 可能已过期（Redis 抖动）：touch 失败时重新登记本连接
        if (!routeStore.touch(userId)) {
            routeStore.addConn(userId, connId);
        }
    }
}
