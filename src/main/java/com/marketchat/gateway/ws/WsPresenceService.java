package com.marketchat.gateway.ws;

import cn.hutool.core.util.StrUtil;
import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.service.ActiveViewTracker;
import com.marketchat.domain.service.ConversationService;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.domain.service.PresenceService;
import com.marketchat.domain.service.UserService;
import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.session.WsRouteStore;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * 在线状态链路：join / heartbeat / 断线 / 心跳超时。
 *
 * <p>同一用户的状态写入和 user_status 广播在同一个串行任务里完成，所以对端看到的状态顺序与落库顺序一致。</p>
 */
@Slf4j
@Component
public class WsPresenceService {

    public static final String CLOSE_REASON_HEARTBEAT_TIMEOUT = "heartbeat_timeout";
    public static final String API_CONNECTION_ID = "api";

    private final PresenceService presenceService;
    private final ConversationService conversationService;
    private final MessageDeliveryService deliveryService;
    private final UserService userService;
    private final ActiveViewTracker activeViewTracker;
    private final SessionRegistry sessionRegistry;
    private final WsRouteStore routeStore;
    private final WsPushService pushService;
    private final WsWriter wsWriter;
    private final KeyedSerialExecutor<Long> presenceSerialExecutor;
    private final KeyedSerialExecutor<Long> conversationSerialExecutor;

    public WsPresenceService(PresenceService presenceService,
                             ConversationService conversationService,
                             MessageDeliveryService deliveryService,
                             UserService userService,
                             ActiveViewTracker activeViewTracker,
                             SessionRegistry sessionRegistry,
                             WsRouteStore routeStore,
                             WsPushService pushService,
                             WsWriter wsWriter,
                             @Qualifier("presenceSerialExecutor") KeyedSerialExecutor<Long> presenceSerialExecutor,
                             @Qualifier("conversationSerialExecutor") KeyedSerialExecutor<Long> conversationSerialExecutor) {
        this.presenceService = presenceService;
        this.conversationService = conversationService;
        this.deliveryService = deliveryService;
        this.userService = userService;
        this.activeViewTracker = activeViewTracker;
        this.sessionRegistry = sessionRegistry;
        this.routeStore = routeStore;
        this.pushService = pushService;
        this.wsWriter = wsWriter;
        this.presenceSerialExecutor = presenceSerialExecutor;
        this.conversationSerialExecutor = conversationSerialExecutor;
    }

    /**
     * join：置在线 -> 广播 user_status 给对端 -> 回 presence_snapshot -> 补送达。
     */
    public CompletableFuture<Void> join(Channel ch, long userId, Long claimedUserId) {
        if (claimedUserId != null && claimedUserId != userId) {
            wsWriter.writeError(ch, ChatException.unauthorized("user_mismatch"));
            return CompletableFuture.completedFuture(null);
        }
        String connId = sessionRegistry.connIdOf(ch);
        return presenceSerialExecutor.run(userId, () -> {
            if (!userService.exists(userId)) {
                throw ChatException.unauthorized("unknown_user");
            }
            UserPresenceDto me = presenceService.setOnline(userId, connId);
            Set<Long> peers = conversationService.peersOf(userId);
            pushService.pushToUsers(peers, WsEvents.userStatus(me));

            Map<Long, UserPresenceDto> snapshot = presenceService.getMany(peers);
            wsWriter.write(ch, WsEvents.presenceSnapshot(snapshot.values()));

            int pending = deliverPending(userId);
            log.debug("user joined: userId={}, connId={}, peers={}, pendingConversations={}",
                    userId, connId, peers.size(), pending);
        }).whenComplete((v, err) -> {
            if (err != null) {
                wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
            }
        });
    }

    /**
     * HTTP 改状态（PUT /users/{userId}/status）：与 join / 断线共用同一个用户串行队列。
     *
     * @param connectionId 上线时的连接标识，为空时用 {@link #API_CONNECTION_ID}
     */
    public CompletableFuture<UserPresenceDto> updateStatus(long userId, boolean online, String connectionId) {
        return presenceSerialExecutor.submit(userId, () -> {
            if (!userService.exists(userId)) {
                throw ChatException.notFound("user_not_found");
            }
            UserPresenceDto me = online
                    ? presenceService.setOnline(userId, StrUtil.isBlank(connectionId) ? API_CONNECTION_ID : connectionId)
                    : presenceService.setOffline(userId);
            pushService.pushToUsers(conversationService.peersOf(userId), WsEvents.userStatus(me));
            if (online) {
                deliverPending(userId);
            }
            log.debug("presence updated via api: userId={}, online={}", userId, online);
            return me;
        });
    }

    /**
     * 补送达：按会话拆开，每个会话在会话串行队列里执行，和 messages_read 保持先后；
     * 只对确实从 sent 推进到 delivered 的回执通知发送方。
     *
     * @return 有待送达回执的会话数
     */
    private int deliverPending(long userId) {
        List<Long> conversations = deliveryService.pendingConversations(userId);
        for (Long conversationId : conversations) {
            conversationSerialExecutor.run(conversationId, () -> {
                for (DeliveryReceipt r : deliveryService.deliverPending(conversationId, userId)) {
                    if (r.changed() && r.senderId() > 0) {
                        pushService.pushToUser(r.senderId(),
                                WsEvents.messageStatus(r.messageId(), r.conversationId(), MessageStatus.DELIVERED));
                    }
                }
            }).whenComplete((v, err) -> {
                if (err != null) {
                    log.error("deliver pending failed: userId={}, conversationId={}", userId, conversationId, err);
                }
            });
        }
        return conversations.size();
    }

    public CompletableFuture<Void> heartbeat(Channel ch, long userId, Long claimedUserId) {
        if (claimedUserId != null && claimedUserId != userId) {
            wsWriter.writeError(ch, ChatException.unauthorized("user_mismatch"));
            return CompletableFuture.completedFuture(null);
        }
        sessionRegistry.touch(ch);
        String connId = sessionRegistry.connIdOf(ch);
        return presenceSerialExecutor.run(userId, () -> presenceService.heartbeat(userId, connId))
                .whenComplete((v, err) -> {
                    if (err != null) {
                        wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
                    }
                });
    }

    /**
     * 连接关闭：清理该连接进入的活跃视图；用户在集群内没有任何连接时置离线并广播。
     *
     * @param remaining {@link SessionRegistry#unbind} 的返回值
     */
    public CompletableFuture<Void> onDisconnect(long userId, String connId, long remaining, String closeReason) {
        activeViewTracker.clearIfOwnedBy(userId, connId);
        if (remaining != 0 || closeReason != null) {
            return CompletableFuture.completedFuture(null);
        }
        return presenceSerialExecutor.run(userId, () -> {
            // 排队期间用户可能又连上了
            if (sessionRegistry.hasLocalConnection(userId)) {
                return;
            }
            Set<String> servers = routeStore.serversOf(userId);
            if (servers != null && !servers.isEmpty()) {
                return;
            }
            UserPresenceDto off = presenceService.setOffline(userId);
            pushService.pushToUsers(conversationService.peersOf(userId), WsEvents.userStatus(off));
            log.debug("user offline: userId={}, connId={}", userId, connId);
        }).whenComplete((v, err) -> {
            if (err != null) {
                log.error("set offline failed: userId={}", userId, err);
            }
        });
    }

    /**
     * 心跳超时：lastSeen 早于 before 的在线用户置离线，关闭其本机僵尸连接，广播离线。
     *
     * @return 本轮提交处理的候选数
     */
    public int reapStale(LocalDateTime before, int limit) {
        List<UserPresenceDto> stale = presenceService.findStale(before, limit);
        for (UserPresenceDto candidate : stale) {
            long userId = candidate.userId();
            presenceSerialExecutor.run(userId, () -> {
                if (!presenceService.markOfflineIfStale(userId, before)) {
                    return;
                }
                for (Channel ch : sessionRegistry.getChannels(userId)) {
                    ch.attr(SessionRegistry.ATTR_CLOSE_REASON).set(CLOSE_REASON_HEARTBEAT_TIMEOUT);
                    ch.close();
                }
                activeViewTracker.clear(userId);
                UserPresenceDto off = new UserPresenceDto(userId, false, candidate.lastSeen(), null);
                pushService.pushToUsers(conversationService.peersOf(userId), WsEvents.userStatus(off));
                log.info("presence reaped: userId={}, lastSeen={}", userId, candidate.lastSeen());
            }).whenComplete((v, err) -> {
                if (err != null) {
                    log.error("reap stale presence failed: userId={}", userId, err);
                }
            });
        }
        return stale.size();
    }
}
