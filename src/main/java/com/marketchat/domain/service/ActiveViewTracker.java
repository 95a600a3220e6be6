package com.marketchat.domain.service;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 活跃视图：userId -> 当前正在看的会话（每个用户至多一条）。
 *
 * <p>只存在于本进程内存，不落库、不跨实例。接收方连接在其它网关实例上时，这里查不到，
 * 消息按 delivered/sent 处理，之后由 enter_chat/mark_read 补成 read。</p>
 */
@Component
public class ActiveViewTracker {

    /**
     * @param connectionId 进入该视图的连接；用于断线时只清理本连接进入的视图
     */
    public record ActiveView(long conversationId, String connectionId) {
    }

    private final ConcurrentHashMap<Long, ActiveView> views = new ConcurrentHashMap<>();

    /** 覆盖之前的视图。 */
    public void enter(long userId, long conversationId, String connectionId) {
        if (userId <= 0 || conversationId <= 0) {
            return;
        }
        views.put(userId, new ActiveView(conversationId, connectionId));
    }

    public void enter(long userId, long conversationId) {
        enter(userId, conversationId, null);
    }

    /**
     * 只有当前视图就是 conversationId 时才移除；否则不动（用户可能已切到别的会话）。
     *
     * @return true 表示移除了视图
     */
    public boolean leave(long userId, long conversationId) {
        boolean[] removed = new boolean[1];
        views.computeIfPresent(userId, (k, v) -> {
            if (v.conversationId() == conversationId) {
                removed[0] = true;
                return null;
            }
            return v;
        });
        return removed[0];
    }

    public boolean isActive(long userId, long conversationId) {
        ActiveView v = views.get(userId);
        return v != null && v.conversationId() == conversationId;
    }

    public ActiveView current(long userId) {
        return views.get(userId);
    }

    public void clear(long userId) {
        views.remove(userId);
    }

    /**
     * 连接关闭时调用：视图是别的连接（另一台设备）进入的就保留。
     */
    public boolean clearIfOwnedBy(long userId, String connectionId) {
        boolean[] removed = new boolean[1];
        views.computeIfPresent(userId, (k, v) -> {
            if (v.connectionId() == null || Objects.equals(v.connectionId(), connectionId)) {
                removed[0] = true;
                return null;
            }
            return v;
        });
        return removed[0];
    }

    public int size() {
        return views.size();
    }
}
