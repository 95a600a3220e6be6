package com.marketchat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.entity.UserPresenceEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 在线状态存储（t_user_presence）。
 *
 * <p>写入都是幂等 upsert，调用方需按 userId 串行（见 gateway 的 WsPresenceService），最后一次写入生效。</p>
 */
public interface PresenceService extends IService<UserPresenceEntity> {

    UserPresenceDto setOnline(long userId, String connectionId);

    UserPresenceDto setOffline(long userId);

    /**
     * 刷新 lastSeen / connectionId，不改变已有记录的 online。
     */
    void heartbeat(long userId, String connectionId);

    /**
     * @return 没有记录时返回离线默认值（lastSeen = null）
     */
    UserPresenceDto get(long userId);

    /**
     * @return 每个请求的 userId 都有值（未知用户为离线默认值）
     */
    Map<Long, UserPresenceDto> getMany(Collection<Long> userIds);

    /**
     * 仍在线但 lastSeen 早于 before 的用户（心跳超时候选）。
     */
    List<UserPresenceDto> findStale(LocalDateTime before, int limit);

    /**
     * 条件置离线：只有 lastSeen 仍早于 before 时才生效，避免覆盖刚到的心跳。
     *
     * @return true 表示本次确实置为离线
     */
    boolean markOfflineIfStale(long userId, LocalDateTime before);
}
