package com.marketchat.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.domain.entity.UserPresenceEntity;

import java.time.LocalDateTime;

/**
 * 在线状态视图。没有记录的用户视为离线，lastSeen 为 null。
 */
public record UserPresenceDto(
        Long userId,
        @JsonProperty("isOnline") boolean online,
        LocalDateTime lastSeen,
        String connectionId
) {

    public static UserPresenceDto offline(long userId) {
        return new UserPresenceDto(userId, false, null, null);
    }

    public static UserPresenceDto from(UserPresenceEntity e) {
        if (e == null || e.getUserId() == null) {
            return null;
        }
        boolean online = Boolean.TRUE.equals(e.getOnline());
        return new UserPresenceDto(e.getUserId(), online, e.getLastSeen(), online ? e.getConnectionId() : null);
    }
}
