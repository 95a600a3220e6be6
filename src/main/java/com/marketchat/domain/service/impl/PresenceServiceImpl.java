package com.marketchat.domain.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.entity.UserPresenceEntity;
import com.marketchat.domain.mapper.UserPresenceMapper;
import com.marketchat.domain.service.PresenceService;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class PresenceServiceImpl extends ServiceImpl<UserPresenceMapper, UserPresenceEntity> implements PresenceService {

    @Override
    public UserPresenceDto setOnline(long userId, String connectionId) {
        requireUserId(userId);
        if (connectionId == null || connectionId.isBlank()) {
            throw ChatException.invalidPayload("missing_connection_id");
        }
        LocalDateTime now = LocalDateTime.now();
        try {
            baseMapper.upsertOnline(userId, connectionId, now);
        } catch (DataAccessException e) {
            throw ChatException.persistence("presence_write_failed", e);
        }
        return new UserPresenceDto(userId, true, now, connectionId);
    }

    @Override
    public UserPresenceDto setOffline(long userId) {
        requireUserId(userId);
        LocalDateTime now = LocalDateTime.now();
        try {
            baseMapper.upsertOffline(userId, now);
        } catch (DataAccessException e) {
            throw ChatException.persistence("presence_write_failed", e);
        }
        return new UserPresenceDto(userId, false, now, null);
    }

    @Override
    public void heartbeat(long userId, String connectionId) {
        requireUserId(userId);
        try {
            baseMapper.upsertHeartbeat(userId, connectionId, LocalDateTime.now());
        } catch (DataAccessException e) {
            throw ChatException.persistence("presence_write_failed", e);
        }
    }

    @Override
    public UserPresenceDto get(long userId) {
        requireUserId(userId);
        UserPresenceDto dto = UserPresenceDto.from(baseMapper.selectById(userId));
        return dto == null ? UserPresenceDto.offline(userId) : dto;
    }

    @Override
    public Map<Long, UserPresenceDto> getMany(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return Map.of();
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (Long id : userIds) {
            if (id != null && id > 0) {
                ids.add(id);
            }
        }
        if (ids.isEmpty()) {
            return Map.of();
        }
        Map<Long, UserPresenceDto> out = new LinkedHashMap<>();
        for (Long id : ids) {
            out.put(id, UserPresenceDto.offline(id));
        }
        for (UserPresenceEntity e : baseMapper.selectByUserIds(new ArrayList<>(ids))) {
            UserPresenceDto dto = UserPresenceDto.from(e);
            if (dto != null) {
                out.put(dto.userId(), dto);
            }
        }
        return out;
    }

    @Override
    public List<UserPresenceDto> findStale(LocalDateTime before, int limit) {
        if (before == null || limit <= 0) {
            return List.of();
        }
        List<UserPresenceDto> out = new ArrayList<>();
        for (UserPresenceEntity e : baseMapper.selectStaleOnline(before, limit)) {
            UserPresenceDto dto = UserPresenceDto.from(e);
            if (dto != null) {
                out.add(dto);
            }
        }
        return out;
    }

    @Override
    public boolean markOfflineIfStale(long userId, LocalDateTime before) {
        requireUserId(userId);
        try {
            return baseMapper.markOfflineIfStale(userId, before, LocalDateTime.now()) > 0;
        } catch (DataAccessException e) {
            throw ChatException.persistence("presence_write_failed", e);
        }
    }

    private static void requireUserId(long userId) {
        if (userId <= 0) {
            throw ChatException.invalidPayload("invalid_user_id");
        }
    }
}
