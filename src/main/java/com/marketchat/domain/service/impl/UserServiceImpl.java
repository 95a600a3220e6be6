package com.marketchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.marketchat.domain.entity.UserEntity;
import com.marketchat.domain.mapper.UserMapper;
import com.marketchat.domain.service.UserService;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Service
public class UserServiceImpl extends ServiceImpl<UserMapper, UserEntity> implements UserService {

    @Override
    public boolean exists(long userId) {
        if (userId <= 0) {
            return false;
        }
        return this.exists(new LambdaQueryWrapper<UserEntity>().eq(UserEntity::getId, userId));
    }

    @Override
    public Map<Long, String> namesOf(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, String> out = new HashMap<>();
        for (UserEntity u : this.listByIds(userIds)) {
            if (u != null && u.getId() != null) {
                out.put(u.getId(), u.getFullName());
            }
        }
        return out;
    }
}
