package com.marketchat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.marketchat.domain.entity.UserEntity;

import java.util.Collection;
import java.util.Map;

public interface UserService extends IService<UserEntity> {

    boolean exists(long userId);

    /**
     * @return userId -> 展示名（不存在的用户不在结果里）
     */
    Map<Long, String> namesOf(Collection<Long> userIds);
}
