package com.marketchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.marketchat.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
