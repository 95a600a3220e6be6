package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.marketchat.domain.enums.AccountType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户（只读）：账号体系属于外部模块，这里只用来判断 userId 是否存在、展示名称。
 */
@Data
@TableName("t_user")
public class UserEntity {

    @TableId(value = "id", type = IdType.INPUT)
    private Long id;

    private String fullName;

    private AccountType accountType;

    private LocalDateTime createdAt;
}
