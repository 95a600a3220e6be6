package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 在线状态（t_user_presence），跨进程重启的事实来源。
 *
 * <p>约束：online = true 时 connectionId 非空。记录从不删除（用于“最后在线 X 分钟前”）。</p>
 */
@Data
@TableName("t_user_presence")
public class UserPresenceEntity {

    @TableId(value = "user_id", type = IdType.INPUT)
    private Long userId;

    private Boolean online;

    private LocalDateTime lastSeen;

    /** 最近一次活跃连接的 connId（serverId 无关），离线时为 null。 */
    private String connectionId;

    private LocalDateTime updatedAt;
}
