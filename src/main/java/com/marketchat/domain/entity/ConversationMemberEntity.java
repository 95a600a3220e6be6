package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_conversation_member")
public class ConversationMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    private Long userId;

    /** unreadCounts[userId]，非负。 */
    private Integer unreadCount;

    private LocalDateTime lastReadAt;

    private LocalDateTime createdAt;
}
