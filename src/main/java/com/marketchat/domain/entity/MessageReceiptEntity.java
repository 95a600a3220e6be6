package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.marketchat.domain.enums.MessageStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * (message, recipient) 维度的投递回执。status 只增不减。
 */
@Data
@TableName("t_message_receipt")
public class MessageReceiptEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private Long conversationId;

    private Long userId;

    /** 冗余发送方，补发送达时用来回执给发送方。 */
    private Long senderId;

    private MessageStatus status;

    private LocalDateTime updatedAt;
}
