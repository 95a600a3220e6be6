package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.marketchat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 买卖双方围绕商品的会话。成员在 t_conversation_member，创建后不变。
 */
@Data
@TableName("t_conversation")
public class ConversationEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 关联商品（可选）。 */
    private Long productId;

    /** "小 userId:大 userId:productId(无则 0)"，唯一键，保证 getOrCreate 并发下只有一条。 */
    private String pairKey;

    /** 会话内消息序号分配器：见 MsgSeqAllocator。 */
    private Long nextMsgSeq;

    /** 最后一条消息摘要（冗余，用于会话列表）。 */
    private String lastMessageText;

    private MessageType lastMessageType;

    private Long lastMessageSenderId;

    private LocalDateTime lastMessageAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
