package com.marketchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_message")
public class MessageEntity {

    /** messageId（雪花 id，服务端分配） */
    @TableId(value = "id", type = IdType.INPUT)
    private Long id;

    private Long conversationId;

    /** 会话内单调递增序号。 */
    private Long msgSeq;

    private Long senderId;

    private MessageType msgType;

    /** 不透明内容：文本或媒体 URL，核心不解析。 */
    private String content;

    /**
     * 汇总状态：所有接收方回执里的最小值。每个接收方自己的状态见 {@link MessageReceiptEntity}。
     */
    private MessageStatus status;

    /** 客户端幂等 key（同一 sender 唯一），可空。 */
    private String clientMsgId;

    private LocalDateTime createdAt;
}
