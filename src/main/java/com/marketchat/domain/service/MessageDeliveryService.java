package com.marketchat.domain.service;

import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.dto.SubmitResult;
import com.marketchat.domain.enums.MessageType;

import java.util.List;
import java.util.Map;

/**
 * 消息投递引擎：sent -> delivered -> read 状态机、未读计数。
 *
 * <p>所有写操作单事务完成，失败整体回滚并抛 PERSISTENCE_FAILURE，不自动重试。
 * 回执状态只升不降：迟到的 delivered 不会覆盖 read。</p>
 *
 * <p>调用方需按 conversationId 串行调用 submit/markRead/markDelivered/deliverPending，
 * 并在同一个串行任务里发出对应事件，发送方看到的状态才不会倒退。</p>
 */
public interface MessageDeliveryService {

    /**
     * 落库一条新消息并计算每个接收方的回执：
     * 正在看该会话 -> read（未读数不变）；否则未读 +1，在线 -> delivered，离线 -> sent。
     *
     * <p>同一 sender 重复的 clientMsgId 返回已存在的消息，不产生新的副作用。</p>
     */
    SubmitResult submit(long conversationId, long senderId, MessageType type, String content, String clientMsgId);

    /**
     * 接收方确认送达：只做 sent -> delivered，已 delivered/read 时 changed = false。
     */
    DeliveryReceipt markDelivered(long messageId, long recipientId);

    /**
     * @return 消息所在会话；消息不存在抛 NOT_FOUND
     */
    long conversationOf(long messageId);

    /**
     * @return 该用户还有 sent 回执的会话，上线补送达时按会话逐个调用 {@link #deliverPending(long, long)}
     */
    List<Long> pendingConversations(long userId);

    /**
     * 用户上线时补送达：把他在该会话里所有 sent 回执推进到 delivered。
     *
     * <p>只返回本次确实由 sent 变为 delivered 的回执。</p>
     */
    List<DeliveryReceipt> deliverPending(long conversationId, long userId);

    /**
     * 该用户在会话中所有未读回执置为 read，他的未读数清零；其他成员不受影响。
     */
    ReadResult markRead(long conversationId, long userId);

    Map<Long, Integer> unreadCounts(long conversationId);
}
