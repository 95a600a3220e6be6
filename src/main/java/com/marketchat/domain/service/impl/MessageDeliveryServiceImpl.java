package com.marketchat.domain.service.impl;

import cn.hutool.core.util.StrUtil;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.dto.SubmitResult;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.entity.ConversationEntity;
import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.entity.MessageReceiptEntity;
import com.marketchat.domain.enums.MessageStatus;
import com.marketchat.domain.enums.MessageType;
import com.marketchat.domain.mapper.ConversationMapper;
import com.marketchat.domain.mapper.ConversationMemberMapper;
import com.marketchat.domain.mapper.MessageMapper;
import com.marketchat.domain.mapper.MessageReceiptMapper;
import com.marketchat.domain.service.ActiveViewTracker;
import com.marketchat.domain.service.ConversationService;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.domain.service.MsgSeqAllocator;
import com.marketchat.domain.service.PresenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageDeliveryServiceImpl implements MessageDeliveryService {

    static final int MAX_CONTENT_LENGTH = 4096;
    static final int MAX_CLIENT_MSG_ID_LENGTH = 64;
    static final int PENDING_BATCH_LIMIT = 500;

    private final ConversationService conversationService;
    private final ConversationMapper conversationMapper;
    private final ConversationMemberMapper memberMapper;
    private final MessageMapper messageMapper;
    private final MessageReceiptMapper receiptMapper;
    private final MsgSeqAllocator msgSeqAllocator;
    private final PresenceService presenceService;
    private final ActiveViewTracker activeViewTracker;

    @Override
    @Transactional(rollbackFor = Exception.class)
    public SubmitResult submit(long conversationId, long senderId, MessageType type, String content, String clientMsgId) {
        if (type == null) {
            throw ChatException.invalidPayload("invalid_message_type");
        }
        if (StrUtil.isBlank(content)) {
            throw ChatException.invalidPayload("missing_content");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw ChatException.invalidPayload("content_too_long");
        }
        String cmid = StrUtil.isBlank(clientMsgId) ? null : clientMsgId.trim();
        if (cmid != null && cmid.length() > MAX_CLIENT_MSG_ID_LENGTH) {
            throw ChatException.invalidPayload("client_msg_id_too_long");
        }

        try {
            conversationService.requireParticipant(conversationId, senderId);

            if (cmid != null) {
                MessageEntity existing = messageMapper.selectBySenderAndClientMsgId(senderId, cmid);
                if (existing != null) {
                    if (existing.getConversationId() == null || existing.getConversationId() != conversationId) {
                        throw ChatException.invalidPayload("client_msg_id_conflict");
                    }
                    return replay(existing);
                }
            }

            // 分配 seq 同时锁住会话行：同一会话的 submit 在库里也是串行的
            long seq = msgSeqAllocator.allocateNextSeq(conversationId);
            if (seq <= 0) {
                throw ChatException.notFound("conversation_not_found");
            }

            List<Long> participants = memberMapper.selectUserIds(conversationId);
            List<Long> recipients = new ArrayList<>();
            for (Long p : participants) {
                if (p != null && p != senderId) {
                    recipients.add(p);
                }
            }

            Map<Long, UserPresenceDto> presence = presenceService.getMany(recipients);
            Map<Long, MessageStatus> statuses = new LinkedHashMap<>();
            List<Long> unreadIncrements = new ArrayList<>();
            for (Long r : recipients) {
                if (activeViewTracker.isActive(r, conversationId)) {
                    statuses.put(r, MessageStatus.READ);
                    continue;
                }
                unreadIncrements.add(r);
                UserPresenceDto p = presence.get(r);
                statuses.put(r, p != null && p.online() ? MessageStatus.DELIVERED : MessageStatus.SENT);
            }

            LocalDateTime now = LocalDateTime.now();
            MessageEntity msg = new MessageEntity();
            msg.setId(IdWorker.getId());
            msg.setConversationId(conversationId);
            msg.setMsgSeq(seq);
            msg.setSenderId(senderId);
            msg.setMsgType(type);
            msg.setContent(content);
            msg.setStatus(aggregate(statuses));
            msg.setClientMsgId(cmid);
            msg.setCreatedAt(now);
            messageMapper.insert(msg);

            for (Map.Entry<Long, MessageStatus> e : statuses.entrySet()) {
                MessageReceiptEntity receipt = new MessageReceiptEntity();
                receipt.setId(IdWorker.getId());
                receipt.setMessageId(msg.getId());
                receipt.setConversationId(conversationId);
                receipt.setUserId(e.getKey());
                receipt.setSenderId(senderId);
                receipt.setStatus(e.getValue());
                receipt.setUpdatedAt(now);
                receiptMapper.insert(receipt);
            }

            if (!unreadIncrements.isEmpty()) {
                memberMapper.incrementUnread(conversationId, unreadIncrements);
            }
            conversationMapper.updateLastMessage(conversationId, type.preview(content), type.getCode(), senderId, now);

            return new SubmitResult(msg, List.copyOf(participants), statuses, false);
        } catch (DataAccessException e) {
            log.error("submit message failed: conversationId={}, senderId={}", conversationId, senderId, e);
            throw ChatException.persistence("message_persist_failed", e);
        }
    }

    private SubmitResult replay(MessageEntity existing) {
        long conversationId = existing.getConversationId();
        Map<Long, MessageStatus> statuses = new LinkedHashMap<>();
        for (MessageReceiptEntity r : receiptMapper.selectByMessageId(existing.getId())) {
            statuses.put(r.getUserId(), r.getStatus());
        }
        List<Long> participants = memberMapper.selectUserIds(conversationId);
        log.debug("duplicate clientMsgId replayed: messageId={}, senderId={}", existing.getId(), existing.getSenderId());
        return new SubmitResult(existing, List.copyOf(participants), statuses, true);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public DeliveryReceipt markDelivered(long messageId, long recipientId) {
        if (messageId <= 0) {
            throw ChatException.invalidPayload("invalid_message_id");
        }
        try {
            MessageEntity msg = messageMapper.selectById(messageId);
            if (msg == null) {
                throw ChatException.notFound("message_not_found");
            }
            MessageReceiptEntity receipt = receiptMapper.selectByMessageAndUser(messageId, recipientId);
            if (receipt == null) {
                throw ChatException.unauthorized("not_recipient");
            }
            boolean changed = receiptMapper.markDelivered(messageId, recipientId, LocalDateTime.now()) > 0;
            if (changed) {
                messageMapper.refreshAggregateStatus(List.of(messageId));
            }
            return new DeliveryReceipt(messageId, msg.getConversationId(), msg.getSenderId(), recipientId, changed);
        } catch (DataAccessException e) {
            log.error("mark delivered failed: messageId={}, recipientId={}", messageId, recipientId, e);
            throw ChatException.persistence("receipt_persist_failed", e);
        }
    }

    @Override
    public long conversationOf(long messageId) {
        if (messageId <= 0) {
            throw ChatException.invalidPayload("invalid_message_id");
        }
        try {
            MessageEntity msg = messageMapper.selectById(messageId);
            if (msg == null || msg.getConversationId() == null) {
                throw ChatException.notFound("message_not_found");
            }
            return msg.getConversationId();
        } catch (DataAccessException e) {
            throw ChatException.persistence("message_query_failed", e);
        }
    }

    @Override
    public List<Long> pendingConversations(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        try {
            List<Long> ids = receiptMapper.selectPendingConversationIds(userId);
            return ids == null ? List.of() : ids;
        } catch (DataAccessException e) {
            throw ChatException.persistence("receipt_query_failed", e);
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<DeliveryReceipt> deliverPending(long conversationId, long userId) {
        if (conversationId <= 0 || userId <= 0) {
            return List.of();
        }
        try {
            List<DeliveryReceipt> out = new ArrayList<>();
            while (true) {
                List<MessageReceiptEntity> pending =
                        receiptMapper.selectPendingForUpdate(conversationId, userId, PENDING_BATCH_LIMIT);
                if (pending == null || pending.isEmpty()) {
                    break;
                }
                List<MessageReceiptEntity> promoted = promote(userId, pending);
                for (MessageReceiptEntity r : promoted) {
                    out.add(new DeliveryReceipt(r.getMessageId(), conversationId,
                            r.getSenderId() == null ? 0 : r.getSenderId(), userId, true));
                }
                // 不足一批，或本批一行都没推进（被并发改过），都说明没有剩余
                if (pending.size() < PENDING_BATCH_LIMIT || promoted.isEmpty()) {
                    break;
                }
            }
            return out;
        } catch (DataAccessException e) {
            log.error("deliver pending failed: conversationId={}, userId={}", conversationId, userId, e);
            throw ChatException.persistence("receipt_persist_failed", e);
        }
    }

    /**
     * @return 本次确实由 sent 变为 delivered 的回执
     */
    private List<MessageReceiptEntity> promote(long userId, List<MessageReceiptEntity> pending) {
        List<Long> receiptIds = new ArrayList<>(pending.size());
        for (MessageReceiptEntity r : pending) {
            receiptIds.add(r.getId());
        }
        int updated = receiptMapper.markDeliveredByIds(userId, receiptIds, LocalDateTime.now());
        if (updated <= 0) {
            return List.of();
        }
        List<MessageReceiptEntity> promoted = pending;
        if (updated < pending.size()) {
            // 部分行在读取后已被推进到 read：只保留仍停在 delivered 的
            Set<Long> stillDelivered = new LinkedHashSet<>();
            for (MessageReceiptEntity r : receiptMapper.selectDeliveredByIds(userId, receiptIds)) {
                stillDelivered.add(r.getId());
            }
            promoted = pending.stream().filter(r -> stillDelivered.contains(r.getId())).toList();
        }
        Set<Long> messageIds = new LinkedHashSet<>();
        for (MessageReceiptEntity r : promoted) {
            messageIds.add(r.getMessageId());
        }
        if (!messageIds.isEmpty()) {
            messageMapper.refreshAggregateStatus(new ArrayList<>(messageIds));
        }
        return promoted;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ReadResult markRead(long conversationId, long userId) {
        try {
            conversationService.requireParticipant(conversationId, userId);

            Integer unread = memberMapper.selectUnreadForUpdate(conversationId, userId);
            int previousUnread = unread == null ? 0 : Math.max(0, unread);

            List<Long> readIds = new ArrayList<>();
            for (MessageReceiptEntity r : receiptMapper.selectUnreadForUpdate(conversationId, userId)) {
                readIds.add(r.getMessageId());
            }

            LocalDateTime now = LocalDateTime.now();
            if (!readIds.isEmpty()) {
                receiptMapper.markAllRead(conversationId, userId, now);
                messageMapper.refreshAggregateStatus(readIds);
            }
            memberMapper.resetUnread(conversationId, userId, now);

            List<Long> participants = memberMapper.selectUserIds(conversationId);
            return new ReadResult(conversationId, userId, List.copyOf(participants), List.copyOf(readIds), previousUnread);
        } catch (DataAccessException e) {
            log.error("mark read failed: conversationId={}, userId={}", conversationId, userId, e);
            throw ChatException.persistence("read_persist_failed", e);
        }
    }

    @Override
    public Map<Long, Integer> unreadCounts(long conversationId) {
        try {
            return conversationService.unreadCounts(conversationId);
        } catch (DataAccessException e) {
            throw ChatException.persistence("unread_query_failed", e);
        }
    }

    static MessageStatus aggregate(Map<Long, MessageStatus> statuses) {
        return statuses == null ? MessageStatus.SENT : MessageStatus.lowest(statuses.values());
    }
}
