package com.marketchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.cache.ConversationParticipantsCache;
import com.marketchat.domain.dto.ConversationDto;
import com.marketchat.domain.dto.ConversationSummaryDto;
import com.marketchat.domain.dto.LastMessageDto;
import com.marketchat.domain.dto.MessageDto;
import com.marketchat.domain.entity.ConversationEntity;
import com.marketchat.domain.entity.ConversationMemberEntity;
import com.marketchat.domain.entity.MessageEntity;
import com.marketchat.domain.mapper.ConversationMapper;
import com.marketchat.domain.mapper.ConversationMemberMapper;
import com.marketchat.domain.mapper.MessageMapper;
import com.marketchat.domain.service.ConversationService;
import com.marketchat.domain.service.UserService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
public class ConversationServiceImpl extends ServiceImpl<ConversationMapper, ConversationEntity> implements ConversationService {

    private static final int MAX_PAGE_SIZE = 200;

    private final ConversationMemberMapper memberMapper;
    private final MessageMapper messageMapper;
    private final ConversationParticipantsCache participantsCache;
    private final UserService userService;
    private final TransactionTemplate transactionTemplate;

    public ConversationServiceImpl(ConversationMemberMapper memberMapper,
                                   MessageMapper messageMapper,
                                   ConversationParticipantsCache participantsCache,
                                   UserService userService,
                                   TransactionTemplate transactionTemplate) {
        this.memberMapper = memberMapper;
        this.messageMapper = messageMapper;
        this.participantsCache = participantsCache;
        this.userService = userService;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Set<Long> participantsOf(long conversationId) {
        if (conversationId <= 0) {
            throw ChatException.invalidPayload("invalid_conversation_id");
        }
        Set<Long> cached = participantsCache.get(conversationId);
        if (cached != null) {
            return cached;
        }
        List<Long> ids = memberMapper.selectUserIds(conversationId);
        if (ids == null || ids.isEmpty()) {
            throw ChatException.notFound("conversation_not_found");
        }
        participantsCache.put(conversationId, ids);
        return Collections.unmodifiableSet(new LinkedHashSet<>(ids));
    }

    @Override
    public boolean isParticipant(long conversationId, long userId) {
        if (conversationId <= 0 || userId <= 0) {
            return false;
        }
        return memberMapper.countMember(conversationId, userId) > 0;
    }

    @Override
    public ConversationEntity requireParticipant(long conversationId, long userId) {
        if (conversationId <= 0) {
            throw ChatException.invalidPayload("invalid_conversation_id");
        }
        ConversationEntity conversation = this.getById(conversationId);
        if (conversation == null) {
            throw ChatException.notFound("conversation_not_found");
        }
        if (!isParticipant(conversationId, userId)) {
            throw ChatException.unauthorized("not_participant");
        }
        return conversation;
    }

    @Override
    public List<Long> conversationsOf(long userId) {
        if (userId <= 0) {
            return List.of();
        }
        List<Long> ids = memberMapper.selectConversationIds(userId);
        return ids == null ? List.of() : ids;
    }

    @Override
    public Set<Long> peersOf(long userId) {
        if (userId <= 0) {
            return Set.of();
        }
        List<Long> ids = memberMapper.selectPeerIds(userId);
        if (ids == null || ids.isEmpty()) {
            return Set.of();
        }
        Set<Long> out = new LinkedHashSet<>(ids);
        out.remove(userId);
        return out;
    }

    @Override
    public ConversationDto getOrCreate(long buyerId, long sellerId, Long productId) {
        if (buyerId <= 0 || sellerId <= 0) {
            throw ChatException.invalidPayload("buyerId and sellerId are required");
        }
        if (buyerId == sellerId) {
            throw ChatException.invalidPayload("buyer and seller must differ");
        }
        if (!userService.exists(buyerId) || !userService.exists(sellerId)) {
            throw ChatException.notFound("user_not_found");
        }

        String pairKey = pairKey(buyerId, sellerId, productId);
        ConversationEntity existing = findByPairKey(pairKey);
        if (existing != null) {
            return detail(existing.getId());
        }

        try {
            Long id = transactionTemplate.execute(status -> create(pairKey, productId, buyerId, sellerId));
            log.info("conversation created: id={}, buyerId={}, sellerId={}, productId={}", id, buyerId, sellerId, productId);
            return detail(id == null ? 0 : id);
        } catch (DuplicateKeyException e) {
            // 并发创建：唯一键冲突后读对方写入的那一条
            ConversationEntity winner = findByPairKey(pairKey);
            if (winner == null) {
                throw ChatException.persistence("conversation_create_failed", e);
            }
            return detail(winner.getId());
        }
    }

    private Long create(String pairKey, Long productId, long buyerId, long sellerId) {
        LocalDateTime now = LocalDateTime.now();
        ConversationEntity c = new ConversationEntity();
        c.setId(IdWorker.getId());
        c.setProductId(productId);
        c.setPairKey(pairKey);
        c.setNextMsgSeq(0L);
        c.setCreatedAt(now);
        c.setUpdatedAt(now);
        this.save(c);

        for (long userId : new long[]{buyerId, sellerId}) {
            ConversationMemberEntity m = new ConversationMemberEntity();
            m.setId(IdWorker.getId());
            m.setConversationId(c.getId());
            m.setUserId(userId);
            m.setUnreadCount(0);
            m.setCreatedAt(now);
            memberMapper.insert(m);
        }
        return c.getId();
    }

    @Override
    public ConversationDto detail(long conversationId) {
        ConversationEntity c = this.getById(conversationId);
        if (c == null) {
            throw ChatException.notFound("conversation_not_found");
        }
        Map<Long, Integer> unread = unreadCounts(conversationId);
        return new ConversationDto(c.getId(), c.getProductId(), new ArrayList<>(unread.keySet()), unread,
                LastMessageDto.from(c), c.getCreatedAt(), c.getUpdatedAt());
    }

    @Override
    public List<ConversationSummaryDto> listForUser(long userId) {
        if (userId <= 0) {
            throw ChatException.invalidPayload("invalid_user_id");
        }
        List<ConversationEntity> conversations = baseMapper.selectByUserId(userId);
        if (conversations == null || conversations.isEmpty()) {
            return List.of();
        }

        List<Long> ids = conversations.stream().map(ConversationEntity::getId).toList();
        Map<Long, List<ConversationMemberEntity>> membersByConversation = new HashMap<>();
        for (ConversationMemberEntity m : memberMapper.selectByConversationIds(ids)) {
            membersByConversation.computeIfAbsent(m.getConversationId(), k -> new ArrayList<>()).add(m);
        }

        Map<Long, Long> otherByConversation = new HashMap<>();
        Map<Long, Integer> unreadByConversation = new HashMap<>();
        for (Map.Entry<Long, List<ConversationMemberEntity>> e : membersByConversation.entrySet()) {
            for (ConversationMemberEntity m : e.getValue()) {
                if (m.getUserId() != null && m.getUserId() == userId) {
                    unreadByConversation.put(e.getKey(), m.getUnreadCount() == null ? 0 : m.getUnreadCount());
                } else if (!otherByConversation.containsKey(e.getKey())) {
                    otherByConversation.put(e.getKey(), m.getUserId());
                }
            }
        }
        Map<Long, String> names = userService.namesOf(new LinkedHashSet<>(otherByConversation.values()));

        List<ConversationSummaryDto> out = new ArrayList<>(conversations.size());
        for (ConversationEntity c : conversations) {
            Long other = otherByConversation.get(c.getId());
            out.add(new ConversationSummaryDto(
                    c.getId(),
                    c.getProductId(),
                    other,
                    other == null ? null : names.get(other),
                    LastMessageDto.from(c),
                    unreadByConversation.getOrDefault(c.getId(), 0),
                    c.getUpdatedAt()
            ));
        }
        return out;
    }

    @Override
    public List<MessageDto> history(long conversationId, int page, int size) {
        if (this.getById(conversationId) == null) {
            throw ChatException.notFound("conversation_not_found");
        }
        int p = Math.max(1, page);
        int s = size <= 0 ? 50 : Math.min(size, MAX_PAGE_SIZE);
        Page<MessageEntity> result = messageMapper.selectPage(new Page<>(p, s, false),
                new LambdaQueryWrapper<MessageEntity>()
                        .eq(MessageEntity::getConversationId, conversationId)
                        .orderByDesc(MessageEntity::getMsgSeq));
        List<MessageDto> out = new ArrayList<>(result.getRecords().size());
        for (MessageEntity m : result.getRecords()) {
            out.add(MessageDto.from(m));
        }
        Collections.reverse(out);
        return out;
    }

    @Override
    public Map<Long, Integer> unreadCounts(long conversationId) {
        List<ConversationMemberEntity> members = memberMapper.selectList(new LambdaQueryWrapper<ConversationMemberEntity>()
                .eq(ConversationMemberEntity::getConversationId, conversationId)
                .orderByAsc(ConversationMemberEntity::getUserId));
        if (members == null || members.isEmpty()) {
            throw ChatException.notFound("conversation_not_found");
        }
        Map<Long, Integer> out = new LinkedHashMap<>();
        for (ConversationMemberEntity m : members) {
            out.put(m.getUserId(), m.getUnreadCount() == null ? 0 : Math.max(0, m.getUnreadCount()));
        }
        return out;
    }

    private ConversationEntity findByPairKey(String pairKey) {
        return this.getOne(new LambdaQueryWrapper<ConversationEntity>()
                .eq(ConversationEntity::getPairKey, pairKey)
                .last("limit 1"));
    }

    static String pairKey(long a, long b, Long productId) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        return lo + ":" + hi + ":" + (productId == null ? 0 : productId);
    }
}
