package com.marketchat.domain.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.marketchat.domain.dto.ConversationDto;
import com.marketchat.domain.dto.ConversationSummaryDto;
import com.marketchat.domain.dto.MessageDto;
import com.marketchat.domain.entity.ConversationEntity;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 会话目录：成员关系、用户的会话、扇出对象。
 */
public interface ConversationService extends IService<ConversationEntity> {

    /**
     * 会话成员（可能来自缓存，仅用于扇出）。
     *
     * @throws com.marketchat.common.error.ChatException NOT_FOUND 会话不存在
     */
    Set<Long> participantsOf(long conversationId);

    /** 直接查库，不走缓存。 */
    boolean isParticipant(long conversationId, long userId);

    /**
     * 会话存在且 userId 是成员，否则抛 NOT_FOUND / UNAUTHORIZED。
     */
    ConversationEntity requireParticipant(long conversationId, long userId);

    List<Long> conversationsOf(long userId);

    /** 与 userId 至少共享一个会话的其它用户（去重）。 */
    Set<Long> peersOf(long userId);

    /**
     * 买家 + 卖家 (+ 商品) 取已有会话，不存在则创建，所有成员未读数初始化为 0。
     */
    ConversationDto getOrCreate(long buyerId, long sellerId, Long productId);

    ConversationDto detail(long conversationId);

    List<ConversationSummaryDto> listForUser(long userId);

    /**
     * 历史消息分页：page 从 1 开始，第 1 页是最新的一页，页内按时间正序。
     */
    List<MessageDto> history(long conversationId, int page, int size);

    Map<Long, Integer> unreadCounts(long conversationId);
}
