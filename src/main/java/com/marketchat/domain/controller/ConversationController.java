package com.marketchat.domain.controller;

import com.marketchat.common.api.Result;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.ConversationDto;
import com.marketchat.domain.dto.ConversationSummaryDto;
import com.marketchat.domain.dto.CreateConversationRequest;
import com.marketchat.domain.dto.MarkReadRequest;
import com.marketchat.domain.dto.MessageDto;
import com.marketchat.domain.service.ConversationService;
import com.marketchat.gateway.ws.WsReceiptHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

@RequiredArgsConstructor
@RestController
@RequestMapping("/conversations")
public class ConversationController {

    private final ConversationService conversationService;
    private final WsReceiptHandler receiptHandler;

    /**
     * 买家 + 卖家 (+ 商品) 取已有会话或新建。
     */
    @PostMapping
    public Result<ConversationDto> create(@Valid @RequestBody CreateConversationRequest req) {
        return Result.ok(conversationService.getOrCreate(req.buyerId(), req.sellerId(), req.productId()));
    }

    @GetMapping
    public Result<List<ConversationSummaryDto>> list(@RequestParam Long userId) {
        if (userId == null || userId <= 0) {
            throw ChatException.invalidPayload("missing_user_id");
        }
        return Result.ok(conversationService.listForUser(userId));
    }

    @GetMapping("/{id}")
    public Result<ConversationDto> detail(@PathVariable("id") Long id) {
        return Result.ok(conversationService.detail(id));
    }

    @GetMapping("/{id}/messages")
    public Result<List<MessageDto>> messages(@PathVariable("id") Long id,
                                             @RequestParam(required = false) Integer page,
                                             @RequestParam(required = false) Integer size) {
        int safePage = page == null ? 1 : Math.max(page, 1);
        int safeSize = size == null ? 0 : size;
        return Result.ok(conversationService.history(id, safePage, safeSize));
    }

    @GetMapping("/{id}/unread-counts")
    public Result<Map<Long, Integer>> unreadCounts(@PathVariable("id") Long id) {
        return Result.ok(conversationService.unreadCounts(id));
    }

    /**
     * 与 WS mark_read 同语义：清零调用方未读，有变化时给会话成员推 messages_read。
     */
    @PutMapping("/{id}/read")
    public Result<Void> markRead(@PathVariable("id") Long id, @Valid @RequestBody MarkReadRequest req) {
        try {
            receiptHandler.readAndBroadcast(id, req.userId()).join();
        } catch (CompletionException e) {
            throw ChatException.unwrap(e);
        }
        return Result.okVoid();
    }
}
