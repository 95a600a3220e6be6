package com.marketchat.gateway.ws;

import com.marketchat.common.error.ChatException;
import com.marketchat.domain.service.ConversationService;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * typing / recording_indicator：不落库，只转发给会话里的其他成员。
 */
@Slf4j
@Component
public class WsIndicatorHandler {

    private final ConversationService conversationService;
    private final WsPushService pushService;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;

    public WsIndicatorHandler(ConversationService conversationService,
                              WsPushService pushService,
                              WsWriter wsWriter,
                              @Qualifier("imDbExecutor") Executor dbExecutor) {
        this.conversationService = conversationService;
        this.pushService = pushService;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
    }

    public CompletableFuture<Void> typing(Channel ch, long userId, long conversationId, boolean typing) {
        return relay(ch, userId, conversationId, WsEvents.userTyping(conversationId, userId, typing));
    }

    public CompletableFuture<Void> recording(Channel ch, long userId, long conversationId, boolean recording) {
        return relay(ch, userId, conversationId, WsEvents.recordingIndicator(conversationId, userId, recording));
    }

    private CompletableFuture<Void> relay(Channel ch, long userId, long conversationId, WsEnvelope env) {
        CompletableFuture<Void> f;
        try {
            f = CompletableFuture.runAsync(() -> {
                // 成员列表走缓存即可：指示器不改任何状态
                Set<Long> participants = conversationService.participantsOf(conversationId);
                if (!participants.contains(userId)) {
                    throw ChatException.unauthorized("not_participant");
                }
                List<Long> others = new ArrayList<>(participants.size());
                for (Long p : participants) {
                    if (p != null && p != userId) {
                        others.add(p);
                    }
                }
                pushService.pushToUsers(others, env);
            }, dbExecutor);
        } catch (RejectedExecutionException e) {
            f = CompletableFuture.failedFuture(e);
        }
        return f.whenComplete((v, err) -> {
            if (err != null) {
                wsWriter.writeFailure(ch, WsEvents.ERROR, err, null, null);
            }
        });
    }
}
