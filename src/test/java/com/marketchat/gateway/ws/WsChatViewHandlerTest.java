package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.service.ActiveViewTracker;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.gateway.session.SessionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsChatViewHandlerTest {

    private static final long CONV = 100L;
    private static final long BUYER = 1L;
    private static final long SELLER = 2L;

    private MessageDeliveryService deliveryService;
    private ActiveViewTracker tracker;
    private WsPushService pushService;
    private WsWriter wsWriter;
    private WsChatViewHandler handler;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        deliveryService = mock(MessageDeliveryService.class);
        tracker = new ActiveViewTracker();
        SessionRegistry sessionRegistry = mock(SessionRegistry.class);
        pushService = mock(WsPushService.class);
        wsWriter = mock(WsWriter.class);
        Executor direct = Runnable::run;
        handler = new WsChatViewHandler(deliveryService, tracker, sessionRegistry, pushService, wsWriter,
                new KeyedSerialExecutor<>(direct));
        ch = new EmbeddedChannel();
        when(sessionRegistry.connIdOf(ch)).thenReturn("conn-1");
    }

    @Test
    void enterChat_ShouldMarkReadThenTrackView() {
        when(deliveryService.markRead(CONV, SELLER))
                .thenReturn(new ReadResult(CONV, SELLER, List.of(BUYER, SELLER), List.of(11L), 1));

        handler.enterChat(ch, SELLER, CONV).join();

        assertThat(tracker.isActive(SELLER, CONV)).isTrue();
        assertThat(tracker.current(SELLER).connectionId()).isEqualTo("conn-1");
        verify(wsWriter).write(eq(ch), argThat(env -> WsEvents.ENTER_CHAT_SUCCESS.equals(env.type)));
        verify(pushService).pushToUsers(eq(List.of(BUYER, SELLER)), argThat(env -> WsEvents.MESSAGES_READ.equals(env.type)));
    }

    @Test
    void enterChat_ShouldNotTrackView_WhenNotParticipant() {
        when(deliveryService.markRead(CONV, 3L)).thenThrow(ChatException.unauthorized("not_participant"));

        handler.enterChat(ch, 3L, CONV).exceptionally(e -> null).join();

        assertThat(tracker.current(3L)).isNull();
        verify(pushService, never()).pushToUsers(any(), any());
    }

    @Test
    void leaveChat_ShouldClearView() {
        tracker.enter(SELLER, CONV, "conn-1");

        handler.leaveChat(ch, SELLER, CONV).join();

        assertThat(tracker.isActive(SELLER, CONV)).isFalse();
        verify(wsWriter).write(eq(ch), argThat(env -> WsEvents.LEAVE_CHAT_SUCCESS.equals(env.type)));
    }
}
