package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.ReadResult;
import com.marketchat.domain.service.MessageDeliveryService;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsReceiptHandlerTest {

    private static final long CONV = 100L;
    private static final long BUYER = 1L;
    private static final long SELLER = 2L;

    private MessageDeliveryService deliveryService;
    private WsPushService pushService;
    private WsWriter wsWriter;
    private WsReceiptHandler handler;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        deliveryService = mock(MessageDeliveryService.class);
        pushService = mock(WsPushService.class);
        wsWriter = mock(WsWriter.class);
        Executor direct = Runnable::run;
        handler = new WsReceiptHandler(deliveryService, pushService, wsWriter, new KeyedSerialExecutor<>(direct), direct);
        ch = new EmbeddedChannel();
    }

    @Test
    void markRead_ShouldAckAndBroadcastOnce_WhenSomethingWasUnread() {
        when(deliveryService.markRead(CONV, SELLER))
                .thenReturn(new ReadResult(CONV, SELLER, List.of(BUYER, SELLER), List.of(11L, 12L), 2));

        handler.markRead(ch, SELLER, CONV).join();

        verify(wsWriter).write(eq(ch), argThat(env -> WsEvents.MARK_READ_SUCCESS.equals(env.type)));
        verify(pushService, times(1)).pushToUsers(eq(List.of(BUYER, SELLER)),
                argThat(env -> WsEvents.MESSAGES_READ.equals(env.type) && Long.valueOf(SELLER).equals(env.userId)));
    }

    @Test
    void markRead_ShouldAckWithoutBroadcast_WhenRepeated() {
        when(deliveryService.markRead(CONV, SELLER))
                .thenReturn(new ReadResult(CONV, SELLER, List.of(BUYER, SELLER), List.of(), 0));

        handler.markRead(ch, SELLER, CONV).join();
        handler.markRead(ch, SELLER, CONV).join();

        verify(wsWriter, times(2)).write(eq(ch), argThat(env -> WsEvents.MARK_READ_SUCCESS.equals(env.type)));
        verify(pushService, never()).pushToUsers(any(), any());
    }

    @Test
    void markRead_ShouldWriteError_WhenNotParticipant() {
        when(deliveryService.markRead(CONV, 3L)).thenThrow(ChatException.unauthorized("not_participant"));

        handler.markRead(ch, 3L, CONV).exceptionally(e -> null).join();

        verify(wsWriter).writeFailure(eq(ch), eq(WsEvents.ERROR), any(Throwable.class), isNull(), isNull());
        verify(wsWriter, never()).write(eq(ch), any(WsEnvelope.class));
    }

    @Test
    void markDelivered_ShouldNotifySender_WhenReceiptChanged() {
        when(deliveryService.conversationOf(11L)).thenReturn(CONV);
        when(deliveryService.markDelivered(11L, SELLER)).thenReturn(new DeliveryReceipt(11L, CONV, BUYER, SELLER, true));

        handler.markDelivered(ch, SELLER, 11L).join();

        verify(pushService).pushToUser(eq(BUYER), argThat(env -> WsEvents.MESSAGE_DELIVERED.equals(env.type)));
    }

    @Test
    void markDelivered_ShouldStayQuiet_WhenAlreadyDelivered() {
        when(deliveryService.conversationOf(11L)).thenReturn(CONV);
        when(deliveryService.markDelivered(11L, SELLER)).thenReturn(new DeliveryReceipt(11L, CONV, BUYER, SELLER, false));

        handler.markDelivered(ch, SELLER, 11L).join();

        verify(pushService, never()).pushToUser(anyLong(), any());
    }

    @Test
    void markDelivered_ShouldRunAfterQueuedRead_WhenSameConversation() {
        List<Runnable> queue = new ArrayList<>();
        Executor direct = Runnable::run;
        handler = new WsReceiptHandler(deliveryService, pushService, wsWriter, new KeyedSerialExecutor<>(queue::add), direct);
        when(deliveryService.conversationOf(11L)).thenReturn(CONV);
        when(deliveryService.markRead(CONV, SELLER))
                .thenReturn(new ReadResult(CONV, SELLER, List.of(BUYER, SELLER), List.of(11L), 1));
        when(deliveryService.markDelivered(11L, SELLER)).thenReturn(new DeliveryReceipt(11L, CONV, BUYER, SELLER, true));

        CompletableFuture<ReadResult> read = handler.readAndBroadcast(CONV, SELLER);
        CompletableFuture<Void> delivered = handler.markDelivered(ch, SELLER, 11L);
        verify(deliveryService, never()).markDelivered(anyLong(), anyLong());
        while (!queue.isEmpty()) {
            queue.remove(0).run();
        }
        read.join();
        delivered.join();

        InOrder inOrder = inOrder(deliveryService, pushService);
        inOrder.verify(deliveryService).markRead(CONV, SELLER);
        inOrder.verify(pushService).pushToUsers(any(), argThat(env -> WsEvents.MESSAGES_READ.equals(env.type)));
        inOrder.verify(deliveryService).markDelivered(11L, SELLER);
    }

    @Test
    void markDelivered_ShouldWriteError_WhenMessageUnknown() {
        when(deliveryService.conversationOf(99L)).thenThrow(ChatException.notFound("message_not_found"));

        handler.markDelivered(ch, SELLER, 99L).exceptionally(e -> null).join();

        verify(deliveryService, never()).markDelivered(anyLong(), anyLong());
        verify(wsWriter).writeFailure(eq(ch), eq(WsEvents.ERROR), any(Throwable.class), eq(99L), isNull());
    }
}
