package com.marketchat.gateway.ws;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import com.marketchat.common.error.ChatErrorCode;
import com.marketchat.common.error.ChatException;
import com.marketchat.domain.dto.DeliveryReceipt;
import com.marketchat.domain.dto.UserPresenceDto;
import com.marketchat.domain.service.ActiveViewTracker;
import com.marketchat.domain.service.ConversationService;
import com.marketchat.domain.service.MessageDeliveryService;
import com.marketchat.domain.service.PresenceService;
import com.marketchat.domain.service.UserService;
import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.session.WsRouteStore;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsPresenceServiceTest {

    private static final long BUYER = 1L;
    private static final long SELLER = 2L;

    private PresenceService presenceService;
    private ConversationService conversationService;
    private MessageDeliveryService deliveryService;
    private UserService userService;
    private ActiveViewTracker tracker;
    private SessionRegistry sessionRegistry;
    private WsRouteStore routeStore;
    private WsPushService pushService;
    private WsWriter wsWriter;
    private WsPresenceService service;
    private EmbeddedChannel ch;

    @BeforeEach
    void setUp() {
        presenceService = mock(PresenceService.class);
        conversationService = mock(ConversationService.class);
        deliveryService = mock(MessageDeliveryService.class);
        userService = mock(UserService.class);
        tracker = new ActiveViewTracker();
        sessionRegistry = mock(SessionRegistry.class);
        routeStore = mock(WsRouteStore.class);
        pushService = mock(WsPushService.class);
        wsWriter = mock(WsWriter.class);
        Executor direct = Runnable::run;
        service = new WsPresenceService(presenceService, conversationService, deliveryService, userService, tracker,
                sessionRegistry, routeStore, pushService, wsWriter, new KeyedSerialExecutor<>(direct), new KeyedSerialExecutor<>(direct));
        ch = new EmbeddedChannel();

        when(sessionRegistry.connIdOf(ch)).thenReturn("conn-1");
        when(conversationService.peersOf(SELLER)).thenReturn(Set.of(BUYER));
    }

    @Test
    void join_ShouldGoOnlineBroadcastAndDeliverPending() {
        when(userService.exists(SELLER)).thenReturn(true);
        when(presenceService.setOnline(SELLER, "conn-1"))
                .thenReturn(new UserPresenceDto(SELLER, true, LocalDateTime.now(), "conn-1"));
        when(presenceService.getMany(any())).thenReturn(Map.of(BUYER, UserPresenceDto.offline(BUYER)));
        when(deliveryService.pendingConversations(SELLER)).thenReturn(List.of(100L));
        when(deliveryService.deliverPending(100L, SELLER)).thenReturn(List.of(new DeliveryReceipt(11L, 100L, BUYER, SELLER, true)));

        service.join(ch, SELLER, null).join();

        verify(pushService).pushToUsers(eq(Set.of(BUYER)),
                argThat(env -> WsEvents.USER_STATUS.equals(env.type) && Boolean.TRUE.equals(env.isOnline)));
        verify(wsWriter).write(eq(ch), argThat(env -> WsEvents.PRESENCE_SNAPSHOT.equals(env.type) && env.users.size() == 1));
        verify(pushService).pushToUser(eq(BUYER),
                argThat(env -> WsEvents.MESSAGE_DELIVERED.equals(env.type) && Long.valueOf(11L).equals(env.messageId)));
    }

    @Test
    void join_ShouldNotReportDelivered_WhenNothingWasPromoted() {
        when(userService.exists(SELLER)).thenReturn(true);
        when(presenceService.setOnline(SELLER, "conn-1"))
                .thenReturn(new UserPresenceDto(SELLER, true, LocalDateTime.now(), "conn-1"));
        when(presenceService.getMany(any())).thenReturn(Map.of());
        when(deliveryService.pendingConversations(SELLER)).thenReturn(List.of(100L));
        when(deliveryService.deliverPending(100L, SELLER)).thenReturn(List.of());

        service.join(ch, SELLER, null).join();

        verify(deliveryService).deliverPending(100L, SELLER);
        verify(pushService, never()).pushToUser(anyLong(), any());
    }

    @Test
    void join_ShouldDeliverPendingInsideConversationQueue() {
        List<Runnable> queue = new ArrayList<>();
        Executor direct = Runnable::run;
        service = new WsPresenceService(presenceService, conversationService, deliveryService, userService, tracker,
                sessionRegistry, routeStore, pushService, wsWriter, new KeyedSerialExecutor<>(direct),
                new KeyedSerialExecutor<>(queue::add));
        when(userService.exists(SELLER)).thenReturn(true);
        when(presenceService.setOnline(SELLER, "conn-1"))
                .thenReturn(new UserPresenceDto(SELLER, true, LocalDateTime.now(), "conn-1"));
        when(presenceService.getMany(any())).thenReturn(Map.of());
        when(deliveryService.pendingConversations(SELLER)).thenReturn(List.of(100L, 200L));

        service.join(ch, SELLER, null).join();

        verify(deliveryService, never()).deliverPending(anyLong(), anyLong());
        assertThat(queue).hasSize(2);
        queue.forEach(Runnable::run);
        verify(deliveryService).deliverPending(100L, SELLER);
        verify(deliveryService).deliverPending(200L, SELLER);
    }

    @Test
    void updateStatus_ShouldGoOnlineWithApiConnectionAndBroadcast() {
        when(userService.exists(SELLER)).thenReturn(true);
        when(presenceService.setOnline(SELLER, WsPresenceService.API_CONNECTION_ID))
                .thenReturn(new UserPresenceDto(SELLER, true, LocalDateTime.now(), WsPresenceService.API_CONNECTION_ID));
        when(deliveryService.pendingConversations(SELLER)).thenReturn(List.of());

        UserPresenceDto dto = service.updateStatus(SELLER, true, null).join();

        assertThat(dto.online()).isTrue();
        verify(pushService).pushToUsers(eq(Set.of(BUYER)),
                argThat(env -> WsEvents.USER_STATUS.equals(env.type) && Boolean.TRUE.equals(env.isOnline)));
        verify(deliveryService).pendingConversations(SELLER);
    }

    @Test
    void updateStatus_ShouldGoOfflineWithoutDelivering() {
        when(userService.exists(SELLER)).thenReturn(true);
        when(presenceService.setOffline(SELLER)).thenReturn(new UserPresenceDto(SELLER, false, LocalDateTime.now(), null));

        UserPresenceDto dto = service.updateStatus(SELLER, false, "sock-9").join();

        assertThat(dto.online()).isFalse();
        verify(presenceService, never()).setOnline(anyLong(), any());
        verify(deliveryService, never()).pendingConversations(anyLong());
        verify(pushService).pushToUsers(eq(Set.of(BUYER)),
                argThat(env -> WsEvents.USER_STATUS.equals(env.type) && Boolean.FALSE.equals(env.isOnline)));
    }

    @Test
    void updateStatus_ShouldFail_WhenUserUnknown() {
        when(userService.exists(SELLER)).thenReturn(false);

        assertThatThrownBy(() -> service.updateStatus(SELLER, true, null).join())
                .hasCauseInstanceOf(ChatException.class);
        verify(presenceService, never()).setOnline(anyLong(), any());
    }

    @Test
    void join_ShouldRejectUnknownUser() {
        when(userService.exists(SELLER)).thenReturn(false);

        service.join(ch, SELLER, null).exceptionally(e -> null).join();

        verify(presenceService, never()).setOnline(anyLong(), any());
        verify(wsWriter).writeFailure(eq(ch), eq(WsEvents.ERROR), any(Throwable.class), isNull(), isNull());
    }

    @Test
    void join_ShouldRejectMismatchedUserId() {
        service.join(ch, SELLER, 99L).join();

        verify(wsWriter).writeError(eq(ch), argThat(e -> e.getErrorCode() == ChatErrorCode.UNAUTHORIZED));
        verify(userService, never()).exists(anyLong());
    }

    @Test
    void heartbeat_ShouldTouchRouteAndRefreshPresence() {
        service.heartbeat(ch, SELLER, SELLER).join();

        verify(sessionRegistry).touch(ch);
        verify(presenceService).heartbeat(SELLER, "conn-1");
        verify(wsWriter, never()).writeError(any(), any());
    }

    @Test
    void heartbeat_ShouldRejectMismatchedUserId() {
        service.heartbeat(ch, SELLER, 99L).join();

        verify(presenceService, never()).heartbeat(anyLong(), any());
        verify(wsWriter).writeError(eq(ch), argThat(e -> e.getErrorCode() == ChatErrorCode.UNAUTHORIZED));
    }

    @Test
    void onDisconnect_ShouldGoOffline_WhenLastConnectionClosed() {
        tracker.enter(SELLER, 100L, "conn-1");
        when(routeStore.serversOf(SELLER)).thenReturn(Set.of());
        when(presenceService.setOffline(SELLER)).thenReturn(new UserPresenceDto(SELLER, false, LocalDateTime.now(), null));

        service.onDisconnect(SELLER, "conn-1", 0, null).join();

        assertThat(tracker.isActive(SELLER, 100L)).isFalse();
        verify(presenceService).setOffline(SELLER);
        verify(pushService).pushToUsers(eq(Set.of(BUYER)),
                argThat(env -> WsEvents.USER_STATUS.equals(env.type) && Boolean.FALSE.equals(env.isOnline)));
    }

    @Test
    void onDisconnect_ShouldStayOnline_WhenOtherConnectionsRemain() {
        tracker.enter(SELLER, 100L, "conn-2");

        service.onDisconnect(SELLER, "conn-1", 1, null).join();

        assertThat(tracker.isActive(SELLER, 100L)).isTrue();
        verify(presenceService, never()).setOffline(anyLong());
    }

    @Test
    void onDisconnect_ShouldStayOnline_WhenReconnectedElsewhereMeanwhile() {
        when(routeStore.serversOf(SELLER)).thenReturn(Set.of("gw-b"));

        service.onDisconnect(SELLER, "conn-1", 0, null).join();

        verify(presenceService, never()).setOffline(anyLong());
    }

    @Test
    void onDisconnect_ShouldSkip_WhenClosedByReaper() {
        service.onDisconnect(SELLER, "conn-1", 0, WsPresenceService.CLOSE_REASON_HEARTBEAT_TIMEOUT).join();

        verify(presenceService, never()).setOffline(anyLong());
    }

    @Test
    void reapStale_ShouldMarkOfflineCloseChannelsAndBroadcast() {
        LocalDateTime lastSeen = LocalDateTime.now().minusMinutes(5);
        LocalDateTime before = LocalDateTime.now().minusSeconds(90);
        when(presenceService.findStale(before, 10)).thenReturn(List.of(new UserPresenceDto(SELLER, true, lastSeen, "conn-1")));
        when(presenceService.markOfflineIfStale(SELLER, before)).thenReturn(true);
        when(sessionRegistry.getChannels(SELLER)).thenReturn(List.of(ch));
        tracker.enter(SELLER, 100L, "conn-1");

        int n = service.reapStale(before, 10);

        assertThat(n).isEqualTo(1);
        assertThat(ch.isOpen()).isFalse();
        assertThat(ch.attr(SessionRegistry.ATTR_CLOSE_REASON).get()).isEqualTo(WsPresenceService.CLOSE_REASON_HEARTBEAT_TIMEOUT);
        assertThat(tracker.current(SELLER)).isNull();
        verify(pushService).pushToUsers(eq(Set.of(BUYER)),
                argThat(env -> WsEvents.USER_STATUS.equals(env.type) && Boolean.FALSE.equals(env.isOnline)));
    }

    @Test
    void reapStale_ShouldSkip_WhenHeartbeatArrivedMeanwhile() {
        LocalDateTime before = LocalDateTime.now().minusSeconds(90);
        when(presenceService.findStale(before, 10))
                .thenReturn(List.of(new UserPresenceDto(SELLER, true, before.minusSeconds(1), "conn-1")));
        when(presenceService.markOfflineIfStale(SELLER, before)).thenReturn(false);

        service.reapStale(before, 10);

        verify(pushService, never()).pushToUsers(any(), any());
    }
}
