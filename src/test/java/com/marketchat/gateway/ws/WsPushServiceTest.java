package com.marketchat.gateway.ws;

import com.marketchat.gateway.session.SessionRegistry;
import com.marketchat.gateway.session.WsRouteStore;
import com.marketchat.gateway.ws.cluster.WsClusterBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsPushServiceTest {

    private SessionRegistry sessionRegistry;
    private WsRouteStore routeStore;
    private WsPushService pushService;

    @BeforeEach
    void setUp() {
        sessionRegistry = mock(SessionRegistry.class);
        routeStore = mock(WsRouteStore.class);
        pushService = new WsPushService(sessionRegistry, routeStore, mock(WsClusterBus.class), mock(WsWriter.class));
    }

    @Test
    void isConnected_ShouldBeTrue_WhenLocalChannelExists() {
        when(sessionRegistry.hasLocalConnection(2L)).thenReturn(true);

        assertThat(pushService.isConnected(2L)).isTrue();
        verify(routeStore, never()).serversOf(2L);
    }

    @Test
    void isConnected_ShouldFollowRedisRoute_WhenConnectedElsewhere() {
        when(routeStore.serversOf(2L)).thenReturn(Set.of("gw-b"));

        assertThat(pushService.isConnected(2L)).isTrue();
    }

    @Test
    void isConnected_ShouldBeFalse_WhenNoRouteOrRedisDown() {
        when(routeStore.serversOf(2L)).thenReturn(Set.of());
        assertThat(pushService.isConnected(2L)).isFalse();

        when(routeStore.serversOf(2L)).thenReturn(null);
        assertThat(pushService.isConnected(2L)).isFalse();
    }
}
