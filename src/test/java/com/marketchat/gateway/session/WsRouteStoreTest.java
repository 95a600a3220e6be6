package com.marketchat.gateway.session;

import com.marketchat.gateway.config.GatewayProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WsRouteStoreTest {

    private StringRedisTemplate redis;
    private HashOperations<String, Object, Object> hashOps;
    private WsRouteStore store;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        WsRouteStore.resetFailFastForTest();
        redis = mock(StringRedisTemplate.class);
        hashOps = mock(HashOperations.class);
        when(redis.opsForHash()).thenReturn(hashOps);
        store = new WsRouteStore(redis, new GatewayProperties("127.0.0.1", 9001, "/ws", "gw-a", null, null));
    }

    @AfterEach
    void tearDown() {
        WsRouteStore.resetFailFastForTest();
    }

    @Test
    void routeKeyOf_ShouldUseUserId() {
        assertEquals("im:chat:route:42", WsRouteStore.routeKeyOf(42));
    }

    @Test
    void serverId_ShouldComeFromInstanceId() {
        assertEquals("gw-a", store.serverId());
    }

    @Test
    void serversOf_ShouldDedupeServerIds() {
        when(hashOps.values("im:chat:route:1")).thenReturn(List.of("gw-a", "gw-b", "gw-a", " "));
        assertEquals(Set.of("gw-a", "gw-b"), store.serversOf(1));
    }

    @Test
    void batchServers_ShouldSkipUsersWithoutConnections() {
        when(hashOps.values("im:chat:route:1")).thenReturn(List.of("gw-a"));
        when(hashOps.values("im:chat:route:2")).thenReturn(List.of());

        Map<Long, Set<String>> out = store.batchServers(List.of(1L, 2L));
        assertEquals(Map.of(1L, Set.of("gw-a")), out);
    }

    @Test
    void serversOf_ShouldReturnNullAndFailFast_WhenRedisDown() {
        when(hashOps.values(anyString())).thenThrow(new RedisConnectionFailureException("down"));

        assertNull(store.serversOf(1));
        assertNull(store.batchServers(List.of(1L, 2L)));
        // fail-fast 窗口内直接放弃，不再访问 Redis
        assertFalse(store.touch(1));
    }

    @Test
    void touch_ShouldRefreshTtl() {
        when(redis.expire(anyString(), any(Duration.class))).thenReturn(true);
        assertTrue(store.touch(7));
    }

    @Test
    void addConn_ShouldIgnoreBlankConnId() {
        assertNull(store.addConn(1, " "));
        assertNull(store.removeConn(1, null));
    }
}
