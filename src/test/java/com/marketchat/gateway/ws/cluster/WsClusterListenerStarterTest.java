package com.marketchat.gateway.ws.cluster;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsClusterListenerStarterTest {

    private final RedisMessageListenerContainer container = mock(RedisMessageListenerContainer.class);
    private final WsClusterListenerStarter starter = new WsClusterListenerStarter(container);

    @Test
    void ensureListening_ShouldDoNothing_BeforeLifecycleStart() {
        starter.ensureListening();

        verify(container, never()).start();
    }

    @Test
    void ensureListening_ShouldRetryUntilRedisComesBack() {
        starter.start();
        when(container.isRunning()).thenReturn(false);
        doThrow(new RedisConnectionFailureException("down")).doNothing().when(container).start();

        starter.ensureListening();
        assertThat(starter.failures()).isEqualTo(1);

        starter.ensureListening();
        assertThat(starter.failures()).isZero();
        verify(container, times(2)).start();
    }

    @Test
    void ensureListening_ShouldSkip_WhenAlreadyRunning() {
        starter.start();
        when(container.isRunning()).thenReturn(true);

        starter.ensureListening();

        verify(container, never()).start();
    }

    @Test
    void stop_ShouldStopContainer() {
        starter.start();
        doNothing().when(container).stop();

        starter.stop();

        assertThat(starter.isRunning()).isFalse();
        verify(container).stop();
    }
}
