package com.marketchat.gateway.ws.cluster;

import com.marketchat.gateway.session.WsRouteStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.backoff.FixedBackOff;

/**
 * 每个实例只订阅自己的控制 topic（im:chat:ctrl:{serverId}），发往别的实例的推送不会收到。
 */
@Slf4j
@Configuration
public class WsClusterConfig {

    private static final long RECOVERY_INTERVAL_MS = 1000;

    @Bean
    public RedisMessageListenerContainer wsClusterListenerContainer(RedisConnectionFactory connectionFactory,
                                                                    WsClusterListener listener,
                                                                    WsRouteStore routeStore) {
        // 由 WsClusterListenerStarter 负责启动
        RedisMessageListenerContainer container = new RedisMessageListenerContainer() {
            @Override
            public boolean isAutoStartup() {
                return false;
            }
        };
        container.setConnectionFactory(connectionFactory);
        ChannelTopic topic = new ChannelTopic(WsClusterBus.topic(routeStore.serverId()));
        container.addMessageListener(listener, topic);
        container.setRecoveryBackoff(new FixedBackOff(RECOVERY_INTERVAL_MS, FixedBackOff.UNLIMITED_ATTEMPTS));
        container.setErrorHandler(e -> log.warn("ws cluster listener error: topic={}, err={}", topic.getTopic(), e.toString()));
        log.info("ws cluster topic: {}", topic.getTopic());
        return container;
    }
}
