package com.marketchat.gateway.config;

import com.marketchat.common.concurrent.KeyedSerialExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

@Configuration
@EnableConfigurationProperties({GatewayProperties.class, PresenceProperties.class})
public class GatewayConfig {

    /**
     * 会话维度串行：send_message / mark_read / enter_chat / leave_chat。
     */
    @Bean("conversationSerialExecutor")
    public KeyedSerialExecutor<Long> conversationSerialExecutor(@Qualifier("imDbExecutor") Executor imDbExecutor) {
        return new KeyedSerialExecutor<>(imDbExecutor);
    }

    /**
     * 用户维度串行：在线状态写入。
     */
    @Bean("presenceSerialExecutor")
    public KeyedSerialExecutor<Long> presenceSerialExecutor(@Qualifier("imDbExecutor") Executor imDbExecutor) {
        return new KeyedSerialExecutor<>(imDbExecutor);
    }
}
