package com.marketchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.gateway.ws")
public record GatewayProperties(
        String host,
        int port,
        String path,
        /**
         * 实例标识（多实例路由用）。不配置时用 host:port。
         */
        String instanceId,
        /**
         * 读空闲秒数：这么久没收到任何帧就关闭连接（走断线流程）。
         */
        Integer readerIdleSeconds,
        /**
         * 写空闲秒数：触发服务端 WS ping + 刷新路由 TTL。
         */
        Integer writerIdleSeconds
) {

    public static final int DEFAULT_READER_IDLE_SECONDS = 90;
    public static final int DEFAULT_WRITER_IDLE_SECONDS = 30;

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host.trim();
    }

    public String pathEffective() {
        if (path == null || path.isBlank()) {
            return "/ws";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    public String effectiveInstanceId() {
        if (instanceId != null && !instanceId.isBlank()) {
            return instanceId.trim();
        }
        return hostEffective() + ":" + port;
    }

    public int readerIdleSecondsEffective() {
        return readerIdleSeconds == null || readerIdleSeconds <= 0 ? DEFAULT_READER_IDLE_SECONDS : readerIdleSeconds;
    }

    public int writerIdleSecondsEffective() {
        return writerIdleSeconds == null || writerIdleSeconds <= 0 ? DEFAULT_WRITER_IDLE_SECONDS : writerIdleSeconds;
    }
}
