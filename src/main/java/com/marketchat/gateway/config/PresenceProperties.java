package com.marketchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 在线状态 / 心跳超时配置。
 *
 * <p>客户端约 30s 发一次 heartbeat，默认超时取 3 倍间隔。</p>
 */
@ConfigurationProperties(prefix = "im.presence")
public record PresenceProperties(
        Integer heartbeatTimeoutSeconds,
        Integer reaperBatchSize,
        Reaper reaper
) {

    public static final int DEFAULT_HEARTBEAT_TIMEOUT_SECONDS = 90;
    public static final int DEFAULT_REAPER_BATCH_SIZE = 200;

    public Duration heartbeatTimeoutEffective() {
        int s = heartbeatTimeoutSeconds == null || heartbeatTimeoutSeconds <= 0
                ? DEFAULT_HEARTBEAT_TIMEOUT_SECONDS
                : heartbeatTimeoutSeconds;
        return Duration.ofSeconds(s);
    }

    public int reaperBatchSizeEffective() {
        return reaperBatchSize == null || reaperBatchSize <= 0 ? DEFAULT_REAPER_BATCH_SIZE : reaperBatchSize;
    }

    /**
     * @param enabled      false 时不跑定时扫描（单测/本地调试）
     * @param fixedDelayMs 扫描间隔，定时任务直接读 {@code im.presence.reaper.fixed-delay-ms}
     */
    public record Reaper(Boolean enabled, Long fixedDelayMs) {
    }
}
