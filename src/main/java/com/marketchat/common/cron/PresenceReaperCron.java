package com.marketchat.common.cron;

import com.marketchat.gateway.config.PresenceProperties;
import com.marketchat.gateway.ws.WsPresenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 心跳超时扫描：lastSeen 超过超时时间仍标记在线的用户置离线并广播。
 *
 * <p>默认开启；多实例同时扫描时由条件更新保证每个用户只被置离线一次。</p>
 */
@ConditionalOnProperty(name = "im.presence.reaper.enabled", havingValue = "true", matchIfMissing = true)
@Component
@RequiredArgsConstructor
@Slf4j
public class PresenceReaperCron {

    private final WsPresenceService presenceService;
    private final PresenceProperties props;

    @Scheduled(fixedDelayString = "${im.presence.reaper.fixed-delay-ms:30000}")
    public void reapStalePresence() {
        LocalDateTime before = LocalDateTime.now().minus(props.heartbeatTimeoutEffective());
        try {
            int n = presenceService.reapStale(before, props.reaperBatchSizeEffective());
            if (n > 0) {
                log.info("presence reaper: candidates={}, before={}", n, before);
            }
        } catch (Exception e) {
            log.warn("presence reaper failed: {}", e.toString());
        }
    }
}
