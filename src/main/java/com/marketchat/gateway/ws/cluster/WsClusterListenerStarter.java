package com.marketchat.gateway.ws.cluster;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 跨实例推送监听器的看门狗。
 *
 * <p>容器不随 Spring 自动启动：Redis 不可用时网关照常起来，只做本机扇出；
 * 这里定时检查，Redis 恢复后把监听器接上。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsClusterListenerStarter implements SmartLifecycle {

    /** 连续失败时每隔多少次打一条 WARN，其余降为 DEBUG。 */
    private static final int WARN_EVERY = 12;

    private final RedisMessageListenerContainer container;

    private final AtomicBoolean enabled = new AtomicBoolean(false);
    private final AtomicInteger failures = new AtomicInteger(0);

    @Override
    public void start() {
        enabled.set(true);
    }

    @Scheduled(fixedDelayString = "${im.gateway.cluster.listener-retry-ms:5000}")
    public void ensureListening() {
        if (!enabled.get() || container.isRunning()) {
            return;
        }
        try {
            container.start();
            int before = failures.getAndSet(0);
            log.info("ws cluster listener started: previousFailures={}", before);
        } catch (Exception e) {
            int n = failures.incrementAndGet();
            if (n == 1 || n % WARN_EVERY == 0) {
                log.warn("ws cluster listener not started, local fan-out only: failures={}, err={}", n, e.toString());
            } else {
                log.debug("ws cluster listener start retry failed: failures={}, err={}", n, e.toString());
            }
        }
    }

    int failures() {
        return failures.get();
    }

    @Override
    public void stop() {
        enabled.set(false);
        try {
            container.stop();
        } catch (Exception e) {
            log.debug("stop ws cluster listener failed: {}", e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        return enabled.get();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
