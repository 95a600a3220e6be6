package com.marketchat.domain.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.marketchat.common.cache.CacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 会话成员缓存：Caffeine 本机 + Redis set 两级，只用于扇出。
 *
 * <p>成员在会话创建后不变，所以只有 put/evict，没有增量更新。鉴权（是否成员）一律走数据库。</p>
 */
@Slf4j
@Component
public class ConversationParticipantsCache {

    private static final String KEY_PREFIX = "im:cache:conversation:participants:";

    /**
     * Redis down 时 fail-fast，读写直接退回本机缓存/数据库。
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private static final AtomicLong REDIS_UNAVAILABLE_UNTIL_MS = new AtomicLong(0);

    private static final int MAX_LOCAL_CACHE_CONVERSATIONS = 50_000;

    private final CacheProperties props;
    private final StringRedisTemplate redis;
    private final Cache<Long, Set<Long>> local;

    public ConversationParticipantsCache(CacheProperties props, StringRedisTemplate redis) {
        this.props = props;
        this.redis = redis;
        this.local = Caffeine.newBuilder()
                .maximumSize(MAX_LOCAL_CACHE_CONVERSATIONS)
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getConversationParticipantsTtlSeconds())))
                .build();
    }

    /**
     * @return 成员集合；未命中/缓存关闭/Redis 不可用返回 null
     */
    public Set<Long> get(long conversationId) {
        if (!props.isEnabled() || conversationId <= 0) {
            return null;
        }

        Set<Long> localHit = local.getIfPresent(conversationId);
        if (localHit != null && !localHit.isEmpty()) {
            return localHit;
        }

        if (shouldFailFast()) {
            return null;
        }
        try {
            Set<String> raw = redis.opsForSet().members(key(conversationId));
            if (raw == null || raw.isEmpty()) {
                return null;
            }
            Set<Long> out = new LinkedHashSet<>();
            for (String s : raw) {
                if (s == null || s.isBlank()) {
                    continue;
                }
                try {
                    long v = Long.parseLong(s.trim());
                    if (v > 0) {
                        out.add(v);
                    }
                } catch (NumberFormatException ignore) {
                    // 脏数据：跳过该项
                }
            }
            // 少于两人的集合不可能是合法会话，当作未命中
            if (out.size() < 2) {
                return null;
            }
            Set<Long> frozen = Set.copyOf(out);
            local.put(conversationId, frozen);
            return frozen;
        } catch (Exception e) {
            log.debug("redis conversation participants cache get failed: conversationId={}, err={}", conversationId, e.toString());
            markRedisDown();
            return null;
        }
    }

    public void put(long conversationId, Collection<Long> userIds) {
        if (!props.isEnabled() || conversationId <= 0 || userIds == null || userIds.isEmpty()) {
            return;
        }

        Set<Long> out = new LinkedHashSet<>();
        for (Long v : userIds) {
            if (v != null && v > 0) {
                out.add(v);
            }
        }
        if (out.size() < 2) {
            return;
        }
        local.put(conversationId, Set.copyOf(out));

        if (shouldFailFast()) {
            return;
        }
        String k = key(conversationId);
        try {
            String[] values = out.stream().map(String::valueOf).toArray(String[]::new);
            redis.opsForSet().add(k, values);
            redis.expire(k, Duration.ofSeconds(Math.max(1, props.getConversationParticipantsTtlSeconds())));
        } catch (Exception e) {
            log.debug("redis conversation participants cache put failed: conversationId={}, err={}", conversationId, e.toString());
            markRedisDown();
        }
    }

    public void evict(long conversationId) {
        if (!props.isEnabled() || conversationId <= 0) {
            return;
        }
        local.invalidate(conversationId);
        if (shouldFailFast()) {
            return;
        }
        try {
            redis.delete(key(conversationId));
        } catch (Exception e) {
            log.debug("redis conversation participants cache evict failed: conversationId={}, err={}", conversationId, e.toString());
            markRedisDown();
        }
    }

    private String key(long conversationId) {
        return KEY_PREFIX + conversationId;
    }

    private static boolean shouldFailFast() {
        return System.currentTimeMillis() < REDIS_UNAVAILABLE_UNTIL_MS.get();
    }

    private static void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        while (true) {
            long prev = REDIS_UNAVAILABLE_UNTIL_MS.get();
            if (prev >= until) {
                return;
            }
            if (REDIS_UNAVAILABLE_UNTIL_MS.compareAndSet(prev, until)) {
                return;
            }
        }
    }
}
