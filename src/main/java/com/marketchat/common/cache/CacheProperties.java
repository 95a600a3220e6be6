package com.marketchat.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "im.cache")
public class CacheProperties {

    private boolean enabled = true;

    /** 会话成员在本实例建会话后不变，TTL 只用于兜底回收内存。 */
    private long conversationParticipantsTtlSeconds = 600;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getConversationParticipantsTtlSeconds() {
        return conversationParticipantsTtlSeconds;
    }

    public void setConversationParticipantsTtlSeconds(long conversationParticipantsTtlSeconds) {
        this.conversationParticipantsTtlSeconds = conversationParticipantsTtlSeconds;
    }
}
