package com.marketchat.gateway.ws.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TypingEvent(Long conversationId, @JsonProperty("isTyping") Boolean isTyping) implements WsInboundEvent {

    @Override
    public void validate() {
        WsInboundEvent.requirePositive(conversationId, "missing_conversation_id");
    }

    public boolean typing() {
        return Boolean.TRUE.equals(isTyping);
    }
}
