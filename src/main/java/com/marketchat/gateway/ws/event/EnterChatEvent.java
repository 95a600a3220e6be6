package com.marketchat.gateway.ws.event;

public record EnterChatEvent(Long conversationId) implements WsInboundEvent {

    @Override
    public void validate() {
        WsInboundEvent.requirePositive(conversationId, "missing_conversation_id");
    }
}
