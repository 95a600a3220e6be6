package com.marketchat.gateway.ws.event;

public record MarkDeliveredEvent(Long messageId) implements WsInboundEvent {

    @Override
    public void validate() {
        WsInboundEvent.requirePositive(messageId, "missing_message_id");
    }
}
