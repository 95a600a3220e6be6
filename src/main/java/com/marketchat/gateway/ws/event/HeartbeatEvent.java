package com.marketchat.gateway.ws.event;

public record HeartbeatEvent(Long userId) implements WsInboundEvent {
}
