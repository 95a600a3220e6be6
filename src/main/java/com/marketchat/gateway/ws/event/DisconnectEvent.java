package com.marketchat.gateway.ws.event;

public record DisconnectEvent() implements WsInboundEvent {
}
