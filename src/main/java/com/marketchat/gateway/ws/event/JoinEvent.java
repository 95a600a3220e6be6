package com.marketchat.gateway.ws.event;

/**
 * @param userId 可选；带了就必须与握手身份一致
 */
public record JoinEvent(Long userId) implements WsInboundEvent {
}
