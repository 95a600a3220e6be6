package com.marketchat.gateway.ws.cluster;

import com.marketchat.gateway.ws.WsEnvelope;

import java.util.List;

/**
 * 网关实例间的控制消息（Redis Pub/Sub）。目前只有 PUSH：把 envelope 写给目标实例上的本机连接。
 */
public record WsClusterMessage(
        String type,
        List<Long> userIds,
        WsEnvelope envelope,
        String fromServerId,
        Long ts
) {

    public static final String TYPE_PUSH = "PUSH";

    public static WsClusterMessage push(List<Long> userIds, WsEnvelope envelope, String fromServerId) {
        return new WsClusterMessage(TYPE_PUSH, userIds, envelope, fromServerId, System.currentTimeMillis());
    }
}
