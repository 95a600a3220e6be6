package com.marketchat.common.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 聊天核心的错误分类。
 *
 * <ul>
 *   <li>UNAUTHORIZED / NOT_FOUND / INVALID_PAYLOAD：同步回给发起方，不重试</li>
 *   <li>PERSISTENCE_FAILURE：回给发起方，操作视为未生效（事务回滚）</li>
 *   <li>TRANSPORT_FAILURE：扇出到某个连接失败，只记录，不影响其他接收方</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum ChatErrorCode {

    UNAUTHORIZED("unauthorized"),
    NOT_FOUND("not_found"),
    INVALID_PAYLOAD("invalid_payload"),
    PERSISTENCE_FAILURE("persistence_failure"),
    TRANSPORT_FAILURE("transport_failure");

    /** 协议层错误码（WS 错误帧的 code 字段）。 */
    private final String code;
}
