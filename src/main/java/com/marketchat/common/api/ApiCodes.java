package com.marketchat.common.api;

/**
 * HTTP 业务错误码（Result.code）。WS 错误帧使用 {@link com.marketchat.common.error.ChatErrorCode} 的字符串码。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    public static final int BAD_REQUEST = 40000;

    /** 非会话成员 */
    public static final int FORBIDDEN = 40300;

    public static final int NOT_FOUND = 40400;

    public static final int INTERNAL_ERROR = 50000;

    /** 落库失败（不自动重试，由调用方决定） */
    public static final int PERSISTENCE_FAILURE = 50300;
}
