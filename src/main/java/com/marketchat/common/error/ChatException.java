package com.marketchat.common.error;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorCode errorCode;

    public ChatException(ChatErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ChatException(ChatErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public static ChatException unauthorized(String message) {
        return new ChatException(ChatErrorCode.UNAUTHORIZED, message);
    }

    public static ChatException notFound(String message) {
        return new ChatException(ChatErrorCode.NOT_FOUND, message);
    }

    public static ChatException invalidPayload(String message) {
        return new ChatException(ChatErrorCode.INVALID_PAYLOAD, message);
    }

    public static ChatException persistence(String message, Throwable cause) {
        return new ChatException(ChatErrorCode.PERSISTENCE_FAILURE, message, cause);
    }

    /**
     * 把异步链路上的异常还原成 ChatException（CompletionException 等包装会被剥掉）。
     * 非 ChatException 一律视为落库失败。
     */
    public static ChatException unwrap(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof ChatException ce) {
                return ce;
            }
            if (t.getCause() == null || t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return persistence("internal_error", error);
    }
}
