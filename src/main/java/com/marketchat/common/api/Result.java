package com.marketchat.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 统一 HTTP 返回对象：{@code {ok, code, message, data, ts}}。
 *
 * <p>code 成功固定为 0，失败见 {@link ApiCodes}。</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, System.currentTimeMillis());
    }

    /** 不能命名为 ok()：record 已生成同名 boolean 访问器。 */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }
}
