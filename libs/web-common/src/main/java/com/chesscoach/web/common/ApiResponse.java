package com.chesscoach.web.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    /**
     * 响应状态码，与 HTTP 状态码保持一致
     * 200: 成功
     * 400: 输入错误（FEN/PGN/参数/评分输入不合法）
     * 422: 引擎拒绝分析该局面
     * 502: 分析失败（引擎返回异常）
     * 503: 引擎不可用
     * 504: 引擎超时
     */
    int code,

    /**
     * 机器可读的错误码（如 INVALID_FEN、ENGINE_TIMEOUT），成功时为空
     */
    String errorCode,

    /**
     * 响应消息
     */
    String message,

    /**
     * 响应数据
     */
    T data
) implements Serializable {

    /**
     * 成功响应（带数据）
     */
    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, null, "success", data);
    }

    /**
     * 失败响应
     *
     * @param code      HTTP 状态码
     * @param errorCode 错误码
     * @param message   错误描述
     */
    public static <T> ApiResponse<T> error(int code, String errorCode, String message) {
        return new ApiResponse<>(code, errorCode, message, null);
    }

    /**
     * 失败响应（400 Bad Request）
     */
    public static <T> ApiResponse<T> badRequest(String errorCode, String message) {
        return error(400, errorCode, message);
    }

    /**
     * 是否成功
     */
    public boolean isSuccess() {
        return code == 200;
    }
}
