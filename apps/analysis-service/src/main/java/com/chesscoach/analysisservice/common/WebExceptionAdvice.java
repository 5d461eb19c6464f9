package com.chesscoach.analysisservice.common;

import com.chesscoach.analysisservice.common.exception.AnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.EngineException;
import com.chesscoach.analysisservice.common.exception.GameAnalysisFailedException;
import com.chesscoach.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常映射处理器。
 * 核心层的异常原样冒泡到这里，再统一映射为 {@link ApiResponse}（HTTP 状态 + errorCode）。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 处理输入类异常（非法 FEN / PGN / 参数 / 评分输入）。
     * 这些异常都继承自 IllegalArgumentException，属于调用方错误，不重试。
     * @param e 参数非法异常
     * @return HTTP 400，errorCode 区分具体类型
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return respond(e);
    }

    /**
     * 处理 Bean Validation 校验失败（请求体缺少必填字段等）。
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(f -> f + " 不能为空")
                .collect(Collectors.joining("; "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.badRequest(ErrorCode.BAD_REQUEST.name(), msg));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> missingParam(MissingServletRequestParameterException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.badRequest(ErrorCode.BAD_REQUEST.name(), e.getMessage()));
    }

    /**
     * 处理引擎异常（不可用 503 / 超时 504 / 拒绝局面 422）。
     * 调用方可自行重试，服务端不做隐式重试。
     */
    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiResponse<Object>> engine(EngineException e) {
        log.warn("引擎异常: {}", e.getMessage());
        return respond(e);
    }

    /**
     * 处理分析失败（包装了底层引擎异常，HTTP 状态取自底层原因）。
     */
    @ExceptionHandler({AnalysisFailedException.class, GameAnalysisFailedException.class})
    public ResponseEntity<ApiResponse<Object>> analysisFailed(RuntimeException e) {
        log.error("分析失败: {}", e.getMessage(), e.getCause());
        return respond(e);
    }

    /**
     * 处理非法状态异常（IllegalStateException），例如引擎句柄在归还后被继续使用。
     * @return HTTP 409（Conflict）
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(HttpStatus.CONFLICT.value(), "CONFLICT", e.getMessage()));
    }

    private ResponseEntity<ApiResponse<Object>> respond(Throwable e) {
        int status = ErrorCode.httpStatusOf(e);
        return ResponseEntity.status(status)
                .body(ApiResponse.error(status, ErrorCode.of(e).name(), e.getMessage()));
    }
}
