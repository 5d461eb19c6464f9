package com.chesscoach.analysisservice.common;

import com.chesscoach.analysisservice.common.exception.AnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.EngineTimeoutException;
import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.common.exception.GameAnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.InvalidFenException;
import com.chesscoach.analysisservice.common.exception.InvalidParameterException;
import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.common.exception.InvalidPositionException;
import com.chesscoach.analysisservice.common.exception.InvalidRatingInputException;

import java.util.concurrent.CancellationException;

/**
 * 错误码与 HTTP 状态的对应关系。
 * HTTP 异常处理器与 WebSocket 错误推送共用同一套映射，前端只需识别 errorCode。
 */
public enum ErrorCode {

    INVALID_FEN(400),
    INVALID_PGN(400),
    INVALID_PARAMETER(400),
    INVALID_RATING_INPUT(400),
    BAD_REQUEST(400),
    INVALID_POSITION(422),
    ANALYSIS_FAILED(502),
    GAME_ANALYSIS_FAILED(502),
    ENGINE_UNAVAILABLE(503),
    ENGINE_TIMEOUT(504),
    CANCELLED(499),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    /**
     * 按异常类型取错误码（子类优先）。
     */
    public static ErrorCode of(Throwable e) {
        if (e instanceof InvalidFenException) return INVALID_FEN;
        if (e instanceof InvalidPgnException) return INVALID_PGN;
        if (e instanceof InvalidParameterException) return INVALID_PARAMETER;
        if (e instanceof InvalidRatingInputException) return INVALID_RATING_INPUT;
        if (e instanceof InvalidPositionException) return INVALID_POSITION;
        if (e instanceof EngineTimeoutException) return ENGINE_TIMEOUT;
        if (e instanceof EngineUnavailableException) return ENGINE_UNAVAILABLE;
        if (e instanceof GameAnalysisFailedException) return GAME_ANALYSIS_FAILED;
        if (e instanceof AnalysisFailedException) return ANALYSIS_FAILED;
        if (e instanceof CancellationException) return CANCELLED;
        if (e instanceof IllegalArgumentException) return BAD_REQUEST;
        return INTERNAL_ERROR;
    }

    /**
     * 包装类异常（分析失败）的 HTTP 状态取自其底层引擎原因：超时 504、不可用 503、其余 502。
     */
    public static int httpStatusOf(Throwable e) {
        ErrorCode code = of(e);
        if (code != ANALYSIS_FAILED && code != GAME_ANALYSIS_FAILED) {
            return code.httpStatus;
        }
        for (Throwable c = e.getCause(); c != null; c = c.getCause()) {
            ErrorCode inner = of(c);
            if (inner == ENGINE_TIMEOUT || inner == ENGINE_UNAVAILABLE || inner == INVALID_POSITION) {
                return inner.httpStatus;
            }
        }
        return code.httpStatus;
    }
}
