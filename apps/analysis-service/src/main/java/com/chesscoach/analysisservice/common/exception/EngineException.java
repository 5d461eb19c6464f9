package com.chesscoach.analysisservice.common.exception;

/**
 * 外部分析引擎相关异常的基类。
 * 引擎类异常对调用方可见、可由调用方重试，核心内部不做隐式重试。
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
