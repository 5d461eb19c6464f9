package com.chesscoach.analysisservice.common.exception;

/**
 * 引擎进程无法启动、握手失败、中途退出，或引擎池在等待时间内没有空闲句柄。
 */
public class EngineUnavailableException extends EngineException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
