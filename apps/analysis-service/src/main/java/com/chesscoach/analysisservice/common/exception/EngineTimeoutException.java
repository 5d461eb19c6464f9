package com.chesscoach.analysisservice.common.exception;

import java.time.Duration;

/**
 * 单次引擎调用超过允许的等待时间（随搜索深度放大）。
 */
public class EngineTimeoutException extends EngineException {

    private final Duration timeout;

    public EngineTimeoutException(int depth, Duration timeout) {
        super("引擎在 " + timeout.toMillis() + "ms 内未完成 depth=" + depth + " 的搜索");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
