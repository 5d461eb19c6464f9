package com.chesscoach.analysisservice.engine.core;

import com.chesscoach.analysisservice.common.exception.EngineTimeoutException;
import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.common.exception.InvalidPositionException;

/**
 * 外部分析引擎的句柄抽象：一个句柄对应一个长期存活的引擎进程。
 * - 引擎配置（技能等级、哈希表、线程数）在构造时固定，不随请求变化；
 * - 同一句柄上的调用串行执行，并发调用方应通过 {@link EnginePool} 各自租用句柄。
 */
public interface EngineClient extends AutoCloseable {

    /**
     * 分析一个局面。
     *
     * @throws EngineUnavailableException 进程无法启动或中途退出
     * @throws InvalidPositionException   引擎拒绝该局面
     * @throws EngineTimeoutException     超过随深度放大的等待上限
     */
    EvaluationResult evaluate(String fen, SearchParameters params);

    /** 句柄是否仍可用；尚未启动的句柄视为可用 */
    boolean isHealthy();

    /** 关闭引擎进程，不抛受检异常 */
    @Override
    void close();
}
