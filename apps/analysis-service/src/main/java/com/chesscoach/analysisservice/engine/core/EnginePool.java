package com.chesscoach.analysisservice.engine.core;

import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;

import java.time.Duration;

/**
 * 引擎句柄池：每个槽位一个独占句柄，租用期间不会被其他调用方使用。
 * 调用方必须用 try-with-resources 归还：
 * <pre>
 *   try (EngineLease lease = pool.acquire(timeout)) {
 *       lease.client().evaluate(fen, params);
 *   }
 * </pre>
 */
public interface EnginePool extends AutoCloseable {

    /**
     * 租用一个句柄。
     * @throws EngineUnavailableException 等待超时，或新句柄无法创建
     */
    EngineLease acquire(Duration timeout);

    /** 使用配置的默认等待时间 */
    EngineLease acquire();

    /** 池容量（最多同时租出的句柄数） */
    int capacity();

    /** 当前空闲可立即租用的槽位数 */
    int available();

    @Override
    void close();
}
