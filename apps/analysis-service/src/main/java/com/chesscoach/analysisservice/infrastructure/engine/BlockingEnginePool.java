package com.chesscoach.analysisservice.infrastructure.engine;

import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.engine.core.EngineClient;
import com.chesscoach.analysisservice.engine.core.EngineLease;
import com.chesscoach.analysisservice.engine.core.EnginePool;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于信号量的引擎句柄池。
 * - 信号量许可数 = 池容量，租用即占用一个许可，归还时释放；
 * - 句柄按需创建，归还时不健康（进程已死 / 已关闭）的句柄直接关闭丢弃，下次租用时补建；
 * - 关闭池后不再出租，租出中的句柄在归还时关闭。
 */
@Slf4j
public class BlockingEnginePool implements EnginePool {

    private final int capacity;
    private final Duration defaultTimeout;
    private final Supplier<EngineClient> factory;
    private final Semaphore permits;
    private final Deque<EngineClient> idle = new ArrayDeque<>();
    private volatile boolean closed;

    public BlockingEnginePool(int capacity, Duration defaultTimeout, Supplier<EngineClient> factory) {
        if (capacity < 1) {
            throw new IllegalArgumentException("引擎池容量至少为 1，实际 " + capacity);
        }
        this.capacity = capacity;
        this.defaultTimeout = defaultTimeout;
        this.factory = factory;
        this.permits = new Semaphore(capacity, true);
        log.info("引擎池已创建: capacity={}, acquireTimeout={}ms", capacity, defaultTimeout.toMillis());
    }

    @Override
    public EngineLease acquire() {
        return acquire(defaultTimeout);
    }

    @Override
    public EngineLease acquire(Duration timeout) {
        if (closed) {
            throw new EngineUnavailableException("引擎池已关闭");
        }
        boolean granted;
        try {
            granted = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineUnavailableException("等待引擎句柄时被中断", e);
        }
        if (!granted) {
            throw new EngineUnavailableException("在 " + timeout.toMillis() + "ms 内没有空闲的引擎句柄（容量 " + capacity + "）");
        }
        try {
            EngineClient client = takeIdleOrCreate();
            return new EngineLease(client, this::release);
        } catch (RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int available() {
        return permits.availablePermits();
    }

    @Override
    public void close() {
        synchronized (idle) {
            closed = true;
            EngineClient c;
            while ((c = idle.poll()) != null) {
                c.close();
            }
        }
        log.info("引擎池已关闭");
    }

    private EngineClient takeIdleOrCreate() {
        synchronized (idle) {
            EngineClient c;
            while ((c = idle.poll()) != null) {
                if (c.isHealthy()) return c;
                log.warn("丢弃不可用的引擎句柄");
                c.close();
            }
        }
        return factory.get();
    }

    private void release(EngineClient client) {
        try {
            boolean kept = false;
            if (client.isHealthy()) {
                synchronized (idle) {
                    if (!closed) {
                        idle.push(client);
                        kept = true;
                    }
                }
            }
            if (!kept) {
                client.close();
            }
        } finally {
            permits.release();
        }
    }
}
