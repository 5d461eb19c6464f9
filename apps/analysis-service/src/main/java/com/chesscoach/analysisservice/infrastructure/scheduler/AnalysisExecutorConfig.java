package com.chesscoach.analysisservice.infrastructure.scheduler;

import com.chesscoach.analysisservice.games.chess.service.AnalysisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 这个线程池专门用于 WebSocket 发起的整盘分析，与 STOMP 入站线程分开，避免长时间的引擎调用阻塞消息处理。
 * 实际并发仍受引擎池容量限制，多出来的任务在引擎池上排队等待。
 */
@Configuration
public class AnalysisExecutorConfig {

    @Bean(name = "analysisExecutor", destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(AnalysisProperties props) {
        int poolSize = Math.max(1, props.getWorkerThreads());
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "analysis-worker-" + idx.getAndIncrement());
                // 设置为守护线程
                t.setDaemon(true);
                return t;
            }
        };
        return new ThreadPoolExecutor(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), tf);
    }
}
