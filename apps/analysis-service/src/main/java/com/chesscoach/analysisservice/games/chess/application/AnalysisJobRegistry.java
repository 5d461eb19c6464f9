package com.chesscoach.analysisservice.games.chess.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * 进行中的 WebSocket 分析任务登记表。
 *
 * 职责：
 *  - 以 requestId 为键提交任务到 analysisExecutor，同一 requestId 同时只允许一个任务；
 *  - 记录任务所属的 STOMP 会话，会话断开时批量取消；
 *  - 取消 = 置取消标记 + 中断工作线程；编排器在半回合之间检查，不打断正在进行的引擎调用。
 */
@Slf4j
@Component
public class AnalysisJobRegistry {

    private final ExecutorService analysisExecutor;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    public AnalysisJobRegistry(@Qualifier("analysisExecutor") ExecutorService analysisExecutor) {
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * 提交任务。task 收到的 BooleanSupplier 在任务被取消后返回 true。
     * @return requestId 已有任务在进行时返回 false，不提交
     */
    public boolean submit(String requestId, String sessionId, Consumer<BooleanSupplier> task) {
        Job job = new Job(sessionId);
        if (jobs.putIfAbsent(requestId, job) != null) {
            return false;
        }
        try {
            job.future = analysisExecutor.submit(() -> {
                try {
                    task.accept(job.cancelled::get);
                } finally {
                    jobs.remove(requestId, job);
                }
            });
        } catch (RejectedExecutionException e) {
            jobs.remove(requestId, job);
            throw e;
        }
        return true;
    }

    /** 取消单个任务；任务不存在返回 false */
    public boolean cancel(String requestId) {
        Job job = jobs.remove(requestId);
        if (job == null) return false;
        job.cancel();
        log.info("已取消分析任务: requestId={}", requestId);
        return true;
    }

    /** 取消某个会话的全部任务，返回取消数量 */
    public int cancelSession(String sessionId) {
        if (sessionId == null) return 0;
        int n = 0;
        for (Map.Entry<String, Job> e : jobs.entrySet()) {
            if (sessionId.equals(e.getValue().sessionId) && jobs.remove(e.getKey(), e.getValue())) {
                e.getValue().cancel();
                n++;
            }
        }
        return n;
    }

    public boolean isActive(String requestId) {
        return jobs.containsKey(requestId);
    }

    public int activeCount() {
        return jobs.size();
    }

    private static final class Job {
        private final String sessionId;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile Future<?> future;

        private Job(String sessionId) {
            this.sessionId = sessionId;
        }

        private void cancel() {
            cancelled.set(true);
            Future<?> f = future;
            if (f != null) {
                f.cancel(true);
            }
        }
    }
}
