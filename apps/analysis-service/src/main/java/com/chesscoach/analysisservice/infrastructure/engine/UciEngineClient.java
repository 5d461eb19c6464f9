package com.chesscoach.analysisservice.infrastructure.engine;

import com.chesscoach.analysisservice.common.exception.EngineTimeoutException;
import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.common.exception.InvalidPositionException;
import com.chesscoach.analysisservice.engine.core.EngineClient;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.SearchParameters;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * UCI 协议引擎句柄：持有一个长期存活的引擎进程，按需启动，进程退出或超时无响应后下次调用自动重启。
 *
 * 协议流程：
 *   启动：uci → uciok，setoption（Skill Level / Hash / Threads），isready → readyok
 *   每次分析：setoption MultiPV，isready → readyok，position fen，go depth D [searchmoves ...]，读到 bestmove 结束
 *
 * 输出由每个进程独立的守护线程逐行读入队列，调用线程按截止时间从队列取行。
 * 单次调用视为原子操作：等待期间收到的中断会推迟到调用结束后再恢复。
 */
@Slf4j
public class UciEngineClient implements EngineClient {

    private static final AtomicInteger SEQ = new AtomicInteger(1);

    /** 读线程结束（进程输出流关闭）的标记，引擎输出不会包含 NUL 字符 */
    private static final String EOF = "\u0000EOF";

    private final int id = SEQ.getAndIncrement();
    private final EngineProcessLauncher launcher;
    private final int skillLevel;
    private final int hashMb;
    private final int threads;
    private final Duration handshakeTimeout;
    private final Duration baseTimeout;
    private final Duration perDepthTimeout;
    private final Duration stopGrace;

    private Process process;
    private BufferedWriter writer;
    private BlockingQueue<String> lines;
    private volatile boolean closed;
    private boolean interruptedWhileWaiting;

    public UciEngineClient(EngineProperties props, EngineProcessLauncher launcher) {
        this.launcher = launcher;
        this.skillLevel = props.getSkillLevel();
        this.hashMb = props.getHashMb();
        this.threads = props.getThreads();
        this.handshakeTimeout = props.getHandshakeTimeout();
        this.baseTimeout = props.getBaseTimeout();
        this.perDepthTimeout = props.getPerDepthTimeout();
        this.stopGrace = props.getStopGrace();
    }

    @Override
    public synchronized EvaluationResult evaluate(String fen, SearchParameters params) {
        if (closed) {
            throw new EngineUnavailableException("引擎句柄 #" + id + " 已关闭");
        }
        interruptedWhileWaiting = false;
        try {
            ensureStarted();
            return search(fen, params);
        } finally {
            if (interruptedWhileWaiting) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isHealthy() {
        if (closed) return false;
        Process p = process;
        return p == null || p.isAlive();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        Process p = process;
        if (p == null) return;
        BufferedWriter w = writer;
        try {
            w.write("quit\n");
            w.flush();
        } catch (IOException e) {
            log.debug("引擎 #{} 发送 quit 失败（进程可能已退出）: {}", id, e.getMessage());
        }
        p.destroy();
        log.info("引擎 #{} 已关闭", id);
    }

    // ----------- protocol -----------

    private EvaluationResult search(String fen, SearchParameters params) {
        drainStaleOutput();
        send("setoption name MultiPV value " + params.multiPv());
        send("isready");
        awaitLine("readyok", handshakeTimeout, "isready");
        send("position fen " + fen);
        StringBuilder go = new StringBuilder("go depth ").append(params.depth());
        if (!params.searchMoves().isEmpty()) {
            go.append(" searchmoves ").append(String.join(" ", params.searchMoves()));
        }
        send(go.toString());

        String[] fields = fen.trim().split("\\s+");
        boolean blackToMove = fields.length > 1 && "b".equals(fields[1]);
        UciSearchCollector collector = new UciSearchCollector(blackToMove);
        Duration timeout = baseTimeout.plus(perDepthTimeout.multipliedBy(params.depth()));
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            String line = poll(deadline);
            if (line == null) {
                handleTimeout(collector);
                if (collector.invalidPositionMessage() != null) {
                    throw new InvalidPositionException(fen, collector.invalidPositionMessage());
                }
                log.warn("引擎 #{} 分析超时: depth={}, timeout={}ms, fen={}", id, params.depth(), timeout.toMillis(), fen);
                throw new EngineTimeoutException(params.depth(), timeout);
            }
            if (EOF.equals(line)) {
                markDead();
                throw new EngineUnavailableException("引擎 #" + id + " 在分析过程中退出");
            }
            if (collector.accept(line)) {
                break;
            }
        }
        if (collector.invalidPositionMessage() != null) {
            throw new InvalidPositionException(fen, collector.invalidPositionMessage());
        }
        return collector.result(fen, params.effectiveLines());
    }

    /** 超时：发送 stop 并在宽限期内等待 bestmove；仍无响应则杀掉进程，下次调用重启 */
    private void handleTimeout(UciSearchCollector collector) {
        send("stop");
        long deadline = System.nanoTime() + stopGrace.toNanos();
        while (true) {
            String line = poll(deadline);
            if (line == null || EOF.equals(line)) {
                log.warn("引擎 #{} 在 stop 后仍无响应，重启进程", id);
                markDead();
                return;
            }
            if (collector.accept(line)) {
                return;
            }
        }
    }

    private void ensureStarted() {
        if (process != null && process.isAlive()) return;
        if (process != null) {
            log.warn("引擎 #{} 进程已退出，重新启动", id);
            markDead();
        }
        Process p;
        try {
            p = launcher.launch();
        } catch (IOException e) {
            throw new EngineUnavailableException("无法启动引擎进程: " + e.getMessage(), e);
        }
        BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        Thread reader = new Thread(() -> pump(p, queue), "uci-reader-" + id);
        reader.setDaemon(true);
        reader.start();

        process = p;
        lines = queue;
        writer = new BufferedWriter(new OutputStreamWriter(p.getOutputStream(), StandardCharsets.UTF_8));
        try {
            send("uci");
            awaitLine("uciok", handshakeTimeout, "uci");
            send("setoption name Skill Level value " + skillLevel);
            send("setoption name Hash value " + hashMb);
            send("setoption name Threads value " + threads);
            send("isready");
            awaitLine("readyok", handshakeTimeout, "isready");
        } catch (EngineUnavailableException e) {
            markDead();
            throw e;
        }
        log.info("引擎 #{} 已启动: skill={}, hash={}MB, threads={}", id, skillLevel, hashMb, threads);
    }

    private void awaitLine(String expected, Duration timeout, String command) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            String line = poll(deadline);
            if (line == null) {
                markDead();
                throw new EngineUnavailableException("引擎 #" + id + " 在 " + timeout.toMillis() + "ms 内未响应 " + command);
            }
            if (EOF.equals(line)) {
                markDead();
                throw new EngineUnavailableException("引擎 #" + id + " 在握手阶段退出");
            }
            if (line.trim().equals(expected)) return;
        }
    }

    private void send(String command) {
        try {
            writer.write(command);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            markDead();
            throw new EngineUnavailableException("向引擎 #" + id + " 写入命令失败: " + command, e);
        }
    }

    /** 截止时间前取一行；超时返回 null */
    private String poll(long deadlineNanos) {
        while (true) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) return null;
            try {
                return lines.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interruptedWhileWaiting = true;
            }
        }
    }

    /** 丢弃上一次调用遗留的输出（例如超时后迟到的 info 行） */
    private void drainStaleOutput() {
        String stale;
        while ((stale = lines.poll()) != null) {
            if (EOF.equals(stale)) {
                markDead();
                throw new EngineUnavailableException("引擎 #" + id + " 已退出");
            }
        }
    }

    private void markDead() {
        Process p = process;
        process = null;
        if (p != null) {
            p.destroyForcibly();
        }
    }

    private void pump(Process p, BlockingQueue<String> queue) {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                queue.add(line);
            }
        } catch (IOException e) {
            log.debug("引擎 #{} 输出流读取结束: {}", id, e.getMessage());
        } finally {
            queue.add(EOF);
        }
    }
}
