package com.chesscoach.analysisservice.infrastructure.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 外部分析引擎（UCI 协议，如 Stockfish）相关配置。
 *
 * 进程级选项（技能等级 / 哈希表 / 线程数）在句柄创建时一次性下发，不随请求变化。
 * 支持通过 application.yml 或环境变量覆盖。
 */
@Component
@ConfigurationProperties(prefix = "chess.engine")
public class EngineProperties {

    /**
     * 引擎可执行文件路径，在 PATH 中时可只写名字
     */
    private String path = "stockfish";

    /**
     * 技能等级 0~20，20 为最强
     */
    private int skillLevel = 20;

    /**
     * 哈希表大小（MB）
     */
    private int hashMb = 128;

    /**
     * 每个引擎进程的搜索线程数
     */
    private int threads = 1;

    /**
     * 引擎池大小；0 表示按 CPU 核数减去保留核数自动计算（至少 1）
     */
    private int poolSize = 0;

    private int reservedCores = 1;

    /**
     * 等待空闲句柄的默认时长
     */
    private Duration acquireTimeout = Duration.ofSeconds(10);

    /**
     * 启动握手（uci / isready）的等待上限
     */
    private Duration handshakeTimeout = Duration.ofSeconds(10);

    /**
     * 单次分析的等待上限 = baseTimeout + perDepthTimeout * depth
     */
    private Duration baseTimeout = Duration.ofSeconds(5);

    private Duration perDepthTimeout = Duration.ofSeconds(1);

    /**
     * 超时后发送 stop 再等待 bestmove 的宽限时间，仍无响应则重启进程
     */
    private Duration stopGrace = Duration.ofSeconds(2);

    /** 实际池大小 */
    public int resolvePoolSize() {
        if (poolSize > 0) return poolSize;
        return Math.max(1, Runtime.getRuntime().availableProcessors() - reservedCores);
    }

    // getters and setters
    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getSkillLevel() {
        return skillLevel;
    }

    public void setSkillLevel(int skillLevel) {
        this.skillLevel = skillLevel;
    }

    public int getHashMb() {
        return hashMb;
    }

    public void setHashMb(int hashMb) {
        this.hashMb = hashMb;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(int threads) {
        this.threads = threads;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public int getReservedCores() {
        return reservedCores;
    }

    public void setReservedCores(int reservedCores) {
        this.reservedCores = reservedCores;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public void setAcquireTimeout(Duration acquireTimeout) {
        this.acquireTimeout = acquireTimeout;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public void setHandshakeTimeout(Duration handshakeTimeout) {
        this.handshakeTimeout = handshakeTimeout;
    }

    public Duration getBaseTimeout() {
        return baseTimeout;
    }

    public void setBaseTimeout(Duration baseTimeout) {
        this.baseTimeout = baseTimeout;
    }

    public Duration getPerDepthTimeout() {
        return perDepthTimeout;
    }

    public void setPerDepthTimeout(Duration perDepthTimeout) {
        this.perDepthTimeout = perDepthTimeout;
    }

    public Duration getStopGrace() {
        return stopGrace;
    }

    public void setStopGrace(Duration stopGrace) {
        this.stopGrace = stopGrace;
    }
}
