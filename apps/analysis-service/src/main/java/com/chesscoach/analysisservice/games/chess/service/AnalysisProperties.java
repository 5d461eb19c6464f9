package com.chesscoach.analysisservice.games.chess.service;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 分析请求的默认参数（请求中未指定时使用）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "chess.analysis")
public class AnalysisProperties {

    /** 默认搜索深度 */
    private int defaultDepth = 18;

    /** 默认候选线数 */
    private int defaultMultiPv = 3;

    /** 整盘分析默认采样间隔（每 N 个半回合分析一次） */
    private int defaultInterval = 3;

    /** WebSocket 整盘分析的工作线程数 */
    private int workerThreads = 2;
}
