package com.chesscoach.analysisservice.games.chess.service;

import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisReport;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisRequest;

import java.util.function.BooleanSupplier;

public interface GameAnalysisOrchestrator {

    /** 采样间隔允许范围 */
    int MIN_INTERVAL = 1;
    int MAX_INTERVAL = 10;

    /**
     * 整盘分析：每 analyzeInterval 个半回合分析一次走后局面。
     * 任一采样点分析失败即整体失败（不返回部分结果）。
     */
    GameAnalysisReport analyzeGame(String pgn, Integer depth, Integer multiPv, Integer analyzeInterval);

    /**
     * 流式整盘分析：每个采样点分析完立即回调 listener。
     * 每个半回合之间检查 cancelled 与线程中断，取消时抛 {@link java.util.concurrent.CancellationException}。
     */
    GameAnalysisReport analyzeGame(GameAnalysisRequest request, PlyAnalysisListener listener, BooleanSupplier cancelled);
}
