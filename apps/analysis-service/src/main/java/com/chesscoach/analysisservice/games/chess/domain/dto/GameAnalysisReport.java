package com.chesscoach.analysisservice.games.chess.domain.dto;

import java.util.List;

/**
 * 整盘分析报告：按半回合顺序排列的采样点，不会重排。
 *
 * @param entries            采样点
 * @param totalPlies         棋谱总半回合数
 * @param positionsAnalyzed  实际送入引擎的局面数
 * @param analyzeInterval    采样间隔
 */
public record GameAnalysisReport(List<PlyAnalysis> entries, int totalPlies, int positionsAnalyzed,
                                 int analyzeInterval, int depth, int multiPv) {

    public GameAnalysisReport {
        entries = List.copyOf(entries);
    }
}
