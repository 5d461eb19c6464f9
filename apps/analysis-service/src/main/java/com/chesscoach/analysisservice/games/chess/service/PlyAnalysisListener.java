package com.chesscoach.analysisservice.games.chess.service;

import com.chesscoach.analysisservice.games.chess.domain.dto.PlyAnalysis;

/**
 * 整盘分析的逐手回调：每分析完一个采样点调用一次，按半回合顺序。
 */
@FunctionalInterface
public interface PlyAnalysisListener {

    PlyAnalysisListener NONE = entry -> { };

    void onPly(PlyAnalysis entry);
}
