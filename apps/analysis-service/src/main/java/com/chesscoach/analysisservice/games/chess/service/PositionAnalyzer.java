package com.chesscoach.analysisservice.games.chess.service;

import com.chesscoach.analysisservice.engine.core.EngineClient;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.SearchParameters;
import com.chesscoach.analysisservice.games.chess.domain.dto.BestMoveResult;

import java.util.List;

public interface PositionAnalyzer {

    /**
     * 分析单个局面（自行从引擎池租用句柄）。
     * 校验顺序：FEN → depth / multiPv → lines，全部通过后才调用引擎。
     * depth / multiPv 为空时使用默认值；lines 为空表示不限制候选着法。
     */
    EvaluationResult analyzePosition(String fen, Integer depth, Integer multiPv, List<String> lines);

    /** 使用调用方已租用的句柄分析（整盘分析整局只租一次） */
    EvaluationResult analyzePosition(String fen, SearchParameters params, EngineClient client);

    /** 最佳着法；终局局面返回"无着法"结果而不是错误，且不调用引擎 */
    BestMoveResult getBestMove(String fen, Integer depth);

    /** 默认搜索深度 */
    int defaultDepth();
}
