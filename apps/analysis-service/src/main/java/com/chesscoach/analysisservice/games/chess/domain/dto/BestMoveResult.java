package com.chesscoach.analysisservice.games.chess.domain.dto;

import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.games.chess.domain.constants.AnalysisMessages;
import com.chesscoach.analysisservice.games.chess.domain.enums.Termination;

/**
 * 最佳着法查询结果。
 * 终局局面不是错误：bestMove 为空，termination 与 reason 说明原因，evaluation 为空（未调用引擎）。
 */
public record BestMoveResult(String fen, String bestMove, Termination termination, String reason,
                             EvaluationResult evaluation) {

    public static BestMoveResult noMove(String fen, Termination termination) {
        return new BestMoveResult(fen, null, termination, AnalysisMessages.describe(termination), null);
    }

    public static BestMoveResult of(EvaluationResult evaluation) {
        return new BestMoveResult(evaluation.fen(), evaluation.bestMove(), null, null, evaluation);
    }

    public boolean hasMove() {
        return bestMove != null;
    }
}
