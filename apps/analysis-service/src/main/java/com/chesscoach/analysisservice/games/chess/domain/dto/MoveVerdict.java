package com.chesscoach.analysisservice.games.chess.domain.dto;

import com.chesscoach.analysisservice.engine.core.Score;

/**
 * 着法判定结果：候选着法是否与引擎最佳着法一致，并附上引擎的选择供前端展示。
 *
 * @param correct    是否与最佳着法一致（严格比较，不区分大小写）
 * @param bestMove   引擎最佳着法；终局局面为 null
 * @param evaluation 白方视角的局面评估；终局局面为 null
 */
public record MoveVerdict(String fen, String move, boolean correct, String bestMove, Score evaluation, String message) {
}
