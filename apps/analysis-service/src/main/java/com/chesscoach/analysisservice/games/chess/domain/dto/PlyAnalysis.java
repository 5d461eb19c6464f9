package com.chesscoach.analysisservice.games.chess.domain.dto;

import com.chesscoach.analysisservice.engine.core.EvaluationResult;

/**
 * 整盘分析中的一个采样点。
 *
 * @param moveIndex  半回合序号（从 1 开始）
 * @param moveNumber 全回合数
 * @param moveColor  走这步棋的一方："white" / "black"（按半回合奇偶推算）
 * @param fen        走完这步后的局面
 * @param move       实际走的着法（UCI）
 * @param san        实际走的着法（SAN）
 * @param evaluation 对 fen 的分析结果
 */
public record PlyAnalysis(int moveIndex, int moveNumber, String moveColor, String fen,
                          String move, String san, EvaluationResult evaluation) {
}
