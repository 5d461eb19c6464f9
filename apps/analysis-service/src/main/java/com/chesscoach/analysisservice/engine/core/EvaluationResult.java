package com.chesscoach.analysisservice.engine.core;

import java.util.List;

/**
 * 单次引擎分析的结果，不可变。
 *
 * @param fen        被分析的局面
 * @param bestMove   最佳着法（UCI）；没有合法着法时为 null
 * @param topMoves   候选着法，按引擎排名排序，长度不超过请求的 multiPv
 * @param evaluation 白方视角的局面评估（取第一候选的评估）；没有合法着法时为 null
 * @param depth      实际达到的搜索深度
 */
public record EvaluationResult(String fen, String bestMove, List<MoveScore> topMoves, Score evaluation, int depth) {

    public EvaluationResult {
        topMoves = topMoves == null ? List.of() : List.copyOf(topMoves);
    }

    /** 截断候选着法到 limit 条 */
    public EvaluationResult limitTopMoves(int limit) {
        if (topMoves.size() <= limit) return this;
        return new EvaluationResult(fen, bestMove, topMoves.subList(0, limit), evaluation, depth);
    }

    public boolean hasBestMove() {
        return bestMove != null;
    }
}
