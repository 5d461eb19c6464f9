package com.chesscoach.analysisservice.engine.core;

import java.util.List;

/**
 * 一条候选着法及其评估。
 *
 * @param move  UCI 着法
 * @param score 白方视角的评估值
 * @param pv    主要变例（UCI 序列，第一个元素即 move）
 */
public record MoveScore(String move, Score score, List<String> pv) {

    public MoveScore {
        pv = pv == null ? List.of() : List.copyOf(pv);
    }
}
