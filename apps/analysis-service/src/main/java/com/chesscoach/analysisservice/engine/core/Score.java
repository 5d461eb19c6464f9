package com.chesscoach.analysisservice.engine.core;

/**
 * 引擎评估值：厘兵值（cp）或 N 步杀（mate，正数为白方杀、负数为黑方杀）。
 * 统一以白方视角表示。
 */
public record Score(Type type, int value) {

    public enum Type { CP, MATE }

    public static Score cp(int centipawns) {
        return new Score(Type.CP, centipawns);
    }

    public static Score mate(int moves) {
        return new Score(Type.MATE, moves);
    }

    /** 视角翻转（走子方视角 ↔ 白方视角） */
    public Score negate() {
        return new Score(type, -value);
    }

    public boolean isMate() {
        return type == Type.MATE;
    }
}
