package com.chesscoach.analysisservice.games.chess.domain.enums;

/**
 * 终局类型。处于终局的局面不再送入引擎。
 */
public enum Termination {
    /** 将死 */
    CHECKMATE,
    /** 逼和 */
    STALEMATE,
    /** 子力不足以将死 */
    INSUFFICIENT_MATERIAL,
    /** 75 回合规则（150 个半回合无吃子、无兵步） */
    SEVENTY_FIVE_MOVES
}
