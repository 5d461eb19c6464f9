package com.chesscoach.analysisservice.games.chess.domain.enums;

/**
 * 棋子种类。letter 为 SAN / FEN 中使用的大写字母（兵在 SAN 中不写字母）。
 */
public enum PieceType {
    PAWN('P'),
    KNIGHT('N'),
    BISHOP('B'),
    ROOK('R'),
    QUEEN('Q'),
    KING('K');

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /** UCI 升变后缀（小写） */
    public char uciSuffix() {
        return Character.toLowerCase(letter);
    }

    /** 不区分大小写地按字母查找；无法识别返回 null */
    public static PieceType fromLetter(char c) {
        char upper = Character.toUpperCase(c);
        for (PieceType t : values()) {
            if (t.letter == upper) return t;
        }
        return null;
    }

    /** 是否可作为升变目标 */
    public boolean isPromotionTarget() {
        return this == KNIGHT || this == BISHOP || this == ROOK || this == QUEEN;
    }
}
