package com.chesscoach.analysisservice.games.chess.domain.enums;

/**
 * 执棋方。FEN 中分别记作 'w' / 'b'。
 */
public enum Side {
    WHITE('w'),
    BLACK('b');

    private final char fenChar;

    Side(char fenChar) {
        this.fenChar = fenChar;
    }

    public char fenChar() {
        return fenChar;
    }

    public Side opposite() {
        return this == WHITE ? BLACK : WHITE;
    }

    /** FEN 第二字段 → 执棋方；无法识别返回 null */
    public static Side fromFen(String field) {
        if ("w".equals(field)) return WHITE;
        if ("b".equals(field)) return BLACK;
        return null;
    }
}
