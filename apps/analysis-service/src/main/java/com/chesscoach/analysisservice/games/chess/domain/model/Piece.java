package com.chesscoach.analysisservice.games.chess.domain.model;

import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;

/**
 * 带颜色的棋子。FEN 中白方大写、黑方小写。
 */
public enum Piece {
    WHITE_PAWN(Side.WHITE, PieceType.PAWN),
    WHITE_KNIGHT(Side.WHITE, PieceType.KNIGHT),
    WHITE_BISHOP(Side.WHITE, PieceType.BISHOP),
    WHITE_ROOK(Side.WHITE, PieceType.ROOK),
    WHITE_QUEEN(Side.WHITE, PieceType.QUEEN),
    WHITE_KING(Side.WHITE, PieceType.KING),
    BLACK_PAWN(Side.BLACK, PieceType.PAWN),
    BLACK_KNIGHT(Side.BLACK, PieceType.KNIGHT),
    BLACK_BISHOP(Side.BLACK, PieceType.BISHOP),
    BLACK_ROOK(Side.BLACK, PieceType.ROOK),
    BLACK_QUEEN(Side.BLACK, PieceType.QUEEN),
    BLACK_KING(Side.BLACK, PieceType.KING);

    private final Side side;
    private final PieceType type;

    Piece(Side side, PieceType type) {
        this.side = side;
        this.type = type;
    }

    public Side side() {
        return side;
    }

    public PieceType type() {
        return type;
    }

    public char fenChar() {
        return side == Side.WHITE ? type.letter() : Character.toLowerCase(type.letter());
    }

    public static Piece of(Side side, PieceType type) {
        return values()[(side == Side.WHITE ? 0 : 6) + type.ordinal()];
    }

    /** FEN 字符 → 棋子；无法识别返回 null */
    public static Piece fromFenChar(char c) {
        PieceType type = PieceType.fromLetter(c);
        if (type == null) return null;
        return of(Character.isUpperCase(c) ? Side.WHITE : Side.BLACK, type);
    }
}
