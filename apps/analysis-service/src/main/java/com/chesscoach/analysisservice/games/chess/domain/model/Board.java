package com.chesscoach.analysisservice.games.chess.domain.model;

import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;

import java.util.Arrays;

/**
 * 国际象棋棋盘：64 格 + 走子方 + 易位权 + 吃过路兵格 + 半回合/全回合计数。
 * 约定：格子编号 0 = a1 ... 63 = h8（见 {@link Squares}）。
 *
 * 只负责存取与执行着法，不判断合法性（由规则层去做），职责单一。
 */
public class Board {

    public static final int WHITE_KINGSIDE = 1;
    public static final int WHITE_QUEENSIDE = 2;
    public static final int BLACK_KINGSIDE = 4;
    public static final int BLACK_QUEENSIDE = 8;

    public static final int E1 = 4, A1 = 0, H1 = 7, E8 = 60, A8 = 56, H8 = 63;

    /** 着法触及某格后保留的易位权掩码（王或车离开原位即失去对应易位权） */
    private static final int[] CASTLING_MASK = new int[64];

    static {
        Arrays.fill(CASTLING_MASK, 0xF);
        CASTLING_MASK[E1] = ~(WHITE_KINGSIDE | WHITE_QUEENSIDE) & 0xF;
        CASTLING_MASK[H1] = ~WHITE_KINGSIDE & 0xF;
        CASTLING_MASK[A1] = ~WHITE_QUEENSIDE & 0xF;
        CASTLING_MASK[E8] = ~(BLACK_KINGSIDE | BLACK_QUEENSIDE) & 0xF;
        CASTLING_MASK[H8] = ~BLACK_KINGSIDE & 0xF;
        CASTLING_MASK[A8] = ~BLACK_QUEENSIDE & 0xF;
    }

    private final Piece[] squares = new Piece[64];
    private Side sideToMove = Side.WHITE;
    private int castlingRights;
    private int enPassantSquare = -1;
    private int halfmoveClock;
    private int fullmoveNumber = 1;

    public Piece get(int square) {
        return squares[square];
    }

    public void set(int square, Piece piece) {
        squares[square] = piece;
    }

    public boolean isEmpty(int square) {
        return squares[square] == null;
    }

    public Side sideToMove() {
        return sideToMove;
    }

    public void setSideToMove(Side sideToMove) {
        this.sideToMove = sideToMove;
    }

    public int castlingRights() {
        return castlingRights;
    }

    public boolean hasCastlingRight(int right) {
        return (castlingRights & right) != 0;
    }

    public void setCastlingRights(int castlingRights) {
        this.castlingRights = castlingRights;
    }

    public int enPassantSquare() {
        return enPassantSquare;
    }

    public void setEnPassantSquare(int enPassantSquare) {
        this.enPassantSquare = enPassantSquare;
    }

    public int halfmoveClock() {
        return halfmoveClock;
    }

    public void setHalfmoveClock(int halfmoveClock) {
        this.halfmoveClock = halfmoveClock;
    }

    public int fullmoveNumber() {
        return fullmoveNumber;
    }

    public void setFullmoveNumber(int fullmoveNumber) {
        this.fullmoveNumber = fullmoveNumber;
    }

    /** 某方王所在格；没有王返回 -1 */
    public int kingSquare(Side side) {
        Piece king = Piece.of(side, PieceType.KING);
        for (int sq = 0; sq < 64; sq++) {
            if (squares[sq] == king) return sq;
        }
        return -1;
    }

    /** 统计某种棋子的数量 */
    public int count(Piece piece) {
        int n = 0;
        for (Piece p : squares) {
            if (p == piece) n++;
        }
        return n;
    }

    /** 统计某方棋子总数 */
    public int count(Side side) {
        int n = 0;
        for (Piece p : squares) {
            if (p != null && p.side() == side) n++;
        }
        return n;
    }

    /**
     * 执行一步棋（不做合法性校验）。
     * 处理：吃过路兵、王车易位的车位移动、升变、易位权维护、半回合/全回合计数、换手。
     */
    public void apply(ChessMove move) {
        int from = move.from();
        int to = move.to();
        Piece moving = squares[from];
        Piece captured = squares[to];
        boolean pawnMove = moving.type() == PieceType.PAWN;

        // 吃过路兵：兵斜走到空的过路兵格
        if (pawnMove && to == enPassantSquare && captured == null && Squares.file(from) != Squares.file(to)) {
            int victim = to + (moving.side() == Side.WHITE ? -8 : 8);
            captured = squares[victim];
            squares[victim] = null;
        }

        squares[from] = null;
        squares[to] = move.promotion() != null ? Piece.of(moving.side(), move.promotion()) : moving;

        // 王车易位：王横移两格，车跟着跳过去
        if (moving.type() == PieceType.KING && Math.abs(to - from) == 2) {
            int rookFrom = to > from ? from + 3 : from - 4;
            int rookTo = to > from ? from + 1 : from - 1;
            squares[rookTo] = squares[rookFrom];
            squares[rookFrom] = null;
        }

        enPassantSquare = pawnMove && Math.abs(to - from) == 16 ? (from + to) / 2 : -1;
        castlingRights &= CASTLING_MASK[from] & CASTLING_MASK[to];
        halfmoveClock = pawnMove || captured != null ? 0 : halfmoveClock + 1;
        if (sideToMove == Side.BLACK) fullmoveNumber++;
        sideToMove = sideToMove.opposite();
    }

    /** 深拷贝（供合法性试走使用） */
    public Board copy() {
        Board b = new Board();
        System.arraycopy(squares, 0, b.squares, 0, 64);
        b.sideToMove = sideToMove;
        b.castlingRights = castlingRights;
        b.enPassantSquare = enPassantSquare;
        b.halfmoveClock = halfmoveClock;
        b.fullmoveNumber = fullmoveNumber;
        return b;
    }
}
