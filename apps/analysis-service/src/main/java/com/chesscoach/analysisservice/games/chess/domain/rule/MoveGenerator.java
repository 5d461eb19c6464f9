package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.ChessMove;
import com.chesscoach.analysisservice.games.chess.domain.model.Piece;
import com.chesscoach.analysisservice.games.chess.domain.model.Squares;

import java.util.ArrayList;
import java.util.List;

/**
 * 着法生成器（无状态）。
 * 先生成伪合法着法，再逐一试走，剔除走完后己方王仍被攻击的着法。
 */
public final class MoveGenerator {

    private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_STEPS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] ROOK_DIRS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
    private static final int[][] BISHOP_DIRS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final PieceType[] PROMOTIONS = {PieceType.QUEEN, PieceType.ROOK, PieceType.BISHOP, PieceType.KNIGHT};

    private MoveGenerator() {
    }

    /** 当前走子方的全部合法着法 */
    public static List<ChessMove> legalMoves(Board board) {
        Side us = board.sideToMove();
        List<ChessMove> legal = new ArrayList<>();
        for (ChessMove m : pseudoLegalMoves(board)) {
            Board next = board.copy();
            next.apply(m);
            if (!isInCheck(next, us)) {
                legal.add(m);
            }
        }
        return legal;
    }

    public static boolean hasLegalMove(Board board) {
        Side us = board.sideToMove();
        for (ChessMove m : pseudoLegalMoves(board)) {
            Board next = board.copy();
            next.apply(m);
            if (!isInCheck(next, us)) return true;
        }
        return false;
    }

    /** 某方王是否正被攻击；无王视为未被将军 */
    public static boolean isInCheck(Board board, Side side) {
        int king = board.kingSquare(side);
        return king >= 0 && isSquareAttacked(board, king, side.opposite());
    }

    /** 格子 square 是否被 attacker 方攻击 */
    public static boolean isSquareAttacked(Board board, int square, Side attacker) {
        int f = Squares.file(square);
        int r = Squares.rank(square);

        // 兵：从被攻击格反向看兵所在的两个斜格
        int pawnRank = attacker == Side.WHITE ? r - 1 : r + 1;
        Piece pawn = Piece.of(attacker, PieceType.PAWN);
        for (int df = -1; df <= 1; df += 2) {
            if (Squares.onBoard(f + df, pawnRank) && board.get(Squares.of(f + df, pawnRank)) == pawn) return true;
        }
        if (stepAttack(board, f, r, KNIGHT_STEPS, Piece.of(attacker, PieceType.KNIGHT))) return true;
        if (stepAttack(board, f, r, KING_STEPS, Piece.of(attacker, PieceType.KING))) return true;
        if (slideAttack(board, f, r, ROOK_DIRS, Piece.of(attacker, PieceType.ROOK), Piece.of(attacker, PieceType.QUEEN))) return true;
        return slideAttack(board, f, r, BISHOP_DIRS, Piece.of(attacker, PieceType.BISHOP), Piece.of(attacker, PieceType.QUEEN));
    }

    /** 伪合法着法：遵守棋子走法，但不检查走后是否送将 */
    public static List<ChessMove> pseudoLegalMoves(Board board) {
        Side us = board.sideToMove();
        List<ChessMove> moves = new ArrayList<>(48);
        for (int sq = 0; sq < 64; sq++) {
            Piece p = board.get(sq);
            if (p == null || p.side() != us) continue;
            switch (p.type()) {
                case PAWN -> pawnMoves(board, sq, us, moves);
                case KNIGHT -> stepMoves(board, sq, us, KNIGHT_STEPS, moves);
                case BISHOP -> slideMoves(board, sq, us, BISHOP_DIRS, moves);
                case ROOK -> slideMoves(board, sq, us, ROOK_DIRS, moves);
                case QUEEN -> {
                    slideMoves(board, sq, us, ROOK_DIRS, moves);
                    slideMoves(board, sq, us, BISHOP_DIRS, moves);
                }
                case KING -> {
                    stepMoves(board, sq, us, KING_STEPS, moves);
                    castlingMoves(board, sq, us, moves);
                }
            }
        }
        return moves;
    }

    private static void pawnMoves(Board board, int from, Side us, List<ChessMove> moves) {
        int dir = us == Side.WHITE ? 1 : -1;
        int startRank = us == Side.WHITE ? 1 : 6;
        int lastRank = us == Side.WHITE ? 7 : 0;
        int f = Squares.file(from);
        int r = Squares.rank(from);
        int r1 = r + dir;
        if (r1 < 0 || r1 > 7) return;

        int one = Squares.of(f, r1);
        if (board.isEmpty(one)) {
            addPawnMove(from, one, r1 == lastRank, moves);
            int two = Squares.of(f, r + 2 * dir);
            if (r == startRank && board.isEmpty(two)) {
                moves.add(ChessMove.of(from, two));
            }
        }
        for (int df = -1; df <= 1; df += 2) {
            if (!Squares.onBoard(f + df, r1)) continue;
            int to = Squares.of(f + df, r1);
            Piece target = board.get(to);
            if (target != null && target.side() != us) {
                addPawnMove(from, to, r1 == lastRank, moves);
            } else if (target == null && to == board.enPassantSquare()) {
                moves.add(ChessMove.of(from, to));
            }
        }
    }

    private static void addPawnMove(int from, int to, boolean promotes, List<ChessMove> moves) {
        if (!promotes) {
            moves.add(ChessMove.of(from, to));
            return;
        }
        for (PieceType promo : PROMOTIONS) {
            moves.add(new ChessMove(from, to, promo));
        }
    }

    private static void stepMoves(Board board, int from, Side us, int[][] steps, List<ChessMove> moves) {
        int f = Squares.file(from);
        int r = Squares.rank(from);
        for (int[] s : steps) {
            if (!Squares.onBoard(f + s[0], r + s[1])) continue;
            int to = Squares.of(f + s[0], r + s[1]);
            Piece target = board.get(to);
            if (target == null || target.side() != us) {
                moves.add(ChessMove.of(from, to));
            }
        }
    }

    private static void slideMoves(Board board, int from, Side us, int[][] dirs, List<ChessMove> moves) {
        int f = Squares.file(from);
        int r = Squares.rank(from);
        for (int[] d : dirs) {
            int nf = f + d[0];
            int nr = r + d[1];
            while (Squares.onBoard(nf, nr)) {
                int to = Squares.of(nf, nr);
                Piece target = board.get(to);
                if (target == null) {
                    moves.add(ChessMove.of(from, to));
                } else {
                    if (target.side() != us) moves.add(ChessMove.of(from, to));
                    break;
                }
                nf += d[0];
                nr += d[1];
            }
        }
    }

    /**
     * 王车易位：王与车在原位、中间格为空、王的起点/经过格/终点均不被攻击。
     */
    private static void castlingMoves(Board board, int from, Side us, List<ChessMove> moves) {
        int home = us == Side.WHITE ? Board.E1 : Board.E8;
        if (from != home) return;
        Side them = us.opposite();
        Piece rook = Piece.of(us, PieceType.ROOK);
        int kingSide = us == Side.WHITE ? Board.WHITE_KINGSIDE : Board.BLACK_KINGSIDE;
        int queenSide = us == Side.WHITE ? Board.WHITE_QUEENSIDE : Board.BLACK_QUEENSIDE;

        if (board.hasCastlingRight(kingSide)
                && board.get(home + 3) == rook
                && board.isEmpty(home + 1) && board.isEmpty(home + 2)
                && !isSquareAttacked(board, home, them)
                && !isSquareAttacked(board, home + 1, them)
                && !isSquareAttacked(board, home + 2, them)) {
            moves.add(ChessMove.of(home, home + 2));
        }
        if (board.hasCastlingRight(queenSide)
                && board.get(home - 4) == rook
                && board.isEmpty(home - 1) && board.isEmpty(home - 2) && board.isEmpty(home - 3)
                && !isSquareAttacked(board, home, them)
                && !isSquareAttacked(board, home - 1, them)
                && !isSquareAttacked(board, home - 2, them)) {
            moves.add(ChessMove.of(home, home - 2));
        }
    }

    private static boolean stepAttack(Board board, int f, int r, int[][] steps, Piece attacker) {
        for (int[] s : steps) {
            if (Squares.onBoard(f + s[0], r + s[1]) && board.get(Squares.of(f + s[0], r + s[1])) == attacker) {
                return true;
            }
        }
        return false;
    }

    private static boolean slideAttack(Board board, int f, int r, int[][] dirs, Piece slider, Piece queen) {
        for (int[] d : dirs) {
            int nf = f + d[0];
            int nr = r + d[1];
            while (Squares.onBoard(nf, nr)) {
                Piece p = board.get(Squares.of(nf, nr));
                if (p != null) {
                    if (p == slider || p == queen) return true;
                    break;
                }
                nf += d[0];
                nr += d[1];
            }
        }
        return false;
    }
}
