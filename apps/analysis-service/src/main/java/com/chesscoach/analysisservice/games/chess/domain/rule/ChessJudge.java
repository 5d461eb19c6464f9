package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidFenException;
import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import com.chesscoach.analysisservice.games.chess.domain.enums.Termination;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.ChessMove;
import com.chesscoach.analysisservice.games.chess.domain.model.Piece;
import com.chesscoach.analysisservice.games.chess.domain.model.Squares;

import java.util.Optional;

/**
 * 核心规则判断
 * 国际象棋局面合法性与终局判定，只包含纯判断逻辑，不持有状态。
 */
public final class ChessJudge {

    /** 75 回合规则对应的半回合数 */
    public static final int SEVENTY_FIVE_MOVE_PLIES = 150;

    private ChessJudge() {
    }

    /** 解析并校验 FEN，返回结构合法的局面 */
    public static Board parseLegal(String fen) {
        Board board = FenCodec.parse(fen);
        validate(board, fen);
        return board;
    }

    /**
     * 局面结构合法性校验，失败抛 {@link InvalidFenException}。
     * 检查：双方各一王、每方不超过 16 子 / 8 兵、底线无兵、非走子方不被将军、易位权与王车位置一致、吃过路兵格一致。
     */
    public static void validate(Board board, String fen) {
        for (Side side : Side.values()) {
            String name = side == Side.WHITE ? "白方" : "黑方";
            int kings = board.count(Piece.of(side, PieceType.KING));
            if (kings != 1) {
                throw new InvalidFenException(fen, name + "应有且只有一个王，实际 " + kings);
            }
            if (board.count(side) > 16) {
                throw new InvalidFenException(fen, name + "棋子超过 16 个");
            }
            if (board.count(Piece.of(side, PieceType.PAWN)) > 8) {
                throw new InvalidFenException(fen, name + "兵超过 8 个");
            }
        }
        for (int file = 0; file < 8; file++) {
            if (isPawn(board.get(Squares.of(file, 0))) || isPawn(board.get(Squares.of(file, 7)))) {
                throw new InvalidFenException(fen, "第 1 / 8 横线上不能有兵");
            }
        }
        if (MoveGenerator.isInCheck(board, board.sideToMove().opposite())) {
            throw new InvalidFenException(fen, "非走子方正被将军");
        }
        validateCastling(board, fen);
        validateEnPassant(board, fen);
    }

    /** 终局判定；未结束返回 empty */
    public static Optional<Termination> termination(Board board) {
        if (!MoveGenerator.hasLegalMove(board)) {
            return Optional.of(MoveGenerator.isInCheck(board, board.sideToMove())
                    ? Termination.CHECKMATE : Termination.STALEMATE);
        }
        if (isInsufficientMaterial(board)) {
            return Optional.of(Termination.INSUFFICIENT_MATERIAL);
        }
        if (board.halfmoveClock() >= SEVENTY_FIVE_MOVE_PLIES) {
            return Optional.of(Termination.SEVENTY_FIVE_MOVES);
        }
        return Optional.empty();
    }

    public static boolean isTerminal(Board board) {
        return termination(board).isPresent();
    }

    /**
     * 子力不足：双方都没有兵、车、后，且
     * 轻子合计不超过 1 个，或者只剩象并且所有象都在同色格上。
     */
    public static boolean isInsufficientMaterial(Board board) {
        int minors = 0;
        int knights = 0;
        int lightBishops = 0;
        int darkBishops = 0;
        for (int sq = 0; sq < 64; sq++) {
            Piece p = board.get(sq);
            if (p == null) continue;
            switch (p.type()) {
                case PAWN, ROOK, QUEEN -> {
                    return false;
                }
                case KNIGHT -> {
                    knights++;
                    minors++;
                }
                case BISHOP -> {
                    if (Squares.isLight(sq)) lightBishops++;
                    else darkBishops++;
                    minors++;
                }
                default -> {
                }
            }
        }
        if (minors <= 1) return true;
        return knights == 0 && (lightBishops == 0 || darkBishops == 0);
    }

    /** 在合法着法中查找与 UCI 串一致的着法（不区分大小写） */
    public static Optional<ChessMove> findLegal(Board board, String uci) {
        if (uci == null) return Optional.empty();
        String wanted = uci.trim().toLowerCase();
        return MoveGenerator.legalMoves(board).stream()
                .filter(m -> m.uci().equals(wanted))
                .findFirst();
    }

    // ----------- private helpers -----------

    private static boolean isPawn(Piece p) {
        return p != null && p.type() == PieceType.PAWN;
    }

    private static void validateCastling(Board board, String fen) {
        checkCastlingRight(board, fen, Board.WHITE_KINGSIDE, Board.E1, Board.H1, Side.WHITE, "K");
        checkCastlingRight(board, fen, Board.WHITE_QUEENSIDE, Board.E1, Board.A1, Side.WHITE, "Q");
        checkCastlingRight(board, fen, Board.BLACK_KINGSIDE, Board.E8, Board.H8, Side.BLACK, "k");
        checkCastlingRight(board, fen, Board.BLACK_QUEENSIDE, Board.E8, Board.A8, Side.BLACK, "q");
    }

    private static void checkCastlingRight(Board board, String fen, int right, int kingSq, int rookSq, Side side, String label) {
        if (!board.hasCastlingRight(right)) return;
        if (board.get(kingSq) != Piece.of(side, PieceType.KING) || board.get(rookSq) != Piece.of(side, PieceType.ROOK)) {
            throw new InvalidFenException(fen, "易位权 " + label + " 与王车位置不符");
        }
    }

    private static void validateEnPassant(Board board, String fen) {
        int ep = board.enPassantSquare();
        if (ep < 0) return;
        Side mover = board.sideToMove();
        int expectedRank = mover == Side.WHITE ? 5 : 2;
        int pawnSq = mover == Side.WHITE ? ep - 8 : ep + 8;
        int originSq = mover == Side.WHITE ? ep + 8 : ep - 8;
        if (Squares.rank(ep) != expectedRank
                || !board.isEmpty(ep)
                || !board.isEmpty(originSq)
                || board.get(pawnSq) != Piece.of(mover.opposite(), PieceType.PAWN)) {
            throw new InvalidFenException(fen, "吃过路兵格 " + Squares.name(ep) + " 与局面不符");
        }
    }
}
