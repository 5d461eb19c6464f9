package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.ChessMove;
import com.chesscoach.analysisservice.games.chess.domain.model.Piece;
import com.chesscoach.analysisservice.games.chess.domain.model.Squares;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SAN（标准代数记谱）与着法之间的转换。
 * 解析时宽容：允许省略吃子符号 x、将军符号 +/#、升变等号，以及 0-0 写法。
 */
public final class SanCodec {

    // 棋子字母、起点纵线、起点横线、吃子、终点、升变
    private static final Pattern SAN = Pattern.compile(
            "^([NBRQK])?([a-h])?([1-8])?(x)?([a-h][1-8])(?:=?([NBRQnbrq]))?$");

    private SanCodec() {
    }

    /**
     * 在当前局面中解析 SAN；无对应合法着法或存在歧义时返回 empty。
     */
    public static Optional<ChessMove> resolve(Board board, String san) {
        if (san == null) return Optional.empty();
        String s = san.trim().replaceAll("[+#!?]+$", "");
        List<ChessMove> legal = MoveGenerator.legalMoves(board);

        if (s.equals("O-O") || s.equals("0-0")) {
            return castle(board, legal, true);
        }
        if (s.equals("O-O-O") || s.equals("0-0-0")) {
            return castle(board, legal, false);
        }

        Matcher m = SAN.matcher(s);
        if (!m.matches()) return Optional.empty();
        PieceType type = m.group(1) == null ? PieceType.PAWN : PieceType.fromLetter(m.group(1).charAt(0));
        int fromFile = m.group(2) == null ? -1 : m.group(2).charAt(0) - 'a';
        int fromRank = m.group(3) == null ? -1 : m.group(3).charAt(0) - '1';
        int to = Squares.parse(m.group(5));
        PieceType promo = m.group(6) == null ? null : PieceType.fromLetter(m.group(6).charAt(0));

        ChessMove found = null;
        for (ChessMove mv : legal) {
            Piece p = board.get(mv.from());
            if (p.type() != type || mv.to() != to) continue;
            if (fromFile >= 0 && Squares.file(mv.from()) != fromFile) continue;
            if (fromRank >= 0 && Squares.rank(mv.from()) != fromRank) continue;
            if (mv.promotion() != promo) continue;
            if (found != null) {
                return Optional.empty();
            }
            found = mv;
        }
        return Optional.ofNullable(found);
    }

    /** 把一步合法着法写成 SAN（含必要的消歧与 +/# 后缀） */
    public static String format(Board board, ChessMove move) {
        Piece moving = board.get(move.from());
        StringBuilder san = new StringBuilder();
        boolean capture = board.get(move.to()) != null
                || (moving.type() == PieceType.PAWN && move.to() == board.enPassantSquare()
                    && Squares.file(move.from()) != Squares.file(move.to()));

        if (moving.type() == PieceType.KING && Math.abs(move.to() - move.from()) == 2) {
            san.append(move.to() > move.from() ? "O-O" : "O-O-O");
        } else if (moving.type() == PieceType.PAWN) {
            if (capture) {
                san.append((char) ('a' + Squares.file(move.from()))).append('x');
            }
            san.append(Squares.name(move.to()));
            if (move.promotion() != null) {
                san.append('=').append(move.promotion().letter());
            }
        } else {
            san.append(moving.type().letter());
            san.append(disambiguation(board, move, moving));
            if (capture) san.append('x');
            san.append(Squares.name(move.to()));
        }

        Board after = board.copy();
        after.apply(move);
        if (MoveGenerator.isInCheck(after, after.sideToMove())) {
            san.append(MoveGenerator.hasLegalMove(after) ? '+' : '#');
        }
        return san.toString();
    }

    private static Optional<ChessMove> castle(Board board, List<ChessMove> legal, boolean kingSide) {
        return legal.stream()
                .filter(mv -> board.get(mv.from()).type() == PieceType.KING)
                .filter(mv -> mv.to() - mv.from() == (kingSide ? 2 : -2))
                .findFirst();
    }

    private static String disambiguation(Board board, ChessMove move, Piece moving) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for (ChessMove other : MoveGenerator.legalMoves(board)) {
            if (other.from() == move.from() || other.to() != move.to() || board.get(other.from()) != moving) continue;
            ambiguous = true;
            if (Squares.file(other.from()) == Squares.file(move.from())) sameFile = true;
            if (Squares.rank(other.from()) == Squares.rank(move.from())) sameRank = true;
        }
        if (!ambiguous) return "";
        String from = Squares.name(move.from());
        if (!sameFile) return from.substring(0, 1);
        if (!sameRank) return from.substring(1);
        return from;
    }
}
