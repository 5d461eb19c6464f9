package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidFenException;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.Piece;
import com.chesscoach.analysisservice.games.chess.domain.model.Squares;

/**
 * FEN 编解码：只做语法层面的解析与输出。
 * 局面是否合法（王的数量、非走子方被将军等）由 {@link ChessJudge#validate(Board, String)} 判定。
 *
 * 接受 4~6 个字段；缺省的半回合计数为 0、全回合数为 1。
 */
public final class FenCodec {

    public static final String STARTING_POSITION = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private FenCodec() {
    }

    public static Board parse(String fen) {
        if (fen == null || fen.isBlank()) {
            throw new InvalidFenException(String.valueOf(fen), "FEN 为空");
        }
        String[] fields = fen.trim().split("\\s+");
        if (fields.length < 4 || fields.length > 6) {
            throw new InvalidFenException(fen, "字段数应为 4~6 个，实际 " + fields.length);
        }
        Board board = new Board();
        parsePlacement(board, fields[0], fen);

        Side side = Side.fromFen(fields[1]);
        if (side == null) {
            throw new InvalidFenException(fen, "走子方只能是 w 或 b");
        }
        board.setSideToMove(side);
        board.setCastlingRights(parseCastling(fields[2], fen));

        if (!"-".equals(fields[3])) {
            int ep = Squares.parse(fields[3]);
            if (ep < 0 || (Squares.rank(ep) != 2 && Squares.rank(ep) != 5)) {
                throw new InvalidFenException(fen, "吃过路兵格不合法: " + fields[3]);
            }
            board.setEnPassantSquare(ep);
        }
        board.setHalfmoveClock(fields.length > 4 ? parseCounter(fields[4], 0, fen) : 0);
        board.setFullmoveNumber(fields.length > 5 ? parseCounter(fields[5], 1, fen) : 1);
        return board;
    }

    public static String format(Board board) {
        StringBuilder fen = new StringBuilder();
        for (int rank = 7; rank >= 0; rank--) {
            int empty = 0;
            for (int file = 0; file < 8; file++) {
                Piece p = board.get(Squares.of(file, rank));
                if (p == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    fen.append(empty);
                    empty = 0;
                }
                fen.append(p.fenChar());
            }
            if (empty > 0) fen.append(empty);
            if (rank > 0) fen.append('/');
        }
        fen.append(' ').append(board.sideToMove().fenChar()).append(' ');

        StringBuilder castling = new StringBuilder();
        if (board.hasCastlingRight(Board.WHITE_KINGSIDE)) castling.append('K');
        if (board.hasCastlingRight(Board.WHITE_QUEENSIDE)) castling.append('Q');
        if (board.hasCastlingRight(Board.BLACK_KINGSIDE)) castling.append('k');
        if (board.hasCastlingRight(Board.BLACK_QUEENSIDE)) castling.append('q');
        fen.append(castling.length() == 0 ? "-" : castling);

        fen.append(' ').append(board.enPassantSquare() < 0 ? "-" : Squares.name(board.enPassantSquare()));
        fen.append(' ').append(board.halfmoveClock());
        fen.append(' ').append(board.fullmoveNumber());
        return fen.toString();
    }

    private static void parsePlacement(Board board, String placement, String fen) {
        String[] rows = placement.split("/", -1);
        if (rows.length != 8) {
            throw new InvalidFenException(fen, "棋盘应有 8 行，实际 " + rows.length);
        }
        for (int i = 0; i < 8; i++) {
            int rank = 7 - i;
            int file = 0;
            boolean lastWasDigit = false;
            for (char c : rows[i].toCharArray()) {
                if (c >= '1' && c <= '8') {
                    if (lastWasDigit) {
                        throw new InvalidFenException(fen, "第 " + (rank + 1) + " 行出现连续数字");
                    }
                    file += c - '0';
                    lastWasDigit = true;
                } else {
                    Piece p = Piece.fromFenChar(c);
                    if (p == null) {
                        throw new InvalidFenException(fen, "无法识别的棋子字符 '" + c + "'");
                    }
                    if (file >= 8) {
                        throw new InvalidFenException(fen, "第 " + (rank + 1) + " 行超过 8 格");
                    }
                    board.set(Squares.of(file, rank), p);
                    file++;
                    lastWasDigit = false;
                }
            }
            if (file != 8) {
                throw new InvalidFenException(fen, "第 " + (rank + 1) + " 行格数为 " + file + "，应为 8");
            }
        }
    }

    private static int parseCastling(String field, String fen) {
        if ("-".equals(field)) return 0;
        int rights = 0;
        for (char c : field.toCharArray()) {
            int bit = switch (c) {
                case 'K' -> Board.WHITE_KINGSIDE;
                case 'Q' -> Board.WHITE_QUEENSIDE;
                case 'k' -> Board.BLACK_KINGSIDE;
                case 'q' -> Board.BLACK_QUEENSIDE;
                default -> throw new InvalidFenException(fen, "易位权字段不合法: " + field);
            };
            if ((rights & bit) != 0) {
                throw new InvalidFenException(fen, "易位权重复: " + field);
            }
            rights |= bit;
        }
        return rights;
    }

    private static int parseCounter(String field, int min, String fen) {
        try {
            int v = Integer.parseInt(field);
            if (v < min) {
                throw new InvalidFenException(fen, "回合计数不能小于 " + min + ": " + field);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new InvalidFenException(fen, "回合计数不是整数: " + field);
        }
    }
}
