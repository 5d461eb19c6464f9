package com.chesscoach.analysisservice.games.chess.domain.model;

import com.chesscoach.analysisservice.games.chess.domain.enums.PieceType;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 一步棋：从 from 走到 to，promotion 为升变目标（非升变为 null）。
 * 只描述坐标，合法性由规则层（MoveGenerator / ChessJudge）判定。
 */
public record ChessMove(int from, int to, PieceType promotion) {

    private static final Pattern UCI = Pattern.compile("^[a-h][1-8][a-h][1-8][qrbnQRBN]?$");

    public static ChessMove of(int from, int to) {
        return new ChessMove(from, to, null);
    }

    /** UCI 形式，如 e2e4、e7e8q */
    public String uci() {
        String s = Squares.name(from) + Squares.name(to);
        return promotion == null ? s : s + promotion.uciSuffix();
    }

    public static boolean looksLikeUci(String text) {
        return text != null && UCI.matcher(text).matches();
    }

    /** 解析 UCI 字符串（只做格式解析，不判断合法性） */
    public static Optional<ChessMove> parseUci(String text) {
        if (!looksLikeUci(text)) return Optional.empty();
        PieceType promo = text.length() == 5 ? PieceType.fromLetter(text.charAt(4)) : null;
        return Optional.of(new ChessMove(Squares.parse(text.substring(0, 2)), Squares.parse(text.substring(2, 4)), promo));
    }

    @Override
    public String toString() {
        return uci();
    }
}
