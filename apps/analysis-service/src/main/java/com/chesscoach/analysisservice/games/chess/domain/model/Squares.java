package com.chesscoach.analysisservice.games.chess.domain.model;

/**
 * 格子编号工具：0 = a1，7 = h1，56 = a8，63 = h8。
 */
public final class Squares {

    private Squares() {
        // 工具类，禁止实例化
    }

    public static int file(int square) {
        return square & 7;
    }

    public static int rank(int square) {
        return square >> 3;
    }

    public static int of(int file, int rank) {
        return rank * 8 + file;
    }

    public static boolean onBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    /** 格子名，如 "e4" */
    public static String name(int square) {
        return "" + (char) ('a' + file(square)) + (char) ('1' + rank(square));
    }

    /** "e4" → 28；格式不对返回 -1 */
    public static int parse(String name) {
        if (name == null || name.length() != 2) return -1;
        int f = name.charAt(0) - 'a';
        int r = name.charAt(1) - '1';
        return onBoard(f, r) ? of(f, r) : -1;
    }

    /** 是否为浅色格（a1 为深色格） */
    public static boolean isLight(int square) {
        return ((file(square) + rank(square)) & 1) == 1;
    }
}
