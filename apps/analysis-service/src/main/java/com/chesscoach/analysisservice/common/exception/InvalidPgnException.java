package com.chesscoach.analysisservice.common.exception;

/**
 * 棋谱（PGN 或着法列表）无法解析成合法的着法序列。
 * ply 为出错的半回合序号（从 1 开始），语法错误时为 0。
 */
public class InvalidPgnException extends IllegalArgumentException {

    private final int ply;

    public InvalidPgnException(String message) {
        this(0, message, null);
    }

    public InvalidPgnException(int ply, String message) {
        this(ply, message, null);
    }

    public InvalidPgnException(int ply, String message, Throwable cause) {
        super(ply > 0 ? "非法棋谱（第 " + ply + " 个半回合）: " + message : "非法棋谱: " + message, cause);
        this.ply = ply;
    }

    public int getPly() {
        return ply;
    }
}
