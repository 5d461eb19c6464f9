package com.chesscoach.analysisservice.common.exception;

/**
 * FEN 串格式错误或局面不合法（王的数量、兵的位置、非走子方被将军等）。
 * 属于调用方输入错误，直接返回，不重试。
 */
public class InvalidFenException extends IllegalArgumentException {

    private final String fen;

    public InvalidFenException(String fen, String reason) {
        super("非法 FEN（" + reason + "）: " + fen);
        this.fen = fen;
    }

    public String getFen() {
        return fen;
    }
}
