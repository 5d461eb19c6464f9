package com.chesscoach.analysisservice.common.exception;

/**
 * 单个局面分析失败，包装底层引擎异常并携带出错的 FEN。
 */
public class AnalysisFailedException extends RuntimeException {

    private final String fen;

    public AnalysisFailedException(String fen, Throwable cause) {
        super("局面分析失败: " + fen + "，原因: " + cause.getMessage(), cause);
        this.fen = fen;
    }

    public String getFen() {
        return fen;
    }
}
