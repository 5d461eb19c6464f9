package com.chesscoach.analysisservice.common.exception;

/**
 * 整盘分析在某个半回合失败。整盘分析不返回部分结果，需要逐手结果的调用方请使用流式接口。
 * ply 为 0 表示还没走到任何半回合（例如租用引擎失败）。
 */
public class GameAnalysisFailedException extends RuntimeException {

    private final int ply;

    public GameAnalysisFailedException(int ply, Throwable cause) {
        super(ply > 0
                ? "整盘分析在第 " + ply + " 个半回合失败: " + cause.getMessage()
                : "整盘分析未能开始: " + cause.getMessage(), cause);
        this.ply = ply;
    }

    public int getPly() {
        return ply;
    }
}
