package com.chesscoach.analysisservice.common.exception;

/**
 * 引擎自身的合法性检查拒绝了该局面。
 */
public class InvalidPositionException extends EngineException {

    private final String fen;

    public InvalidPositionException(String fen, String engineMessage) {
        super("引擎拒绝分析该局面（" + engineMessage + "）: " + fen);
        this.fen = fen;
    }

    public String getFen() {
        return fen;
    }
}
