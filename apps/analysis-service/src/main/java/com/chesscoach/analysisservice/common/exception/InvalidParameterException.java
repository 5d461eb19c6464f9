package com.chesscoach.analysisservice.common.exception;

/**
 * 分析参数超出策略范围：depth、multiPv、候选着法 lines、采样间隔 analyzeInterval。
 */
public class InvalidParameterException extends IllegalArgumentException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
