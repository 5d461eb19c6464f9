package com.chesscoach.analysisservice.common.exception;

/**
 * 评分计算输入不合法：负数等级分、得分不在 [0,1]、空的对局列表等。
 */
public class InvalidRatingInputException extends IllegalArgumentException {

    public InvalidRatingInputException(String message) {
        super(message);
    }
}
