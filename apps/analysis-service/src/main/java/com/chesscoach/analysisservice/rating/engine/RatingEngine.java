package com.chesscoach.analysisservice.rating.engine;

import com.chesscoach.analysisservice.rating.model.PerformanceEstimate;
import com.chesscoach.analysisservice.rating.model.RatingRecord;
import com.chesscoach.analysisservice.rating.model.RatingUpdate;

import java.util.List;

/**
 * 等级分计算引擎：纯函数、无状态、线程安全，相同输入必得相同输出。
 * 非法输入（负等级分、得分不在 [0,1]、空列表引用等）抛
 * {@link com.chesscoach.analysisservice.common.exception.InvalidRatingInputException}。
 */
public interface RatingEngine {

    /** 性能分迭代的默认初值 */
    int DEFAULT_INITIAL_GUESS = 1500;

    /** A 对 B 的期望得分，(0,1) */
    double expectedScore(int ratingA, int ratingB);

    /** 一局结束后的双方新等级分（四舍五入到整数） */
    RatingUpdate calculateNewRatings(int playerRating, int opponentRating, double score);

    /** 多局表现分 */
    int calculatePerformanceRating(List<RatingRecord> results, int initialGuess);

    default int calculatePerformanceRating(List<RatingRecord> results) {
        return calculatePerformanceRating(results, DEFAULT_INITIAL_GUESS);
    }

    /** 等级分不确定度 */
    double calculateRatingDeviation(List<RatingRecord> results, int currentRating);

    /** 表现分 + 不确定度 */
    PerformanceEstimate estimatePerformance(List<RatingRecord> results, int initialGuess, int currentRating);

    int kFactor();

    int defaultRating();
}
