package com.chesscoach.analysisservice.rating.model;

/**
 * 表现分估计：每次调用根据一组对局结果重新计算，没有持久身份。
 *
 * @param performanceRating 表现分
 * @param ratingDeviation   不确定度（非负），对局越少越大
 * @param games             参与计算的对局数
 */
public record PerformanceEstimate(int performanceRating, double ratingDeviation, int games) {
}
