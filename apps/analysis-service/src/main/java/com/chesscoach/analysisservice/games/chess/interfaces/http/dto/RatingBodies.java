package com.chesscoach.analysisservice.games.chess.interfaces.http.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * 评分接口的请求体定义。
 * 数值范围（非负等级分、得分在 [0,1]）由评分引擎统一校验，这里只保证字段存在。
 */
public class RatingBodies {

    /** 期望得分：A 对 B */
    @Data
    public static class ExpectedScoreBody {
        @NotNull
        private Integer ratingA;
        @NotNull
        private Integer ratingB;
    }

    /** 一局结束后的等级分更新；score：1 胜、0.5 和、0 负 */
    @Data
    public static class RatingUpdateBody {
        @NotNull
        private Integer playerRating;
        @NotNull
        private Integer opponentRating;
        @NotNull
        private Double score;
    }

    /** 一局历史结果 */
    @Data
    public static class ResultItem {
        @NotNull
        private Integer opponentRating;
        @NotNull
        private Double score;
        private Integer currentRating;
    }

    /**
     * 表现分估计：
     *  initialGuess 为迭代初值（默认 1500）；
     *  currentRating 用于计算不确定度，为空时取默认等级分
     */
    @Data
    public static class PerformanceBody {
        @NotNull
        @Valid
        private List<ResultItem> results;
        private Integer initialGuess;
        private Integer currentRating;
    }
}
