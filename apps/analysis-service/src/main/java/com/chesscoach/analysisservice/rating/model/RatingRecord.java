package com.chesscoach.analysisservice.rating.model;

/**
 * 一局历史对局结果（由持久层提供，评分引擎只读）。
 *
 * @param currentRating  该局时玩家的等级分，可为空
 * @param opponentRating 对手等级分
 * @param score          得分：1 胜、0.5 和、0 负；聚合计算时允许 [0,1] 内的连续值
 */
public record RatingRecord(Integer currentRating, int opponentRating, double score) {

    public static RatingRecord of(int opponentRating, double score) {
        return new RatingRecord(null, opponentRating, score);
    }
}
