package com.chesscoach.analysisservice.rating.model;

/**
 * 一局结束后的双方新等级分。
 *
 * @param expectedScore 赛前玩家的期望得分
 */
public record RatingUpdate(int playerRating, int opponentRating,
                           int newPlayerRating, int newOpponentRating,
                           double expectedScore) {

    public int playerDelta() {
        return newPlayerRating - playerRating;
    }

    public int opponentDelta() {
        return newOpponentRating - opponentRating;
    }
}
