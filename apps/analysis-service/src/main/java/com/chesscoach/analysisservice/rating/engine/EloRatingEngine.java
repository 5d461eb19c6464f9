package com.chesscoach.analysisservice.rating.engine;

import com.chesscoach.analysisservice.common.exception.InvalidRatingInputException;
import com.chesscoach.analysisservice.rating.model.PerformanceEstimate;
import com.chesscoach.analysisservice.rating.model.RatingRecord;
import com.chesscoach.analysisservice.rating.model.RatingUpdate;

import java.util.List;

/**
 * 简化版 Elo 等级分实现。
 *
 * 表现分：
 *   - 0 局：返回默认等级分；
 *   - 1~4 局：对手平均分 + 400 * (平均得分 - 0.5)；
 *   - 5 局及以上：从 initialGuess 出发做不动点迭代，每轮按 kFactor * (实际总分 - 期望总分) 修正，
 *     单步修正小于 {@link #CONVERGENCE_THRESHOLD} 即停止，最多 {@link #MAX_ITERATIONS} 轮。
 * 不确定度：
 *   - 少于 {@link #MIN_GAMES_FOR_DEVIATION} 局：固定 {@link #HIGH_UNCERTAINTY}；
 *   - 否则取最近 {@link #DEVIATION_WINDOW} 局，预测误差的均方根 × 400。
 *
 * 取整采用四舍六入五成双：恰好 .5 时取最近的偶数（{@link Math#rint(double)}）。
 */
public class EloRatingEngine implements RatingEngine {

    public static final int MAX_ITERATIONS = 20;
    public static final double CONVERGENCE_THRESHOLD = 1.0;
    public static final int CLOSED_FORM_MAX_GAMES = 4;
    public static final int MIN_GAMES_FOR_DEVIATION = 5;
    public static final int DEVIATION_WINDOW = 10;
    public static final double HIGH_UNCERTAINTY = 200.0;

    private final int kFactor;
    private final int defaultRating;

    public EloRatingEngine(int kFactor, int defaultRating) {
        if (kFactor <= 0) {
            throw new InvalidRatingInputException("kFactor 必须为正数，实际 " + kFactor);
        }
        requireRating("defaultRating", defaultRating);
        this.kFactor = kFactor;
        this.defaultRating = defaultRating;
    }

    @Override
    public double expectedScore(int ratingA, int ratingB) {
        requireRating("ratingA", ratingA);
        requireRating("ratingB", ratingB);
        return expected(ratingA, ratingB);
    }

    @Override
    public RatingUpdate calculateNewRatings(int playerRating, int opponentRating, double score) {
        requireRating("playerRating", playerRating);
        requireRating("opponentRating", opponentRating);
        requireScore(score);
        double expected = expected(playerRating, opponentRating);
        double playerChange = kFactor * (score - expected);
        double opponentChange = kFactor * ((1 - score) - (1 - expected));
        return new RatingUpdate(playerRating, opponentRating,
                round(playerRating + playerChange),
                round(opponentRating + opponentChange),
                expected);
    }

    @Override
    public int calculatePerformanceRating(List<RatingRecord> results, int initialGuess) {
        requireResults(results);
        requireRating("initialGuess", initialGuess);
        if (results.isEmpty()) {
            return defaultRating;
        }
        int n = results.size();
        if (n <= CLOSED_FORM_MAX_GAMES) {
            double totalOpponents = 0;
            double totalScore = 0;
            for (RatingRecord r : results) {
                totalOpponents += r.opponentRating();
                totalScore += r.score();
            }
            return round(totalOpponents / n + 400 * (totalScore / n - 0.5));
        }

        double rating = initialGuess;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double sumExpected = 0;
            double sumActual = 0;
            for (RatingRecord r : results) {
                sumExpected += expected(rating, r.opponentRating());
                sumActual += r.score();
            }
            double next = rating + kFactor * (sumActual - sumExpected);
            if (Math.abs(next - rating) < CONVERGENCE_THRESHOLD) {
                break;
            }
            rating = next;
        }
        return round(rating);
    }

    @Override
    public double calculateRatingDeviation(List<RatingRecord> results, int currentRating) {
        requireResults(results);
        requireRating("currentRating", currentRating);
        if (results.size() < MIN_GAMES_FOR_DEVIATION) {
            return HIGH_UNCERTAINTY;
        }
        List<RatingRecord> recent = results.subList(Math.max(0, results.size() - DEVIATION_WINDOW), results.size());
        double sumSquared = 0;
        for (RatingRecord r : recent) {
            double error = r.score() - expected(currentRating, r.opponentRating());
            sumSquared += error * error;
        }
        return Math.sqrt(sumSquared / recent.size()) * 400;
    }

    @Override
    public PerformanceEstimate estimatePerformance(List<RatingRecord> results, int initialGuess, int currentRating) {
        int performance = calculatePerformanceRating(results, initialGuess);
        double deviation = calculateRatingDeviation(results, currentRating);
        return new PerformanceEstimate(performance, deviation, results.size());
    }

    @Override
    public int kFactor() {
        return kFactor;
    }

    @Override
    public int defaultRating() {
        return defaultRating;
    }

    // ----------- private helpers -----------

    private static double expected(double ratingA, double ratingB) {
        return 1.0 / (1.0 + Math.pow(10, (ratingB - ratingA) / 400.0));
    }

    private static int round(double value) {
        return (int) Math.rint(value);
    }

    private static void requireRating(String name, int rating) {
        if (rating < 0) {
            throw new InvalidRatingInputException(name + " 不能为负数，实际 " + rating);
        }
    }

    private static void requireScore(double score) {
        if (!Double.isFinite(score) || score < 0 || score > 1) {
            throw new InvalidRatingInputException("score 应在 [0,1] 之间，实际 " + score);
        }
    }

    private static void requireResults(List<RatingRecord> results) {
        if (results == null) {
            throw new InvalidRatingInputException("对局结果列表不能为空引用");
        }
        for (int i = 0; i < results.size(); i++) {
            RatingRecord r = results.get(i);
            if (r == null) {
                throw new InvalidRatingInputException("第 " + (i + 1) + " 条对局结果为空");
            }
            requireRating("results[" + i + "].opponentRating", r.opponentRating());
            requireScore(r.score());
            if (r.currentRating() != null) {
                requireRating("results[" + i + "].currentRating", r.currentRating());
            }
        }
    }
}
