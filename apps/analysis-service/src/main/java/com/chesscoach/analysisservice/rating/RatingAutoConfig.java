package com.chesscoach.analysisservice.rating;

import com.chesscoach.analysisservice.rating.engine.EloRatingEngine;
import com.chesscoach.analysisservice.rating.engine.RatingEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RatingAutoConfig
 * ---------------------------------------
 * 评分引擎的装配：k 值与默认等级分在启动时读取一次，之后不再变化。
 *
 * 说明：
 *  - 引擎本身是纯计算，无状态，单例即可被所有请求并发使用。
 */
@Configuration
public class RatingAutoConfig {

    @Value("${chess.rating.k-factor:32}")
    private int kFactor;

    @Value("${chess.rating.default-rating:1200}")
    private int defaultRating;

    @Bean
    public RatingEngine ratingEngine() {
        return new EloRatingEngine(kFactor, defaultRating);
    }
}
