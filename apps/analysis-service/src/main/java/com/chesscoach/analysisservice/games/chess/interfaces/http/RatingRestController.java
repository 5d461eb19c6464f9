package com.chesscoach.analysisservice.games.chess.interfaces.http;

import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.RatingBodies.ExpectedScoreBody;
import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.RatingBodies.PerformanceBody;
import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.RatingBodies.RatingUpdateBody;
import com.chesscoach.analysisservice.rating.engine.RatingEngine;
import com.chesscoach.analysisservice.rating.model.PerformanceEstimate;
import com.chesscoach.analysisservice.rating.model.RatingRecord;
import com.chesscoach.analysisservice.rating.model.RatingUpdate;
import com.chesscoach.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 等级分计算 http 接口控制器（纯计算，不读写任何存储）
 */
@RestController
@RequestMapping("/api/rating")
@RequiredArgsConstructor
public class RatingRestController {

    private final RatingEngine ratingEngine;

    /** A 对 B 的期望得分 */
    @PostMapping("/expected")
    public ResponseEntity<ApiResponse<Double>> expected(@Valid @RequestBody ExpectedScoreBody body) {
        return ResponseEntity.ok(ApiResponse.success(ratingEngine.expectedScore(body.getRatingA(), body.getRatingB())));
    }

    /** 一局结束后的双方新等级分 */
    @PostMapping("/update")
    public ResponseEntity<ApiResponse<RatingUpdate>> update(@Valid @RequestBody RatingUpdateBody body) {
        RatingUpdate update = ratingEngine.calculateNewRatings(body.getPlayerRating(), body.getOpponentRating(), body.getScore());
        return ResponseEntity.ok(ApiResponse.success(update));
    }

    /** 多局表现分 + 不确定度 */
    @PostMapping("/performance")
    public ResponseEntity<ApiResponse<PerformanceEstimate>> performance(@Valid @RequestBody PerformanceBody body) {
        List<RatingRecord> records = body.getResults().stream()
                .map(r -> r == null ? null : new RatingRecord(r.getCurrentRating(), r.getOpponentRating(), r.getScore()))
                .toList();
        int initialGuess = body.getInitialGuess() == null ? RatingEngine.DEFAULT_INITIAL_GUESS : body.getInitialGuess();
        int currentRating = body.getCurrentRating() == null ? ratingEngine.defaultRating() : body.getCurrentRating();
        return ResponseEntity.ok(ApiResponse.success(ratingEngine.estimatePerformance(records, initialGuess, currentRating)));
    }
}
