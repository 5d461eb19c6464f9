package com.chesscoach.analysisservice.games.chess.interfaces.http;

import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.games.chess.domain.dto.BestMoveResult;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisReport;
import com.chesscoach.analysisservice.games.chess.domain.dto.MoveVerdict;
import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.GameAnalysisBody;
import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.MoveCheckBody;
import com.chesscoach.analysisservice.games.chess.interfaces.http.dto.PositionAnalysisBody;
import com.chesscoach.analysisservice.games.chess.service.GameAnalysisOrchestrator;
import com.chesscoach.analysisservice.games.chess.service.MoveJudge;
import com.chesscoach.analysisservice.games.chess.service.PositionAnalyzer;
import com.chesscoach.web.common.ApiResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 局面 / 整盘分析 http 接口控制器
 * 异常不在这里处理，统一交给 WebExceptionAdvice 映射为 ApiResponse。
 */
@Slf4j
@RestController
@RequestMapping("/api/analyze")
public class AnalysisRestController {

    private final PositionAnalyzer positionAnalyzer;
    private final GameAnalysisOrchestrator orchestrator;
    private final MoveJudge moveJudge;

    public AnalysisRestController(PositionAnalyzer positionAnalyzer,
                                  GameAnalysisOrchestrator orchestrator,
                                  MoveJudge moveJudge) {
        this.positionAnalyzer = positionAnalyzer;
        this.orchestrator = orchestrator;
        this.moveJudge = moveJudge;
    }

    /**
     * 分析单个局面：
     *  fen 必填；depth 5~30（默认 18）；multiPv 1~5（默认 3）；lines 可选，限制只在这些着法里搜索
     */
    @PostMapping("/position")
    public ResponseEntity<ApiResponse<EvaluationResult>> position(@Valid @RequestBody PositionAnalysisBody body) {
        log.info("收到局面分析请求: fen={}", body.getFen());
        EvaluationResult result = positionAnalyzer.analyzePosition(
                body.getFen(), body.getDepth(), body.getMultiPv(), body.getLines());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    /**
     * 整盘分析：
     *  pgn 必填；analyzeInterval 1~10（默认 3），每 N 个半回合分析一次
     *  任一采样点失败整体失败，需要逐手结果请使用 WebSocket /app/analysis.game
     */
    @PostMapping("/game")
    public ResponseEntity<ApiResponse<GameAnalysisReport>> game(@Valid @RequestBody GameAnalysisBody body) {
        log.info("收到整盘分析请求: interval={}, depth={}", body.getAnalyzeInterval(), body.getDepth());
        GameAnalysisReport report = orchestrator.analyzeGame(
                body.getPgn(), body.getDepth(), body.getMultiPv(), body.getAnalyzeInterval());
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    /**
     * 最佳着法（旧接口）：终局局面返回 bestMove 为空并附终局原因
     */
    @GetMapping("/best-move")
    public ResponseEntity<ApiResponse<BestMoveResult>> bestMove(@RequestParam("fen") String fen,
                                                                @RequestParam(name = "depth", required = false) Integer depth) {
        return ResponseEntity.ok(ApiResponse.success(positionAnalyzer.getBestMove(fen, depth)));
    }

    /**
     * 着法判定：与引擎最佳着法严格一致才算正确
     */
    @PostMapping("/move-check")
    public ResponseEntity<ApiResponse<MoveVerdict>> moveCheck(@Valid @RequestBody MoveCheckBody body) {
        return ResponseEntity.ok(ApiResponse.success(moveJudge.judge(body.getFen(), body.getMove())));
    }
}
