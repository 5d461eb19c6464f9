package com.chesscoach.analysisservice.games.chess.service.impl;

import com.chesscoach.analysisservice.common.exception.AnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.EngineException;
import com.chesscoach.analysisservice.common.exception.InvalidParameterException;
import com.chesscoach.analysisservice.engine.core.EngineClient;
import com.chesscoach.analysisservice.engine.core.EngineLease;
import com.chesscoach.analysisservice.engine.core.EnginePool;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.SearchParameters;
import com.chesscoach.analysisservice.games.chess.domain.dto.BestMoveResult;
import com.chesscoach.analysisservice.games.chess.domain.enums.Termination;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.ChessMove;
import com.chesscoach.analysisservice.games.chess.domain.rule.ChessJudge;
import com.chesscoach.analysisservice.games.chess.service.AnalysisProperties;
import com.chesscoach.analysisservice.games.chess.service.PositionAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PositionAnalyzerImpl implements PositionAnalyzer {

    private final EnginePool enginePool;
    private final AnalysisProperties props;

    @Override
    public EvaluationResult analyzePosition(String fen, Integer depth, Integer multiPv, List<String> lines) {
        // 1) 局面校验在前：非法 FEN 不会占用引擎
        Board board = ChessJudge.parseLegal(fen);
        // 2) 参数范围
        int d = depth == null ? props.getDefaultDepth() : depth;
        int pv = multiPv == null ? props.getDefaultMultiPv() : multiPv;
        SearchParameters base = SearchParameters.of(d, pv);
        // 3) 候选着法必须是该局面下的合法着法
        SearchParameters params = new SearchParameters(base.depth(), base.multiPv(), normalizeLines(board, lines));

        log.info("分析局面: fen={}, depth={}, multiPv={}, lines={}", fen, d, pv, params.searchMoves());
        try (EngineLease lease = enginePool.acquire()) {
            return analyzePosition(fen, params, lease.client());
        } catch (EngineException e) {
            // 租用失败（池耗尽 / 已关闭）
            throw new AnalysisFailedException(fen, e);
        }
    }

    @Override
    public EvaluationResult analyzePosition(String fen, SearchParameters params, EngineClient client) {
        ChessJudge.parseLegal(fen);
        EvaluationResult result;
        try {
            result = client.evaluate(fen, params);
        } catch (EngineException e) {
            log.warn("引擎分析失败: fen={}, cause={}", fen, e.getMessage());
            throw new AnalysisFailedException(fen, e);
        }
        log.debug("分析完成: fen={}, best={}, depth={}", fen, result.bestMove(), result.depth());
        return result.limitTopMoves(params.effectiveLines());
    }

    @Override
    public BestMoveResult getBestMove(String fen, Integer depth) {
        Board board = ChessJudge.parseLegal(fen);
        int d = depth == null ? props.getDefaultDepth() : depth;
        SearchParameters params = SearchParameters.of(d, props.getDefaultMultiPv());

        Optional<Termination> termination = ChessJudge.termination(board);
        if (termination.isPresent()) {
            log.info("终局局面，不调用引擎: fen={}, termination={}", fen, termination.get());
            return BestMoveResult.noMove(fen, termination.get());
        }
        log.info("查询最佳着法: fen={}, depth={}", fen, d);
        try (EngineLease lease = enginePool.acquire()) {
            return BestMoveResult.of(analyzePosition(fen, params, lease.client()));
        } catch (EngineException e) {
            throw new AnalysisFailedException(fen, e);
        }
    }

    @Override
    public int defaultDepth() {
        return props.getDefaultDepth();
    }

    private static List<String> normalizeLines(Board board, List<String> lines) {
        if (lines == null || lines.isEmpty()) return List.of();
        List<String> normalized = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (StringUtils.isBlank(line)) {
                throw new InvalidParameterException("lines", "候选着法不能为空");
            }
            String uci = line.trim().toLowerCase();
            if (!ChessMove.looksLikeUci(uci)) {
                throw new InvalidParameterException("lines", "不是 UCI 格式的着法: " + line);
            }
            if (ChessJudge.findLegal(board, uci).isEmpty()) {
                throw new InvalidParameterException("lines", "该局面下不合法的着法: " + line);
            }
            if (!normalized.contains(uci)) {
                normalized.add(uci);
            }
        }
        return normalized;
    }
}
