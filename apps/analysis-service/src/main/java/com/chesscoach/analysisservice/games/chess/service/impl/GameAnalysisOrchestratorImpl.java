package com.chesscoach.analysisservice.games.chess.service.impl;

import com.chesscoach.analysisservice.common.exception.EngineException;
import com.chesscoach.analysisservice.common.exception.GameAnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.InvalidParameterException;
import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.engine.core.EngineLease;
import com.chesscoach.analysisservice.engine.core.EnginePool;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.SearchParameters;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisReport;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisRequest;
import com.chesscoach.analysisservice.games.chess.domain.dto.PlyAnalysis;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import com.chesscoach.analysisservice.games.chess.domain.rule.GameWalk;
import com.chesscoach.analysisservice.games.chess.domain.rule.GameWalker;
import com.chesscoach.analysisservice.games.chess.domain.rule.WalkedPly;
import com.chesscoach.analysisservice.games.chess.service.AnalysisProperties;
import com.chesscoach.analysisservice.games.chess.service.GameAnalysisOrchestrator;
import com.chesscoach.analysisservice.games.chess.service.PlyAnalysisListener;
import com.chesscoach.analysisservice.games.chess.service.PositionAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * 整盘分析编排：GameWalker 顺序重放 + PositionAnalyzer 按间隔采样。
 *
 * 流程：
 *   1. 校验参数与棋谱（完整重放一遍，不调用引擎），非法输入在租用引擎之前就失败；
 *   2. 整局只租用一个引擎句柄，无论成功、失败或取消都会归还；租用失败同样包装为 GameAnalysisFailedException（ply 为 0）；
 *   3. 每走一个半回合计数器加一，counter % interval == 0 时分析走后局面；
 *   4. 走子方按半回合奇偶推算：奇数为先走的一方。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameAnalysisOrchestratorImpl implements GameAnalysisOrchestrator {

    private final PositionAnalyzer positionAnalyzer;
    private final EnginePool enginePool;
    private final AnalysisProperties props;

    @Override
    public GameAnalysisReport analyzeGame(String pgn, Integer depth, Integer multiPv, Integer analyzeInterval) {
        return analyzeGame(new GameAnalysisRequest(pgn, depth, multiPv, analyzeInterval), PlyAnalysisListener.NONE, () -> false);
    }

    @Override
    public GameAnalysisReport analyzeGame(GameAnalysisRequest request, PlyAnalysisListener listener, BooleanSupplier cancelled) {
        if (StringUtils.isBlank(request.pgn())) {
            throw new InvalidPgnException("棋谱为空");
        }
        int interval = request.analyzeInterval() == null ? props.getDefaultInterval() : request.analyzeInterval();
        if (interval < MIN_INTERVAL || interval > MAX_INTERVAL) {
            throw new InvalidParameterException("analyzeInterval",
                    "应在 [" + MIN_INTERVAL + "," + MAX_INTERVAL + "] 之间，实际 " + interval);
        }
        SearchParameters params = SearchParameters.of(
                request.depth() == null ? props.getDefaultDepth() : request.depth(),
                request.multiPv() == null ? props.getDefaultMultiPv() : request.multiPv());

        int totalPlies = GameWalker.countPlies(request.pgn());
        GameWalk walk = GameWalker.open(request.pgn());
        log.info("开始整盘分析: plies={}, interval={}, depth={}, multiPv={}",
                totalPlies, interval, params.depth(), params.multiPv());

        List<PlyAnalysis> entries = new ArrayList<>();
        try (EngineLease lease = acquireLease(cancelled)) {
            int counter = 0;
            for (WalkedPly ply : walk) {
                checkCancelled(cancelled);
                counter++;
                if (counter % interval != 0) {
                    continue;
                }
                EvaluationResult evaluation;
                try {
                    evaluation = positionAnalyzer.analyzePosition(ply.fenAfter(), params, lease.client());
                } catch (RuntimeException e) {
                    log.error("整盘分析在第 {} 个半回合失败: {}", ply.ply(), e.getMessage());
                    throw new GameAnalysisFailedException(ply.ply(), e);
                }
                PlyAnalysis entry = new PlyAnalysis(
                        ply.ply(),
                        ply.moveNumber(),
                        colorOf(counter, walk.firstMover()),
                        ply.fenAfter(),
                        ply.uci(),
                        ply.san(),
                        evaluation);
                entries.add(entry);
                listener.onPly(entry);
            }
        }
        log.info("整盘分析完成: plies={}, analysed={}", totalPlies, entries.size());
        return new GameAnalysisReport(entries, totalPlies, entries.size(), interval, params.depth(), params.multiPv());
    }

    /** 奇数半回合为先走的一方 */
    private static String colorOf(int ply, Side firstMover) {
        Side mover = ply % 2 == 1 ? firstMover : firstMover.opposite();
        return mover == Side.WHITE ? "white" : "black";
    }

    /** 等待引擎期间被取消（中断）按取消处理，其余租用失败按整盘分析失败处理 */
    private EngineLease acquireLease(BooleanSupplier cancelled) {
        try {
            return enginePool.acquire();
        } catch (EngineException e) {
            checkCancelled(cancelled);
            log.warn("整盘分析无法租用引擎: {}", e.getMessage());
            throw new GameAnalysisFailedException(0, e);
        }
    }

    private static void checkCancelled(BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("整盘分析已取消");
        }
    }
}
