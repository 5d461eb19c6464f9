package com.chesscoach.analysisservice.games.chess.service.impl;

import com.chesscoach.analysisservice.common.exception.EngineTimeoutException;
import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.common.exception.GameAnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.InvalidParameterException;
import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.engine.core.EngineLease;
import com.chesscoach.analysisservice.engine.core.ScriptedEngineClient;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisReport;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisRequest;
import com.chesscoach.analysisservice.games.chess.domain.dto.PlyAnalysis;
import com.chesscoach.analysisservice.games.chess.service.AnalysisProperties;
import com.chesscoach.analysisservice.infrastructure.engine.BlockingEnginePool;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameAnalysisOrchestratorImplTest {

    /** 10 个半回合 */
    private static final String RUY_LOPEZ = """
            [Event "Training"]
            [White "A"]
            [Black "B"]

            1. e4 e5 2. Nf3 Nc6 3. Bb5 a6 4. Ba4 Nf6 5. O-O Be7 *
            """;

    private ScriptedEngineClient client = new ScriptedEngineClient();
    private final BlockingEnginePool pool = new BlockingEnginePool(1, Duration.ofMillis(100), () -> client);
    private final AnalysisProperties props = new AnalysisProperties();
    private final GameAnalysisOrchestratorImpl orchestrator =
            new GameAnalysisOrchestratorImpl(new PositionAnalyzerImpl(pool, props), pool, props);

    @Test
    void samplesEveryNthPly() {
        GameAnalysisReport report = orchestrator.analyzeGame(RUY_LOPEZ, 10, 2, 3);

        assertThat(report.totalPlies()).isEqualTo(10);
        assertThat(report.positionsAnalyzed()).isEqualTo(3);
        assertThat(report.analyzeInterval()).isEqualTo(3);
        assertThat(report.entries()).extracting(PlyAnalysis::moveIndex).containsExactly(3, 6, 9);
        assertThat(report.entries()).extracting(PlyAnalysis::moveColor).containsExactly("white", "black", "white");
        assertThat(report.entries()).extracting(PlyAnalysis::moveNumber).containsExactly(2, 3, 5);
        assertThat(report.entries()).extracting(PlyAnalysis::move).containsExactly("g1f3", "a7a6", "e1g1");
        assertThat(report.entries()).extracting(PlyAnalysis::san).containsExactly("Nf3", "a6", "O-O");
        assertThat(report.entries()).allSatisfy(e -> assertThat(e.evaluation().topMoves()).hasSizeLessThanOrEqualTo(2));
        assertThat(client.evaluatedFens()).containsExactlyElementsOf(
                report.entries().stream().map(PlyAnalysis::fen).toList());
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void intervalOneAnalysesEveryPly() {
        GameAnalysisReport report = orchestrator.analyzeGame("e2e4 e7e5 g1f3", 10, 1, 1);
        assertThat(report.entries()).extracting(PlyAnalysis::moveIndex).containsExactly(1, 2, 3);
    }

    @Test
    void defaultsComeFromProperties() {
        GameAnalysisReport report = orchestrator.analyzeGame(RUY_LOPEZ, null, null, null);
        assertThat(report.analyzeInterval()).isEqualTo(3);
        assertThat(report.depth()).isEqualTo(18);
        assertThat(report.multiPv()).isEqualTo(3);
    }

    @Test
    void blackFirstGameStartsWithBlack() {
        String pgn = "[FEN \"4k3/4p3/8/8/8/8/4P3/4K3 b - - 0 1\"]\n1... e5 2. e4 Kd7 *";
        GameAnalysisReport report = orchestrator.analyzeGame(pgn, 10, 1, 1);
        assertThat(report.entries()).extracting(PlyAnalysis::moveColor).containsExactly("black", "white", "black");
    }

    @Test
    void invalidInputFailsBeforeEngine() {
        assertThatThrownBy(() -> orchestrator.analyzeGame(" ", 10, 1, 1)).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> orchestrator.analyzeGame(RUY_LOPEZ, 10, 1, 0))
                .isInstanceOfSatisfying(InvalidParameterException.class,
                        e -> assertThat(e.getParameter()).isEqualTo("analyzeInterval"));
        assertThatThrownBy(() -> orchestrator.analyzeGame(RUY_LOPEZ, 10, 1, 11)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> orchestrator.analyzeGame(RUY_LOPEZ, 3, 1, 1)).isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> orchestrator.analyzeGame("1. e4 e5 2. Nf3 Ke6", 10, 1, 1))
                .isInstanceOfSatisfying(InvalidPgnException.class, e -> assertThat(e.getPly()).isEqualTo(4));
        assertThat(client.calls()).isZero();
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void engineFailureNamesThePly() {
        AtomicBoolean first = new AtomicBoolean(true);
        client = new ScriptedEngineClient((fen, params) -> {
            if (first.getAndSet(false)) {
                return ScriptedEngineClient.legalMovesInOrder(fen, params);
            }
            throw new EngineTimeoutException(params.depth(), Duration.ofSeconds(1));
        });
        List<PlyAnalysis> streamed = new ArrayList<>();

        assertThatThrownBy(() -> orchestrator.analyzeGame(
                new GameAnalysisRequest(RUY_LOPEZ, 10, 1, 3), streamed::add, () -> false))
                .isInstanceOfSatisfying(GameAnalysisFailedException.class, e -> assertThat(e.getPly()).isEqualTo(6));
        assertThat(streamed).extracting(PlyAnalysis::moveIndex).containsExactly(3);
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void cancellationStopsBetweenPlies() {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        List<PlyAnalysis> streamed = new ArrayList<>();

        assertThatThrownBy(() -> orchestrator.analyzeGame(
                new GameAnalysisRequest(RUY_LOPEZ, 10, 1, 2),
                entry -> {
                    streamed.add(entry);
                    cancelled.set(true);
                },
                cancelled::get))
                .isInstanceOf(CancellationException.class);
        assertThat(streamed).hasSize(1);
        assertThat(client.calls()).isEqualTo(1);
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void listenerSeesEntriesInOrder() {
        List<Integer> order = new ArrayList<>();
        GameAnalysisReport report = orchestrator.analyzeGame(
                new GameAnalysisRequest(RUY_LOPEZ, 10, 1, 2), e -> order.add(e.moveIndex()), () -> false);
        assertThat(order).containsExactly(2, 4, 6, 8, 10);
        assertThat(report.entries()).hasSize(5);
    }

    @Test
    void busyPoolIsReportedAsGameFailureBeforeFirstPly() {
        try (EngineLease held = pool.acquire()) {
            assertThatThrownBy(() -> orchestrator.analyzeGame(RUY_LOPEZ, 10, 1, 1))
                    .isInstanceOfSatisfying(GameAnalysisFailedException.class, e -> {
                        assertThat(e.getPly()).isZero();
                        assertThat(e.getCause()).isInstanceOf(EngineUnavailableException.class);
                    });
        }
        assertThat(client.calls()).isZero();
        assertThat(pool.available()).isEqualTo(1);
    }

    @Test
    void cancelWhileWaitingForEngineIsCancellation() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> orchestrator.analyzeGame(
                    new GameAnalysisRequest(RUY_LOPEZ, 10, 1, 1), entry -> { }, () -> true))
                    .isInstanceOf(CancellationException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(client.calls()).isZero();
        assertThat(pool.available()).isEqualTo(1);
    }
}
