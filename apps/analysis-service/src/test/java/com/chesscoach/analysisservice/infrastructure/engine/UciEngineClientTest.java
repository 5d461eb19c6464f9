package com.chesscoach.analysisservice.infrastructure.engine;

import com.chesscoach.analysisservice.common.exception.EngineTimeoutException;
import com.chesscoach.analysisservice.common.exception.EngineUnavailableException;
import com.chesscoach.analysisservice.common.exception.InvalidPositionException;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.MoveScore;
import com.chesscoach.analysisservice.engine.core.Score;
import com.chesscoach.analysisservice.engine.core.SearchParameters;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UciEngineClientTest {

    private static final String AFTER_E4 = "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1";
    private static final String START = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private final List<FakeUciProcess> launched = new ArrayList<>();
    private final AtomicBoolean answerGo = new AtomicBoolean(true);
    private final AtomicBoolean answerStop = new AtomicBoolean(true);
    private List<String> searchOutput = List.of("info depth 5 multipv 1 score cp 12 pv e2e4", "bestmove e2e4");
    private UciEngineClient client;

    @AfterEach
    void tearDown() {
        if (client != null) client.close();
    }

    private FakeUciProcess.Script stockfish() {
        return (cmd, e) -> {
            if (cmd.equals("uci")) {
                e.reply("id name FakeFish", "uciok");
            } else if (cmd.equals("isready")) {
                e.reply("readyok");
            } else if (cmd.startsWith("go") && answerGo.get()) {
                e.reply(searchOutput);
            } else if (cmd.equals("stop") && answerStop.get()) {
                e.reply("bestmove e2e4");
            } else if (cmd.equals("quit")) {
                e.exit();
            }
        };
    }

    private UciEngineClient newClient(Duration baseTimeout) {
        EngineProperties props = new EngineProperties();
        props.setHandshakeTimeout(Duration.ofSeconds(2));
        props.setBaseTimeout(baseTimeout);
        props.setPerDepthTimeout(Duration.ZERO);
        props.setStopGrace(Duration.ofMillis(200));
        client = new UciEngineClient(props, () -> {
            FakeUciProcess p = new FakeUciProcess(stockfish());
            launched.add(p);
            return p;
        });
        return client;
    }

    @Test
    void startsLazilyAndConfiguresEngineOnce() {
        UciEngineClient c = newClient(Duration.ofSeconds(5));
        assertThat(launched).isEmpty();
        assertThat(c.isHealthy()).isTrue();

        c.evaluate(START, SearchParameters.of(5, 1));
        c.evaluate(START, SearchParameters.of(5, 1));

        assertThat(launched).hasSize(1);
        List<String> received = launched.get(0).received();
        assertThat(received.get(0)).isEqualTo("uci");
        assertThat(received).containsSubsequence(
                "setoption name Skill Level value 20",
                "setoption name Hash value 128",
                "setoption name Threads value 1",
                "isready");
        assertThat(received).filteredOn(cmd -> cmd.startsWith("setoption name Skill Level")).hasSize(1);
    }

    @Test
    void collectsMultiPvLinesFromWhitePerspective() {
        searchOutput = List.of(
                "info depth 9 multipv 1 score cp 25 pv e7e5 g1f3",
                "info depth 9 multipv 2 score cp 15 pv c7c5 g1f3",
                "info depth 10 seldepth 14 multipv 1 score cp 30 nodes 51234 nps 900000 pv e7e5 g1f3 b8c6",
                "info depth 10 multipv 2 score cp 40 upperbound pv c7c5",
                "info nodes 60000 nps 950000",
                "bestmove e7e5 ponder g1f3");
        UciEngineClient c = newClient(Duration.ofSeconds(5));

        EvaluationResult result = c.evaluate(AFTER_E4, SearchParameters.of(10, 2));

        assertThat(result.fen()).isEqualTo(AFTER_E4);
        assertThat(result.bestMove()).isEqualTo("e7e5");
        assertThat(result.depth()).isEqualTo(10);
        assertThat(result.evaluation()).isEqualTo(Score.cp(-30));
        assertThat(result.topMoves()).extracting(MoveScore::move).containsExactly("e7e5", "c7c5");
        assertThat(result.topMoves()).extracting(MoveScore::score).containsExactly(Score.cp(-30), Score.cp(-15));
        assertThat(result.topMoves().get(0).pv()).containsExactly("e7e5", "g1f3", "b8c6");
        assertThat(launched.get(0).received()).contains(
                "setoption name MultiPV value 2",
                "position fen " + AFTER_E4,
                "go depth 10");
    }

    @Test
    void restrictsSearchToCandidateMoves() {
        UciEngineClient c = newClient(Duration.ofSeconds(5));
        c.evaluate(START, new SearchParameters(8, 2, List.of("e2e4", "d2d4")));
        assertThat(launched.get(0).received()).contains("go depth 8 searchmoves e2e4 d2d4");
    }

    @Test
    void reportsNoBestMoveWhenGameIsOver() {
        searchOutput = List.of("info depth 0 score mate 0", "bestmove (none)");
        UciEngineClient c = newClient(Duration.ofSeconds(5));

        EvaluationResult result = c.evaluate(START, SearchParameters.of(5, 1));

        assertThat(result.hasBestMove()).isFalse();
        assertThat(result.topMoves()).isEmpty();
    }

    @Test
    void engineRejectingPositionRaisesInvalidPosition() {
        searchOutput = List.of("info string Invalid position: king can be captured", "bestmove (none)");
        UciEngineClient c = newClient(Duration.ofSeconds(5));

        assertThatThrownBy(() -> c.evaluate(START, SearchParameters.of(5, 1)))
                .isInstanceOf(InvalidPositionException.class);
    }

    @Test
    void timeoutStopsSearchAndKeepsProcess() {
        answerGo.set(false);
        UciEngineClient c = newClient(Duration.ofMillis(200));

        assertThatThrownBy(() -> c.evaluate(START, SearchParameters.of(12, 1)))
                .isInstanceOf(EngineTimeoutException.class);
        assertThat(launched.get(0).received()).contains("stop");
        assertThat(c.isHealthy()).isTrue();

        answerGo.set(true);
        assertThat(c.evaluate(START, SearchParameters.of(5, 1)).bestMove()).isEqualTo("e2e4");
        assertThat(launched).hasSize(1);
    }

    @Test
    void unresponsiveEngineIsRestartedOnNextCall() {
        answerGo.set(false);
        answerStop.set(false);
        UciEngineClient c = newClient(Duration.ofMillis(200));

        assertThatThrownBy(() -> c.evaluate(START, SearchParameters.of(12, 1)))
                .isInstanceOf(EngineTimeoutException.class);
        assertThat(launched.get(0).isAlive()).isFalse();

        answerGo.set(true);
        assertThat(c.evaluate(START, SearchParameters.of(5, 1)).bestMove()).isEqualTo("e2e4");
        assertThat(launched).hasSize(2);
    }

    @Test
    void crashedProcessIsRelaunchedOnNextCall() {
        UciEngineClient c = newClient(Duration.ofSeconds(5));
        c.evaluate(START, SearchParameters.of(5, 1));
        launched.get(0).exit();

        assertThat(c.evaluate(START, SearchParameters.of(5, 1)).bestMove()).isEqualTo("e2e4");
        assertThat(launched).hasSize(2);
    }

    @Test
    void exitMidSearchRaisesUnavailable() {
        EngineProperties props = new EngineProperties();
        props.setHandshakeTimeout(Duration.ofSeconds(2));
        props.setBaseTimeout(Duration.ofSeconds(5));
        client = new UciEngineClient(props, () -> new FakeUciProcess((cmd, e) -> {
            if (cmd.equals("uci")) e.reply("uciok");
            else if (cmd.equals("isready")) e.reply("readyok");
            else if (cmd.startsWith("go")) e.exit();
        }));

        assertThatThrownBy(() -> client.evaluate(START, SearchParameters.of(5, 1)))
                .isInstanceOf(EngineUnavailableException.class);
    }

    @Test
    void launchFailureRaisesUnavailable() {
        client = new UciEngineClient(new EngineProperties(), () -> {
            throw new IOException("No such file or directory");
        });
        assertThatThrownBy(() -> client.evaluate(START, SearchParameters.of(5, 1)))
                .isInstanceOf(EngineUnavailableException.class)
                .hasMessageContaining("No such file");
    }

    @Test
    void silentHandshakeRaisesUnavailable() {
        EngineProperties props = new EngineProperties();
        props.setHandshakeTimeout(Duration.ofMillis(200));
        client = new UciEngineClient(props, () -> new FakeUciProcess((cmd, e) -> { }));
        assertThatThrownBy(() -> client.evaluate(START, SearchParameters.of(5, 1)))
                .isInstanceOf(EngineUnavailableException.class);
    }

    @Test
    void closeSendsQuitAndRefusesFurtherWork() {
        UciEngineClient c = newClient(Duration.ofSeconds(5));
        c.evaluate(START, SearchParameters.of(5, 1));

        c.close();

        assertThat(launched.get(0).received()).endsWith("quit");
        assertThat(launched.get(0).isAlive()).isFalse();
        assertThat(c.isHealthy()).isFalse();
        assertThatThrownBy(() -> c.evaluate(START, SearchParameters.of(5, 1)))
                .isInstanceOf(EngineUnavailableException.class);
    }
}
