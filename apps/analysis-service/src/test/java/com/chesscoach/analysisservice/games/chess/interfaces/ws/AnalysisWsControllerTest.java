package com.chesscoach.analysisservice.games.chess.interfaces.ws;

import com.chesscoach.analysisservice.engine.core.EngineLease;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.ScriptedEngineClient;
import com.chesscoach.analysisservice.games.chess.application.AnalysisJobRegistry;
import com.chesscoach.analysisservice.games.chess.domain.dto.PlyAnalysis;
import com.chesscoach.analysisservice.games.chess.domain.rule.FenCodec;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.CancelCmd;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.ErrorPayload;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.GameCmd;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.GameDone;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.PositionCmd;
import com.chesscoach.analysisservice.games.chess.service.AnalysisProperties;
import com.chesscoach.analysisservice.games.chess.service.impl.GameAnalysisOrchestratorImpl;
import com.chesscoach.analysisservice.games.chess.service.impl.PositionAnalyzerImpl;
import com.chesscoach.analysisservice.infrastructure.engine.BlockingEnginePool;
import com.chesscoach.analysisservice.platform.transport.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.support.ExecutorServiceAdapter;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AnalysisWsControllerTest {

    private static final String TOPIC = "/topic/analysis.req-1";

    private final ScriptedEngineClient client = new ScriptedEngineClient();
    private BlockingEnginePool pool;
    private SimpMessagingTemplate messaging;
    private AnalysisJobRegistry registry;
    private AnalysisWsController controller;
    private SimpMessageHeaderAccessor sha;

    @BeforeEach
    void setUp() {
        pool = new BlockingEnginePool(1, Duration.ofMillis(100), () -> client);
        AnalysisProperties props = new AnalysisProperties();
        PositionAnalyzerImpl analyzer = new PositionAnalyzerImpl(pool, props);
        messaging = mock(SimpMessagingTemplate.class);
        // 同步执行，便于断言推送顺序
        registry = new AnalysisJobRegistry(new ExecutorServiceAdapter(new SyncTaskExecutor()));
        controller = new AnalysisWsController(analyzer, new GameAnalysisOrchestratorImpl(analyzer, pool, props), registry, messaging);
        sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId("session-1");
    }

    private List<Envelope<?>> sent() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(messaging, atLeastOnce()).convertAndSend(eq(TOPIC), captor.capture());
        return captor.getAllValues().stream().<Envelope<?>>map(o -> (Envelope<?>) o).toList();
    }

    @Test
    void positionRepliesWithSingleState() {
        PositionCmd cmd = new PositionCmd();
        cmd.setRequestId("req-1");
        cmd.setFen(FenCodec.STARTING_POSITION);
        cmd.setDepth(10);
        cmd.setMultiPv(2);

        controller.position(cmd, sha);

        List<Envelope<?>> sent = sent();
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).getKind()).isEqualTo(Envelope.Kind.STATE);
        assertThat(((EvaluationResult) sent.get(0).getPayload()).topMoves()).hasSize(2);
    }

    @Test
    void gameStreamsEventsInOrderThenDone() {
        GameCmd cmd = new GameCmd();
        cmd.setRequestId("req-1");
        cmd.setPgn("1. e4 e5 2. Nf3 Nc6 3. Bb5 a6");
        cmd.setDepth(10);
        cmd.setMultiPv(1);
        cmd.setAnalyzeInterval(2);

        controller.game(cmd, sha);

        List<Envelope<?>> sent = sent();
        assertThat(sent).extracting(Envelope::getKind).containsExactly(
                Envelope.Kind.EVENT, Envelope.Kind.EVENT, Envelope.Kind.EVENT, Envelope.Kind.DONE);
        assertThat(sent).extracting(Envelope::getSeq).containsExactly(1L, 2L, 3L, 4L);
        assertThat(sent.subList(0, 3)).extracting(e -> ((PlyAnalysis) e.getPayload()).moveIndex())
                .containsExactly(2, 4, 6);
        GameDone done = (GameDone) sent.get(3).getPayload();
        assertThat(done.getTotalPlies()).isEqualTo(6);
        assertThat(done.getPositionsAnalyzed()).isEqualTo(3);
        assertThat(registry.activeCount()).isZero();
    }

    @Test
    void illegalMoveEndsStreamWithError() {
        GameCmd cmd = new GameCmd();
        cmd.setRequestId("req-1");
        cmd.setPgn("1. e4 e5 2. Ke3");

        controller.game(cmd, sha);

        List<Envelope<?>> sent = sent();
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).getKind()).isEqualTo(Envelope.Kind.ERROR);
        ErrorPayload error = (ErrorPayload) sent.get(0).getPayload();
        assertThat(error.getErrorCode()).isEqualTo("INVALID_PGN");
        assertThat(error.getPly()).isEqualTo(3);
        assertThat(client.calls()).isZero();
    }

    @Test
    void missingRequestIdIsIgnored() {
        GameCmd cmd = new GameCmd();
        cmd.setPgn("1. e4");

        controller.game(cmd, sha);
        controller.cancel(new CancelCmd());

        verify(messaging, never()).convertAndSend(anyString(), any(Object.class));
        assertThat(client.calls()).isZero();
    }

    @Test
    void busyPoolEndsStreamWithGameErrorWithoutPly() {
        GameCmd cmd = new GameCmd();
        cmd.setRequestId("req-1");
        cmd.setPgn("1. e4 e5");
        cmd.setAnalyzeInterval(1);

        try (EngineLease held = pool.acquire()) {
            controller.game(cmd, sha);
        }

        List<Envelope<?>> sent = sent();
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).getKind()).isEqualTo(Envelope.Kind.ERROR);
        ErrorPayload error = (ErrorPayload) sent.get(0).getPayload();
        assertThat(error.getErrorCode()).isEqualTo("GAME_ANALYSIS_FAILED");
        assertThat(error.getPly()).isNull();
        assertThat(client.calls()).isZero();
    }

    @Test
    void interruptWhileWaitingForEngineReportsCancelled() {
        GameCmd cmd = new GameCmd();
        cmd.setRequestId("req-1");
        cmd.setPgn("1. e4 e5");
        cmd.setAnalyzeInterval(1);

        // 同步执行器在当前线程运行任务：线程带中断标记进入引擎池等待
        Thread.currentThread().interrupt();
        try {
            controller.game(cmd, sha);
        } finally {
            Thread.interrupted();
        }

        List<Envelope<?>> sent = sent();
        assertThat(sent).hasSize(1);
        ErrorPayload error = (ErrorPayload) sent.get(0).getPayload();
        assertThat(error.getErrorCode()).isEqualTo("CANCELLED");
        assertThat(client.calls()).isZero();
        assertThat(pool.available()).isEqualTo(1);
    }
}
