package com.chesscoach.analysisservice.games.chess.interfaces.ws;

import com.chesscoach.analysisservice.common.ErrorCode;
import com.chesscoach.analysisservice.common.exception.GameAnalysisFailedException;
import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.games.chess.application.AnalysisJobRegistry;
import com.chesscoach.analysisservice.games.chess.domain.constants.AnalysisMessages;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisReport;
import com.chesscoach.analysisservice.games.chess.domain.dto.GameAnalysisRequest;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.CancelCmd;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.ErrorPayload;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.GameCmd;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.GameDone;
import com.chesscoach.analysisservice.games.chess.interfaces.ws.dto.AnalysisWsMessages.PositionCmd;
import com.chesscoach.analysisservice.games.chess.service.GameAnalysisOrchestrator;
import com.chesscoach.analysisservice.games.chess.service.PositionAnalyzer;
import com.chesscoach.analysisservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Controller;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 分析 WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的分析指令，在 analysisExecutor 上执行，
 * 结果通过 SimpMessagingTemplate 推送到 /topic/analysis.{requestId}。
 *
 *   1. /app/analysis.position → 一条 STATE
 *   2. /app/analysis.game     → 每个采样点一条 EVENT（按半回合顺序），结束一条 DONE；失败或取消一条 ERROR
 *   3. /app/analysis.cancel   → 取消进行中的分析
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class AnalysisWsController {

    private static final String CHANNEL = "analysis";

    private final PositionAnalyzer positionAnalyzer;
    private final GameAnalysisOrchestrator orchestrator;
    private final AnalysisJobRegistry jobRegistry;
    private final SimpMessagingTemplate messaging;

    @MessageMapping("/analysis.position")
    public void position(PositionCmd cmd, SimpMessageHeaderAccessor sha) {
        final String requestId = cmd.getRequestId();
        if (!checkRequestId(requestId)) return;
        boolean accepted = jobRegistry.submit(requestId, sha.getSessionId(), cancelled -> {
            try {
                EvaluationResult result = positionAnalyzer.analyzePosition(
                        cmd.getFen(), cmd.getDepth(), cmd.getMultiPv(), cmd.getLines());
                send(requestId, Envelope.state(CHANNEL, requestId, result));
            } catch (RuntimeException e) {
                sendError(requestId, e);
            }
        });
        if (!accepted) {
            sendDuplicate(requestId);
        }
    }

    @MessageMapping("/analysis.game")
    public void game(GameCmd cmd, SimpMessageHeaderAccessor sha) {
        final String requestId = cmd.getRequestId();
        if (!checkRequestId(requestId)) return;
        GameAnalysisRequest request = new GameAnalysisRequest(
                cmd.getPgn(), cmd.getDepth(), cmd.getMultiPv(), cmd.getAnalyzeInterval());
        boolean accepted = jobRegistry.submit(requestId, sha.getSessionId(), cancelled -> {
            AtomicLong seq = new AtomicLong();
            try {
                GameAnalysisReport report = orchestrator.analyzeGame(request,
                        entry -> send(requestId, Envelope.of(Envelope.Kind.EVENT, CHANNEL, requestId, entry, seq.incrementAndGet())),
                        cancelled);
                GameDone done = new GameDone(report.totalPlies(), report.positionsAnalyzed(),
                        AnalysisMessages.formatGameDone(report.totalPlies(), report.positionsAnalyzed()));
                send(requestId, Envelope.done(CHANNEL, requestId, done, seq.incrementAndGet()));
            } catch (CancellationException e) {
                log.info("整盘分析已取消: requestId={}", requestId);
                send(requestId, Envelope.error(CHANNEL, requestId,
                        new ErrorPayload(ErrorCode.CANCELLED.name(), AnalysisMessages.GAME_CANCELLED, null)));
            } catch (RuntimeException e) {
                sendError(requestId, e);
            }
        });
        if (!accepted) {
            sendDuplicate(requestId);
        }
    }

    @MessageMapping("/analysis.cancel")
    public void cancel(CancelCmd cmd) {
        if (!checkRequestId(cmd.getRequestId())) return;
        if (!jobRegistry.cancel(cmd.getRequestId())) {
            log.debug("取消请求未命中进行中的分析: requestId={}", cmd.getRequestId());
        }
    }

    // ----------- helpers -----------

    private boolean checkRequestId(String requestId) {
        if (StringUtils.isBlank(requestId)) {
            log.warn("分析请求缺少 requestId，无法推送结果，已忽略");
            return false;
        }
        return true;
    }

    private void send(String requestId, Envelope<?> envelope) {
        messaging.convertAndSend("/topic/analysis." + requestId, envelope);
    }

    private void sendError(String requestId, RuntimeException e) {
        ErrorCode code = ErrorCode.of(e);
        if (code.httpStatus() >= 500) {
            log.error("分析失败: requestId={}, error={}", requestId, e.getMessage(), e);
        } else {
            log.info("分析请求被拒绝: requestId={}, error={}", requestId, e.getMessage());
        }
        Integer ply = null;
        if (e instanceof GameAnalysisFailedException g && g.getPly() > 0) {
            ply = g.getPly();
        } else if (e instanceof InvalidPgnException p && p.getPly() > 0) {
            ply = p.getPly();
        }
        send(requestId, Envelope.error(CHANNEL, requestId, new ErrorPayload(code.name(), e.getMessage(), ply)));
    }

    private void sendDuplicate(String requestId) {
        send(requestId, Envelope.error(CHANNEL, requestId,
                new ErrorPayload(ErrorCode.BAD_REQUEST.name(), AnalysisMessages.formatDuplicateRequest(requestId), null)));
    }
}
