package com.chesscoach.analysisservice.platform.ws;

import com.chesscoach.analysisservice.games.chess.application.AnalysisJobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * WebSocket 断开监听器。
 *
 * 客户端断开（关闭页面、网络中断、心跳超时）时，取消该 STOMP 会话发起的所有分析任务，
 * 让引擎句柄尽快回到池中。
 */
@Slf4j
@Component
public class AnalysisSessionListener {

    private final AnalysisJobRegistry jobRegistry;

    public AnalysisSessionListener(AnalysisJobRegistry jobRegistry) {
        this.jobRegistry = jobRegistry;
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        int cancelled = jobRegistry.cancelSession(sessionId);
        if (cancelled > 0) {
            log.info("WebSocket 会话断开，已取消 {} 个分析任务: sessionId={}", cancelled, sessionId);
        } else {
            log.debug("WebSocket 会话断开: sessionId={}", sessionId);
        }
    }
}
