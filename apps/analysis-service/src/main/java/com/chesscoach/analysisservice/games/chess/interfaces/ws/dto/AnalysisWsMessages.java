package com.chesscoach.analysisservice.games.chess.interfaces.ws.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端与后端通过 STOMP 交互的分析消息格式：
 *   1. 前端 -> 后端：/app/analysis.position、/app/analysis.game、/app/analysis.cancel
 *   2. 后端 -> 前端：/topic/analysis.{requestId}，统一包在 Envelope 中
 *
 * requestId 由前端生成，前端先订阅 /topic/analysis.{requestId} 再发请求。
 */
public class AnalysisWsMessages {

    /**
     * 单局面分析命令（客户端 → 服务端）
     * 结果以一条 STATE 消息返回。
     */
    @Data
    public static class PositionCmd {
        private String requestId;
        private String fen;
        private Integer depth;
        private Integer multiPv;
        private List<String> lines;
    }

    /**
     * 整盘分析命令（客户端 → 服务端）
     * 每分析完一个采样点推一条 EVENT，全部完成后推 DONE，失败或取消推 ERROR。
     */
    @Data
    public static class GameCmd {
        private String requestId;
        private String pgn;
        private Integer depth;
        private Integer multiPv;
        private Integer analyzeInterval;
    }

    /**
     * 取消命令（客户端 → 服务端）
     */
    @Data
    public static class CancelCmd {
        private String requestId;
    }

    /**
     * 整盘分析结束（服务端 → 客户端，DONE 的载荷）
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameDone {
        private int totalPlies;
        private int positionsAnalyzed;
        private String message;
    }

    /**
     * 错误通知（服务端 → 客户端，ERROR 的载荷）
     * ply 仅在整盘分析某个半回合失败时有值。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorPayload {
        private String errorCode;
        private String message;
        private Integer ply;
    }
}
