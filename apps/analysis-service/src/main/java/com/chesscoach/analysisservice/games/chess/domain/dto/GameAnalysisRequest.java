package com.chesscoach.analysisservice.games.chess.domain.dto;

/**
 * 整盘分析请求。depth / multiPv / analyzeInterval 为空时使用配置的默认值。
 */
public record GameAnalysisRequest(String pgn, Integer depth, Integer multiPv, Integer analyzeInterval) {
}
