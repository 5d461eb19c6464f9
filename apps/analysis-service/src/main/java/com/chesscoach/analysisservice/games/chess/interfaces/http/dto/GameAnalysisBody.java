package com.chesscoach.analysisservice.games.chess.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 整盘分析请求体。pgn 也可以是空白分隔的 UCI 着法列表。
 */
@Data
public class GameAnalysisBody {
    @NotBlank
    private String pgn;
    private Integer depth;
    private Integer multiPv;
    /** 每 N 个半回合分析一次（1 = 每步），默认 3 */
    private Integer analyzeInterval;
}
