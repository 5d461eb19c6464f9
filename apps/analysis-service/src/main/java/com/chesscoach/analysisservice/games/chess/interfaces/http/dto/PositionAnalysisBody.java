package com.chesscoach.analysisservice.games.chess.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.List;

/**
 * 单局面分析请求体。depth / multiPv 为空时使用默认值（18 / 3），lines 为空表示不限制候选着法。
 */
@Data
public class PositionAnalysisBody {
    @NotBlank
    private String fen;
    private Integer depth;
    private Integer multiPv;
    private List<String> lines;
}
