package com.chesscoach.analysisservice.games.chess.domain.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 解析后的棋谱：标签对、主线着法记号（SAN 或 UCI，尚未校验合法性）、结果标记。
 *
 * @param tags   标签对（保持出现顺序）
 * @param moves  主线着法记号，已去掉回合号、注释、变着与 NAG
 * @param result 结果标记（1-0 / 0-1 / 1/2-1/2 / *），棋谱中没有则为 null
 */
public record PgnGame(Map<String, String> tags, List<String> moves, String result) {

    public PgnGame {
        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        moves = List.copyOf(moves);
    }

    /** 起始局面：有 [FEN] 标签用标签值，否则为标准初始局面 */
    public String startingFen() {
        String fen = tags.get("FEN");
        return fen == null || fen.isBlank() ? FenCodec.STARTING_POSITION : fen;
    }
}
