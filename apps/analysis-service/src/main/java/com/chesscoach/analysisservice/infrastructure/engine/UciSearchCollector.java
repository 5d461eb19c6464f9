package com.chesscoach.analysisservice.infrastructure.engine;

import com.chesscoach.analysisservice.engine.core.EvaluationResult;
import com.chesscoach.analysisservice.engine.core.MoveScore;
import com.chesscoach.analysisservice.engine.core.Score;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * 收集一次 go 搜索的输出：逐行喂入 info / bestmove，搜索结束后组装成 {@link EvaluationResult}。
 * 每个 multipv 序号只保留最新（最深）的一行；带 lowerbound / upperbound 的行不是最终值，忽略。
 * UCI 的分数是走子方视角，blackToMove 时翻转为白方视角。
 */
@Slf4j
class UciSearchCollector {

    private final boolean blackToMove;
    private final Map<Integer, Line> lines = new TreeMap<>();
    private String bestMove;
    private boolean finished;
    private String invalidPositionMessage;

    UciSearchCollector(boolean blackToMove) {
        this.blackToMove = blackToMove;
    }

    /**
     * 处理一行引擎输出。
     * @return 读到 bestmove（搜索结束）时返回 true
     */
    boolean accept(String raw) {
        String line = raw.trim();
        if (line.startsWith("bestmove")) {
            String[] parts = line.split("\\s+");
            String move = parts.length > 1 ? parts[1] : null;
            bestMove = move == null || "(none)".equals(move) || "0000".equals(move) ? null : move;
            finished = true;
            return true;
        }
        if (line.startsWith("info string")) {
            String text = line.substring("info string".length()).trim();
            String lower = text.toLowerCase(Locale.ROOT);
            if (lower.contains("invalid") || lower.contains("illegal")) {
                invalidPositionMessage = text;
            }
            return false;
        }
        if (line.startsWith("info ")) {
            parseInfo(line, line.split("\\s+"));
        }
        return false;
    }

    boolean isFinished() {
        return finished;
    }

    /** 引擎报告的非法局面说明；没有则为 null */
    String invalidPositionMessage() {
        return invalidPositionMessage;
    }

    EvaluationResult result(String fen, int maxLines) {
        List<MoveScore> top = new ArrayList<>();
        for (Line l : lines.values()) {
            if (top.size() >= maxLines) break;
            if (l.pv.isEmpty() || l.score == null) continue;
            top.add(new MoveScore(l.pv.get(0), l.score, l.pv));
        }
        Line first = lines.get(1);
        Score evaluation = first == null ? null : first.score;
        int depth = first == null ? 0 : first.depth;
        return new EvaluationResult(fen, bestMove, top, evaluation, depth);
    }

    private void parseInfo(String line, String[] t) {
        int multipv = 1;
        int depth = -1;
        Score score = null;
        boolean bound = false;
        List<String> pv = List.of();
        try {
            for (int i = 1; i < t.length; i++) {
                switch (t[i]) {
                    case "depth" -> depth = parseInt(t, ++i);
                    case "multipv" -> multipv = parseInt(t, ++i);
                    case "score" -> {
                        String kind = i + 1 < t.length ? t[i + 1] : "";
                        if (!"cp".equals(kind) && !"mate".equals(kind)) {
                            throw new NumberFormatException("未知的分数类型: " + kind);
                        }
                        int v = parseInt(t, i + 2);
                        score = "mate".equals(kind) ? Score.mate(v) : Score.cp(v);
                        i += 2;
                    }
                    case "lowerbound", "upperbound" -> bound = true;
                    case "pv" -> {
                        pv = Arrays.asList(Arrays.copyOfRange(t, i + 1, t.length));
                        i = t.length;
                    }
                    default -> {
                    }
                }
            }
        } catch (NumberFormatException e) {
            // 数值残缺的行整行丢弃，不能当作真实评估
            log.warn("忽略无法解析的引擎输出: {} ({})", line, e.getMessage());
            return;
        }
        // 只有 nodes/nps 等统计信息的行没有深度与评估
        if (depth < 0 || multipv < 1 || score == null || bound) return;
        if (blackToMove) score = score.negate();
        Line previous = lines.get(multipv);
        if (previous == null || depth >= previous.depth) {
            lines.put(multipv, new Line(depth, score, pv));
        }
    }

    private static int parseInt(String[] t, int i) {
        if (i >= t.length) {
            throw new NumberFormatException("缺少数值: " + t[t.length - 1]);
        }
        return Integer.parseInt(t[i]);
    }

    private record Line(int depth, Score score, List<String> pv) {
    }
}
