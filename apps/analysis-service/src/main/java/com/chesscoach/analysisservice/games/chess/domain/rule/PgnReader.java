package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidPgnException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PGN 词法解析：只读第一盘棋的主线。
 * 支持标签对、{} 与 ; 注释、嵌套 () 变着、$n NAG 与独立的 !? 注释符号、回合号、结果标记；
 * 也接受以空白分隔的 UCI 着法列表（无标签、无回合号）。
 * 着法是否合法不在这里判断，由 {@link GameWalker} 重放时校验。
 */
public final class PgnReader {

    private static final Pattern TAG = Pattern.compile("^\\[\\s*([A-Za-z0-9_]+)\\s+\"((?:[^\"\\\\]|\\\\.)*)\"\\s*]$");
    private static final Pattern MOVE_NUMBER = Pattern.compile("^\\d+\\.+");
    private static final Pattern ANNOTATION = Pattern.compile("^[!?]+$");
    private static final Set<String> RESULTS = Set.of("1-0", "0-1", "1/2-1/2", "*");

    private PgnReader() {
    }

    public static PgnGame read(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPgnException("棋谱为空");
        }
        Map<String, String> tags = new LinkedHashMap<>();
        List<String> moves = new ArrayList<>();
        String result = null;
        int variationDepth = 0;
        int i = 0;
        int n = text.length();

        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '{') {
                int end = text.indexOf('}', i + 1);
                if (end < 0) throw new InvalidPgnException("注释 { 未闭合");
                i = end + 1;
            } else if (c == '}') {
                throw new InvalidPgnException("注释 } 不匹配");
            } else if (c == ';') {
                int end = text.indexOf('\n', i);
                i = end < 0 ? n : end + 1;
            } else if (c == '%' && (i == 0 || text.charAt(i - 1) == '\n')) {
                int end = text.indexOf('\n', i);
                i = end < 0 ? n : end + 1;
            } else if (c == '(') {
                variationDepth++;
                i++;
            } else if (c == ')') {
                if (variationDepth == 0) throw new InvalidPgnException("变着括号 ) 不匹配");
                variationDepth--;
                i++;
            } else if (c == '[') {
                if (!moves.isEmpty() || variationDepth > 0) {
                    throw new InvalidPgnException("标签必须出现在着法之前");
                }
                int end = tagEnd(text, i);
                Matcher m = TAG.matcher(text.substring(i, end + 1));
                if (!m.matches()) throw new InvalidPgnException("标签格式错误: " + text.substring(i, end + 1));
                tags.put(m.group(1), m.group(2).replace("\\\"", "\"").replace("\\\\", "\\"));
                i = end + 1;
            } else {
                int end = i;
                while (end < n && !isDelimiter(text.charAt(end))) end++;
                String token = text.substring(i, end);
                i = end;
                if (variationDepth > 0) continue;
                // NAG（$n）与独立的 !? 类注释符号都不是着法
                if (token.startsWith("$") || ANNOTATION.matcher(token).matches()) continue;
                if (RESULTS.contains(token)) {
                    result = token;
                    // 结果标记之后的内容属于下一盘棋
                    break;
                }
                String move = MOVE_NUMBER.matcher(token).replaceFirst("");
                if (move.isEmpty() || move.chars().allMatch(Character::isDigit)) continue;
                moves.add(move);
            }
        }
        if (result == null && variationDepth > 0) {
            throw new InvalidPgnException("变着括号 ( 未闭合");
        }
        return new PgnGame(tags, moves, result);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '{' || c == '}' || c == '(' || c == ')' || c == ';' || c == '[';
    }

    private static int tagEnd(String text, int start) {
        boolean quoted = false;
        for (int i = start + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && quoted) {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == ']' && !quoted) {
                return i;
            }
        }
        throw new InvalidPgnException("标签 [ 未闭合");
    }
}
