package com.chesscoach.analysisservice.games.chess.domain.constants;

import com.chesscoach.analysisservice.games.chess.domain.enums.Termination;

/**
 * 分析相关的提示消息常量
 * 统一管理返回给前端的说明文字，避免硬编码
 *
 * 使用示例：
 *   String reason = AnalysisMessages.describe(Termination.CHECKMATE);
 *   String done = AnalysisMessages.formatGameDone(12, 80);
 */
public final class AnalysisMessages {

    private AnalysisMessages() {
        // 工具类，禁止实例化
    }

    // ========== 终局说明 ==========

    /** 将死 */
    public static final String CHECKMATE = "将死，当前局面没有可走的着法";

    /** 逼和 */
    public static final String STALEMATE = "逼和，当前局面没有可走的着法";

    /** 子力不足 */
    public static final String INSUFFICIENT_MATERIAL = "双方子力均不足以将死，和棋";

    /** 75 回合规则 */
    public static final String SEVENTY_FIVE_MOVES = "75 回合内无吃子和兵步，和棋";

    public static String describe(Termination termination) {
        return switch (termination) {
            case CHECKMATE -> CHECKMATE;
            case STALEMATE -> STALEMATE;
            case INSUFFICIENT_MATERIAL -> INSUFFICIENT_MATERIAL;
            case SEVENTY_FIVE_MOVES -> SEVENTY_FIVE_MOVES;
        };
    }

    // ========== 整盘分析进度 ==========

    /** 整盘分析完成（需要格式化：已分析局面数、总半回合数） */
    public static final String GAME_DONE = "整盘分析完成：共 %d 个半回合，分析了 %d 个局面";

    public static String formatGameDone(int totalPlies, int analysed) {
        return String.format(GAME_DONE, totalPlies, analysed);
    }

    /** 整盘分析已取消 */
    public static final String GAME_CANCELLED = "整盘分析已取消";

    /** 同一个 requestId 已有分析在进行 */
    public static final String DUPLICATE_REQUEST = "requestId %s 已有分析在进行";

    public static String formatDuplicateRequest(String requestId) {
        return String.format(DUPLICATE_REQUEST, requestId);
    }

    // ========== 着法判定 ==========

    /** 与引擎最佳着法一致 */
    public static final String MOVE_MATCHES_BEST = "与引擎最佳着法一致";

    /** 与引擎最佳着法不一致（需要格式化：引擎最佳着法） */
    public static final String MOVE_DIFFERS = "引擎最佳着法为 %s";

    public static String formatMoveDiffers(String bestMove) {
        return String.format(MOVE_DIFFERS, bestMove);
    }
}
