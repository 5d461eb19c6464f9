package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.games.chess.domain.enums.Side;

/**
 * 重放棋谱时的一个半回合。
 *
 * @param ply        半回合序号，从 1 开始
 * @param moveNumber 该步所在的全回合数（取自走棋前局面）
 * @param mover      走这步棋的一方
 * @param sideToMove 走完后轮到的一方
 * @param fenAfter   走完后的局面
 * @param uci        该步的 UCI 形式
 * @param san        该步的 SAN 形式
 */
public record WalkedPly(int ply, int moveNumber, Side mover, Side sideToMove,
                        String fenAfter, String uci, String san) {
}
