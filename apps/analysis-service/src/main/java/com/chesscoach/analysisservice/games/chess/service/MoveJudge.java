package com.chesscoach.analysisservice.games.chess.service;

import com.chesscoach.analysisservice.games.chess.domain.dto.MoveVerdict;

/**
 * 着法判定："正确"严格定义为与引擎在默认深度下的唯一最佳着法一致（不区分大小写），
 * 评估接近的其他着法也判为不正确。需要容差的调用方请自行用 topMoves 过滤。
 */
public interface MoveJudge {

    boolean isMoveCorrect(String fen, String candidateUci);

    /** 判定结果附带引擎最佳着法与评估 */
    MoveVerdict judge(String fen, String candidateUci);
}
