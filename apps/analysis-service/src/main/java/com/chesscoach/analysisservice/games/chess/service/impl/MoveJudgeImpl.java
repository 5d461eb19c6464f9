package com.chesscoach.analysisservice.games.chess.service.impl;

import com.chesscoach.analysisservice.common.exception.InvalidParameterException;
import com.chesscoach.analysisservice.engine.core.Score;
import com.chesscoach.analysisservice.games.chess.domain.constants.AnalysisMessages;
import com.chesscoach.analysisservice.games.chess.domain.dto.BestMoveResult;
import com.chesscoach.analysisservice.games.chess.domain.dto.MoveVerdict;
import com.chesscoach.analysisservice.games.chess.service.MoveJudge;
import com.chesscoach.analysisservice.games.chess.service.PositionAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class MoveJudgeImpl implements MoveJudge {

    private final PositionAnalyzer positionAnalyzer;

    @Override
    public boolean isMoveCorrect(String fen, String candidateUci) {
        return judge(fen, candidateUci).correct();
    }

    @Override
    public MoveVerdict judge(String fen, String candidateUci) {
        if (StringUtils.isBlank(candidateUci)) {
            throw new InvalidParameterException("move", "待判定的着法不能为空");
        }
        String candidate = candidateUci.trim();
        BestMoveResult best = positionAnalyzer.getBestMove(fen, positionAnalyzer.defaultDepth());
        if (!best.hasMove()) {
            return new MoveVerdict(fen, candidate, false, null, null, best.reason());
        }
        boolean correct = candidate.equalsIgnoreCase(best.bestMove());
        Score evaluation = best.evaluation() == null ? null : best.evaluation().evaluation();
        log.debug("着法判定: fen={}, move={}, best={}, correct={}", fen, candidate, best.bestMove(), correct);
        String message = correct ? AnalysisMessages.MOVE_MATCHES_BEST : AnalysisMessages.formatMoveDiffers(best.bestMove());
        return new MoveVerdict(fen, candidate, correct, best.bestMove(), evaluation, message);
    }
}
