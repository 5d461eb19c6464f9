package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidFenException;
import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;

import java.util.stream.Stream;

/**
 * 棋谱重放入口。
 * 文本在调用时即完成词法解析（语法错误立刻抛出），着法合法性在遍历到该步时校验。
 */
public final class GameWalker {

    private GameWalker() {
    }

    public static GameWalk open(String pgnOrMoveList) {
        PgnGame game = PgnReader.read(pgnOrMoveList);
        if (game.moves().isEmpty()) {
            throw new InvalidPgnException("棋谱中没有着法");
        }
        Board start;
        try {
            start = ChessJudge.parseLegal(game.startingFen());
        } catch (InvalidFenException e) {
            throw new InvalidPgnException(0, "[FEN] 标签不合法: " + e.getMessage(), e);
        }
        return new GameWalk(game.startingFen(), start, game.moves());
    }

    /** 惰性顺序流：(ply, 走后局面, UCI) */
    public static Stream<WalkedPly> walk(String pgnOrMoveList) {
        return open(pgnOrMoveList).plies();
    }

    /** 完整重放一遍（不调用引擎），返回半回合数；任何一步不合法都抛 {@link InvalidPgnException} */
    public static int countPlies(String pgnOrMoveList) {
        int plies = 0;
        for (WalkedPly ignored : open(pgnOrMoveList)) {
            plies++;
        }
        return plies;
    }
}
