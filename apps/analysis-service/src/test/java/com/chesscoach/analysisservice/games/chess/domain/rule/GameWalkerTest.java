package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameWalkerTest {

    @Test
    void walksSanGameInOrder() {
        List<WalkedPly> plies = GameWalker.walk("1. e4 e5 2. Nf3 Nc6").toList();

        assertThat(plies).extracting(WalkedPly::ply).containsExactly(1, 2, 3, 4);
        assertThat(plies).extracting(WalkedPly::uci).containsExactly("e2e4", "e7e5", "g1f3", "b8c6");
        assertThat(plies).extracting(WalkedPly::moveNumber).containsExactly(1, 1, 2, 2);
        assertThat(plies).extracting(WalkedPly::mover)
                .containsExactly(Side.WHITE, Side.BLACK, Side.WHITE, Side.BLACK);
        assertThat(plies.get(0).fenAfter())
                .isEqualTo("rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1");
        assertThat(plies.get(3).fenAfter())
                .isEqualTo("r1bqkbnr/pppp1ppp/2n5/4p3/4P3/5N2/PPPP1PPP/RNBQKB1R w KQkq - 2 3");
    }

    @Test
    void uciAndSanTokensProduceSamePositions() {
        List<String> san = GameWalker.walk("1. d4 d5 2. c4 dxc4").map(WalkedPly::fenAfter).toList();
        List<String> uci = GameWalker.walk("d2d4 d7d5 c2c4 d5c4").map(WalkedPly::fenAfter).toList();
        assertThat(uci).isEqualTo(san);
        assertThat(GameWalker.walk("d2d4 d7d5 c2c4 d5c4").map(WalkedPly::san).toList())
                .containsExactly("d4", "d5", "c4", "dxc4");
    }

    @Test
    void blackMovesFirstFromFenTag() {
        GameWalk walk = GameWalker.open("[FEN \"4k3/4p3/8/8/8/8/4P3/4K3 b - - 0 7\"]\n7... e5 8. e4 *");
        assertThat(walk.firstMover()).isEqualTo(Side.BLACK);
        assertThat(walk.tokenCount()).isEqualTo(2);
        List<WalkedPly> plies = walk.plies().toList();
        assertThat(plies).extracting(WalkedPly::moveNumber).containsExactly(7, 8);
        assertThat(plies.get(0).mover()).isEqualTo(Side.BLACK);
    }

    @Test
    void illegalMoveReportsItsPly() {
        assertThatThrownBy(() -> GameWalker.countPlies("1. e4 e5 2. Ke3"))
                .isInstanceOfSatisfying(InvalidPgnException.class, e -> assertThat(e.getPly()).isEqualTo(3));
    }

    @Test
    void rejectsEmptyGameAndBadFenTag() {
        assertThatThrownBy(() -> GameWalker.open("[Event \"x\"] *")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> GameWalker.open("[FEN \"8/8/8/8/8/8/8/8 w - - 0 1\"] 1. e4"))
                .isInstanceOfSatisfying(InvalidPgnException.class, e -> assertThat(e.getPly()).isZero());
    }

    @Test
    void walkCanOnlyBeConsumedOnce() {
        GameWalk walk = GameWalker.open("e2e4");
        assertThat(GameWalker.countPlies("e2e4")).isEqualTo(1);
        walk.iterator();
        assertThatThrownBy(walk::iterator).isInstanceOf(IllegalStateException.class);
    }
}
