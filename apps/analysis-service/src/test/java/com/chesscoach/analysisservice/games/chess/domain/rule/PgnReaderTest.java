package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgnReaderTest {

    @Test
    void readsTagsMovesAndResult() {
        String pgn = """
                [Event "Casual"]
                [White "Alice"]
                [Black "Bob \\"The Rook\\""]

                1. e4 e5 2. Nf3 {king's knight} Nc6 $1 3. Bb5 (3. Bc4 Bc5) a6 1-0
                """;
        PgnGame game = PgnReader.read(pgn);

        assertThat(game.tags()).containsKeys("Event", "White", "Black");
        assertThat(game.tags().keySet()).containsExactly("Event", "White", "Black");
        assertThat(game.tags().get("Black")).isEqualTo("Bob \"The Rook\"");
        assertThat(game.moves()).containsExactly("e4", "e5", "Nf3", "Nc6", "Bb5", "a6");
        assertThat(game.result()).isEqualTo("1-0");
        assertThat(game.startingFen()).isEqualTo(FenCodec.STARTING_POSITION);
    }

    @Test
    void readsPlainUciMoveList() {
        PgnGame game = PgnReader.read("e2e4 e7e5\ng1f3");
        assertThat(game.moves()).containsExactly("e2e4", "e7e5", "g1f3");
        assertThat(game.tags()).isEmpty();
        assertThat(game.result()).isNull();
    }

    @Test
    void skipsLineCommentsAndBlackMoveNumbers() {
        PgnGame game = PgnReader.read("1. d4 ; queen pawn\n1... d5 2.c4 *");
        assertThat(game.moves()).containsExactly("d4", "d5", "c4");
        assertThat(game.result()).isEqualTo("*");
    }

    @Test
    void skipsStandaloneAnnotationSymbols() {
        PgnGame game = PgnReader.read("1. e4 !? e5 ! 2. Nf3 ?! Nc6 !! 3. Bb5 ?? a6 ? *");
        assertThat(game.moves()).containsExactly("e4", "e5", "Nf3", "Nc6", "Bb5", "a6");
        assertThat(GameWalker.countPlies("1. e4 !? e5 2. Nf3!? Nc6 ?! *")).isEqualTo(4);
    }

    @Test
    void usesFenTagAsStartingPosition() {
        String fen = "4k3/8/8/8/8/8/4P3/4K3 w - - 0 1";
        PgnGame game = PgnReader.read("[SetUp \"1\"]\n[FEN \"" + fen + "\"]\n1. e4 *");
        assertThat(game.startingFen()).isEqualTo(fen);
    }

    @Test
    void rejectsStructuralErrors() {
        assertThatThrownBy(() -> PgnReader.read("  ")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("1. e4 {open comment")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("1. e4 } e5")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("1. e4 (1. d4 e5")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("1. e4 ) e5")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("1. e4 [Event \"late\"] e5")).isInstanceOf(InvalidPgnException.class);
        assertThatThrownBy(() -> PgnReader.read("[Event \"open\" 1. e4")).isInstanceOf(InvalidPgnException.class);
    }
}
