package com.chesscoach.analysisservice.games.chess.domain.rule;

import com.chesscoach.analysisservice.common.exception.InvalidPgnException;
import com.chesscoach.analysisservice.games.chess.domain.enums.Side;
import com.chesscoach.analysisservice.games.chess.domain.model.Board;
import com.chesscoach.analysisservice.games.chess.domain.model.ChessMove;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 一次棋谱重放：惰性、单次遍历。
 * 棋盘随迭代逐步前进，不能回退也不能重复遍历；需要再走一遍请重新 {@link GameWalker#open(String)}。
 */
public final class GameWalk implements Iterable<WalkedPly> {

    private final String startingFen;
    private final Side firstMover;
    private final List<String> tokens;
    private final Board board;
    private boolean consumed;

    GameWalk(String startingFen, Board start, List<String> tokens) {
        this.startingFen = startingFen;
        this.firstMover = start.sideToMove();
        this.board = start;
        this.tokens = tokens;
    }

    public String startingFen() {
        return startingFen;
    }

    /** 第一步的走棋方（由起始局面决定，带 [FEN] 标签的棋谱可能是黑方先走） */
    public Side firstMover() {
        return firstMover;
    }

    /** 棋谱中的着法记号数（尚未校验合法性） */
    public int tokenCount() {
        return tokens.size();
    }

    @Override
    public Iterator<WalkedPly> iterator() {
        if (consumed) {
            throw new IllegalStateException("棋谱重放只能遍历一次");
        }
        consumed = true;
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < tokens.size();
            }

            @Override
            public WalkedPly next() {
                if (!hasNext()) throw new NoSuchElementException();
                String token = tokens.get(index++);
                return step(index, token);
            }
        };
    }

    /** 以顺序流的形式遍历（不可并行） */
    public Stream<WalkedPly> plies() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private WalkedPly step(int ply, String token) {
        Optional<ChessMove> move = ChessMove.looksLikeUci(token)
                ? ChessJudge.findLegal(board, token)
                : SanCodec.resolve(board, token);
        if (move.isEmpty()) {
            throw new InvalidPgnException(ply, "无法识别或不合法的着法 " + token + "（局面 " + FenCodec.format(board) + "）");
        }
        ChessMove m = move.get();
        int moveNumber = board.fullmoveNumber();
        Side mover = board.sideToMove();
        String san = SanCodec.format(board, m);
        board.apply(m);
        return new WalkedPly(ply, moveNumber, mover, board.sideToMove(), FenCodec.format(board), m.uci(), san);
    }
}
