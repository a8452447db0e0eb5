package max.xiangqi.engine.game;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.xiangqi.engine.common.CorruptGameStateException;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;

import java.util.Objects;

/**
 * Search-side position: a board, the side to move and an incrementally maintained
 * Zobrist key, with make/unmake stacks. Not thread-safe; each search owns its own copy.
 */
public class Game {
    private static final int MAX_PLY = 512;

    private final Board board;
    private Side sideToMove;
    private long zobristKey;

    // Undo stacks, one frame per played move (null moves included)
    private final int[] movesPlayed = new int[MAX_PLY];
    private final Piece[] captured = new Piece[MAX_PLY];
    private final long[] previousKeys = new long[MAX_PLY];
    private int ply;

    public Game(Board board, Side sideToMove) {
        this.board = Objects.requireNonNull(board, "board");
        this.sideToMove = Objects.requireNonNull(sideToMove, "sideToMove");
        recomputeZobristKey();
    }

    /** Independent game over a deep copy of the board. Undo history is not carried over. */
    public Game copy() {
        return new Game(board.copy(), sideToMove);
    }

    public Board board() {
        return board;
    }

    public Side sideToMove() {
        return sideToMove;
    }

    public long zobristKey() {
        return zobristKey;
    }

    public void recomputeZobristKey() {
        zobristKey = ZobristHashKeys.compute(board, sideToMove);
    }

    public int ply() {
        return ply;
    }

    public void playMove(int move) {
        if (ply >= MAX_PLY) {
            throw new CorruptGameStateException("Move stack overflow at ply " + ply);
        }
        int from = Move.getStartPosition(move);
        int to = Move.getEndPosition(move);
        Piece mover = board.pieceAt(from);
        if (mover == null) {
            throw new CorruptGameStateException("No piece at origin of move " + Move.toString(move));
        }

        previousKeys[ply] = zobristKey;
        movesPlayed[ply] = move;

        Piece eaten = board.movePiece(from, to);
        captured[ply] = eaten;
        long key = zobristKey ^ ZobristHashKeys.pieceKey(mover, from) ^ ZobristHashKeys.pieceKey(mover, to);
        if (eaten != null) {
            key ^= ZobristHashKeys.pieceKey(eaten, to);
        }
        zobristKey = key ^ ZobristHashKeys.SIDE_KEY;
        sideToMove = sideToMove.opposite();
        ply++;
    }

    public void undoMove() {
        if (ply == 0) {
            throw new CorruptGameStateException("No move to undo");
        }
        ply--;
        int move = movesPlayed[ply];
        if (move == Move.NONE) {
            throw new CorruptGameStateException("Undoing a regular move over a null move");
        }
        board.unmovePiece(Move.getStartPosition(move), Move.getEndPosition(move), captured[ply]);
        captured[ply] = null;
        zobristKey = previousKeys[ply];
        sideToMove = sideToMove.opposite();
    }

    /** Passes the turn without moving a piece. */
    public void playNullMove() {
        if (ply >= MAX_PLY) {
            throw new CorruptGameStateException("Move stack overflow at ply " + ply);
        }
        previousKeys[ply] = zobristKey;
        movesPlayed[ply] = Move.NONE;
        captured[ply] = null;
        zobristKey ^= ZobristHashKeys.SIDE_KEY;
        sideToMove = sideToMove.opposite();
        ply++;
    }

    public void undoNullMove() {
        if (ply == 0 || movesPlayed[ply - 1] != Move.NONE) {
            throw new CorruptGameStateException("No null move to undo");
        }
        ply--;
        zobristKey = previousKeys[ply];
        sideToMove = sideToMove.opposite();
    }

    public boolean lastMoveWasNull() {
        return ply > 0 && movesPlayed[ply - 1] == Move.NONE;
    }

    public int getLegalMoves(int[] buffer) {
        return MoveGenerator.generateMoves(this, buffer);
    }

    public IntArrayList getLegalMoves() {
        return MoveGenerator.legalMoves(this);
    }

    public boolean hasGeneral(Side side) {
        return board.getGeneral(side) != null;
    }

    public boolean inCheck() {
        return isInCheck(sideToMove);
    }

    public boolean isInCheck(Side side) {
        return MoveGenerator.isInCheck(board, side);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Game game = (Game) o;
        return zobristKey == game.zobristKey;
    }

    @Override
    public int hashCode() {
        return (int) zobristKey;
    }
}
