package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;

public final class Horse {
    static final int[][] DELTAS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2},
            {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };
    static final int[][] TARGETS = new int[BoardUtils.SQUARES][];
    // LEGS[i][k] is the orthogonal square that blocks TARGETS[i][k]
    static final int[][] LEGS = new int[BoardUtils.SQUARES][];

    static {
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            TARGETS[i] = PieceTables.targets(i, DELTAS);
            LEGS[i] = PieceTables.legs(i, DELTAS);
        }
    }

    private Horse() {
    }

    public static boolean isValidMove(Board board, int from, int to) {
        int fr = BoardUtils.row(from), fc = BoardUtils.col(from);
        int dr = BoardUtils.row(to) - fr;
        int dc = BoardUtils.col(to) - fc;
        int legRow, legCol;
        if (Math.abs(dr) == 2 && Math.abs(dc) == 1) {
            legRow = fr + dr / 2;
            legCol = fc;
        } else if (Math.abs(dr) == 1 && Math.abs(dc) == 2) {
            legRow = fr;
            legCol = fc + dc / 2;
        } else {
            return false;
        }
        return board.pieceAt(BoardUtils.index(legRow, legCol)) == null;
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        int[] targets = TARGETS[from];
        int[] legs = LEGS[from];
        for (int k = 0; k < targets.length; k++) {
            if (board.pieceAt(legs[k]) != null) continue;
            int to = targets[k];
            Piece target = board.pieceAt(to);
            if (target == null || target.getSide() != side) {
                buffer[n++] = Move.asBytes(from, to);
            }
        }
        return n;
    }

    /** Destinations whose leg is free, regardless of what stands on them. */
    public static int countActiveSquares(Board board, int from) {
        int[] legs = LEGS[from];
        int count = 0;
        for (int leg : legs) {
            if (board.pieceAt(leg) == null) count++;
        }
        return count;
    }
}
