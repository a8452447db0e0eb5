package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;

public final class General {
    // One orthogonal step, palace filter applied per side
    static final int[][] STEPS = new int[BoardUtils.SQUARES][];

    static {
        int[][] deltas = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            STEPS[i] = PieceTables.targets(i, deltas);
        }
    }

    private General() {
    }

    public static boolean isValidMove(Side side, int from, int to) {
        int dr = Math.abs(BoardUtils.row(to) - BoardUtils.row(from));
        int dc = Math.abs(BoardUtils.col(to) - BoardUtils.col(from));
        return dr + dc == 1 && side.isInPalace(BoardUtils.row(to), BoardUtils.col(to));
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        for (int to : STEPS[from]) {
            if (!side.isInPalace(BoardUtils.row(to), BoardUtils.col(to))) continue;
            Piece target = board.pieceAt(to);
            if (target == null || target.getSide() != side) {
                buffer[n++] = Move.asBytes(from, to);
            }
        }
        return n;
    }
}
