package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;

public final class Elephant {
    static final int[][] TARGETS = new int[BoardUtils.SQUARES][];
    // EYES[i][k] is the midpoint that must stay empty for TARGETS[i][k]
    static final int[][] EYES = new int[BoardUtils.SQUARES][];

    static {
        int[][] deltas = {{-2, -2}, {-2, 2}, {2, -2}, {2, 2}};
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            TARGETS[i] = PieceTables.targets(i, deltas);
            EYES[i] = PieceTables.midpoints(i, deltas);
        }
    }

    private Elephant() {
    }

    public static boolean isValidMove(Board board, Side side, int from, int to) {
        int fr = BoardUtils.row(from), fc = BoardUtils.col(from);
        int tr = BoardUtils.row(to), tc = BoardUtils.col(to);
        if (Math.abs(tr - fr) != 2 || Math.abs(tc - fc) != 2) {
            return false;
        }
        if (side.hasCrossedRiver(tr)) {
            return false;
        }
        return board.pieceAt(BoardUtils.index((fr + tr) / 2, (fc + tc) / 2)) == null;
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        int[] targets = TARGETS[from];
        int[] eyes = EYES[from];
        for (int k = 0; k < targets.length; k++) {
            int to = targets[k];
            if (side.hasCrossedRiver(BoardUtils.row(to)) || board.pieceAt(eyes[k]) != null) continue;
            Piece target = board.pieceAt(to);
            if (target == null || target.getSide() != side) {
                buffer[n++] = Move.asBytes(from, to);
            }
        }
        return n;
    }
}
