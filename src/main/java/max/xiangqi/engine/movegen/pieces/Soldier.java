package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;

public final class Soldier {
    private Soldier() {
    }

    public static boolean isValidMove(Side side, int from, int to) {
        int fr = BoardUtils.row(from), fc = BoardUtils.col(from);
        int dr = BoardUtils.row(to) - fr;
        int dc = BoardUtils.col(to) - fc;
        if (dc == 0 && dr == side.forward) {
            return true;
        }
        // Sideways only once the river is behind
        return dr == 0 && Math.abs(dc) == 1 && side.hasCrossedRiver(fr);
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        int fr = BoardUtils.row(from), fc = BoardUtils.col(from);
        n = add(board, side, from, fr + side.forward, fc, buffer, n);
        if (side.hasCrossedRiver(fr)) {
            n = add(board, side, from, fr, fc - 1, buffer, n);
            n = add(board, side, from, fr, fc + 1, buffer, n);
        }
        return n;
    }

    private static int add(Board board, Side side, int from, int row, int col, int[] buffer, int n) {
        if (!BoardUtils.isOnBoard(row, col)) return n;
        int to = BoardUtils.index(row, col);
        Piece target = board.pieceAt(to);
        if (target == null || target.getSide() != side) {
            buffer[n++] = Move.asBytes(from, to);
        }
        return n;
    }
}
