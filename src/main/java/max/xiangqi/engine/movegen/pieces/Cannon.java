package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.movegen.Move;

public final class Cannon {
    private Cannon() {
    }

    public static boolean isValidMove(Board board, int from, int to) {
        int between = PieceTables.countBetween(board, from, to);
        if (between < 0) {
            return false;
        }
        // A capture jumps exactly one screen, a quiet move slides over nothing
        return board.pieceAt(to) == null ? between == 0 : between == 1;
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        for (int[] ray : PieceTables.RAYS[from]) {
            boolean screened = false;
            for (int to : ray) {
                Piece target = board.pieceAt(to);
                if (!screened) {
                    if (target == null) {
                        buffer[n++] = Move.asBytes(from, to);
                    } else {
                        screened = true;
                    }
                } else if (target != null) {
                    if (target.getSide() != side) {
                        buffer[n++] = Move.asBytes(from, to);
                    }
                    break;
                }
            }
        }
        return n;
    }

    /** Own pieces met along the four lines before the first enemy piece. */
    public static int countScreens(Board board, Side side, int from) {
        int screens = 0;
        for (int[] ray : PieceTables.RAYS[from]) {
            for (int sq : ray) {
                Piece p = board.pieceAt(sq);
                if (p == null) continue;
                if (p.getSide() != side) break;
                screens++;
            }
        }
        return screens;
    }
}
