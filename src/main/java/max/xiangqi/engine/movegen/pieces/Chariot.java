package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.movegen.Move;

public final class Chariot {
    private Chariot() {
    }

    public static boolean isValidMove(Board board, int from, int to) {
        return PieceTables.countBetween(board, from, to) == 0;
    }

    public static int generate(Board board, Side side, int from, int[] buffer, int n) {
        for (int[] ray : PieceTables.RAYS[from]) {
            for (int to : ray) {
                Piece target = board.pieceAt(to);
                if (target == null) {
                    buffer[n++] = Move.asBytes(from, to);
                    continue;
                }
                if (target.getSide() != side) {
                    buffer[n++] = Move.asBytes(from, to);
                }
                break;
            }
        }
        return n;
    }
}
