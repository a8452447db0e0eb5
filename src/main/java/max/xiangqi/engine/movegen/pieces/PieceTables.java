package max.xiangqi.engine.movegen.pieces;

import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.utils.BoardUtils;

import java.util.Arrays;

final class PieceTables {
    // RAYS[square][direction] lists squares outward from square, nearest first
    static final int[][][] RAYS = new int[BoardUtils.SQUARES][4][];

    static {
        int[][] dirs = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            for (int d = 0; d < 4; d++) {
                int[] buf = new int[BoardUtils.ROWS];
                int n = 0;
                int r = BoardUtils.row(i) + dirs[d][0];
                int c = BoardUtils.col(i) + dirs[d][1];
                while (BoardUtils.isOnBoard(r, c)) {
                    buf[n++] = BoardUtils.index(r, c);
                    r += dirs[d][0];
                    c += dirs[d][1];
                }
                RAYS[i][d] = Arrays.copyOf(buf, n);
            }
        }
    }

    private PieceTables() {
    }

    static int[] targets(int from, int[][] deltas) {
        int[] out = new int[deltas.length];
        int n = 0;
        for (int[] d : deltas) {
            int r = BoardUtils.row(from) + d[0];
            int c = BoardUtils.col(from) + d[1];
            if (BoardUtils.isOnBoard(r, c)) {
                out[n++] = BoardUtils.index(r, c);
            }
        }
        return Arrays.copyOf(out, n);
    }

    // Midpoint of each on-board jump, aligned with targets()
    static int[] midpoints(int from, int[][] deltas) {
        int[] out = new int[deltas.length];
        int n = 0;
        for (int[] d : deltas) {
            int r = BoardUtils.row(from) + d[0];
            int c = BoardUtils.col(from) + d[1];
            if (BoardUtils.isOnBoard(r, c)) {
                out[n++] = BoardUtils.index(BoardUtils.row(from) + d[0] / 2, BoardUtils.col(from) + d[1] / 2);
            }
        }
        return Arrays.copyOf(out, n);
    }

    // Horse leg of each on-board jump, aligned with targets()
    static int[] legs(int from, int[][] deltas) {
        int[] out = new int[deltas.length];
        int n = 0;
        for (int[] d : deltas) {
            int r = BoardUtils.row(from) + d[0];
            int c = BoardUtils.col(from) + d[1];
            if (BoardUtils.isOnBoard(r, c)) {
                int legRow = Math.abs(d[0]) == 2 ? BoardUtils.row(from) + d[0] / 2 : BoardUtils.row(from);
                int legCol = Math.abs(d[1]) == 2 ? BoardUtils.col(from) + d[1] / 2 : BoardUtils.col(from);
                out[n++] = BoardUtils.index(legRow, legCol);
            }
        }
        return Arrays.copyOf(out, n);
    }

    /**
     * Occupied squares strictly between two squares on one line.
     * @return -1 when the squares do not share a row or a column
     */
    static int countBetween(Board board, int from, int to) {
        int fr = BoardUtils.row(from), fc = BoardUtils.col(from);
        int tr = BoardUtils.row(to), tc = BoardUtils.col(to);
        if (fr != tr && fc != tc) {
            return -1;
        }
        int dr = Integer.signum(tr - fr);
        int dc = Integer.signum(tc - fc);
        int count = 0;
        int r = fr + dr, c = fc + dc;
        while (r != tr || c != tc) {
            if (board.pieceAt(BoardUtils.index(r, c)) != null) count++;
            r += dr;
            c += dc;
        }
        return count;
    }
}
