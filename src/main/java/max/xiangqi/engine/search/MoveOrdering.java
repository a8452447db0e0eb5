package max.xiangqi.engine.search;

import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.search.evaluator.PieceValues;

/**
 * Move-ordering helpers. Everything is static and allocation-free.
 */
final class MoveOrdering {
    static final int CAPTURE_BASE = 10_000;
    static final int KILLER_1 = 9_000;
    static final int KILLER_2 = 8_000;

    private MoveOrdering() {}

    /**
     * Captures first by victim value, then the two killers of this ply, every move
     * biased by its history score. The TT move, when present, goes first.
     */
    static void orderMoves(Board board, int[] moves, int n, int[] scores, SearchContext ctx, int ply, int ttMove) {
        int[] killers = ply < ctx.killer.length ? ctx.killer[ply] : null;
        for (int i = 0; i < n; i++) {
            int m = moves[i];
            int score = 0;
            Piece victim = board.pieceAt(Move.getEndPosition(m));
            if (victim != null) {
                score = CAPTURE_BASE + PieceValues.of(victim.getKind());
            } else if (killers != null) {
                if (m == killers[0]) score = KILLER_1;
                else if (m == killers[1]) score = KILLER_2;
            }
            score += ctx.history[historyIndex(m)];
            scores[i] = score;
        }
        insertionSort(moves, scores, n);
        moveTTToFront(ttMove, moves, n);
    }

    /** Captures only, most valuable victim first. */
    static void orderCaptures(Board board, int[] moves, int n, int[] scores) {
        for (int i = 0; i < n; i++) {
            Piece victim = board.pieceAt(Move.getEndPosition(moves[i]));
            scores[i] = victim == null ? 0 : PieceValues.of(victim.getKind());
        }
        insertionSort(moves, scores, n);
    }

    /** If ttMove is in the list, swap it to index 0. */
    static void moveTTToFront(int ttMove, int[] moves, int n) {
        if (ttMove == Move.NONE) return;
        for (int i = 0; i < n; i++) {
            if (moves[i] == ttMove) {
                if (i != 0) {
                    int t = moves[0]; moves[0] = moves[i]; moves[i] = t;
                }
                return;
            }
        }
    }

    static boolean isCapture(Board board, int move) {
        return board.pieceAt(Move.getEndPosition(move)) != null;
    }

    /** Records a quiet move that caused a beta cutoff. */
    static void recordCutoff(SearchContext ctx, int move, int depth, int ply) {
        if (ply < ctx.killer.length) {
            int[] k = ctx.killer[ply];
            if (k[0] != move) {
                k[1] = k[0];
                k[0] = move;
            }
        }
        ctx.history[historyIndex(move)] += depth * depth;
    }

    static int historyIndex(int move) {
        return Move.getStartPosition(move) * BoardUtils.SQUARES + Move.getEndPosition(move);
    }

    // Descending, stable
    private static void insertionSort(int[] moves, int[] scores, int n) {
        for (int i = 1; i < n; i++) {
            int m = moves[i], s = scores[i], j = i - 1;
            while (j >= 0 && scores[j] < s) {
                moves[j + 1] = moves[j];
                scores[j + 1] = scores[j];
                j--;
            }
            moves[j + 1] = m;
            scores[j + 1] = s;
        }
    }
}
