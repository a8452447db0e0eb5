package max.xiangqi.engine.search;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;

import static max.xiangqi.engine.search.SearchConstants.TIMEOUT;

/**
 * Capture-only search below the horizon. Fail-soft, stand pat as the floor.
 */
final class Quiescence {
    private Quiescence() {
    }

    static int search(Game game, SearchContext ctx, int ply, int qDepth, int alpha, int beta) {
        ctx.nodes++;
        ctx.totalNodes++;
        ctx.qNodes++;
        if (TimeControl.aborted(ctx)) return TIMEOUT;

        if (!game.hasGeneral(game.sideToMove())) return Negamax.lossScore(ply);

        final int[] moves = ctx.moveBuf[ply];
        int n = MoveGenerator.generateMoves(game, moves);
        if (n == 0) return Negamax.lossScore(ply);

        final Board board = game.board();
        int standPat = ctx.evaluator.evaluate(board, game.sideToMove());
        if (qDepth >= ctx.cfg.quiescenceMaxDepth) return standPat;
        if (standPat >= beta) return standPat;
        if (standPat > alpha) alpha = standPat;

        // Keep captures only
        int captures = 0;
        for (int i = 0; i < n; i++) {
            if (board.pieceAt(Move.getEndPosition(moves[i])) != null) {
                moves[captures++] = moves[i];
            }
        }
        MoveOrdering.orderCaptures(board, moves, captures, ctx.scoreBuf[ply]);

        int best = standPat;
        for (int i = 0; i < captures; i++) {
            game.playMove(moves[i]);
            int score = -search(game, ctx, ply + 1, qDepth + 1, -beta, -alpha);
            game.undoMove();
            if (score == TIMEOUT) return TIMEOUT;

            if (score > best) best = score;
            if (score > alpha) alpha = score;
            if (alpha >= beta) break;
        }
        return best;
    }
}
