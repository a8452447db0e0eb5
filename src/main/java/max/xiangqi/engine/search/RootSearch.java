package max.xiangqi.engine.search;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.search.transpositiontable.TranspositionTable;

import static max.xiangqi.engine.search.SearchConstants.INF;
import static max.xiangqi.engine.search.SearchConstants.TIMEOUT;

final class RootSearch {
    private RootSearch() {
    }

    /**
     * Full-window search of the root at {@code depth}, principal variation search over
     * the ordered root moves.
     * @return the best move and its score, or null when the search was stopped before
     * every root move was searched or there is no legal move
     */
    static SearchResult searchAtDepth(Game game, SearchContext ctx, int depth) {
        ctx.nodes = 0; // per-depth nodes
        if (TimeControl.aborted(ctx)) return null;

        final long zStart = game.zobristKey();
        final int ply = 0;
        final int[] moves = ctx.moveBuf[ply];
        int moveCount = MoveGenerator.generateMoves(game, moves);
        if (moveCount == 0) return null;

        int ttMove = ctx.tt != null ? ctx.tt.peekMove(zStart) : Move.NONE;
        MoveOrdering.orderMoves(game.board(), moves, moveCount, ctx.scoreBuf[ply], ctx, ply, ttMove);
        boolean truncated = ctx.cfg.rootMoveLimit > 0 && moveCount > ctx.cfg.rootMoveLimit;
        if (truncated) {
            moveCount = ctx.cfg.rootMoveLimit;
        }

        int bestMove = Move.NONE, bestScore = -INF;
        int alpha = -INF;
        final int beta = INF;
        for (int i = 0; i < moveCount; i++) {
            int mv = moves[i];
            game.playMove(mv);
            int score;
            if (i == 0) {
                score = -Negamax.search(game, ctx, depth - 1, 1, -beta, -alpha);
            } else {
                score = -Negamax.search(game, ctx, depth - 1, 1, -(alpha + 1), -alpha);
                if (score != TIMEOUT && score > alpha && score < beta) {
                    score = -Negamax.search(game, ctx, depth - 1, 1, -beta, -alpha);
                }
            }
            game.undoMove();
            if (score == TIMEOUT) return null; // timed out deeper

            if (score > bestScore) {
                bestScore = score;
                bestMove = mv;
            }
            if (bestScore > alpha) alpha = bestScore;
        }

        if (zStart != game.zobristKey()) {
            throw new IllegalStateException("Position mutated across search");
        }
        if (ctx.tt != null) {
            // Skipped root moves can only raise the true score
            byte flag = truncated ? TranspositionTable.TT_LOWER : TranspositionTable.TT_EXACT;
            ctx.tt.store(zStart, bestMove, depth, bestScore, flag, ply);
        }
        return new SearchResult(bestMove, bestScore, depth, ctx.nodes, ctx.elapsedMs(), SearchResult.Source.SEARCH);
    }
}
