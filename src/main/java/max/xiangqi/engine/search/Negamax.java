package max.xiangqi.engine.search;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.search.transpositiontable.TranspositionTable;

import static max.xiangqi.engine.search.SearchConstants.MATE_VALUE;
import static max.xiangqi.engine.search.SearchConstants.MAX_PLY;
import static max.xiangqi.engine.search.SearchConstants.TIMEOUT;

final class Negamax {
    private Negamax() {
    }

    static int search(Game game, SearchContext ctx, int depth, int ply, int alpha, int beta) {
        return search(game, ctx, depth, ply, alpha, beta, true);
    }

    static int search(Game game, SearchContext ctx, int depth, int ply,
                      int alpha, int beta, boolean allowNull) {
        ctx.nodes++;
        ctx.totalNodes++;
        if (TimeControl.aborted(ctx)) return TIMEOUT;

        if (!game.hasGeneral(game.sideToMove())) return lossScore(ply);

        if (depth <= 0) {
            if (ctx.cfg.useQuiescence) {
                return Quiescence.search(game, ctx, ply, 0, alpha, beta);
            }
            if (MoveGenerator.generateMoves(game, ctx.moveBuf[ply]) == 0) return lossScore(ply);
            return ctx.evaluator.evaluate(game.board(), game.sideToMove());
        }

        final long key = game.zobristKey();
        final int alphaOrig = alpha;
        int ttMove = 0;

        // TT bounds
        if (ctx.tt != null) {
            TranspositionTable.Hit hit = ctx.ttHit;
            if (ctx.tt.probe(key, ply, hit)) {
                ttMove = hit.move;
                if (hit.depth >= depth) {
                    switch (hit.flag) {
                        case TranspositionTable.TT_EXACT -> { return hit.score; }
                        case TranspositionTable.TT_LOWER -> alpha = Math.max(alpha, hit.score);
                        case TranspositionTable.TT_UPPER -> beta = Math.min(beta, hit.score);
                        default -> { }
                    }
                    if (alpha >= beta) return hit.score;
                }
            }
        }

        // Null move pruning
        if (ctx.cfg.useNullMove && allowNull && depth >= ctx.cfg.nullMinDepth && !game.inCheck()) {
            game.playNullMove();
            int score = -search(game, ctx, depth - 1 - ctx.cfg.nullReduction, ply + 1, -beta, -beta + 1, false);
            game.undoNullMove();
            if (score == TIMEOUT) return TIMEOUT;
            if (score >= beta) {
                return score >= MATE_VALUE - MAX_PLY ? beta : score;
            }
        }

        final int[] moves = ctx.moveBuf[ply];
        final int n = MoveGenerator.generateMoves(game, moves);
        if (n == 0) return lossScore(ply);

        MoveOrdering.orderMoves(game.board(), moves, n, ctx.scoreBuf[ply], ctx, ply, ttMove);

        int bestScore = -SearchConstants.INF;
        int bestMove = 0;
        for (int i = 0; i < n; i++) {
            int move = moves[i];
            boolean capture = MoveOrdering.isCapture(game.board(), move);
            game.playMove(move);
            int score = -search(game, ctx, depth - 1, ply + 1, -beta, -alpha, true);
            game.undoMove();
            if (score == TIMEOUT) return TIMEOUT;

            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (score > alpha) alpha = score;
            if (alpha >= beta) {
                if (!capture) MoveOrdering.recordCutoff(ctx, move, depth, ply);
                break;
            }
        }

        if (ctx.tt != null) {
            byte flag = bestScore <= alphaOrig ? TranspositionTable.TT_UPPER
                    : bestScore >= beta ? TranspositionTable.TT_LOWER
                    : TranspositionTable.TT_EXACT;
            ctx.tt.store(key, bestMove, depth, bestScore, flag, ply);
        }
        return bestScore;
    }

    // Faster losses score lower
    static int lossScore(int ply) {
        return -(MATE_VALUE - ply);
    }
}
