package max.xiangqi.engine.search;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class IterativeDeepening {
    private static final Logger LOG = LoggerFactory.getLogger(IterativeDeepening.class);

    private IterativeDeepening() {
    }

    /**
     * Searches depth 1, 2, ... up to the configured maximum and keeps the last
     * completed depth's answer. {@code fallbackMove} is returned when not even
     * depth 1 completes.
     */
    static SearchResult run(Game game, SearchContext ctx, int fallbackMove) {
        SearchResult last = null;
        for (ctx.currentDepth = 1; ctx.currentDepth <= ctx.cfg.maxDepth; ctx.currentDepth++) {
            SearchResult r = RootSearch.searchAtDepth(game, ctx, ctx.currentDepth);
            if (r == null) break;
            last = r;
            if (LOG.isDebugEnabled()) {
                LOG.debug("depth {} best {} score {} nodes {} ({} ms)",
                        r.depth(), Move.toIccs(r.move()), r.score(), r.nodes(), r.timeMs());
            }
            if (SearchConstants.isMateScore(r.score())) break;
        }

        if (ctx.timedOut) {
            LOG.info("Search stopped after {} nodes in {} ms, keeping depth {}",
                    ctx.totalNodes, ctx.elapsedMs(), last == null ? 0 : last.depth());
        }
        if (last == null) {
            LOG.info("No depth completed, playing fallback move {}", Move.toIccs(fallbackMove));
            return new SearchResult(fallbackMove, 0, 0, ctx.totalNodes, ctx.elapsedMs(), SearchResult.Source.FALLBACK);
        }
        return new SearchResult(last.move(), last.score(), last.depth(), ctx.totalNodes, ctx.elapsedMs(), last.source());
    }
}
