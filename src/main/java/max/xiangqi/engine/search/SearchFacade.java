package max.xiangqi.engine.search;

import max.xiangqi.engine.book.OpeningBook;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of the move search: book, then phase shortcuts, then iterative deepening.
 * Not thread-safe; the game passed in is searched in place and restored.
 */
public final class SearchFacade {
    private static final Logger LOG = LoggerFactory.getLogger(SearchFacade.class);

    private final SearchContext ctx;
    private final OpeningBook book;
    private final Random random;

    public SearchFacade(SearchConfig cfg) {
        this(cfg, OpeningBook.NONE);
    }

    public SearchFacade(SearchConfig cfg, OpeningBook book) {
        this(cfg, book, new Random());
    }

    public SearchFacade(SearchConfig cfg, OpeningBook book, Random random) {
        this.ctx = new SearchContext(Objects.requireNonNull(cfg, "cfg"));
        this.book = Objects.requireNonNull(book, "book");
        this.random = Objects.requireNonNull(random, "random");
    }

    public void init() {
        if (ctx.tt != null) ctx.tt.clear();
    }

    public SearchConfig config() {
        return ctx.cfg;
    }

    public SearchResult findBestMove(Game game) {
        return findBestMove(game, new AtomicBoolean(false));
    }

    /**
     * @return the chosen move, or a result without move when the side to move has
     * no general or no legal move
     */
    public SearchResult findBestMove(Game game, AtomicBoolean stop) {
        int[] moves = new int[MoveGenerator.MAX_MOVES];
        int n = game.hasGeneral(game.sideToMove()) ? MoveGenerator.generateMoves(game, moves) : 0;
        if (n == 0) {
            LOG.info("{} has no legal move", game.sideToMove());
            return SearchResult.none();
        }

        if (ctx.cfg.useCloudBook && book.isAvailable()) {
            Optional<Integer> bookMove = book.pickMove(game);
            if (bookMove.isPresent()) {
                return new SearchResult(bookMove.get(), 0, 0, 0, 0, SearchResult.Source.BOOK);
            }
        }

        if (ctx.cfg.usePhaseHeuristics) {
            int move = PhaseHeuristics.pick(game.board(), game.sideToMove(), moves, n);
            if (move != Move.NONE) {
                LOG.debug("Phase heuristic move {}", Move.toIccs(move));
                return new SearchResult(move, 0, 0, 0, 0, SearchResult.Source.HEURISTIC);
            }
        }

        int fallback = RandomSearch.pickNextMove(game, random);
        ctx.newSearch(stop, ctx.cfg.maxThinkingTimeMs);
        SearchResult result = IterativeDeepening.run(game, ctx, fallback);
        if (ctx.tt != null && LOG.isDebugEnabled()) {
            LOG.debug("TT probes {} hits {} stores {}", ctx.tt.probes(), ctx.tt.hits(), ctx.tt.stores());
        }
        return result;
    }
}
