package max.xiangqi.engine.session;

import max.xiangqi.engine.book.CloudOpeningBook;
import max.xiangqi.engine.book.OpeningBook;
import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.CorruptGameStateException;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.search.SearchConfig;
import max.xiangqi.engine.search.SearchFacade;
import max.xiangqi.engine.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plays the automated side of a session. Each turn is searched on a private copy of
 * the position, off the caller's thread, and stopped at the session's think time.
 * The chosen move goes through the session's normal move path. At most one turn per session
 * is in flight. The automated side forfeits when the search finds no move, or its move
 * is refused, on the position that was searched.
 */
public final class AutomatedOpponent implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatedOpponent.class);

    private final OpeningBook book;
    private final ExecutorService searchExecutor;
    private final ScheduledExecutorService deadlines;
    private final Set<String> thinking = ConcurrentHashMap.newKeySet();

    public AutomatedOpponent() {
        this(new CloudOpeningBook());
    }

    public AutomatedOpponent(OpeningBook book) {
        this(book, Executors.newFixedThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors() / 2),
                daemonThreads("xiangqi-ai-")));
    }

    public AutomatedOpponent(OpeningBook book, ExecutorService searchExecutor) {
        this.book = Objects.requireNonNull(book, "book");
        this.searchExecutor = Objects.requireNonNull(searchExecutor, "searchExecutor");
        this.deadlines = Executors.newSingleThreadScheduledExecutor(daemonThreads("xiangqi-ai-deadline-"));
    }

    /**
     * Searches and plays the automated side's move.
     * @return the move result; a failure when it is not the automated side's turn or
     * a turn for this session is already being searched
     */
    public CompletableFuture<MoveResult> playTurn(GameSession session) {
        if (!session.isTurnOf(GameSession.AI_PLAYER)) {
            return CompletableFuture.completedFuture(notItsTurn());
        }
        if (!thinking.add(session.getId())) {
            return CompletableFuture.completedFuture(
                    MoveResult.failure(MoveError.NOT_YOUR_TURN, "The automated side is already thinking"));
        }
        AtomicBoolean stop = new AtomicBoolean(false);
        long thinkMs = session.getConfig().aiThinkTime().toMillis();
        ScheduledFuture<?> deadline = deadlines.schedule(() -> stop.set(true), thinkMs, TimeUnit.MILLISECONDS);
        try {
            return CompletableFuture
                    .supplyAsync(() -> searchAndPlay(session, stop, thinkMs), searchExecutor)
                    .whenComplete((r, e) -> {
                        deadline.cancel(false);
                        thinking.remove(session.getId());
                    });
        } catch (RejectedExecutionException e) {
            deadline.cancel(false);
            thinking.remove(session.getId());
            throw e;
        }
    }

    // Setting stop ends the search early; it still answers with its best move so far
    MoveResult searchAndPlay(GameSession session, AtomicBoolean stop, long thinkMs) {
        try {
            return search(session, stop, thinkMs);
        } catch (CorruptGameStateException e) {
            LOG.error("Game {} has a corrupt state and is aborted", session.getId(), e);
            session.abandon(FinishReason.CORRUPTED);
            return MoveResult.failure(MoveError.AI_UNAVAILABLE, "The game was aborted: " + e.getMessage());
        }
    }

    private MoveResult search(GameSession session, AtomicBoolean stop, long thinkMs) {
        GameSession.SearchPosition position = session.searchPositionFor(GameSession.AI_PLAYER);
        if (position == null) {
            return staleTurn(session);
        }
        Game game = position.game();
        Side aiSide = game.sideToMove();
        SearchConfig cfg = SearchConfig.forDifficulty(session.getConfig().difficulty()).toBuilder()
                .maxThinkingTimeMs(thinkMs)
                .build();

        SearchResult result = new SearchFacade(cfg, book).findBestMove(game, stop);
        if (!result.hasMove()) {
            if (!session.forfeitAt(position.ply(), aiSide, FinishReason.NO_LEGAL_MOVE)) {
                return staleTurn(session);
            }
            LOG.info("Game {}: automated side {} has no move and loses", session.getId(), aiSide);
            return MoveResult.failure(MoveError.AI_UNAVAILABLE, "The automated side has no move");
        }

        Coordinate from = Move.from(result.move());
        Coordinate to = Move.to(result.move());
        MoveResult played = session.moveAt(position.ply(), from, to);
        if (!played.success()) {
            if (!session.forfeitAt(position.ply(), aiSide, FinishReason.NO_LEGAL_MOVE)) {
                LOG.debug("Game {}: automated move {} dropped, the game moved on ({})",
                        session.getId(), Move.toIccs(result.move()), played.message());
                return staleTurn(session);
            }
            LOG.warn("Game {}: automated move {} refused ({}), forfeiting",
                    session.getId(), Move.toIccs(result.move()), played.message());
            return MoveResult.failure(MoveError.AI_UNAVAILABLE, "The automated move was refused: " + played.message());
        }
        LOG.debug("Game {}: automated move {} ({})", session.getId(), played.notation(), result);
        return played;
    }

    private static MoveResult notItsTurn() {
        return MoveResult.failure(MoveError.NOT_YOUR_TURN, "It is not the automated side's turn");
    }

    private static MoveResult staleTurn(GameSession session) {
        return session.isPlaying() ? notItsTurn()
                : MoveResult.failure(MoveError.GAME_ALREADY_FINISHED, "The game is already over");
    }

    @Override
    public void close() {
        searchExecutor.shutdownNow();
        deadlines.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger idx = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + idx.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
