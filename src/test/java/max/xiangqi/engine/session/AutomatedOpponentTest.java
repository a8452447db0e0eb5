package max.xiangqi.engine.session;

import max.xiangqi.engine.book.OpeningBook;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.search.Difficulty;
import max.xiangqi.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class AutomatedOpponentTest {
    private static final long HUMAN = 1L;
    private static final SessionConfig QUICK = new SessionConfig(Difficulty.EASY, Duration.ofSeconds(5));

    private static GameSession aiAsBlack(String fen, Side sideToMove) {
        return new GameSession("ai", HUMAN, GameSession.AI_PLAYER, 0L, QUICK, Clock.systemUTC(),
                FENUtils.getBoardFrom(fen), sideToMove);
    }

    @Test
    public void repliesToTheHumanMove() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            // Given
            GameSession session = new GameSession("ai", HUMAN, GameSession.AI_PLAYER, 0L, QUICK, Clock.systemUTC());
            assertTrue(session.submit(HUMAN, "炮二平五").success());

            // When
            MoveResult result = opponent.playTurn(session).get(30, TimeUnit.SECONDS);

            // Then
            assertTrue(result.success(), result::message);
            assertEquals(2, session.getHistory().size());
            assertEquals(Side.RED, session.getCurrentSide());
            assertTrue(session.isTurnOf(HUMAN));
        }
    }

    @Test
    public void waitsForItsTurn() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            GameSession session = new GameSession("ai", HUMAN, GameSession.AI_PLAYER, 0L, QUICK, Clock.systemUTC());

            MoveResult result = opponent.playTurn(session).get(5, TimeUnit.SECONDS);

            assertEquals(MoveError.NOT_YOUR_TURN, result.error());
            assertTrue(session.getHistory().isEmpty());
        }
    }

    @Test
    public void overlappingTurnRequestsPlayOnce() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            // Given
            GameSession session = new GameSession("ai", HUMAN, GameSession.AI_PLAYER, 0L, QUICK, Clock.systemUTC());
            assertTrue(session.submit(HUMAN, "炮二平五").success());

            // When: the turn is triggered twice before the first search returns
            CompletableFuture<MoveResult> first = opponent.playTurn(session);
            CompletableFuture<MoveResult> second = opponent.playTurn(session);
            MoveResult a = first.get(30, TimeUnit.SECONDS);
            MoveResult b = second.get(30, TimeUnit.SECONDS);

            // Then: one reply is played and the game goes on
            assertTrue(a.success() ^ b.success(), () -> a.message() + " / " + b.message());
            assertEquals(MoveError.NOT_YOUR_TURN, (a.success() ? b : a).error());
            assertEquals(GameStatus.PLAYING, session.getStatus());
            assertNull(session.getWinner());
            assertEquals(2, session.getHistory().size());
            assertTrue(session.isTurnOf(HUMAN));
        }
    }

    @Test
    public void searchOnAPassedTurnDoesNotForfeit() {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            // Given
            GameSession session = new GameSession("ai", HUMAN, GameSession.AI_PLAYER, 0L, QUICK, Clock.systemUTC());
            assertTrue(session.submit(HUMAN, "炮二平五").success());
            assertTrue(opponent.searchAndPlay(session, new AtomicBoolean(true), 5_000).success());

            // When: the same turn is searched again after the reply was committed
            MoveResult again = opponent.searchAndPlay(session, new AtomicBoolean(true), 5_000);

            // Then
            assertEquals(MoveError.NOT_YOUR_TURN, again.error());
            assertEquals(GameStatus.PLAYING, session.getStatus());
            assertEquals(2, session.getHistory().size());
        }
    }

    @Test
    public void finishedGameIsNotPlayed() {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            GameSession session = aiAsBlack("4k4/9/9/9/9/9/8P/9/9/3K4r", Side.BLACK);
            assertTrue(session.resign(HUMAN));

            MoveResult result = opponent.searchAndPlay(session, new AtomicBoolean(true), 5_000);

            assertEquals(MoveError.GAME_ALREADY_FINISHED, result.error());
            assertEquals(FinishReason.RESIGNATION, session.getFinishReason());
            assertEquals(Side.BLACK, session.getWinner());
        }
    }

    @Test
    public void takesAnExposedGeneral() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            // Given: the black chariot can take the red general along the back rank
            GameSession session = aiAsBlack("4k4/9/9/9/9/9/8P/9/9/3K4r", Side.BLACK);

            // When
            MoveResult result = opponent.playTurn(session).get(30, TimeUnit.SECONDS);

            // Then
            assertTrue(result.capturedGeneral());
            assertEquals(Side.BLACK, session.getWinner());
            assertEquals(FinishReason.GENERAL_CAPTURED, session.getFinishReason());
        }
    }

    @Test
    public void forfeitsWithoutALegalMove() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            GameSession session = aiAsBlack("3aka3/4a4/3a1a3/9/9/9/9/9/9/3K5", Side.BLACK);

            MoveResult result = opponent.playTurn(session).get(30, TimeUnit.SECONDS);

            assertEquals(MoveError.AI_UNAVAILABLE, result.error());
            assertEquals(GameStatus.FINISHED, session.getStatus());
            assertEquals(Side.RED, session.getWinner());
            assertEquals(FinishReason.NO_LEGAL_MOVE, session.getFinishReason());
        }
    }

    @Test
    public void stoppedSearchStillPlays() {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            GameSession session = aiAsBlack("r1bakab2/9/1cn3nc1/p1p1p3p/6p2/2P6/P3P1P1P/1C2C1N2/9/RNBAKAB1R", Side.BLACK);

            MoveResult result = opponent.searchAndPlay(session, new AtomicBoolean(true), 5_000);

            assertTrue(result.success(), result::message);
            assertEquals(Side.RED, session.getCurrentSide());
        }
    }

    @Test
    public void corruptSessionIsAborted() throws Exception {
        try (AutomatedOpponent opponent = new AutomatedOpponent(OpeningBook.NONE)) {
            // Given: no red general on the board
            GameSession session = aiAsBlack("4k4/9/9/9/9/9/9/9/9/R8", Side.BLACK);

            // When
            MoveResult result = opponent.playTurn(session).get(30, TimeUnit.SECONDS);

            // Then
            assertEquals(MoveError.AI_UNAVAILABLE, result.error());
            assertEquals(FinishReason.CORRUPTED, session.getFinishReason());
            assertNull(session.getWinner());
        }
    }
}
