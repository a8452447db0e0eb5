package max.xiangqi.engine.session;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class SessionDirectoryTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    private final SessionDirectory directory = new SessionDirectory(DirectorySettings.defaults(), clock);

    @Test
    public void playersCanOnlyBeInOneRunningGame() {
        // Given
        GameSession first = directory.createGame(1L, 2L, 10L).orElseThrow();

        // Then
        assertTrue(first.getId().startsWith("game_"));
        assertTrue(directory.createGame(2L, 3L, 10L).isEmpty());
        assertTrue(directory.createGame(3L, 1L, 10L).isEmpty());
        assertTrue(directory.createGame(3L, 4L, 11L).isPresent());
        assertEquals(2, directory.size());

        // When the first game ends its players are free again
        assertTrue(first.resign(1L));
        assertTrue(directory.createGame(1L, 2L, 10L).isPresent());
    }

    @Test
    public void automatedOpponentIsNeverBusy() {
        assertTrue(directory.createGame(1L, GameSession.AI_PLAYER, 10L, SessionConfig.defaults()).isPresent());
        assertTrue(directory.createGame(2L, GameSession.AI_PLAYER, 10L, SessionConfig.defaults()).isPresent());
        assertEquals(2, directory.getAllActiveGames().size());
    }

    @Test
    public void lookups() {
        GameSession game = directory.createGame(1L, 2L, 10L).orElseThrow();
        directory.createGame(3L, 4L, 11L).orElseThrow();

        assertSame(game, directory.getGame(game.getId()).orElseThrow());
        assertTrue(directory.getGame("missing").isEmpty());
        assertSame(game, directory.getPlayerActiveGame(2L).orElseThrow());
        assertSame(game, directory.getPlayerTurnGame(1L).orElseThrow());
        assertTrue(directory.getPlayerTurnGame(2L).isEmpty());
        assertTrue(directory.arePlayersInGame(2L, 1L));
        assertFalse(directory.arePlayersInGame(1L, 3L));
        assertEquals(1, directory.getChatGames(10L).size());
        assertEquals(2, directory.getAllActiveGames().size());
    }

    @Test
    public void moveTextIsRoutedToThePlayersGame() {
        // Given
        GameSession game = directory.createGame(1L, 2L, 10L).orElseThrow();

        // Then
        assertEquals(MoveError.NO_ACTIVE_GAME, directory.submitMoveText(5L, "炮二平五").error());
        assertEquals(MoveError.NOT_YOUR_TURN, directory.submitMoveText(2L, "马8进7").error());
        assertTrue(directory.submitMoveText(1L, "炮二平五").success());
        assertEquals(MoveError.NOT_YOUR_TURN, directory.submitMoveText(1L, "马二进三").error());
        assertEquals(MoveError.INVALID_NOTATION, directory.submitMoveText(2L, "马九进七").error());
        assertTrue(directory.submitMoveText(2L, "马8进7").success());
        assertEquals(List.of("炮二平五", "马八进七"), game.getHistory());
    }

    @Test
    public void concurrentSubmissionsPlayOnce() throws Exception {
        // Given
        GameSession game = directory.createGame(1L, 2L, 10L).orElseThrow();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<MoveResult>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return directory.submitMoveText(1L, "炮二平五");
            }));
        }
        start.countDown();
        int played = 0;
        for (Future<MoveResult> future : futures) {
            MoveResult result = future.get(10, TimeUnit.SECONDS);
            if (result.success()) {
                played++;
            } else {
                assertEquals(MoveError.NOT_YOUR_TURN, result.error());
            }
        }
        executor.shutdown();

        // Then
        assertEquals(1, played);
        assertEquals(1, game.getHistory().size());
        assertEquals(Side.BLACK, game.getCurrentSide());
    }

    @Test
    public void endGameRemovesTheSession() {
        GameSession game = directory.createGame(1L, 2L, 10L).orElseThrow();

        assertTrue(directory.endGame(game.getId()));
        assertFalse(directory.endGame(game.getId()));
        assertEquals(FinishReason.ENDED, game.getFinishReason());
        assertEquals(0, directory.size());
    }

    @Test
    public void resignThroughTheDirectory() {
        GameSession game = directory.createGame(1L, 2L, 10L).orElseThrow();

        assertFalse(directory.resign("missing", 1L));
        assertFalse(directory.resign(game.getId(), 9L));
        assertTrue(directory.resign(game.getId(), 2L));
        assertEquals(Side.RED, game.getWinner());
        assertEquals(1, directory.cleanupFinishedGames());
        assertEquals(0, directory.size());
    }

    @Test
    public void invitesExpire() {
        // Given
        Invite invite = directory.addInvite(2L, 1L);

        // Then
        assertTrue(invite.id().startsWith("invite_"));
        assertEquals(clock.instant().plus(DirectorySettings.DEFAULT_INVITE_TTL), invite.expiresAt());
        assertTrue(directory.hasInvite(2L, 1L));
        assertFalse(directory.hasInvite(2L, 3L));
        assertEquals(0, directory.cleanupExpiredInvites());

        // When
        clock.advance(Duration.ofMinutes(5).plusSeconds(1));

        // Then
        assertTrue(directory.getInvite(2L).isEmpty());
        assertEquals(1, directory.cleanupExpiredInvites());
        assertFalse(directory.removeInvite(2L));
    }

    @Test
    public void newInviteReplacesThePreviousOne() {
        directory.addInvite(2L, 1L);
        directory.addInvite(2L, 3L);
        assertTrue(directory.hasInvite(2L, 3L));
        assertFalse(directory.hasInvite(2L, 1L));
        assertTrue(directory.removeInvite(2L));
        assertTrue(directory.getInvite(2L).isEmpty());
    }

    @Test
    public void idleGamesAreLostByTheSideToMove() {
        // Given
        GameSession idle = directory.createGame(1L, 2L, 10L).orElseThrow();
        GameSession active = directory.createGame(3L, 4L, 11L).orElseThrow();
        clock.advance(Duration.ofHours(12).plusMinutes(1));
        assertTrue(directory.submitMoveText(3L, "炮二平五").success());

        // When
        List<GameSession> timedOut = directory.checkTimeoutGames();

        // Then
        assertEquals(List.of(idle), timedOut);
        assertEquals(FinishReason.TIMEOUT, idle.getFinishReason());
        assertEquals(Side.BLACK, idle.getWinner());
        assertTrue(active.isPlaying());
        assertTrue(directory.checkTimeoutGames(Duration.ofHours(1)).isEmpty());
    }

    @Test
    public void corruptGameIsAbortedWithoutAffectingOthers() {
        // Given
        GameSession healthy = directory.createGame(1L, 2L, 10L).orElseThrow();
        GameSession corrupt = new GameSession("broken", 5L, 6L, 10L, SessionConfig.defaults(), clock,
                FENUtils.getBoardFrom("9/9/9/9/9/9/9/9/4R4/3K5"), Side.RED);

        // When
        MoveResult result = directory.guarded(corrupt, s -> s.move(Coordinate.of(8, 4), Coordinate.of(7, 4)));

        // Then
        assertEquals(MoveError.GAME_ALREADY_FINISHED, result.error());
        assertEquals(FinishReason.CORRUPTED, corrupt.getFinishReason());
        assertNull(corrupt.getWinner());
        assertTrue(healthy.isPlaying());
        assertTrue(directory.submitMoveText(1L, "炮二平五").success());
    }

    @Test
    public void resigningACorruptGameAbortsIt() {
        // Given: a registered game that lost its black general
        GameSession healthy = directory.createGame(1L, 2L, 10L).orElseThrow();
        GameSession corrupt = new GameSession("broken", 5L, 6L, 10L, SessionConfig.defaults(), clock,
                FENUtils.getBoardFrom("9/9/9/9/9/9/9/9/4R4/3K5"), Side.RED);
        directory.register(corrupt);

        // When
        boolean resigned = directory.resign("broken", 6L);

        // Then
        assertFalse(resigned);
        assertEquals(FinishReason.CORRUPTED, corrupt.getFinishReason());
        assertNull(corrupt.getWinner());
        assertTrue(healthy.isPlaying());
        assertTrue(directory.resign(healthy.getId(), 2L));
        assertEquals(Side.RED, healthy.getWinner());
    }
}
