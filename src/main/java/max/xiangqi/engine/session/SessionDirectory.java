package max.xiangqi.engine.session;

import max.xiangqi.engine.common.CorruptGameStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * In-memory registry of game sessions (by id) and pending invites (by invited player).
 * One instance is created at startup and handed to whoever routes player commands.
 */
public final class SessionDirectory {
    private static final Logger LOG = LoggerFactory.getLogger(SessionDirectory.class);

    private final Map<String, GameSession> games = new ConcurrentHashMap<>();
    private final Map<Long, Invite> invites = new ConcurrentHashMap<>();
    // Serializes the busy-check and the registration of a new game
    private final Object createLock = new Object();
    private final DirectorySettings settings;
    private final Clock clock;

    public SessionDirectory() {
        this(DirectorySettings.defaults(), Clock.systemUTC());
    }

    public SessionDirectory(DirectorySettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /* =========================
     * Games
     * ========================= */

    public Optional<GameSession> createGame(long redPlayer, long blackPlayer, long chatId) {
        return createGame(redPlayer, blackPlayer, chatId, SessionConfig.defaults());
    }

    /**
     * Registers a new game from the standard position.
     * @return empty when either human participant already plays an unfinished game
     */
    public Optional<GameSession> createGame(long redPlayer, long blackPlayer, long chatId, SessionConfig config) {
        synchronized (createLock) {
            if (isBusy(redPlayer) || isBusy(blackPlayer)) {
                return Optional.empty();
            }
            GameSession session = new GameSession(newId("game"), redPlayer, blackPlayer, chatId, config, clock);
            register(session);
            LOG.info("Game {} created: red={} black={} chat={} difficulty={}",
                    session.getId(), redPlayer, blackPlayer, chatId, config.difficulty());
            return Optional.of(session);
        }
    }

    void register(GameSession session) {
        games.put(session.getId(), session);
    }

    private boolean isBusy(long playerId) {
        return playerId != GameSession.AI_PLAYER && getPlayerActiveGame(playerId).isPresent();
    }

    public Optional<GameSession> getGame(String gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    public Optional<GameSession> getPlayerActiveGame(long playerId) {
        return games.values().stream()
                .filter(g -> g.isParticipant(playerId) && g.isPlaying())
                .findFirst();
    }

    /** The game in which it is {@code playerId}'s turn, used to route an incoming move. */
    public Optional<GameSession> getPlayerTurnGame(long playerId) {
        return games.values().stream()
                .filter(g -> g.isTurnOf(playerId))
                .findFirst();
    }

    public boolean arePlayersInGame(long playerA, long playerB) {
        return games.values().stream()
                .anyMatch(g -> g.isPlaying()
                        && ((g.getRedPlayer() == playerA && g.getBlackPlayer() == playerB)
                        || (g.getRedPlayer() == playerB && g.getBlackPlayer() == playerA)));
    }

    public List<GameSession> getAllActiveGames() {
        return games.values().stream().filter(GameSession::isPlaying).toList();
    }

    public List<GameSession> getChatGames(long chatId) {
        return games.values().stream().filter(g -> g.getChatId() == chatId).toList();
    }

    /** Finishes the game if still running and removes it. */
    public boolean endGame(String gameId) {
        GameSession session = games.remove(gameId);
        if (session == null) {
            return false;
        }
        session.abandon(FinishReason.ENDED);
        LOG.info("Game {} ended and removed", gameId);
        return true;
    }

    /* =========================
     * Player commands
     * ========================= */

    /** Plays {@code text} in the game where it is {@code playerId}'s turn. */
    public MoveResult submitMoveText(long playerId, String text) {
        Optional<GameSession> turnGame = getPlayerTurnGame(playerId);
        if (turnGame.isEmpty()) {
            return getPlayerActiveGame(playerId).isPresent()
                    ? MoveResult.failure(MoveError.NOT_YOUR_TURN, "It is not your turn")
                    : MoveResult.failure(MoveError.NO_ACTIVE_GAME, "You are not playing any game");
        }
        GameSession session = turnGame.get();
        return guarded(session, s -> {
            MoveResult result = s.submit(playerId, text);
            if (!result.success()) {
                LOG.debug("Game {}: move '{}' by {} rejected: {}", s.getId(), text, playerId, result.message());
            } else if (!s.isPlaying()) {
                LOG.info("Game {} finished: {} wins ({})", s.getId(), s.getWinner(), s.getFinishReason());
            }
            return result;
        });
    }

    public boolean resign(String gameId, long playerId) {
        GameSession session = games.get(gameId);
        if (session == null) {
            return false;
        }
        boolean resigned = guarded(session, s -> s.resign(playerId), false);
        if (resigned) {
            LOG.info("Game {}: player {} resigned, {} wins", gameId, playerId, session.getWinner());
        }
        return resigned;
    }

    /**
     * Runs an operation on one session. A corrupt session is finished without a winner,
     * the others keep running.
     */
    MoveResult guarded(GameSession session, Function<GameSession, MoveResult> operation) {
        try {
            return operation.apply(session);
        } catch (CorruptGameStateException e) {
            abort(session, e);
            return MoveResult.failure(MoveError.GAME_ALREADY_FINISHED, "The game was aborted: " + e.getMessage());
        }
    }

    <T> T guarded(GameSession session, Function<GameSession, T> operation, T whenCorrupt) {
        try {
            return operation.apply(session);
        } catch (CorruptGameStateException e) {
            abort(session, e);
            return whenCorrupt;
        }
    }

    private static void abort(GameSession session, CorruptGameStateException e) {
        LOG.error("Game {} has a corrupt state and is aborted", session.getId(), e);
        session.abandon(FinishReason.CORRUPTED);
    }

    /* =========================
     * Invites
     * ========================= */

    /** Replaces any pending invite for {@code targetId}. */
    public Invite addInvite(long targetId, long inviterId) {
        Invite invite = new Invite(newId("invite"), inviterId, targetId, clock.instant().plus(settings.inviteTtl()));
        invites.put(targetId, invite);
        return invite;
    }

    public Optional<Invite> getInvite(long targetId) {
        Invite invite = invites.get(targetId);
        if (invite == null || invite.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(invite);
    }

    public boolean hasInvite(long targetId, long inviterId) {
        return getInvite(targetId).map(i -> i.inviterId() == inviterId).orElse(false);
    }

    public boolean removeInvite(long targetId) {
        return invites.remove(targetId) != null;
    }

    /* =========================
     * Sweeps
     * ========================= */

    /** @return the number of invites removed */
    public int cleanupExpiredInvites() {
        Instant now = clock.instant();
        int before = invites.size();
        invites.values().removeIf(i -> i.isExpired(now));
        int removed = before - invites.size();
        if (removed > 0) {
            LOG.info("Removed {} expired invites", removed);
        }
        return removed;
    }

    /** @return the number of finished games removed */
    public int cleanupFinishedGames() {
        int before = games.size();
        games.values().removeIf(g -> !g.isPlaying());
        int removed = before - games.size();
        if (removed > 0) {
            LOG.info("Removed {} finished games", removed);
        }
        return removed;
    }

    public List<GameSession> checkTimeoutGames() {
        return checkTimeoutGames(settings.idleTimeout());
    }

    /** Games idle for longer than {@code idle} are lost by the side to move. */
    public List<GameSession> checkTimeoutGames(Duration idle) {
        Instant now = clock.instant();
        List<GameSession> timedOut = new ArrayList<>();
        for (GameSession session : games.values()) {
            if (session.isPlaying()
                    && Duration.between(session.getLastActiveTime(), now).compareTo(idle) > 0
                    && session.forfeit(session.getCurrentSide(), FinishReason.TIMEOUT)) {
                LOG.info("Game {} timed out, {} wins", session.getId(), session.getWinner());
                timedOut.add(session);
            }
        }
        return timedOut;
    }

    public int size() {
        return games.size();
    }

    private String newId(String prefix) {
        return prefix + "_" + clock.millis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
