package max.xiangqi.engine.session;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.CorruptGameStateException;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.BoardSnapshot;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardGenerator;
import max.xiangqi.engine.movegen.MoveValidator;
import max.xiangqi.engine.utils.notations.NotationCodec;
import max.xiangqi.engine.utils.notations.ParseResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One game between two participants. PLAYING until a general is captured, a player
 * resigns or the game is forfeited; FINISHED is terminal.
 * <p>
 * All operations take the session lock, so concurrent submissions are serialized.
 */
public final class GameSession {
    /** Player id standing for the automated opponent. */
    public static final long AI_PLAYER = -1L;

    private final String id;
    private final long redPlayer;
    private final long blackPlayer;
    private final long chatId;
    private final SessionConfig config;
    private final Clock clock;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private final Board board;
    private Side currentSide;
    private GameStatus status = GameStatus.PLAYING;
    private final List<String> history = new ArrayList<>();
    private Coordinate lastMoveFrom;
    private Coordinate lastMoveTo;
    private Side winner;
    private FinishReason finishReason;
    private Instant lastActiveTime;

    public GameSession(String id, long redPlayer, long blackPlayer, long chatId, SessionConfig config, Clock clock) {
        this(id, redPlayer, blackPlayer, chatId, config, clock, BoardGenerator.newStandardBoard(), Side.RED);
    }

    /** Session starting from an arbitrary position, {@code board} is taken over. */
    public GameSession(String id, long redPlayer, long blackPlayer, long chatId, SessionConfig config, Clock clock,
                       Board board, Side sideToMove) {
        this.id = Objects.requireNonNull(id, "id");
        this.redPlayer = redPlayer;
        this.blackPlayer = blackPlayer;
        this.chatId = chatId;
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.board = Objects.requireNonNull(board, "board");
        this.currentSide = Objects.requireNonNull(sideToMove, "sideToMove");
        this.createdAt = clock.instant();
        this.lastActiveTime = createdAt;
    }

    public MoveResult move(Coordinate from, Coordinate to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) {
                return MoveResult.failure(MoveError.GAME_ALREADY_FINISHED, "The game is already over");
            }
            requireGenerals();

            Piece piece = board.getPiece(from);
            if (piece == null) {
                return MoveResult.failure(MoveError.PIECE_NOT_FOUND, "No piece at " + from);
            }
            if (piece.getSide() != currentSide) {
                return MoveResult.failure(MoveError.NOT_YOUR_TURN, "It is " + currentSide.displayName + "'s turn");
            }
            if (!MoveValidator.isValidMove(board, from, to)) {
                return MoveResult.failure(MoveError.ILLEGAL_MOVE,
                        piece.getDisplayName() + " cannot move from " + from + " to " + to);
            }

            // Notation describes the position before the move
            String notation = NotationCodec.generate(board, from, to);
            Piece captured = board.movePiece(from, to);
            if (board.areGeneralsFacing()) {
                board.unmovePiece(from.index, to.index, captured);
                return MoveResult.failure(MoveError.ILLEGAL_MOVE, "The move would leave the generals facing each other");
            }

            history.add(notation);
            lastMoveFrom = from;
            lastMoveTo = to;
            lastActiveTime = clock.instant();
            Side mover = currentSide;
            currentSide = currentSide.opposite();

            PieceKind capturedKind = captured == null ? null : captured.getKind();
            if (capturedKind == PieceKind.GENERAL) {
                finish(mover, FinishReason.GENERAL_CAPTURED);
            }
            return MoveResult.played(from, to, capturedKind, notation);
        } finally {
            lock.unlock();
        }
    }

    /** Plays the move only while the game is still at {@code ply} moves. */
    MoveResult moveAt(int ply, Coordinate from, Coordinate to) {
        lock.lock();
        try {
            if (status == GameStatus.PLAYING && history.size() != ply) {
                return MoveResult.failure(MoveError.NOT_YOUR_TURN, "The position changed since move " + ply);
            }
            return move(from, to);
        } finally {
            lock.unlock();
        }
    }

    /** Parses Chinese move text for the side to move and plays it. */
    public MoveResult moveByNotation(String text) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) {
                return MoveResult.failure(MoveError.GAME_ALREADY_FINISHED, "The game is already over");
            }
            ParseResult parsed = NotationCodec.parse(text, board, currentSide);
            if (!parsed.isSuccess()) {
                return MoveResult.failure(MoveError.INVALID_NOTATION,
                        parsed.message() + " (" + parsed.failedToken() + ")");
            }
            return move(parsed.from(), parsed.to());
        } finally {
            lock.unlock();
        }
    }

    /** Plays {@code text} for {@code playerId}, refused unless that player holds the side to move. */
    public MoveResult submit(long playerId, String text) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) {
                return MoveResult.failure(MoveError.GAME_ALREADY_FINISHED, "The game is already over");
            }
            if (playerOf(currentSide) != playerId) {
                return MoveResult.failure(MoveError.NOT_YOUR_TURN, "It is " + currentSide.displayName + "'s turn");
            }
            return moveByNotation(text);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return false when the game is over or {@code playerId} does not take part;
     * otherwise the other participant wins
     */
    public boolean resign(long playerId) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) return false;
            Side side = getPlayerSide(playerId);
            if (side == null) return false;
            requireGenerals();
            finish(side.opposite(), FinishReason.RESIGNATION);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** {@code loser} loses without a move being played. */
    public boolean forfeit(Side loser, FinishReason reason) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) return false;
            finish(loser.opposite(), reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forfeits {@code loser} only while the game is still at {@code ply} moves, so a
     * decision taken on an older position cannot end a game that has moved on.
     */
    boolean forfeitAt(int ply, Side loser, FinishReason reason) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING || history.size() != ply) return false;
            finish(loser.opposite(), reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Finishes without a winner. */
    public boolean abandon(FinishReason reason) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING) return false;
            finish(null, reason);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void finish(Side winningSide, FinishReason reason) {
        status = GameStatus.FINISHED;
        winner = winningSide;
        finishReason = reason;
    }

    private void requireGenerals() {
        for (Side side : Side.VALUES) {
            if (board.getGeneral(side) == null) {
                throw new CorruptGameStateException("Game " + id + " is running without a " + side + " general");
            }
        }
    }

    /** Independent search position for the side to move. */
    public Game toSearchGame() {
        lock.lock();
        try {
            return new Game(board.copy(), currentSide);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Search position taken together with the move count it was copied at, or null when
     * the game is over or {@code playerId} does not hold the side to move.
     */
    SearchPosition searchPositionFor(long playerId) {
        lock.lock();
        try {
            if (status != GameStatus.PLAYING || playerOf(currentSide) != playerId) return null;
            return new SearchPosition(new Game(board.copy(), currentSide), history.size());
        } finally {
            lock.unlock();
        }
    }

    record SearchPosition(Game game, int ply) {
    }

    public BoardSnapshot snapshot() {
        lock.lock();
        try {
            return board.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public String statusText() {
        lock.lock();
        try {
            if (status == GameStatus.FINISHED) {
                return winner == null ? "Game over, no winner" : "Game over, " + winner.displayName + " wins";
            }
            return "Game in progress, " + currentSide.displayName + " to move";
        } finally {
            lock.unlock();
        }
    }

    public Side getPlayerSide(long playerId) {
        if (playerId == redPlayer) return Side.RED;
        if (playerId == blackPlayer) return Side.BLACK;
        return null;
    }

    public long playerOf(Side side) {
        return side == Side.RED ? redPlayer : blackPlayer;
    }

    public boolean isParticipant(long playerId) {
        return playerId == redPlayer || playerId == blackPlayer;
    }

    public boolean isPlaying() {
        return getStatus() == GameStatus.PLAYING;
    }

    /** True while playing and {@code playerId} holds the side to move. */
    public boolean isTurnOf(long playerId) {
        lock.lock();
        try {
            return status == GameStatus.PLAYING && playerOf(currentSide) == playerId;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasAiOpponent() {
        return redPlayer == AI_PLAYER || blackPlayer == AI_PLAYER;
    }

    public String getId() {
        return id;
    }

    public long getRedPlayer() {
        return redPlayer;
    }

    public long getBlackPlayer() {
        return blackPlayer;
    }

    public long getChatId() {
        return chatId;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public GameStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public Side getCurrentSide() {
        lock.lock();
        try {
            return currentSide;
        } finally {
            lock.unlock();
        }
    }

    /** Number of moves committed so far. */
    public int moveCount() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    public List<String> getHistory() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(history));
        } finally {
            lock.unlock();
        }
    }

    public Coordinate getLastMoveFrom() {
        lock.lock();
        try {
            return lastMoveFrom;
        } finally {
            lock.unlock();
        }
    }

    public Coordinate getLastMoveTo() {
        lock.lock();
        try {
            return lastMoveTo;
        } finally {
            lock.unlock();
        }
    }

    public Side getWinner() {
        lock.lock();
        try {
            return winner;
        } finally {
            lock.unlock();
        }
    }

    public FinishReason getFinishReason() {
        lock.lock();
        try {
            return finishReason;
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastActiveTime() {
        lock.lock();
        try {
            return lastActiveTime;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "GameSession[" + id + " red=" + redPlayer + " black=" + blackPlayer + " " + getStatus() + "]";
    }
}
