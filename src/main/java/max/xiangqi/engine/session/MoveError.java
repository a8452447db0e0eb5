package max.xiangqi.engine.session;

/** Why a submitted move was not played. */
public enum MoveError {
    INVALID_NOTATION,
    ILLEGAL_MOVE,
    NOT_YOUR_TURN,
    NO_ACTIVE_GAME,
    GAME_ALREADY_FINISHED,
    PIECE_NOT_FOUND,
    AI_UNAVAILABLE,
    REMOTE_LOOKUP_FAILURE
}
