package max.xiangqi.engine.session;

public enum FinishReason {
    GENERAL_CAPTURED,
    RESIGNATION,
    // The side to move had no legal move, or the automated side could not produce one
    NO_LEGAL_MOVE,
    TIMEOUT,
    CORRUPTED,
    // Ended from outside, without a winner
    ENDED
}
