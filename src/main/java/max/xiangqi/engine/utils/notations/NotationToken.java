package max.xiangqi.engine.utils.notations;

/** The part of a move text that could not be resolved. */
public enum NotationToken {
    FORMAT,
    PIECE_GLYPH,
    POSITION_DESCRIPTOR,
    ACTION_GLYPH,
    MAGNITUDE
}
