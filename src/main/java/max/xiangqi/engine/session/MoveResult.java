package max.xiangqi.engine.session;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.PieceKind;

/**
 * Outcome of a move submission. Failures carry the error kind and a message,
 * successes the squares, the captured kind (null when none) and the notation.
 */
public record MoveResult(boolean success, MoveError error, String message,
                         Coordinate from, Coordinate to, PieceKind captured, String notation) {

    public static MoveResult played(Coordinate from, Coordinate to, PieceKind captured, String notation) {
        return new MoveResult(true, null, notation, from, to, captured, notation);
    }

    public static MoveResult failure(MoveError error, String message) {
        return new MoveResult(false, error, message, null, null, null, null);
    }

    public boolean capturedGeneral() {
        return captured == PieceKind.GENERAL;
    }
}
