package max.xiangqi.engine.movegen;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.movegen.pieces.Advisor;
import max.xiangqi.engine.movegen.pieces.Cannon;
import max.xiangqi.engine.movegen.pieces.Chariot;
import max.xiangqi.engine.movegen.pieces.Elephant;
import max.xiangqi.engine.movegen.pieces.General;
import max.xiangqi.engine.movegen.pieces.Horse;
import max.xiangqi.engine.movegen.pieces.Soldier;

/**
 * Geometric legality of a single move: piece movement rules, blocking squares and
 * same-side captures. Whether the move exposes the generals to each other is left to callers.
 */
public final class MoveValidator {
    private MoveValidator() {
    }

    public static boolean isValidMove(Board board, Coordinate from, Coordinate to) {
        if (from == null || to == null) {
            return false;
        }
        return isValidMove(board, from.index, to.index);
    }

    public static boolean isValidMove(Board board, int from, int to) {
        if (from == to) {
            return false;
        }
        Piece mover = board.pieceAt(from);
        if (mover == null) {
            return false;
        }
        Piece target = board.pieceAt(to);
        if (target != null && target.getSide() == mover.getSide()) {
            return false;
        }
        return followsPieceRule(board, mover, from, to);
    }

    /**
     * True when the piece on {@code from} guards the friendly piece standing on {@code to},
     * i.e. it could recapture there.
     */
    public static boolean defends(Board board, int from, int to) {
        if (from == to) {
            return false;
        }
        Piece mover = board.pieceAt(from);
        Piece target = board.pieceAt(to);
        if (mover == null || target == null || target.getSide() != mover.getSide()) {
            return false;
        }
        return followsPieceRule(board, mover, from, to);
    }

    private static boolean followsPieceRule(Board board, Piece mover, int from, int to) {
        return switch (mover.getKind()) {
            case GENERAL -> General.isValidMove(mover.getSide(), from, to);
            case ADVISOR -> Advisor.isValidMove(mover.getSide(), from, to);
            case ELEPHANT -> Elephant.isValidMove(board, mover.getSide(), from, to);
            case HORSE -> Horse.isValidMove(board, from, to);
            case CHARIOT -> Chariot.isValidMove(board, from, to);
            case CANNON -> Cannon.isValidMove(board, from, to);
            case SOLDIER -> Soldier.isValidMove(mover.getSide(), from, to);
        };
    }
}
