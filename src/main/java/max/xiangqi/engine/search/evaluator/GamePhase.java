package max.xiangqi.engine.search.evaluator;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;

/**
 * Coarse phase detection from the material left and how far pieces have left their
 * starting squares.
 */
public final class GamePhase {
    public static final int OPENING_MAX_MOVED = 6;
    public static final int ENDGAME_MAX_PIECES = 12;

    private GamePhase() {
    }

    /** Fewer than {@value #OPENING_MAX_MOVED} soldiers, cannons, horses or chariots have left home. */
    public static boolean isOpening(Board board) {
        return countMovedPieces(board) < OPENING_MAX_MOVED;
    }

    /** Fewer than {@value #ENDGAME_MAX_PIECES} pieces remain, both sides together. */
    public static boolean isEndgame(Board board) {
        return board.getPieceCount() < ENDGAME_MAX_PIECES;
    }

    static int countMovedPieces(Board board) {
        int moved = 0;
        for (int sq = 0; sq < BoardUtils.SQUARES; sq++) {
            Piece piece = board.pieceAt(sq);
            if (piece != null && hasLeftHome(piece)) {
                moved++;
            }
        }
        return moved;
    }

    private static boolean hasLeftHome(Piece piece) {
        Side side = piece.getSide();
        int row = piece.getRow();
        int col = piece.getCol();
        return switch (piece.getKind()) {
            case SOLDIER -> row != soldierRow(side);
            case CANNON -> row != cannonRow(side) || (col != 1 && col != 7);
            case HORSE, CHARIOT -> row != side.homeRow;
            default -> false;
        };
    }

    public static int soldierRow(Side side) {
        return side == Side.RED ? 6 : 3;
    }

    public static int cannonRow(Side side) {
        return side == Side.RED ? 7 : 2;
    }

    public static boolean isDevelopingKind(PieceKind kind) {
        return kind == PieceKind.HORSE || kind == PieceKind.CANNON;
    }
}
