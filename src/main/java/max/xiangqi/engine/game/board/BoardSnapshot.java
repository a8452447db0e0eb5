package max.xiangqi.engine.game.board;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.utils.BoardUtils;

/**
 * Read-only copy of the grid handed to renderers. {@code cell(row, col)} is null on empty squares.
 */
public final class BoardSnapshot {

    public record Cell(PieceKind kind, Side side, String displayName) {
    }

    private final Cell[] cells;

    BoardSnapshot(Cell[] cells) {
        this.cells = cells;
    }

    public Cell cell(int row, int col) {
        if (!BoardUtils.isOnBoard(row, col)) {
            throw new IllegalArgumentException("Coordinate out of board: (" + row + "," + col + ")");
        }
        return cells[BoardUtils.index(row, col)];
    }

    public int rows() {
        return BoardUtils.ROWS;
    }

    public int cols() {
        return BoardUtils.COLS;
    }

    public int pieceCount() {
        int n = 0;
        for (Cell c : cells) {
            if (c != null) n++;
        }
        return n;
    }
}
