package max.xiangqi.engine.common;

import max.xiangqi.engine.game.board.utils.BoardUtils;

/**
 * Immutable board square. Instances are interned, so identity comparison is valid.
 * Use the packed int index on the hot path instead.
 */
public final class Coordinate {

    private static final Coordinate[] CACHE = new Coordinate[BoardUtils.SQUARES];

    static {
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            CACHE[i] = new Coordinate(BoardUtils.row(i), BoardUtils.col(i));
        }
    }

    public static Coordinate of(int row, int col) {
        if (!BoardUtils.isOnBoard(row, col)) {
            throw new IllegalArgumentException("Coordinate out of board: (" + row + "," + col + ")");
        }
        return CACHE[BoardUtils.index(row, col)];
    }

    public static Coordinate of(int index) {
        if (index < 0 || index >= BoardUtils.SQUARES) {
            throw new IllegalArgumentException("Square index out of board: " + index);
        }
        return CACHE[index];
    }

    public final int row;
    public final int col;
    public final int index;

    private Coordinate(int row, int col) {
        this.row = row;
        this.col = col;
        this.index = BoardUtils.index(row, col);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
