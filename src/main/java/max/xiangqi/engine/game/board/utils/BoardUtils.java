package max.xiangqi.engine.game.board.utils;

public final class BoardUtils {
    public static final int ROWS = 10;
    public static final int COLS = 9;
    public static final int SQUARES = ROWS * COLS;

    private BoardUtils() {
    }

    public static int index(int row, int col) {
        return row * COLS + col;
    }

    public static int row(int index) {
        return index / COLS;
    }

    public static int col(int index) {
        return index % COLS;
    }

    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < ROWS && col >= 0 && col < COLS;
    }

    public static int manhattan(int fromIndex, int toIndex) {
        return Math.abs(row(fromIndex) - row(toIndex)) + Math.abs(col(fromIndex) - col(toIndex));
    }
}
