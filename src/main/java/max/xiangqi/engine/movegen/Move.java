package max.xiangqi.engine.movegen;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.game.board.utils.BoardUtils;

/**
 * Moves travel as packed ints: {@code from << 7 | to} over square indexes 0..89.
 * 0 never encodes a real move since origin and destination would coincide.
 */
public final class Move {
    public static final int NONE = 0;

    private static final int SQUARE_MASK = 0b1111111;

    private Move() {
    }

    public static int asBytes(int from, int to) {
        return (from << 7) | to;
    }

    public static int of(Coordinate from, Coordinate to) {
        return asBytes(from.index, to.index);
    }

    public static int getStartPosition(int move) {
        return (move >>> 7) & SQUARE_MASK;
    }

    public static int getEndPosition(int move) {
        return move & SQUARE_MASK;
    }

    public static Coordinate from(int move) {
        return Coordinate.of(getStartPosition(move));
    }

    public static Coordinate to(int move) {
        return Coordinate.of(getEndPosition(move));
    }

    /** File letter a..i and rank digit counted from Red's back rank, e.g. {@code h2e2}. */
    public static String toIccs(int move) {
        return square(getStartPosition(move)) + square(getEndPosition(move));
    }

    /** @return the packed move, or {@link #NONE} when the text is not a valid code */
    public static int fromIccs(String code) {
        if (code == null || code.length() != 4) {
            return NONE;
        }
        String c = code.toLowerCase();
        int fromCol = c.charAt(0) - 'a';
        int fromRank = c.charAt(1) - '0';
        int toCol = c.charAt(2) - 'a';
        int toRank = c.charAt(3) - '0';
        if (!BoardUtils.isOnBoard(9 - fromRank, fromCol) || !BoardUtils.isOnBoard(9 - toRank, toCol)) {
            return NONE;
        }
        int from = BoardUtils.index(9 - fromRank, fromCol);
        int to = BoardUtils.index(9 - toRank, toCol);
        return from == to ? NONE : asBytes(from, to);
    }

    private static String square(int index) {
        return "" + (char) ('a' + BoardUtils.col(index)) + (9 - BoardUtils.row(index));
    }

    public static String toString(int move) {
        if (move == NONE) {
            return "none";
        }
        return Coordinate.of(getStartPosition(move)) + "->" + Coordinate.of(getEndPosition(move));
    }
}
