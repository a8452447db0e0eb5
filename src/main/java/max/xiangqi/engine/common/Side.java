package max.xiangqi.engine.common;

public enum Side {
    RED(-1, 9, "红方"),
    BLACK(1, 0, "黑方");

    public static final Side[] VALUES = Side.values();

    // Row delta of a one-step advance
    public final int forward;
    public final int homeRow;
    public final String displayName;

    Side(int forward, int homeRow, String displayName) {
        this.forward = forward;
        this.homeRow = homeRow;
        this.displayName = displayName;
    }

    public Side opposite() {
        return this == RED ? BLACK : RED;
    }

    public boolean hasCrossedRiver(int row) {
        return this == RED ? row < 5 : row > 4;
    }

    public boolean isInPalace(int row, int col) {
        if (col < 3 || col > 5) {
            return false;
        }
        return this == RED ? row >= 7 && row <= 9 : row >= 0 && row <= 2;
    }

    public boolean isForward(int fromRow, int toRow) {
        return (toRow - fromRow) * forward > 0;
    }

    /** Column as counted by this side, 1..9 from its own right. */
    public int columnNumeral(int col) {
        return this == RED ? 9 - col : col + 1;
    }

    public int columnFromNumeral(int numeral) {
        return this == RED ? 9 - numeral : numeral - 1;
    }

    /** Negative when {@code rowA} is further forward than {@code rowB} for this side. */
    public int compareFrontToBack(int rowA, int rowB) {
        return this == RED ? Integer.compare(rowA, rowB) : Integer.compare(rowB, rowA);
    }

    /** Negative when {@code colA} is further right than {@code colB} from this side's seat. */
    public int compareRightToLeft(int colA, int colB) {
        return this == RED ? Integer.compare(colB, colA) : Integer.compare(colA, colB);
    }
}
