package max.xiangqi.engine.game.board;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;

import java.util.Objects;

/**
 * A piece owned by exactly one {@link Board}. The board repositions it in place;
 * copies of a board never share pieces.
 */
public final class Piece {
    private final PieceKind kind;
    private final Side side;
    private final String displayName;
    private Coordinate coordinate;

    public Piece(PieceKind kind, Side side, Coordinate coordinate) {
        this(kind, side, coordinate, kind.glyph(side));
    }

    public Piece(PieceKind kind, Side side, Coordinate coordinate, String displayName) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.side = Objects.requireNonNull(side, "side");
        this.coordinate = Objects.requireNonNull(coordinate, "coordinate");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
    }

    public PieceKind getKind() {
        return kind;
    }

    public Side getSide() {
        return side;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    public int getRow() {
        return coordinate.row;
    }

    public int getCol() {
        return coordinate.col;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTraditionalName() {
        return kind.traditionalGlyph(side);
    }

    void moveTo(Coordinate target) {
        this.coordinate = target;
    }

    Piece copy() {
        return new Piece(kind, side, coordinate, displayName);
    }

    @Override
    public String toString() {
        return displayName + coordinate;
    }
}
