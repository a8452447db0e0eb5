package max.xiangqi.engine.game.board;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.CorruptGameStateException;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.utils.BoardUtils;

import java.util.ArrayList;
import java.util.List;

public class Board {
    private final Piece[] pieceAt;
    // Indexed by Side.ordinal()
    private final Piece[] generals = new Piece[2];
    private final int[] pieceCount = new int[2];

    public Board() {
        this.pieceAt = new Piece[BoardUtils.SQUARES];
    }

    private Board(Board other) {
        this.pieceAt = new Piece[BoardUtils.SQUARES];
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            Piece p = other.pieceAt[i];
            if (p != null) {
                Piece copy = p.copy();
                pieceAt[i] = copy;
                if (copy.getKind() == PieceKind.GENERAL) {
                    generals[copy.getSide().ordinal()] = copy;
                }
            }
        }
        this.pieceCount[0] = other.pieceCount[0];
        this.pieceCount[1] = other.pieceCount[1];
    }

    /** Deep copy: every piece is duplicated. */
    public Board copy() {
        return new Board(this);
    }

    public Piece getPiece(Coordinate coordinate) {
        return pieceAt[coordinate.index];
    }

    public Piece getPiece(int row, int col) {
        if (!BoardUtils.isOnBoard(row, col)) {
            throw new IllegalArgumentException("Coordinate out of board: (" + row + "," + col + ")");
        }
        return pieceAt[BoardUtils.index(row, col)];
    }

    // Hot path, index is trusted
    public Piece pieceAt(int index) {
        return pieceAt[index];
    }

    public boolean isEmpty(int row, int col) {
        return pieceAt[BoardUtils.index(row, col)] == null;
    }

    public void placePiece(Piece piece) {
        int index = piece.getCoordinate().index;
        if (pieceAt[index] != null) {
            throw new IllegalArgumentException("Square already occupied: " + piece.getCoordinate());
        }
        if (piece.getKind() == PieceKind.GENERAL) {
            int s = piece.getSide().ordinal();
            if (generals[s] != null) {
                throw new IllegalArgumentException("A " + piece.getSide() + " general is already on the board");
            }
            generals[s] = piece;
        }
        pieceAt[index] = piece;
        pieceCount[piece.getSide().ordinal()]++;
    }

    public Piece removePiece(Coordinate coordinate) {
        Piece piece = pieceAt[coordinate.index];
        if (piece != null) {
            pieceAt[coordinate.index] = null;
            detach(piece);
        }
        return piece;
    }

    /**
     * Moves the piece standing on {@code from} to {@code to}.
     * @return the captured piece, or null
     */
    public Piece movePiece(Coordinate from, Coordinate to) {
        if (pieceAt[from.index] == null) {
            throw new IllegalArgumentException("No piece at " + from);
        }
        return movePiece(from.index, to.index);
    }

    public Piece movePiece(int from, int to) {
        Piece mover = pieceAt[from];
        if (mover == null) {
            throw new CorruptGameStateException("No piece to move at square " + from);
        }
        Piece captured = pieceAt[to];
        if (captured != null) {
            detach(captured);
        }
        pieceAt[from] = null;
        pieceAt[to] = mover;
        mover.moveTo(Coordinate.of(to));
        return captured;
    }

    /** Reverts {@link #movePiece(int, int)}. */
    public void unmovePiece(int from, int to, Piece captured) {
        Piece mover = pieceAt[to];
        pieceAt[from] = mover;
        mover.moveTo(Coordinate.of(from));
        pieceAt[to] = captured;
        if (captured != null) {
            attach(captured);
        }
    }

    private void detach(Piece piece) {
        if (piece.getKind() == PieceKind.GENERAL) {
            generals[piece.getSide().ordinal()] = null;
        }
        pieceCount[piece.getSide().ordinal()]--;
    }

    private void attach(Piece piece) {
        if (piece.getKind() == PieceKind.GENERAL) {
            generals[piece.getSide().ordinal()] = piece;
        }
        pieceCount[piece.getSide().ordinal()]++;
    }

    public Piece getGeneral(Side side) {
        return generals[side.ordinal()];
    }

    public int getPieceCount() {
        return pieceCount[0] + pieceCount[1];
    }

    public int getPieceCount(Side side) {
        return pieceCount[side.ordinal()];
    }

    public List<Piece> getPieces(Side side) {
        List<Piece> pieces = new ArrayList<>(16);
        for (Piece p : pieceAt) {
            if (p != null && p.getSide() == side) {
                pieces.add(p);
            }
        }
        return pieces;
    }

    public List<Piece> getPieces(PieceKind kind, Side side) {
        List<Piece> pieces = new ArrayList<>(5);
        for (Piece p : pieceAt) {
            if (p != null && p.getSide() == side && p.getKind() == kind) {
                pieces.add(p);
            }
        }
        return pieces;
    }

    /** True when both generals share a file with nothing between them. */
    public boolean areGeneralsFacing() {
        Piece red = generals[Side.RED.ordinal()];
        Piece black = generals[Side.BLACK.ordinal()];
        if (red == null || black == null) {
            return false;
        }
        int col = red.getCol();
        if (col != black.getCol()) {
            return false;
        }
        int top = Math.min(red.getRow(), black.getRow());
        int bottom = Math.max(red.getRow(), black.getRow());
        for (int row = top + 1; row < bottom; row++) {
            if (pieceAt[BoardUtils.index(row, col)] != null) {
                return false;
            }
        }
        return true;
    }

    public BoardSnapshot snapshot() {
        BoardSnapshot.Cell[] cells = new BoardSnapshot.Cell[BoardUtils.SQUARES];
        for (int i = 0; i < BoardUtils.SQUARES; i++) {
            Piece p = pieceAt[i];
            if (p != null) {
                cells[i] = new BoardSnapshot.Cell(p.getKind(), p.getSide(), p.getDisplayName());
            }
        }
        return new BoardSnapshot(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < BoardUtils.ROWS; row++) {
            for (int col = 0; col < BoardUtils.COLS; col++) {
                Piece p = pieceAt[BoardUtils.index(row, col)];
                sb.append(p == null ? '.' : p.getKind().fenChar(p.getSide()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
