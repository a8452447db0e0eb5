package max.xiangqi.engine.utils.notations;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;

/**
 * Xiangqi FEN: ten ranks from Black's back rank (row 0) to Red's (row 9), uppercase for Red,
 * digits for runs of empty squares, then {@code w} (Red) or {@code b} (Black) to move.
 * Trailing fields are accepted and ignored.
 */
public final class FENUtils {

    private FENUtils() {
    }

    public static Game getGameFrom(String fen) {
        String[] fields = fen.trim().split("\\s+");
        Board board = getBoardFrom(fields[0]);
        Side side = Side.RED;
        if (fields.length > 1) {
            side = parseSide(fields[1]);
        }
        return new Game(board, side);
    }

    public static Board getBoardFrom(String piecePlacement) {
        String placement = piecePlacement.trim();
        int space = placement.indexOf(' ');
        if (space >= 0) {
            placement = placement.substring(0, space);
        }
        String[] ranks = placement.split("/");
        if (ranks.length != BoardUtils.ROWS) {
            throw new IllegalArgumentException("Invalid FEN, expected " + BoardUtils.ROWS + " ranks: " + piecePlacement);
        }
        Board board = new Board();
        for (int row = 0; row < BoardUtils.ROWS; row++) {
            int col = 0;
            for (char c : ranks[row].toCharArray()) {
                if (c >= '1' && c <= '9') {
                    col += c - '0';
                    continue;
                }
                PieceKind kind = PieceKind.fromFenChar(c);
                if (kind == null) {
                    throw new IllegalArgumentException("Invalid FEN piece letter '" + c + "' in " + piecePlacement);
                }
                if (col >= BoardUtils.COLS) {
                    throw new IllegalArgumentException("Invalid FEN, rank " + row + " too long: " + piecePlacement);
                }
                Side side = Character.isUpperCase(c) ? Side.RED : Side.BLACK;
                board.placePiece(new Piece(kind, side, Coordinate.of(row, col)));
                col++;
            }
            if (col != BoardUtils.COLS) {
                throw new IllegalArgumentException("Invalid FEN, rank " + row + " has " + col + " files: " + piecePlacement);
            }
        }
        return board;
    }

    public static String getFENFromBoard(Board board, Side sideToMove) {
        StringBuilder fen = new StringBuilder(96);
        for (int row = 0; row < BoardUtils.ROWS; row++) {
            if (row > 0) {
                fen.append('/');
            }
            int empty = 0;
            for (int col = 0; col < BoardUtils.COLS; col++) {
                Piece piece = board.pieceAt(BoardUtils.index(row, col));
                if (piece == null) {
                    empty++;
                    continue;
                }
                if (empty > 0) {
                    fen.append(empty);
                    empty = 0;
                }
                fen.append(piece.getKind().fenChar(piece.getSide()));
            }
            if (empty > 0) {
                fen.append(empty);
            }
        }
        fen.append(' ').append(sideToMove == Side.RED ? 'w' : 'b');
        return fen.toString();
    }

    public static String getFENFromGame(Game game) {
        return getFENFromBoard(game.board(), game.sideToMove());
    }

    private static Side parseSide(String field) {
        switch (field.toLowerCase()) {
            case "w":
            case "r":
                return Side.RED;
            case "b":
                return Side.BLACK;
            default:
                throw new IllegalArgumentException("Invalid FEN side to move: " + field);
        }
    }
}
