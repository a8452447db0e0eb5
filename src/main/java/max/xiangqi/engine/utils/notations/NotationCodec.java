package max.xiangqi.engine.utils.notations;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.MoveValidator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static max.xiangqi.engine.utils.notations.NotationGlyphs.ADVANCE;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.BACK;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.FRONT;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.LEFT;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.MIDDLE;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.RETREAT;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.RIGHT;
import static max.xiangqi.engine.utils.notations.NotationGlyphs.TRAVERSE;

/**
 * Chinese move notation, e.g. {@code 炮二平五}, {@code 前马进七}, {@code 三兵平四}, {@code 仕进五}.
 * <p>
 * A move is written as piece, column, action and magnitude. When the moving piece shares
 * its file with another piece of the same kind, the column is replaced by a position
 * descriptor written before the piece: 前/中/后 on a single crowded file, ordinals when
 * there are more than three pieces on it or when two files are crowded (files right to
 * left, then front to back). Columns are counted by each side from its own right.
 * <p>
 * 进 and 退 give a step count for pieces moving along lines (chariot, cannon, soldier,
 * general) and the destination column for the horse, elephant and advisor. 平 always
 * names the destination column.
 */
public final class NotationCodec {

    private NotationCodec() {
    }

    public static ParseResult parse(String text, Board board, Side side) {
        if (text == null || text.isBlank()) {
            return ParseResult.failure(NotationToken.FORMAT, "Empty move text");
        }
        String move = NotationGlyphs.normalize(text);
        if (move.length() == 3) {
            return parseAbbreviated(move, board, side);
        }
        if (move.length() != 4) {
            return ParseResult.failure(NotationToken.FORMAT, "Move text must have 4 glyphs: " + text);
        }

        PieceKind kind = NotationGlyphs.pieceKind(move.charAt(0));
        if (kind != null) {
            return parseColumnForm(move, kind, board, side);
        }
        kind = NotationGlyphs.pieceKind(move.charAt(1));
        if (kind == null) {
            return ParseResult.failure(NotationToken.PIECE_GLYPH, "Unknown piece in " + text);
        }
        return parsePositionalForm(move, kind, board, side);
    }

    // 炮二平五
    private static ParseResult parseColumnForm(String move, PieceKind kind, Board board, Side side) {
        int column = NotationGlyphs.numeral(move.charAt(1));
        if (column < 0) {
            return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR, "Unknown column '" + move.charAt(1) + "'");
        }
        ParseResult actionCheck = checkAction(move.charAt(2), move.charAt(3));
        if (actionCheck != null) {
            return actionCheck;
        }
        int col = side.columnFromNumeral(column);
        List<Piece> candidates = new ArrayList<>(2);
        for (Piece piece : board.getPieces(kind, side)) {
            if (piece.getCol() == col) {
                candidates.add(piece);
            }
        }
        if (candidates.isEmpty()) {
            return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR,
                    "No " + kind.glyph(side) + " on column " + NotationGlyphs.chineseNumeral(column));
        }
        return resolve(board, side, candidates, move.charAt(2), NotationGlyphs.numeral(move.charAt(3)));
    }

    // 前马进七, 二兵平五, 右车进一
    private static ParseResult parsePositionalForm(String move, PieceKind kind, Board board, Side side) {
        ParseResult actionCheck = checkAction(move.charAt(2), move.charAt(3));
        if (actionCheck != null) {
            return actionCheck;
        }
        char descriptor = move.charAt(0);
        List<Piece> pieces = board.getPieces(kind, side);
        if (pieces.isEmpty()) {
            return ParseResult.failure(NotationToken.PIECE_GLYPH, "No " + kind.glyph(side) + " left on the board");
        }

        List<Piece> candidates = new ArrayList<>(2);
        if (descriptor == LEFT || descriptor == RIGHT) {
            pieces.sort(Comparator.comparingInt(p -> rightToLeftRank(side, p.getCol())));
            int edgeCol = descriptor == RIGHT ? pieces.get(0).getCol() : pieces.get(pieces.size() - 1).getCol();
            for (Piece piece : pieces) {
                if (piece.getCol() == edgeCol) {
                    candidates.add(piece);
                }
            }
        } else if (descriptor == FRONT || descriptor == MIDDLE || descriptor == BACK) {
            for (List<Piece> file : crowdedFiles(pieces, side)) {
                if (descriptor == FRONT) {
                    candidates.add(file.get(0));
                } else if (descriptor == BACK) {
                    candidates.add(file.get(file.size() - 1));
                } else if (file.size() == 3) {
                    candidates.add(file.get(1));
                }
            }
        } else {
            int ordinal = NotationGlyphs.numeral(descriptor);
            if (ordinal < 0) {
                return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR, "Unknown position descriptor '" + descriptor + "'");
            }
            List<Piece> ordered = orderedCrowdedPieces(crowdedFiles(pieces, side));
            if (ordinal <= ordered.size()) {
                candidates.add(ordered.get(ordinal - 1));
            }
        }

        if (candidates.isEmpty()) {
            return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR,
                    "No " + kind.glyph(side) + " matches '" + descriptor + "'");
        }
        return resolve(board, side, candidates, move.charAt(2), NotationGlyphs.numeral(move.charAt(3)));
    }

    // 仕进五: the action alone tells which advisor or elephant moves
    private static ParseResult parseAbbreviated(String move, Board board, Side side) {
        PieceKind kind = NotationGlyphs.pieceKind(move.charAt(0));
        if (kind == null) {
            return ParseResult.failure(NotationToken.PIECE_GLYPH, "Unknown piece in " + move);
        }
        if (kind != PieceKind.ADVISOR && kind != PieceKind.ELEPHANT) {
            return ParseResult.failure(NotationToken.FORMAT, "Only advisors and elephants may omit their column: " + move);
        }
        char action = move.charAt(1);
        if (action != ADVANCE && action != RETREAT) {
            return ParseResult.failure(NotationToken.ACTION_GLYPH, "Expected 进 or 退 in " + move);
        }
        int magnitude = NotationGlyphs.numeral(move.charAt(2));
        if (magnitude < 0) {
            return ParseResult.failure(NotationToken.MAGNITUDE, "Unknown numeral '" + move.charAt(2) + "'");
        }
        List<Piece> pieces = board.getPieces(kind, side);
        if (pieces.isEmpty()) {
            return ParseResult.failure(NotationToken.PIECE_GLYPH, "No " + kind.glyph(side) + " left on the board");
        }
        return resolve(board, side, pieces, action, magnitude);
    }

    private static ParseResult checkAction(char action, char magnitude) {
        if (!NotationGlyphs.isAction(action)) {
            return ParseResult.failure(NotationToken.ACTION_GLYPH, "Unknown action '" + action + "'");
        }
        if (NotationGlyphs.numeral(magnitude) < 0) {
            return ParseResult.failure(NotationToken.MAGNITUDE, "Unknown numeral '" + magnitude + "'");
        }
        return null;
    }

    /**
     * A single candidate is resolved as written, legality is left to the caller.
     * Several candidates are narrowed to those whose move the validator accepts.
     */
    private static ParseResult resolve(Board board, Side side, List<Piece> candidates, char action, int magnitude) {
        if (candidates.size() == 1) {
            return target(candidates.get(0), side, action, magnitude);
        }
        ParseResult found = null;
        for (Piece piece : candidates) {
            ParseResult result = target(piece, side, action, magnitude);
            if (!result.isSuccess() || !MoveValidator.isValidMove(board, result.from(), result.to())) {
                continue;
            }
            if (found != null) {
                return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR,
                        "Ambiguous move: several " + piece.getKind().glyph(side) + " can play it");
            }
            found = result;
        }
        if (found == null) {
            return ParseResult.failure(NotationToken.POSITION_DESCRIPTOR,
                    "No " + candidates.get(0).getKind().glyph(side) + " can play this move");
        }
        return found;
    }

    private static ParseResult target(Piece piece, Side side, char action, int magnitude) {
        Coordinate from = piece.getCoordinate();
        PieceKind kind = piece.getKind();
        if (action == TRAVERSE) {
            if (!kind.linear) {
                return ParseResult.failure(NotationToken.ACTION_GLYPH, kind.glyph(side) + " cannot move along a rank");
            }
            int toCol = side.columnFromNumeral(magnitude);
            if (toCol == from.col) {
                return ParseResult.failure(NotationToken.MAGNITUDE, kind.glyph(side) + " is already on column "
                        + NotationGlyphs.chineseNumeral(magnitude));
            }
            return ParseResult.success(from, Coordinate.of(from.row, toCol));
        }

        int direction = action == ADVANCE ? side.forward : -side.forward;
        if (kind.linear) {
            int toRow = from.row + direction * magnitude;
            if (!BoardUtils.isOnBoard(toRow, from.col)) {
                return ParseResult.failure(NotationToken.MAGNITUDE, "Moving " + magnitude + " steps leaves the board");
            }
            return ParseResult.success(from, Coordinate.of(toRow, from.col));
        }

        int toCol = side.columnFromNumeral(magnitude);
        int dc = Math.abs(toCol - from.col);
        int dr = switch (kind) {
            case HORSE -> dc == 1 ? 2 : dc == 2 ? 1 : 0;
            case ELEPHANT -> dc == 2 ? 2 : 0;
            case ADVISOR -> dc == 1 ? 1 : 0;
            default -> 0;
        };
        int toRow = from.row + direction * dr;
        if (dr == 0 || !BoardUtils.isOnBoard(toRow, toCol)) {
            return ParseResult.failure(NotationToken.MAGNITUDE,
                    kind.glyph(side) + " cannot reach column " + NotationGlyphs.chineseNumeral(magnitude));
        }
        return ParseResult.success(from, Coordinate.of(toRow, toCol));
    }

    /** Simplified notation of the move, computed on the board before the move is played. */
    public static String generate(Board board, Coordinate from, Coordinate to) {
        Piece mover = board.getPiece(from);
        if (mover == null) {
            throw new IllegalArgumentException("No piece at " + from);
        }
        Side side = mover.getSide();
        PieceKind kind = mover.getKind();

        char action;
        int magnitude;
        if (to.row == from.row) {
            action = TRAVERSE;
            magnitude = side.columnNumeral(to.col);
        } else {
            action = side.isForward(from.row, to.row) ? ADVANCE : RETREAT;
            magnitude = kind.linear ? Math.abs(to.row - from.row) : side.columnNumeral(to.col);
        }
        String tail = "" + action + NotationGlyphs.chineseNumeral(magnitude);
        String glyph = kind.glyph(side);

        List<Piece> pieces = board.getPieces(kind, side);
        List<List<Piece>> crowded = crowdedFiles(pieces, side);
        List<Piece> ownFile = null;
        for (List<Piece> file : crowded) {
            if (file.contains(mover)) {
                ownFile = file;
            }
        }
        if (ownFile == null) {
            return glyph + NotationGlyphs.chineseNumeral(side.columnNumeral(from.col)) + tail;
        }

        if ((kind == PieceKind.ADVISOR || kind == PieceKind.ELEPHANT) && action != TRAVERSE
                && resolve(board, side, pieces, action, magnitude).isSuccess()) {
            return glyph + tail;
        }

        char descriptor;
        if (crowded.size() == 1) {
            int position = ownFile.indexOf(mover);
            int size = ownFile.size();
            if (size == 2) {
                descriptor = position == 0 ? FRONT : BACK;
            } else if (size == 3) {
                descriptor = position == 0 ? FRONT : position == 1 ? MIDDLE : BACK;
            } else {
                descriptor = NotationGlyphs.chineseNumeral(position + 1);
            }
        } else {
            descriptor = NotationGlyphs.chineseNumeral(orderedCrowdedPieces(crowded).indexOf(mover) + 1);
        }
        return descriptor + glyph + tail;
    }

    /** Same as {@link #generate} with traditional glyphs (車, 馬, 進, 後...). */
    public static String generateTraditional(Board board, Coordinate from, Coordinate to) {
        return NotationGlyphs.toTraditional(generate(board, from, to));
    }

    // Files holding two or more of the pieces, right to left, each sorted front to back
    private static List<List<Piece>> crowdedFiles(List<Piece> pieces, Side side) {
        List<List<Piece>> files = new ArrayList<>(2);
        for (int rank = 0; rank < BoardUtils.COLS; rank++) {
            int col = side == Side.RED ? BoardUtils.COLS - 1 - rank : rank;
            List<Piece> file = new ArrayList<>(2);
            for (Piece piece : pieces) {
                if (piece.getCol() == col) {
                    file.add(piece);
                }
            }
            if (file.size() >= 2) {
                file.sort((a, b) -> side.compareFrontToBack(a.getRow(), b.getRow()));
                files.add(file);
            }
        }
        return files;
    }

    private static List<Piece> orderedCrowdedPieces(List<List<Piece>> crowded) {
        List<Piece> ordered = new ArrayList<>();
        for (List<Piece> file : crowded) {
            ordered.addAll(file);
        }
        return ordered;
    }

    // 0 for the mover's rightmost column
    private static int rightToLeftRank(Side side, int col) {
        return side == Side.RED ? BoardUtils.COLS - 1 - col : col;
    }
}
