package max.xiangqi.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.pieces.Advisor;
import max.xiangqi.engine.movegen.pieces.Cannon;
import max.xiangqi.engine.movegen.pieces.Chariot;
import max.xiangqi.engine.movegen.pieces.Elephant;
import max.xiangqi.engine.movegen.pieces.General;
import max.xiangqi.engine.movegen.pieces.Horse;
import max.xiangqi.engine.movegen.pieces.Soldier;

/**
 * Legal moves are the geometrically valid ones minus those that leave both generals
 * facing on an open file. Leaving one's own general attacked is allowed: the opponent
 * may then capture it, which ends the game.
 */
public final class MoveGenerator {
    // Comfortably above the largest move count reachable in a real position
    public static final int MAX_MOVES = 160;
    // A chariot or cannon in open space: 9 + 8
    public static final int MAX_PIECE_MOVES = 17;

    private MoveGenerator() {
    }

    /** Fills {@code buffer} with the legal moves of the side to move and returns their count. */
    public static int generateMoves(Game game, int[] buffer) {
        return generateMoves(game.board(), game.sideToMove(), buffer);
    }

    public static int generateMoves(Board board, Side side, int[] buffer) {
        int n = generatePseudoMoves(board, side, buffer);
        return filterFlyingGeneral(board, buffer, n);
    }

    /** Legal moves landing on an enemy piece. */
    public static int generateCaptures(Game game, int[] buffer) {
        Board board = game.board();
        int n = generateMoves(board, game.sideToMove(), buffer);
        int kept = 0;
        for (int i = 0; i < n; i++) {
            if (board.pieceAt(Move.getEndPosition(buffer[i])) != null) {
                buffer[kept++] = buffer[i];
            }
        }
        return kept;
    }

    public static IntArrayList legalMoves(Game game) {
        int[] buffer = new int[MAX_MOVES];
        int n = generateMoves(game, buffer);
        return IntArrayList.wrap(buffer, n);
    }

    static int generatePseudoMoves(Board board, Side side, int[] buffer) {
        int n = 0;
        for (int from = 0; from < BoardUtils.SQUARES; from++) {
            Piece piece = board.pieceAt(from);
            if (piece == null || piece.getSide() != side) continue;
            n = generatePieceMoves(board, piece, from, buffer, n);
        }
        return n;
    }

    private static int generatePieceMoves(Board board, Piece piece, int from, int[] buffer, int n) {
        Side side = piece.getSide();
        return switch (piece.getKind()) {
            case GENERAL -> General.generate(board, side, from, buffer, n);
            case ADVISOR -> Advisor.generate(board, side, from, buffer, n);
            case ELEPHANT -> Elephant.generate(board, side, from, buffer, n);
            case HORSE -> Horse.generate(board, side, from, buffer, n);
            case CHARIOT -> Chariot.generate(board, side, from, buffer, n);
            case CANNON -> Cannon.generate(board, side, from, buffer, n);
            case SOLDIER -> Soldier.generate(board, side, from, buffer, n);
        };
    }

    private static int filterFlyingGeneral(Board board, int[] buffer, int n) {
        int kept = 0;
        for (int i = 0; i < n; i++) {
            int move = buffer[i];
            if (!exposesGenerals(board, Move.getStartPosition(move), Move.getEndPosition(move))) {
                buffer[kept++] = move;
            }
        }
        return kept;
    }

    /** Plays the move on the board, checks for facing generals, then reverts it. */
    public static boolean exposesGenerals(Board board, int from, int to) {
        Piece captured = board.movePiece(from, to);
        boolean facing = board.areGeneralsFacing();
        board.unmovePiece(from, to, captured);
        return facing;
    }

    /** Geometrically valid moves of the piece on {@code from}, flying general not filtered. */
    public static int generatePieceMoves(Board board, int from, int[] buffer) {
        Piece piece = board.pieceAt(from);
        if (piece == null) {
            return 0;
        }
        return generatePieceMoves(board, piece, from, buffer, 0);
    }

    /** Number of squares the piece on {@code from} may move to, geometrically. */
    public static int countPieceMoves(Board board, int from) {
        return generatePieceMoves(board, from, new int[MAX_PIECE_MOVES]);
    }

    /** True when some piece of {@code attacker} could move onto {@code square}. */
    public static boolean isSquareAttacked(Board board, Side attacker, int square) {
        for (int from = 0; from < BoardUtils.SQUARES; from++) {
            Piece piece = board.pieceAt(from);
            if (piece == null || piece.getSide() != attacker) continue;
            if (MoveValidator.isValidMove(board, from, square)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isInCheck(Board board, Side side) {
        Piece general = board.getGeneral(side);
        return general != null && isSquareAttacked(board, side.opposite(), general.getCoordinate().index);
    }
}
