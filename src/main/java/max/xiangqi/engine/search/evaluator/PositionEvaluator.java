package max.xiangqi.engine.search.evaluator;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.movegen.MoveValidator;
import max.xiangqi.engine.movegen.pieces.Cannon;
import max.xiangqi.engine.movegen.pieces.Horse;

import java.util.List;

/**
 * Static evaluation from one side's point of view: own score minus the opponent's,
 * each side scored from scratch. The board is temporarily modified while counting
 * check paths and restored before returning.
 */
public final class PositionEvaluator {
    public static final int GENERAL_MISSING_SCORE = 9999;

    static final double POSITION_WEIGHT = 1.5;
    static final int MOBILITY_WEIGHT = 8;
    static final double ATTACK_WEIGHT = 1.5;
    static final int PROTECTION_WEIGHT = 20;
    static final int CENTER_WEIGHT = 25;
    static final int CHECK_PATH_WEIGHT = 30;
    static final int AGGRESSION_WEIGHT = 25;
    static final int MAX_CHECK_PATHS = 5;

    private final boolean advanced;

    public PositionEvaluator(boolean advanced) {
        this.advanced = advanced;
    }

    public boolean isAdvanced() {
        return advanced;
    }

    public int evaluate(Board board, Side side) {
        Side opponent = side.opposite();
        if (board.getGeneral(opponent) == null) return GENERAL_MISSING_SCORE;
        if (board.getGeneral(side) == null) return -GENERAL_MISSING_SCORE;

        // Rounded per side so that evaluate(side) == -evaluate(opponent)
        long own = Math.round(sideScore(board, side));
        long theirs = Math.round(sideScore(board, opponent));
        return (int) (own - theirs);
    }

    double sideScore(Board board, Side side) {
        List<Piece> pieces = board.getPieces(side);
        Piece enemyGeneral = board.getGeneral(side.opposite());
        double total = 0;
        for (Piece piece : pieces) {
            total += PieceValues.of(piece.getKind());
            if (piece.getKind() == PieceKind.SOLDIER && side.hasCrossedRiver(piece.getRow())) {
                total += PieceValues.SOLDIER_CROSS_RIVER_BONUS;
                int distance = BoardUtils.manhattan(piece.getCoordinate().index, enemyGeneral.getCoordinate().index);
                total += Math.max(0, (10 - distance) * 15);
            }
            total += positionValue(board, piece) * POSITION_WEIGHT;
            total += MoveGenerator.countPieceMoves(board, piece.getCoordinate().index) * MOBILITY_WEIGHT;
            total += coordination(piece, pieces);
        }

        total += attackBonus(board, side, enemyGeneral) * ATTACK_WEIGHT;
        total += protectedCount(board, pieces) * PROTECTION_WEIGHT;
        total += centerControl(board, pieces) * CENTER_WEIGHT;

        if (advanced) {
            total += checkingPaths(board, side) * CHECK_PATH_WEIGHT;
            total += aggression(pieces, side) * AGGRESSION_WEIGHT;
        }
        return total;
    }

    static int positionValue(Board board, Piece piece) {
        Side side = piece.getSide();
        int row = piece.getRow();
        int col = piece.getCol();
        int bonus = 0;
        switch (piece.getKind()) {
            case GENERAL -> {
                if (row == side.homeRow) {
                    if (col == 4) bonus += 50;
                    else if (col >= 3 && col <= 5) bonus += 30;
                }
            }
            case SOLDIER -> {
                if (side.hasCrossedRiver(row)) {
                    bonus += PieceValues.SOLDIER_CROSS_RIVER_BONUS;
                    // Close to the enemy palace
                    if ((side == Side.RED && row < 3) || (side == Side.BLACK && row > 6)) bonus += 50;
                }
                if (col == 3 || col == 5) bonus += 20;
            }
            case CANNON -> {
                if (col == 4) bonus += 30;
                bonus += Cannon.countScreens(board, side, piece.getCoordinate().index) * 15;
            }
            case HORSE -> {
                bonus += Horse.countActiveSquares(board, piece.getCoordinate().index) * 20;
                if (row >= 3 && row <= 6 && col >= 2 && col <= 6) bonus += 30;
            }
            case CHARIOT -> {
                int fromHome = Math.abs(row - side.homeRow);
                if (fromHome == 2) bonus += 50;
                if (fromHome == 1) bonus += 80;
                if (fromHome == 5) bonus += 40;
            }
            case ADVISOR -> {
                Piece general = board.getGeneral(side);
                if (general != null && Math.abs(row - general.getRow()) <= 1 && Math.abs(col - general.getCol()) <= 1) {
                    bonus += 50;
                }
            }
            case ELEPHANT -> {
                if (hasOpenEye(board, row, col)) bonus += 30;
            }
        }
        return bonus;
    }

    private static boolean hasOpenEye(Board board, int row, int col) {
        for (int dr = -1; dr <= 1; dr += 2) {
            for (int dc = -1; dc <= 1; dc += 2) {
                if (BoardUtils.isOnBoard(row + dr, col + dc) && board.isEmpty(row + dr, col + dc)) {
                    return true;
                }
            }
        }
        return false;
    }

    // Average distance to friendly pieces, best around 5
    static double coordination(Piece piece, List<Piece> allies) {
        if (allies.size() <= 1) {
            return Math.max(0, 5 - Math.abs(0 - 5)) * 2;
        }
        int totalDistance = 0;
        int index = piece.getCoordinate().index;
        for (Piece ally : allies) {
            if (ally != piece) {
                totalDistance += BoardUtils.manhattan(index, ally.getCoordinate().index);
            }
        }
        double average = (double) totalDistance / (allies.size() - 1);
        return Math.max(0, 5 - Math.abs(average - 5)) * 2;
    }

    /**
     * 500 once some piece attacks the enemy general, plus 100 for each palace square next
     * to the general attacked by the pieces scanned before that one.
     */
    static int attackBonus(Board board, Side side, Piece enemyGeneral) {
        int generalSquare = enemyGeneral.getCoordinate().index;
        int gRow = enemyGeneral.getRow();
        int gCol = enemyGeneral.getCol();
        Side defender = side.opposite();
        int bonus = 0;
        for (Piece piece : board.getPieces(side)) {
            int from = piece.getCoordinate().index;
            if (MoveValidator.isValidMove(board, from, generalSquare)) {
                bonus += 500;
                break;
            }
            for (int[] d : ORTHOGONAL) {
                int r = gRow + d[0];
                int c = gCol + d[1];
                if (BoardUtils.isOnBoard(r, c) && defender.isInPalace(r, c)
                        && MoveValidator.isValidMove(board, from, BoardUtils.index(r, c))) {
                    bonus += 100;
                }
            }
        }
        return bonus;
    }

    private static final int[][] ORTHOGONAL = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};

    static int protectedCount(Board board, List<Piece> pieces) {
        int count = 0;
        for (Piece piece : pieces) {
            int target = piece.getCoordinate().index;
            for (Piece ally : pieces) {
                if (ally != piece && MoveValidator.defends(board, ally.getCoordinate().index, target)) {
                    count++;
                    break;
                }
            }
        }
        return count;
    }

    static int centerControl(Board board, List<Piece> pieces) {
        int control = 0;
        for (int row = 3; row <= 6; row++) {
            for (int col = 3; col <= 5; col++) {
                int square = BoardUtils.index(row, col);
                for (Piece piece : pieces) {
                    if (MoveValidator.isValidMove(board, piece.getCoordinate().index, square)) {
                        control++;
                        break;
                    }
                }
            }
        }
        return control;
    }

    /** Moves after which some piece of {@code side} attacks the enemy general, capped. */
    static int checkingPaths(Board board, Side side) {
        Side defender = side.opposite();
        int[] buffer = new int[MoveGenerator.MAX_PIECE_MOVES];
        int paths = 0;
        for (Piece piece : board.getPieces(side)) {
            int n = MoveGenerator.generatePieceMoves(board, piece.getCoordinate().index, buffer);
            for (int i = 0; i < n; i++) {
                int from = Move.getStartPosition(buffer[i]);
                int to = Move.getEndPosition(buffer[i]);
                Piece captured = board.movePiece(from, to);
                boolean check = MoveGenerator.isInCheck(board, defender);
                board.unmovePiece(from, to, captured);
                if (check && ++paths >= MAX_CHECK_PATHS) {
                    return paths;
                }
            }
        }
        return paths;
    }

    static double aggression(List<Piece> pieces, Side side) {
        double score = 0;
        for (Piece piece : pieces) {
            int row = piece.getRow();
            if (side.hasCrossedRiver(row)) {
                score += switch (piece.getKind()) {
                    case CHARIOT, CANNON -> 3;
                    case HORSE -> 2;
                    case SOLDIER -> 1;
                    default -> 0;
                };
            } else if ((side == Side.RED && row <= 6) || (side == Side.BLACK && row >= 3)) {
                score += 0.5;
            }
        }
        return score;
    }
}
