package max.xiangqi.engine.search;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;
import max.xiangqi.engine.search.evaluator.GamePhase;

/**
 * Shortcut moves for clearly classified phases, tried before any search.
 */
final class PhaseHeuristics {
    static final int OPENING_MIN_SCORE = 2;
    static final int ENDGAME_MAX_DISTANCE = 3;

    private PhaseHeuristics() {
    }

    /** @return a move for an opening or endgame position, {@link Move#NONE} otherwise */
    static int pick(Board board, Side side, int[] moves, int n) {
        if (n == 0) return Move.NONE;
        if (GamePhase.isOpening(board)) {
            return openingMove(board, side, moves, n);
        }
        if (GamePhase.isEndgame(board)) {
            return endgameMove(board, side, moves, n);
        }
        return Move.NONE;
    }

    /** Develops horses and cannons toward the centre, pushes edge and centre soldiers. */
    static int openingMove(Board board, Side side, int[] moves, int n) {
        int best = Move.NONE;
        int bestScore = OPENING_MIN_SCORE;
        for (int i = 0; i < n; i++) {
            int move = moves[i];
            int from = Move.getStartPosition(move);
            int to = Move.getEndPosition(move);
            Piece piece = board.pieceAt(from);
            int fromRow = BoardUtils.row(from), fromCol = BoardUtils.col(from);
            int toCol = BoardUtils.col(to);

            int score = 0;
            if (GamePhase.isDevelopingKind(piece.getKind())) {
                if (toCol >= 2 && toCol <= 6) score += 5 - Math.abs(toCol - 4);
                int startRow = piece.getKind() == PieceKind.HORSE ? side.homeRow : GamePhase.cannonRow(side);
                if (fromRow == startRow) score += 2;
            }
            if (piece.getKind() == PieceKind.SOLDIER && fromCol % 2 == 0) {
                score += 2;
                if (side.isForward(fromRow, BoardUtils.row(to))) score += 1;
            }
            if (score > bestScore) {
                bestScore = score;
                best = move;
            }
        }
        return best;
    }

    /**
     * First move that takes the enemy general or attacks it, else the move landing
     * closest to it when close enough.
     */
    static int endgameMove(Board board, Side side, int[] moves, int n) {
        Piece enemyGeneral = board.getGeneral(side.opposite());
        if (enemyGeneral == null) return Move.NONE;
        int target = enemyGeneral.getCoordinate().index;

        for (int i = 0; i < n; i++) {
            int move = moves[i];
            int from = Move.getStartPosition(move);
            int to = Move.getEndPosition(move);
            if (to == target) return move;

            Piece captured = board.movePiece(from, to);
            boolean check = MoveGenerator.isSquareAttacked(board, side, target);
            board.unmovePiece(from, to, captured);
            if (check) return move;
        }

        int best = Move.NONE;
        int minDistance = Integer.MAX_VALUE;
        for (int i = 0; i < n; i++) {
            int distance = BoardUtils.manhattan(Move.getEndPosition(moves[i]), target);
            if (distance < minDistance) {
                minDistance = distance;
                best = moves[i];
            }
        }
        return minDistance <= ENDGAME_MAX_DISTANCE ? best : Move.NONE;
    }
}
