package max.xiangqi.engine.game;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.Piece;
import max.xiangqi.engine.game.board.utils.BoardUtils;

import java.util.SplittableRandom;

public final class ZobristHashKeys {
    // Fixed seed: keys must be stable across runs so hashes can be compared in tests
    private static final long SEED = 0x9E3779B97F4A7C15L;

    // (kind * 2 + side) * 90 + square
    private static final long[] PIECE_KEYS = new long[PieceKind.VALUES.length * 2 * BoardUtils.SQUARES];
    public static final long SIDE_KEY;

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (int i = 0; i < PIECE_KEYS.length; i++) {
            PIECE_KEYS[i] = random.nextLong();
        }
        SIDE_KEY = random.nextLong();
    }

    private ZobristHashKeys() {
    }

    public static long pieceKey(PieceKind kind, Side side, int square) {
        return PIECE_KEYS[(kind.ordinal() * 2 + side.ordinal()) * BoardUtils.SQUARES + square];
    }

    public static long pieceKey(Piece piece, int square) {
        return pieceKey(piece.getKind(), piece.getSide(), square);
    }

    /** Full hash of a position; Black to move is folded in with {@link #SIDE_KEY}. */
    public static long compute(Board board, Side sideToMove) {
        long key = 0L;
        for (int sq = 0; sq < BoardUtils.SQUARES; sq++) {
            Piece piece = board.pieceAt(sq);
            if (piece != null) {
                key ^= pieceKey(piece, sq);
            }
        }
        if (sideToMove == Side.BLACK) {
            key ^= SIDE_KEY;
        }
        return key;
    }

    public static String print(long key) {
        return String.format("%016x", key);
    }
}
