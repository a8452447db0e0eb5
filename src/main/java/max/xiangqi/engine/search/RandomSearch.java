package max.xiangqi.engine.search;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.movegen.Move;
import max.xiangqi.engine.movegen.MoveGenerator;

import java.util.Random;

public class RandomSearch {
    private RandomSearch() {
    }

    /** A uniformly chosen legal move, or {@link Move#NONE} when there is none. */
    public static int pickNextMove(Game game, Random random) {
        int[] moveBuffer = new int[MoveGenerator.MAX_MOVES];
        int numberOfMoves = MoveGenerator.generateMoves(game, moveBuffer);
        if (numberOfMoves == 0) {
            return Move.NONE;
        }
        return moveBuffer[random.nextInt(numberOfMoves)];
    }
}
