package max.xiangqi.engine.game.board.utils;

import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbakabnr/9/1c5c1/p1p1p1p1p/9/9/P1P1P1P1P/1C5C1/9/RNBAKABNR w";

    public static Board newStandardBoard() {
        return FENUtils.getBoardFrom(STANDARD_GAME);
    }

    public static Game newStandardGame() {
        return FENUtils.getGameFrom(STANDARD_GAME);
    }

    public static Game from(String fen) {
        return FENUtils.getGameFrom(fen);
    }
}
