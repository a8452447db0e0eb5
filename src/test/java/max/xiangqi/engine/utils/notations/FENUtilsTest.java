package max.xiangqi.engine.utils.notations;

import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FENUtilsTest {

    @Test
    public void standardPositionRoundTrips() {
        Game game = BoardGenerator.newStandardGame();
        assertEquals(BoardGenerator.STANDARD_GAME, FENUtils.getFENFromGame(game));
    }

    @Test
    public void parsesSideToMoveAndIgnoresTrailingFields() {
        Game game = FENUtils.getGameFrom("4k4/9/9/9/9/9/9/9/4R4/3K5 b - - 0 1");
        assertEquals(Side.BLACK, game.sideToMove());
        assertEquals("4k4/9/9/9/9/9/9/9/4R4/3K5 b", FENUtils.getFENFromGame(game));
        assertEquals(Side.RED, FENUtils.getGameFrom("4k4/9/9/9/9/9/9/9/4R4/3K5").sideToMove());
    }

    @Test
    public void acceptsAliasLetters() {
        Board board = FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/2E1H4/3K5");
        assertEquals(PieceKind.ELEPHANT, board.getPiece(8, 2).getKind());
        assertEquals(PieceKind.HORSE, board.getPiece(8, 4).getKind());
        assertEquals(Side.RED, board.getPiece(8, 4).getSide());
    }

    @Test
    public void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom("4k4/9/9"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/9/3K4"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom("4x4/9/9/9/9/9/9/9/9/3K5"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getGameFrom("4k4/9/9/9/9/9/9/9/9/3K5 x"));
        assertThrows(IllegalArgumentException.class, () -> FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/9/3KK4"));

        // Empty runs are the ASCII digits 1 to 9 only
        IllegalArgumentException zero = assertThrows(IllegalArgumentException.class,
                () -> FENUtils.getBoardFrom("4k04/9/9/9/9/9/9/9/9/3K5"));
        assertTrue(zero.getMessage().contains("'0'"), zero.getMessage());
        IllegalArgumentException arabicIndic = assertThrows(IllegalArgumentException.class,
                () -> FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/9/3K\u06632"));
        assertTrue(arabicIndic.getMessage().contains("piece letter"), arabicIndic.getMessage());
    }
}
