package max.xiangqi.engine.utils.notations;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.Game;
import max.xiangqi.engine.game.board.Board;
import max.xiangqi.engine.game.board.utils.BoardGenerator;
import max.xiangqi.engine.movegen.Move;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class NotationCodecTest {

    private static void assertParses(String text, Board board, Side side, int fromRow, int fromCol, int toRow, int toCol) {
        ParseResult result = NotationCodec.parse(text, board, side);
        assertTrue(result.isSuccess(), () -> text + " failed: " + result.message());
        assertEquals(Coordinate.of(fromRow, fromCol), result.from(), text);
        assertEquals(Coordinate.of(toRow, toCol), result.to(), text);
    }

    private static void assertFails(String text, Board board, Side side, NotationToken token) {
        ParseResult result = NotationCodec.parse(text, board, side);
        assertFalse(result.isSuccess(), text);
        assertEquals(token, result.failedToken(), text);
        assertNotNull(result.message());
    }

    @Test
    public void parsesColumnFormOnTheStandardBoard() {
        Board board = BoardGenerator.newStandardBoard();
        assertParses("炮二平五", board, Side.RED, 7, 7, 7, 4);
        assertParses("马二进三", board, Side.RED, 9, 7, 7, 6);
        assertParses("车一进一", board, Side.RED, 9, 8, 8, 8);
        assertParses("兵七进一", board, Side.RED, 6, 2, 5, 2);
        assertParses("仕四进五", board, Side.RED, 9, 5, 8, 4);
        assertParses("相三进五", board, Side.RED, 9, 6, 7, 4);
        assertParses("帅五进一", board, Side.RED, 9, 4, 8, 4);
    }

    @Test
    public void blackCountsColumnsFromItsOwnRight() {
        Board board = BoardGenerator.newStandardBoard();
        assertParses("马8进7", board, Side.BLACK, 0, 7, 2, 6);
        assertParses("马八进七", board, Side.BLACK, 0, 7, 2, 6);
        assertParses("炮８平５", board, Side.BLACK, 2, 7, 2, 4);
        assertParses("卒3进1", board, Side.BLACK, 3, 2, 4, 2);
        assertParses("象3进5", board, Side.BLACK, 0, 2, 2, 4);
    }

    @Test
    public void acceptsTraditionalAndFormalGlyphs() {
        Board board = BoardGenerator.newStandardBoard();
        assertParses("砲二平五", board, Side.RED, 7, 7, 7, 4);
        assertParses("傌二進三", board, Side.RED, 9, 7, 7, 6);
        assertParses("俥壹進壹", board, Side.RED, 9, 8, 8, 8);
        assertParses(" 炮 二 平 五 ", board, Side.RED, 7, 7, 7, 4);
    }

    @Test
    public void reportsTheFailingToken() {
        Board board = BoardGenerator.newStandardBoard();
        assertFails("", board, Side.RED, NotationToken.FORMAT);
        assertFails(null, board, Side.RED, NotationToken.FORMAT);
        assertFails("炮二平五五", board, Side.RED, NotationToken.FORMAT);
        assertFails("炮二平", board, Side.RED, NotationToken.FORMAT);
        assertFails("X二平五", board, Side.RED, NotationToken.PIECE_GLYPH);
        assertFails("炮十平五", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
        assertFails("炮三平五", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
        assertFails("炮二走五", board, Side.RED, NotationToken.ACTION_GLYPH);
        assertFails("马二平三", board, Side.RED, NotationToken.ACTION_GLYPH);
        assertFails("炮二平十", board, Side.RED, NotationToken.MAGNITUDE);
        assertFails("炮二平二", board, Side.RED, NotationToken.MAGNITUDE);
        assertFails("马二进五", board, Side.RED, NotationToken.MAGNITUDE);
        assertFails("车一退一", board, Side.RED, NotationToken.MAGNITUDE);
        assertFails("仕退五", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
    }

    @Test
    public void frontAndBackOnOneFile() {
        // Given
        Board board = BoardGenerator.from("5k3/9/9/9/9/9/4R4/9/4R4/3K5 w").board();

        // Then
        assertParses("前车进一", board, Side.RED, 6, 4, 5, 4);
        assertParses("后车平一", board, Side.RED, 8, 4, 8, 8);
        assertParses("後俥平一", board, Side.RED, 8, 4, 8, 8);
        assertFails("车五进一", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
        assertEquals("前车进一", NotationCodec.generate(board, Coordinate.of(6, 4), Coordinate.of(5, 4)));
        assertEquals("后车平一", NotationCodec.generate(board, Coordinate.of(8, 4), Coordinate.of(8, 8)));
        assertEquals("後車平一", NotationCodec.generateTraditional(board, Coordinate.of(8, 4), Coordinate.of(8, 8)));
    }

    @Test
    public void middleOfThreeOnOneFile() {
        Board board = BoardGenerator.from("4k4/9/4P4/4P4/4P4/9/9/9/9/3K5 w").board();
        assertParses("中兵平六", board, Side.RED, 3, 4, 3, 3);
        assertParses("前兵进一", board, Side.RED, 2, 4, 1, 4);
        assertParses("后兵平四", board, Side.RED, 4, 4, 4, 5);
        assertEquals("中兵平六", NotationCodec.generate(board, Coordinate.of(3, 4), Coordinate.of(3, 3)));
    }

    @Test
    public void ordinalsWhenTwoFilesAreCrowded() {
        // Given: right file counted first, each file front to back
        Board board = BoardGenerator.from("4k4/9/9/4P1P2/4P1P2/9/9/9/9/3K5 w").board();

        // Then
        assertParses("一兵进一", board, Side.RED, 3, 6, 2, 6);
        assertParses("二兵平二", board, Side.RED, 4, 6, 4, 7);
        assertParses("三兵平六", board, Side.RED, 3, 4, 3, 3);
        assertEquals("四兵平六", NotationCodec.generate(board, Coordinate.of(4, 4), Coordinate.of(4, 3)));
        assertFails("五兵平六", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
        assertFails("前兵进一", board, Side.RED, NotationToken.POSITION_DESCRIPTOR);
    }

    @Test
    public void ordinalsWhenFourShareAFile() {
        Board board = BoardGenerator.from("4k4/4P4/4P4/4P4/4P4/9/9/9/9/3K5 w").board();
        assertParses("二兵平四", board, Side.RED, 2, 4, 2, 5);
        assertEquals("四兵平四", NotationCodec.generate(board, Coordinate.of(4, 4), Coordinate.of(4, 5)));
        assertEquals("一兵平六", NotationCodec.generate(board, Coordinate.of(1, 4), Coordinate.of(1, 3)));
    }

    @Test
    public void leftAndRightPickTheEdgeFile() {
        Board board = BoardGenerator.newStandardBoard();
        assertParses("右车进一", board, Side.RED, 9, 8, 8, 8);
        assertParses("左车进二", board, Side.RED, 9, 0, 7, 0);
        assertParses("右车进一", board, Side.BLACK, 0, 0, 1, 0);
    }

    @Test
    public void advisorsMayOmitTheirColumn() {
        // Given
        Board board = BoardGenerator.from("5k3/9/9/9/9/9/9/3A5/9/3AK4 w").board();

        // Then
        assertParses("仕进五", board, Side.RED, 9, 3, 8, 4);
        assertParses("仕退五", board, Side.RED, 7, 3, 8, 4);
        assertEquals("仕进五", NotationCodec.generate(board, Coordinate.of(9, 3), Coordinate.of(8, 4)));
        assertFails("车进五", board, Side.RED, NotationToken.FORMAT);
        assertFails("仕平五", board, Side.RED, NotationToken.ACTION_GLYPH);
    }

    @Test
    public void generatesSimplifiedAndTraditionalTexts() {
        Board board = BoardGenerator.newStandardBoard();
        assertEquals("炮二平五", NotationCodec.generate(board, Coordinate.of(7, 7), Coordinate.of(7, 4)));
        assertEquals("砲二平五", NotationCodec.generateTraditional(board, Coordinate.of(7, 7), Coordinate.of(7, 4)));
        assertEquals("马二进三", NotationCodec.generate(board, Coordinate.of(9, 7), Coordinate.of(7, 6)));
        assertEquals("馬二進三", NotationCodec.generateTraditional(board, Coordinate.of(9, 7), Coordinate.of(7, 6)));
        assertEquals("马八进七", NotationCodec.generate(board, Coordinate.of(0, 7), Coordinate.of(2, 6)));
        assertEquals("炮八进七", NotationCodec.generate(board, Coordinate.of(7, 1), Coordinate.of(0, 1)));
        assertThrows(IllegalArgumentException.class,
                () -> NotationCodec.generate(board, Coordinate.of(4, 4), Coordinate.of(3, 4)));
    }

    @Test
    public void everyLegalMoveRoundTripsThroughItsText() {
        Random random = new Random(2024);
        for (int g = 0; g < 8; g++) {
            Game game = BoardGenerator.newStandardGame();
            for (int ply = 0; ply < 80 && game.hasGeneral(Side.RED) && game.hasGeneral(Side.BLACK); ply++) {
                IntArrayList moves = game.getLegalMoves();
                if (moves.isEmpty()) break;
                for (int i = 0; i < moves.size(); i++) {
                    int move = moves.getInt(i);
                    String text = NotationCodec.generate(game.board(), Move.from(move), Move.to(move));
                    ParseResult parsed = NotationCodec.parse(text, game.board(), game.sideToMove());
                    assertTrue(parsed.isSuccess(), () -> text + ": " + parsed.message());
                    assertEquals(move, Move.of(parsed.from(), parsed.to()), text);
                }
                game.playMove(moves.getInt(random.nextInt(moves.size())));
            }
        }
    }
}
