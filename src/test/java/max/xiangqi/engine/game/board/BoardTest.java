package max.xiangqi.engine.game.board;

import max.xiangqi.engine.common.Coordinate;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;
import max.xiangqi.engine.game.board.utils.BoardGenerator;
import max.xiangqi.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoardTest {

    @Test
    public void standardBoardHas32PiecesInPlace() {
        // Given
        Board board = BoardGenerator.newStandardBoard();

        // Then
        assertEquals(32, board.getPieceCount());
        assertEquals(16, board.getPieces(Side.RED).size());
        assertEquals(16, board.getPieces(Side.BLACK).size());
        assertEquals(Coordinate.of(9, 4), board.getGeneral(Side.RED).getCoordinate());
        assertEquals(Coordinate.of(0, 4), board.getGeneral(Side.BLACK).getCoordinate());
        assertEquals(PieceKind.CANNON, board.getPiece(7, 7).getKind());
        assertEquals(5, board.getPieces(PieceKind.SOLDIER, Side.BLACK).size());
        assertFalse(board.areGeneralsFacing());
    }

    @Test
    public void moveReturnsCapturedPieceAndUnmoveRestoresIt() {
        // Given
        Board board = BoardGenerator.newStandardBoard();
        int from = Coordinate.of(7, 1).index;
        int to = Coordinate.of(0, 1).index;

        // When
        Piece captured = board.movePiece(from, to);

        // Then
        assertNotNull(captured);
        assertEquals(PieceKind.HORSE, captured.getKind());
        assertEquals(Side.BLACK, captured.getSide());
        assertEquals(31, board.getPieceCount());
        assertEquals(15, board.getPieceCount(Side.BLACK));
        assertEquals(Coordinate.of(0, 1), board.pieceAt(to).getCoordinate());

        // When
        board.unmovePiece(from, to, captured);

        // Then
        assertEquals(32, board.getPieceCount());
        assertSame(captured, board.pieceAt(to));
        assertEquals(PieceKind.CANNON, board.pieceAt(from).getKind());
        assertEquals(Coordinate.of(7, 1), board.pieceAt(from).getCoordinate());
    }

    @Test
    public void copyIsDeep() {
        // Given
        Board board = BoardGenerator.newStandardBoard();
        Board copy = board.copy();

        // When
        copy.movePiece(Coordinate.of(7, 7), Coordinate.of(7, 4));

        // Then
        assertNotNull(board.getPiece(7, 7));
        assertNull(board.getPiece(7, 4));
        assertNotSame(board.getGeneral(Side.RED), copy.getGeneral(Side.RED));
        assertEquals(Coordinate.of(7, 7), board.getPiece(7, 7).getCoordinate());
    }

    @Test
    public void capturingAGeneralRemovesIt() {
        // Given
        Board board = FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/4R4/3K5");

        // When
        board.movePiece(Coordinate.of(8, 4), Coordinate.of(0, 4));

        // Then
        assertNull(board.getGeneral(Side.BLACK));
        assertEquals(2, board.getPieceCount());
    }

    @Test
    public void generalsFacingOnlyOnAnOpenFile() {
        assertTrue(FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/9/4K4").areGeneralsFacing());
        assertFalse(FENUtils.getBoardFrom("4k4/9/9/9/4p4/9/9/9/9/4K4").areGeneralsFacing());
        assertFalse(FENUtils.getBoardFrom("3k5/9/9/9/9/9/9/9/9/4K4").areGeneralsFacing());
    }

    @Test
    public void rejectsSecondGeneralAndOccupiedSquare() {
        Board board = FENUtils.getBoardFrom("4k4/9/9/9/9/9/9/9/9/3K5");
        assertThrows(IllegalArgumentException.class,
                () -> board.placePiece(new Piece(PieceKind.GENERAL, Side.RED, Coordinate.of(8, 4))));
        assertThrows(IllegalArgumentException.class,
                () -> board.placePiece(new Piece(PieceKind.SOLDIER, Side.BLACK, Coordinate.of(0, 4))));
        assertThrows(IllegalArgumentException.class, () -> board.getPiece(10, 0));
        assertThrows(IllegalArgumentException.class, () -> Coordinate.of(0, 9));
    }

    @Test
    public void snapshotExposesKindsSidesAndNames() {
        // Given
        BoardSnapshot snapshot = BoardGenerator.newStandardBoard().snapshot();

        // Then
        assertEquals(32, snapshot.pieceCount());
        BoardSnapshot.Cell cannon = snapshot.cell(7, 7);
        assertEquals(PieceKind.CANNON, cannon.kind());
        assertEquals(Side.RED, cannon.side());
        assertEquals("炮", cannon.displayName());
        assertEquals("将", snapshot.cell(0, 4).displayName());
        assertNull(snapshot.cell(4, 4));
    }
}
