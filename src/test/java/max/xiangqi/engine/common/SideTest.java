package max.xiangqi.engine.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SideTest {

    @Test
    public void testRiverAndPalace() {
        assertTrue(Side.RED.hasCrossedRiver(4));
        assertFalse(Side.RED.hasCrossedRiver(5));
        assertTrue(Side.BLACK.hasCrossedRiver(5));
        assertFalse(Side.BLACK.hasCrossedRiver(4));

        assertTrue(Side.RED.isInPalace(9, 4));
        assertTrue(Side.RED.isInPalace(7, 3));
        assertFalse(Side.RED.isInPalace(6, 4));
        assertFalse(Side.RED.isInPalace(9, 6));
        assertTrue(Side.BLACK.isInPalace(0, 5));
        assertFalse(Side.BLACK.isInPalace(3, 4));
    }

    @Test
    public void testColumnNumerals() {
        // Red counts from its right, which is column 8 of the grid
        assertEquals(1, Side.RED.columnNumeral(8));
        assertEquals(9, Side.RED.columnNumeral(0));
        assertEquals(1, Side.BLACK.columnNumeral(0));
        assertEquals(9, Side.BLACK.columnNumeral(8));

        for (int col = 0; col < 9; col++) {
            for (Side side : Side.VALUES) {
                assertEquals(col, side.columnFromNumeral(side.columnNumeral(col)));
            }
        }
    }

    @Test
    public void testDirection() {
        assertTrue(Side.RED.isForward(6, 5));
        assertFalse(Side.RED.isForward(5, 6));
        assertTrue(Side.BLACK.isForward(3, 4));
        assertTrue(Side.RED.compareFrontToBack(2, 6) < 0);
        assertTrue(Side.BLACK.compareFrontToBack(6, 2) < 0);
        assertSame(Side.BLACK, Side.RED.opposite());
    }

    @Test
    public void testCoordinatesAreInterned() {
        Coordinate c = Coordinate.of(9, 4);
        assertSame(c, Coordinate.of(85));
        assertEquals(85, c.getIndex());
        assertEquals("(9,4)", c.toString());
        assertThrows(IllegalArgumentException.class, () -> Coordinate.of(10, 0));
        assertThrows(IllegalArgumentException.class, () -> Coordinate.of(90));
    }

    @Test
    public void testFenLetters() {
        assertEquals('R', PieceKind.CHARIOT.fenChar(Side.RED));
        assertEquals('c', PieceKind.CANNON.fenChar(Side.BLACK));
        assertSame(PieceKind.HORSE, PieceKind.fromFenChar('N'));
        assertSame(PieceKind.ELEPHANT, PieceKind.fromFenChar('e'));
        assertNull(PieceKind.fromFenChar('x'));
        assertEquals("帅", PieceKind.GENERAL.glyph(Side.RED));
        assertEquals("將", PieceKind.GENERAL.traditionalGlyph(Side.BLACK));
    }
}
