package max.xiangqi.engine.utils.notations;

import it.unimi.dsi.fastutil.chars.Char2CharOpenHashMap;
import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;
import it.unimi.dsi.fastutil.chars.Char2ObjectOpenHashMap;
import max.xiangqi.engine.common.PieceKind;
import max.xiangqi.engine.common.Side;

/**
 * Glyph tables for move texts. Input is folded onto simplified glyphs before parsing;
 * every numeral form maps to a value 1..9.
 */
final class NotationGlyphs {
    static final char ADVANCE = '进';
    static final char RETREAT = '退';
    static final char TRAVERSE = '平';
    static final char FRONT = '前';
    static final char MIDDLE = '中';
    static final char BACK = '后';
    static final char LEFT = '左';
    static final char RIGHT = '右';

    private static final String CHINESE_NUMERALS = "一二三四五六七八九";
    private static final String FORMAL_NUMERALS = "壹贰叁肆伍陆柒捌玖";
    private static final String ASCII_DIGITS = "123456789";
    private static final String FULLWIDTH_DIGITS = "１２３４５６７８９";

    private static final Char2CharOpenHashMap TO_SIMPLIFIED = new Char2CharOpenHashMap();
    private static final Char2CharOpenHashMap TO_TRADITIONAL = new Char2CharOpenHashMap();
    private static final Char2IntOpenHashMap NUMERALS = new Char2IntOpenHashMap();
    private static final Char2ObjectOpenHashMap<PieceKind> PIECES = new Char2ObjectOpenHashMap<>();

    static {
        simplified('車', '车');
        simplified('俥', '车');
        simplified('馬', '马');
        simplified('傌', '马');
        simplified('砲', '炮');
        simplified('包', '炮');
        simplified('帥', '帅');
        simplified('將', '将');
        simplified('進', '进');
        simplified('後', '后');
        simplified('貳', '贰');
        simplified('陸', '陆');

        TO_TRADITIONAL.put('车', '車');
        TO_TRADITIONAL.put('马', '馬');
        TO_TRADITIONAL.put('炮', '砲');
        TO_TRADITIONAL.put('帅', '帥');
        TO_TRADITIONAL.put('将', '將');
        TO_TRADITIONAL.put('进', '進');
        TO_TRADITIONAL.put('后', '後');

        NUMERALS.defaultReturnValue(-1);
        for (int i = 0; i < 9; i++) {
            NUMERALS.put(CHINESE_NUMERALS.charAt(i), i + 1);
            NUMERALS.put(FORMAL_NUMERALS.charAt(i), i + 1);
            NUMERALS.put(ASCII_DIGITS.charAt(i), i + 1);
            NUMERALS.put(FULLWIDTH_DIGITS.charAt(i), i + 1);
        }

        for (PieceKind kind : PieceKind.VALUES) {
            for (Side side : Side.VALUES) {
                PIECES.put(kind.glyph(side).charAt(0), kind);
            }
        }
    }

    private NotationGlyphs() {
    }

    private static void simplified(char from, char to) {
        TO_SIMPLIFIED.put(from, to);
    }

    static String normalize(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) continue;
            sb.append(TO_SIMPLIFIED.getOrDefault(c, c));
        }
        return sb.toString();
    }

    static String toTraditional(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(TO_TRADITIONAL.getOrDefault(c, c));
        }
        return sb.toString();
    }

    /** @return 1..9, or -1 when {@code c} is not a numeral */
    static int numeral(char c) {
        return NUMERALS.get(c);
    }

    static char chineseNumeral(int value) {
        return CHINESE_NUMERALS.charAt(value - 1);
    }

    /** @return the kind named by {@code c}, or null */
    static PieceKind pieceKind(char c) {
        return PIECES.get(c);
    }

    static boolean isAction(char c) {
        return c == ADVANCE || c == RETREAT || c == TRAVERSE;
    }
}
